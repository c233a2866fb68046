package me.golemcore.graph.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.graph.adapter.outbound.tool.ToolProviderRegistry;
import me.golemcore.graph.domain.service.SnapshotJsonCodec;
import me.golemcore.graph.domain.service.SnapshotRegistry;
import me.golemcore.graph.port.outbound.ToolInvokerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Shared infrastructure beans and startup.
 *
 * <p>
 * On startup this logs the effective engine defaults and, when
 * {@code graph.snapshot.bootstrap-path} is set, publishes the snapshot stored
 * there. An invalid bootstrap snapshot stops the application.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final GraphRuntimeProperties properties;
    private final SnapshotRegistry snapshotRegistry;
    private final SnapshotJsonCodec snapshotJsonCodec;
    private final ToolInvokerPort toolInvokerPort;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        GraphRuntimeProperties.EngineProperties engine = properties.getEngine();
        log.info("Graph runtime starting: maxSteps={}, maxToolErrors={}, toolTimeoutMs={}, onPermissionDenied={}",
                engine.getDefaultMaxSteps(), engine.getDefaultMaxToolErrors(), engine.getToolTimeoutMs(),
                engine.getPermissionFailurePolicy());
        if (toolInvokerPort instanceof ToolProviderRegistry registry) {
            log.info("Tool providers: {}", registry.getProviderTypes());
        }
        bootstrapSnapshot();
    }

    private void bootstrapSnapshot() {
        String bootstrapPath = properties.getSnapshot().getBootstrapPath();
        if (bootstrapPath == null || bootstrapPath.isBlank()) {
            log.info("No bootstrap snapshot configured");
            return;
        }
        Path path = Path.of(bootstrapPath);
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Bootstrap snapshot not found: " + path.toAbsolutePath());
        }
        snapshotRegistry.publish(snapshotJsonCodec.read(path));
        log.info("Bootstrap snapshot loaded from {}", path);
    }
}
