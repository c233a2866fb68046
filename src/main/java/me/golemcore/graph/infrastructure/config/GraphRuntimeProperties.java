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

import lombok.Data;
import me.golemcore.graph.domain.model.PermissionFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the graph runtime, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code graph.*} prefix:
 * <ul>
 * <li>{@link EngineProperties} - run loop guards, tool timeout and permission
 * failure policy defaults (a snapshot policy overrides them)</li>
 * <li>{@link LogProperties} - execution log preview limits</li>
 * <li>{@link ContextProperties} - context building</li>
 * <li>{@link SystemParamsProperties} - default system parameters</li>
 * <li>{@link SnapshotProperties} - snapshot bootstrap</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "graph")
@Data
public class GraphRuntimeProperties {

    private EngineProperties engine = new EngineProperties();
    private LogProperties log = new LogProperties();
    private ContextProperties context = new ContextProperties();
    private SystemParamsProperties systemParams = new SystemParamsProperties();
    private SnapshotProperties snapshot = new SnapshotProperties();

    @Data
    public static class EngineProperties {
        private int defaultMaxSteps = 10;
        private int defaultMaxToolErrors = 3;
        private long toolTimeoutMs = 30000;
        private PermissionFailurePolicy permissionFailurePolicy = PermissionFailurePolicy.FAIL_FAST;
        private int toolThreads = 8;
    }

    @Data
    public static class LogProperties {
        private int decisionMaxChars = 120;
        private int inputMaxChars = 80;
        private int requestMaxChars = 50;
        private int responseMaxChars = 100;
    }

    @Data
    public static class ContextProperties {
        private int logSummaryEntries = 10;
    }

    @Data
    public static class SystemParamsProperties {
        private Map<String, String> defaults = new HashMap<>();
    }

    @Data
    public static class SnapshotProperties {
        private String bootstrapPath;
    }
}
