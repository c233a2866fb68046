package me.golemcore.graph.domain.loop;

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

import me.golemcore.graph.adapter.outbound.tool.ToolProvider;
import me.golemcore.graph.adapter.outbound.tool.ToolProviderRegistry;
import me.golemcore.graph.domain.context.ContextBuilder;
import me.golemcore.graph.domain.context.DefaultContextBuilder;
import me.golemcore.graph.domain.context.PromptConstraintsRenderer;
import me.golemcore.graph.domain.log.PreviewLimits;
import me.golemcore.graph.domain.log.PreviewRenderer;
import me.golemcore.graph.domain.permission.PermissionEnforcer;
import me.golemcore.graph.infrastructure.config.GraphRuntimeProperties;
import me.golemcore.graph.port.outbound.ToolInvokerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Spring wiring for the run loop (engine, context builder, tool execution). */
@Configuration
public class RunLoopConfiguration {

    @Bean
    public PreviewLimits previewLimits(GraphRuntimeProperties properties) {
        GraphRuntimeProperties.LogProperties log = properties.getLog();
        return new PreviewLimits(log.getDecisionMaxChars(), log.getInputMaxChars(), log.getRequestMaxChars(),
                log.getResponseMaxChars());
    }

    @Bean
    public ContextBuilder contextBuilder(PromptConstraintsRenderer constraintsRenderer,
            GraphRuntimeProperties properties) {
        return new DefaultContextBuilder(constraintsRenderer, properties.getContext().getLogSummaryEntries());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolExecutor(GraphRuntimeProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "graph-tool-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getEngine().getToolThreads()), threadFactory);
    }

    @Bean
    public ToolInvokerPort toolInvokerPort(List<ToolProvider> providers, ExecutorService toolExecutor) {
        return new ToolProviderRegistry(providers, toolExecutor);
    }

    @Bean
    public RunLoopEngine runLoopEngine(ContextBuilder contextBuilder, PermissionEnforcer permissionEnforcer,
            ToolInvokerPort toolInvokerPort, PreviewRenderer previewRenderer, PreviewLimits previewLimits,
            GraphRuntimeProperties properties, Clock clock) {
        return new DefaultRunLoopEngine(contextBuilder, permissionEnforcer, toolInvokerPort, previewRenderer,
                previewLimits, properties.getEngine(), clock);
    }
}
