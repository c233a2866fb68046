package me.golemcore.graph.adapter.outbound.tool;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.graph.domain.model.ToolFailureKind;
import me.golemcore.graph.domain.model.ToolInvocation;
import me.golemcore.graph.domain.model.ToolOutcome;
import me.golemcore.graph.port.outbound.ToolInvokerPort;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * {@link ToolInvokerPort} backed by {@link ToolProvider} beans keyed by
 * provider type.
 *
 * <p>
 * Calls run on the tool executor so the run loop can apply its timeout. A
 * tool whose provider type has no registered provider, and a provider that
 * throws, both complete normally with a failed {@link ToolOutcome}.
 */
@Slf4j
public class ToolProviderRegistry implements ToolInvokerPort {

    private final Map<String, ToolProvider> providers = new ConcurrentHashMap<>();
    private final Executor executor;

    public ToolProviderRegistry(List<ToolProvider> providers, Executor executor) {
        this.executor = executor;
        if (providers != null) {
            providers.forEach(this::register);
        }
    }

    public void register(ToolProvider provider) {
        ToolProvider previous = providers.put(provider.getProviderType(), provider);
        if (previous != null && previous != provider) {
            log.warn("[Tools] provider {} replaced: {} -> {}", provider.getProviderType(),
                    previous.getClass().getSimpleName(), provider.getClass().getSimpleName());
        }
    }

    public Collection<String> getProviderTypes() {
        return List.copyOf(providers.keySet());
    }

    @Override
    public CompletableFuture<ToolOutcome> invoke(ToolInvocation invocation) {
        String providerType = invocation.tool().providerType();
        ToolProvider provider = providerType != null ? providers.get(providerType) : null;
        if (provider == null) {
            log.warn("[Tools] no provider for type '{}' (tool {})", providerType, invocation.tool().key());
            return CompletableFuture.completedFuture(ToolOutcome.failure(ToolFailureKind.UNKNOWN_PROVIDER,
                    "No provider for type '" + providerType + "'"));
        }
        return CompletableFuture.supplyAsync(() -> execute(provider, invocation), executor);
    }

    private ToolOutcome execute(ToolProvider provider, ToolInvocation invocation) {
        try {
            ToolOutcome outcome = provider.execute(invocation);
            return outcome != null ? outcome : ToolOutcome.failure("Tool returned no outcome");
        } catch (RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", invocation.tool().key(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ToolOutcome.failure("Tool execution failed: " + message);
        }
    }
}
