package me.golemcore.graph.adapter.outbound.tool;

import me.golemcore.graph.domain.model.ToolFailureKind;
import me.golemcore.graph.domain.model.ToolInvocation;
import me.golemcore.graph.domain.model.ToolOutcome;
import me.golemcore.graph.domain.model.ToolParamSpec;
import me.golemcore.graph.domain.model.ToolSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolProviderRegistryTest {

    private static final Executor DIRECT = Runnable::run;

    private ToolProviderRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolProviderRegistry(List.of(new EchoToolProvider()), DIRECT);
    }

    private ToolInvocation invocation(ToolSpec tool, Map<String, Object> params) {
        return new ToolInvocation("run-1", "exec-1", "triage", tool, params);
    }

    @Test
    void shouldDispatchByProviderType() {
        ToolSpec tool = new ToolSpec("crm", EchoToolProvider.PROVIDER_TYPE, null,
                List.of(ToolParamSpec.agent("q", true), ToolParamSpec.system("tenant", true)), Map.of("team", "x"));

        ToolOutcome outcome = registry.invoke(invocation(tool, Map.of("q", "acme", "tenant", "t-1"))).join();

        assertTrue(outcome.isSuccess());
        assertEquals(Map.of("echo", Map.of("q", "acme"), "metadata", Map.of("team", "x")), outcome.getResult());
        assertFalse(String.valueOf(outcome.getResult()).contains("t-1"));
    }

    @Test
    void shouldFailForUnknownProviderType() {
        ToolSpec tool = ToolSpec.of("web", "http:get", List.of());

        ToolOutcome outcome = registry.invoke(invocation(tool, Map.of())).join();

        assertFalse(outcome.isSuccess());
        assertEquals(ToolFailureKind.UNKNOWN_PROVIDER, outcome.getFailureKind());
        assertTrue(outcome.getError().contains("http:get"));
    }

    @Test
    void shouldReportThrowingProviderAsFailure() {
        registry.register(new ToolProvider() {
            @Override
            public String getProviderType() {
                return "test:broken";
            }

            @Override
            public ToolOutcome execute(ToolInvocation invocation) {
                throw new IllegalStateException("backend down");
            }
        });

        ToolOutcome outcome = registry.invoke(invocation(ToolSpec.of("b", "test:broken", List.of()), Map.of()))
                .join();

        assertFalse(outcome.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, outcome.getFailureKind());
        assertEquals("Tool execution failed: backend down", outcome.getError());
        assertTrue(registry.getProviderTypes().contains("test:broken"));
    }
}
