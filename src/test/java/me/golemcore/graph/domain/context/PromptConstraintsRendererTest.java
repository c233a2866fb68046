package me.golemcore.graph.domain.context;

import me.golemcore.graph.domain.model.AgentSpec;
import me.golemcore.graph.domain.model.CompiledSnapshot;
import me.golemcore.graph.domain.model.RuntimePolicy;
import me.golemcore.graph.domain.model.ToolParamSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.golemcore.graph.testsupport.SnapshotFixtures.echoTool;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptConstraintsRendererTest {

    private final PromptConstraintsRenderer renderer = new PromptConstraintsRenderer();

    @Test
    void shouldListToolsRoutesAndAgentParamsOnly() {
        AgentSpec triage = new AgentSpec("triage", false, true, List.of("crm"), List.of("writer"),
                "You triage requests.");
        CompiledSnapshot snapshot = new CompiledSnapshot("v1",
                List.of(triage, new AgentSpec("writer", true, false, null, null, null)),
                List.of(echoTool("crm", ToolParamSpec.agent("query", true), ToolParamSpec.system("tenant", true),
                        ToolParamSpec.withDefault("limit", 5))),
                List.of(), "triage", RuntimePolicy.defaults());

        String fragment = renderer.render(snapshot, triage);

        assertTrue(fragment.startsWith("You triage requests."));
        assertTrue(fragment.contains("- crm: params=[query*, limit]"));
        assertTrue(fragment.contains("- writer"));
        assertFalse(fragment.contains("tenant"));
        assertFalse(fragment.contains("USE_TOOL|ROUTE_TO_AGENT|RESPOND"));
        assertTrue(fragment.contains("may not RESPOND"));
    }

    @Test
    void shouldOfferRespondToCapableAgent() {
        AgentSpec writer = new AgentSpec("writer", true, true, null, null, null);
        CompiledSnapshot snapshot = new CompiledSnapshot("v1", List.of(writer), null, null, null, null);

        String fragment = renderer.render(snapshot, writer);

        assertTrue(fragment.contains("USE_TOOL|ROUTE_TO_AGENT|RESPOND"));
        assertTrue(fragment.contains("action_details.payload"));
    }
}
