package me.golemcore.graph.adapter.outbound.decision;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.graph.domain.context.ContextPayload;
import me.golemcore.graph.domain.model.ActionType;
import me.golemcore.graph.domain.model.Decision;
import me.golemcore.graph.domain.model.DecisionRequest;
import me.golemcore.graph.domain.permission.PermissionException;
import me.golemcore.graph.domain.service.DecisionParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScriptedDecisionPortTest {

    private final DecisionParser parser = new DecisionParser(new ObjectMapper());

    private DecisionRequest request(int step) {
        return new DecisionRequest("run-1", step, "triage",
                new ContextPayload("triage", null, "hi", "", List.of(), List.of()));
    }

    @Test
    void shouldReplayDecisionsInOrder() {
        ScriptedDecisionPort port = new ScriptedDecisionPort(parser, List.of(
                "{\"action\": \"ROUTE_TO_AGENT\", \"action_details\": {\"target_agent_name\": \"writer\"}}",
                "{\"action\": \"RESPOND\", \"action_details\": {\"payload\": \"ok\"}}"));

        Decision first = port.decide(request(0)).join();
        Decision second = port.decide(request(1)).join();

        assertEquals(ActionType.ROUTE_TO_AGENT, first.action().type());
        assertEquals(ActionType.RESPOND, second.action().type());
        assertEquals(0, port.remaining());
    }

    @Test
    void shouldSurfaceMalformedEntryAsPermissionException() {
        ScriptedDecisionPort port = new ScriptedDecisionPort(parser, List.of("{\"action\": \"FLY\"}"));

        CompletionException error = assertThrows(CompletionException.class, () -> port.decide(request(0)).join());

        assertInstanceOf(PermissionException.class, error.getCause());
    }

    @Test
    void shouldFailWhenScriptIsExhausted() {
        ScriptedDecisionPort port = new ScriptedDecisionPort(parser, List.of());

        CompletionException error = assertThrows(CompletionException.class, () -> port.decide(request(3)).join());

        assertInstanceOf(IllegalStateException.class, error.getCause());
    }
}
