package me.golemcore.graph.domain.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.graph.domain.model.AgentSpec;
import me.golemcore.graph.domain.model.CompiledSnapshot;
import me.golemcore.graph.domain.model.ExecutionLogPolicy;
import me.golemcore.graph.domain.model.ParamSource;
import me.golemcore.graph.domain.model.PermissionFailurePolicy;
import me.golemcore.graph.domain.model.RouteEdge;
import me.golemcore.graph.domain.model.RuntimePolicy;
import me.golemcore.graph.domain.model.ToolParamSpec;
import me.golemcore.graph.domain.model.ToolSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotJsonCodecTest {

    private static final String SNAPSHOT_JSON = """
            {
              "version_key": "support-v3",
              "default_agent_key": "triage",
              "agents": [
                {"key": "triage", "is_default": true, "allow_respond": false,
                 "equipped_tools": ["crm"], "allowed_routes": ["writer"], "prompt": "Triage."},
                {"key": "writer", "allow_respond": true}
              ],
              "tools": [
                {"key": "crm", "provider_type": "builtin:echo",
                 "params": [
                   {"name": "query", "source": "agent", "required": true},
                   {"name": "tenant", "source": "system", "required": true},
                   {"name": "limit", "source": "default", "default_value": 5}
                 ],
                 "metadata": {"team": "support"}}
              ],
              "routes": [{"from": "triage", "to": "writer"}],
              "policy": {"max_steps": 8, "max_tool_errors": 2, "permission_failure_policy": "TOLERATE",
                         "execution_log": {"defaults": {"request_max_chars": 40},
                                           "tools": {"crm": {"response": [{"path": "hits[0]", "label": "top"}]}}}}
            }
            """;

    private SnapshotJsonCodec codec;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        codec = new SnapshotJsonCodec(mapper);
    }

    @Test
    void shouldReadSnakeCaseSnapshot() {
        CompiledSnapshot snapshot = codec.read(SNAPSHOT_JSON);

        assertEquals("support-v3", snapshot.versionKey());
        AgentSpec triage = snapshot.findAgent("triage").orElseThrow();
        assertTrue(triage.isDefault());
        assertEquals(List.of("writer"), triage.allowedRoutes());
        ToolSpec crm = snapshot.findTool("crm").orElseThrow();
        assertEquals(ParamSource.SYSTEM, crm.findParam("tenant").orElseThrow().source());
        assertEquals(5, crm.findParam("limit").orElseThrow().defaultValue());
        assertEquals(List.of(new RouteEdge("triage", "writer")), snapshot.routes());
        assertEquals(8, snapshot.policy().maxSteps());
        assertEquals(PermissionFailurePolicy.TOLERATE, snapshot.policy().permissionFailurePolicy());
        assertEquals("top", snapshot.policy().executionLog().toolPreview("crm").response().get(0).label());
    }

    @Test
    void shouldRoundTripEveryField() {
        CompiledSnapshot original = new CompiledSnapshot("v9",
                List.of(new AgentSpec("a", true, true, List.of("t"), List.of(), "Prompt A")),
                List.of(new ToolSpec("t", "builtin:echo", "Echo", List.of(ToolParamSpec.agent("x", true),
                        ToolParamSpec.withDefault("y", "z")), Map.of("k", "v"))),
                List.of(new RouteEdge("a", "a")), "a",
                new RuntimePolicy(4, 1, PermissionFailurePolicy.FAIL_FAST, 1500L,
                        new ExecutionLogPolicy(new ExecutionLogPolicy.Defaults(10, 20), Map.of())));

        CompiledSnapshot copy = codec.read(codec.write(original));

        assertEquals(original, copy);
    }

    @Test
    void shouldReadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("snapshot.json");
        Files.writeString(file, SNAPSHOT_JSON);

        assertEquals("support-v3", codec.read(file).versionKey());
    }

    @Test
    void shouldRejectInvalidJson() {
        assertThrows(IllegalArgumentException.class, () -> codec.read("{\"agents\": 5"));
    }

    @Test
    void shouldReportMissingFile(@TempDir Path dir) {
        assertThrows(IllegalStateException.class, () -> codec.read(dir.resolve("missing.json")));
    }
}
