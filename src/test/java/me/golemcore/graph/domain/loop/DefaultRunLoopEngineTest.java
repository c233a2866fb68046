package me.golemcore.graph.domain.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.graph.adapter.outbound.tool.EchoToolProvider;
import me.golemcore.graph.adapter.outbound.tool.ToolProviderRegistry;
import me.golemcore.graph.domain.context.DefaultContextBuilder;
import me.golemcore.graph.domain.context.PromptConstraintsRenderer;
import me.golemcore.graph.domain.log.PreviewLimits;
import me.golemcore.graph.domain.log.PreviewRenderer;
import me.golemcore.graph.domain.model.ActionType;
import me.golemcore.graph.domain.model.CompiledSnapshot;
import me.golemcore.graph.domain.model.Decision;
import me.golemcore.graph.domain.model.DecisionRequest;
import me.golemcore.graph.domain.model.ExecutionLogEntry;
import me.golemcore.graph.domain.model.ExecutionLogPolicy;
import me.golemcore.graph.domain.model.PermissionFailurePolicy;
import me.golemcore.graph.domain.model.RunErrorKind;
import me.golemcore.graph.domain.model.RunResult;
import me.golemcore.graph.domain.model.RunStatus;
import me.golemcore.graph.domain.model.RuntimePolicy;
import me.golemcore.graph.domain.model.StepStatus;
import me.golemcore.graph.domain.model.ToolExecutionRecord;
import me.golemcore.graph.domain.model.ToolFailureKind;
import me.golemcore.graph.domain.model.ToolInvocation;
import me.golemcore.graph.domain.model.ToolOutcome;
import me.golemcore.graph.domain.model.ToolParamSpec;
import me.golemcore.graph.domain.permission.PermissionEnforcer;
import me.golemcore.graph.domain.permission.PermissionErrorKind;
import me.golemcore.graph.domain.permission.PermissionException;
import me.golemcore.graph.infrastructure.config.GraphRuntimeProperties;
import me.golemcore.graph.port.outbound.ToolInvokerPort;
import me.golemcore.graph.testsupport.QueuedDecisionPort;
import me.golemcore.graph.testsupport.SnapshotFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static me.golemcore.graph.testsupport.SnapshotFixtures.agent;
import static me.golemcore.graph.testsupport.SnapshotFixtures.echoTool;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultRunLoopEngineTest {

    private static final String USER_INPUT = "Where is my order?";

    @Mock
    private ToolInvokerPort toolInvoker;

    private GraphRuntimeProperties.EngineProperties settings;
    private DefaultRunLoopEngine engine;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));
        settings = new GraphRuntimeProperties.EngineProperties();
        PreviewRenderer renderer = new PreviewRenderer(new ObjectMapper());
        engine = new DefaultRunLoopEngine(new DefaultContextBuilder(new PromptConstraintsRenderer(), 10),
                new PermissionEnforcer(), toolInvoker, renderer, PreviewLimits.defaults(), settings, clock);

        when(toolInvoker.invoke(any())).thenAnswer(invocation -> {
            ToolInvocation call = invocation.getArgument(0);
            return CompletableFuture.completedFuture(ToolOutcome.success(Map.of("echo", call.params())));
        });
    }

    private RunResult run(CompiledSnapshot snapshot, QueuedDecisionPort decisions) {
        return run(snapshot, decisions, Map.of());
    }

    private RunResult run(CompiledSnapshot snapshot, QueuedDecisionPort decisions, Map<String, Object> system) {
        return engine.run(RunRequest.builder()
                .runId("run-1")
                .snapshot(snapshot)
                .userInput(USER_INPUT)
                .systemParams(system)
                .decisionPort(decisions)
                .build());
    }

    private static Decision lookup(String agentKey) {
        return Decision.useTool("check", "lookup_" + agentKey, Map.of("q", "order"));
    }

    private static RuntimePolicy policy(int maxSteps, int maxToolErrors) {
        return RuntimePolicy.of(maxSteps, maxToolErrors);
    }

    // ==================== Scenarios ====================

    @Test
    void shouldRouteThenRespond() {
        QueuedDecisionPort decisions = QueuedDecisionPort.of(
                Decision.routeTo("needs writing", "writer"),
                Decision.respond("answer", Map.of("text", "shipped")));

        RunResult result = run(SnapshotFixtures.triageWriter(), decisions);

        assertEquals(RunStatus.DONE, result.getStatus());
        assertEquals(2, result.getSteps());
        assertEquals(1, result.getControlEpoch());
        assertEquals("writer", result.getFinalAgentKey());
        assertEquals(Map.of("text", "shipped"), result.getFinalPayload());
        assertNull(result.getError());
        assertEquals(2, result.getExecutionLog().size());
        assertEquals(ActionType.RESPOND,
                ((ExecutionLogEntry.AgentStep) result.getExecutionLog().get(1)).action());
        assertEquals(List.of("triage", "writer"),
                decisions.requests().stream().map(DecisionRequest::agentKey).toList());
    }

    @Test
    void shouldFailFastWhenAgentUsesUnequippedTool() {
        QueuedDecisionPort decisions = QueuedDecisionPort.of(Decision.useTool("try", "anything", Map.of()));

        RunResult result = run(SnapshotFixtures.triageWriter(), decisions);

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(RunErrorKind.PERMISSION_DENIED, result.getError().kind());
        assertTrue(result.getError().message().startsWith("UNAUTHORIZED_TOOL"));
        assertEquals(1, result.getExecutionLog().size());
        ExecutionLogEntry.AgentStep entry = (ExecutionLogEntry.AgentStep) result.getExecutionLog().get(0);
        assertEquals(StepStatus.ERROR, entry.status());
        assertTrue(entry.error().contains("anything"));
        verify(toolInvoker, never()).invoke(any());
    }

    @Test
    void shouldTripMaxStepsGuardWithPartialLog() {
        CompiledSnapshot snapshot = SnapshotFixtures.pingPong(policy(3, 3));
        QueuedDecisionPort decisions = QueuedDecisionPort.repeating(request -> lookup("a"));

        RunResult result = run(snapshot, decisions);

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(RunErrorKind.MAX_STEPS_EXCEEDED, result.getError().kind());
        assertTrue(result.getError().kind().isGuardTripped());
        assertEquals(3, result.getSteps());
        assertEquals(3, result.getExecutionLog().size());
        assertTrue(result.getExecutionLog().stream().allMatch(e -> e instanceof ExecutionLogEntry.ToolStep));
        assertEquals(3, result.getToolLogIndex().size());
        verify(toolInvoker, times(3)).invoke(any());
    }

    // ==================== Log properties ====================

    @Test
    void shouldNumberStepsFromZeroStrictlyIncreasing() {
        QueuedDecisionPort decisions = QueuedDecisionPort.of(lookup("a"), lookup("a"),
                Decision.routeTo("b please", "b"), lookup("b"), Decision.respond("done", "ok"));

        RunResult result = run(SnapshotFixtures.pingPong(policy(10, 3)), decisions);

        List<Integer> steps = result.getExecutionLog().stream().map(ExecutionLogEntry::step).toList();
        assertEquals(List.of(0, 1, 2, 3, 4), steps);
    }

    @Test
    void shouldChangeEpochOnlyWhenControlChangesHands() {
        QueuedDecisionPort decisions = QueuedDecisionPort.of(lookup("a"), lookup("a"),
                Decision.routeTo("to b", "b"), lookup("b"), Decision.routeTo("back", "a"),
                Decision.respond("done", "ok"));

        RunResult result = run(SnapshotFixtures.pingPong(policy(10, 3)), decisions);

        assertEquals(RunStatus.DONE, result.getStatus());
        assertEquals(List.of(0, 0, 0, 1, 1, 2),
                result.getExecutionLog().stream().map(ExecutionLogEntry::epoch).toList());
        assertEquals(2, result.getControlEpoch());
    }

    @Test
    void shouldNotLeakToolOutputsAcrossHandBacks() {
        QueuedDecisionPort decisions = QueuedDecisionPort.of(lookup("a"), Decision.routeTo("to b", "b"),
                lookup("b"), Decision.routeTo("back", "a"), Decision.respond("done", "ok"));

        run(SnapshotFixtures.pingPong(policy(10, 3)), decisions);

        List<DecisionRequest> requests = decisions.requests();
        assertEquals(5, requests.size());
        assertEquals(1, requests.get(1).context().toolOutputs().size());
        assertTrue(requests.get(2).context().toolOutputs().isEmpty());
        assertEquals(1, requests.get(3).context().toolOutputs().size());
        assertEquals("lookup_b", requests.get(3).context().toolOutputs().get(0).toolKey());
        assertEquals("a", requests.get(4).agentKey());
        assertTrue(requests.get(4).context().toolOutputs().isEmpty());
    }

    @Test
    void shouldKeepExecutionIdsConsistentAcrossBothLogs() {
        QueuedDecisionPort decisions = QueuedDecisionPort.of(lookup("a"), lookup("a"),
                Decision.routeTo("to b", "b"), lookup("b"), Decision.respond("done", "ok"));

        RunResult result = run(SnapshotFixtures.pingPong(policy(10, 3)), decisions);

        Set<String> logged = result.getExecutionLog().stream()
                .filter(ExecutionLogEntry.ToolStep.class::isInstance)
                .map(e -> ((ExecutionLogEntry.ToolStep) e).executionId())
                .collect(Collectors.toSet());
        assertEquals(3, logged.size());
        assertEquals(logged, Set.copyOf(result.getToolLogIndex()));
        assertEquals(logged, result.getToolLog().keySet());
        for (ToolExecutionRecord record : result.getToolLog().values()) {
            assertEquals(Map.of("q", "order"), record.params());
            assertEquals(StepStatus.OK, record.status());
        }
    }

    // ==================== System params ====================

    @Test
    void shouldInjectSystemParamsAndKeepThemOutOfPreviews() {
        CompiledSnapshot snapshot = SnapshotFixtures.singleAgent(policy(5, 3),
                echoTool("crm", ToolParamSpec.agent("q", true), ToolParamSpec.system("tenant", true)));
        doReturn(CompletableFuture.completedFuture(ToolOutcome.success("found"))).when(toolInvoker).invoke(any());
        QueuedDecisionPort decisions = QueuedDecisionPort.of(
                Decision.useTool("lookup", "crm", Map.of("q", "acme", "tenant", "evil")),
                Decision.respond("done", "ok"));

        RunResult result = run(snapshot, decisions, Map.of("tenant", "tenant-7"));

        ArgumentCaptor<ToolInvocation> captor = ArgumentCaptor.forClass(ToolInvocation.class);
        verify(toolInvoker).invoke(captor.capture());
        assertEquals("tenant-7", captor.getValue().params().get("tenant"));
        ExecutionLogEntry.ToolStep step = (ExecutionLogEntry.ToolStep) result.getExecutionLog().get(0);
        assertFalse(step.requestPreview().contains("tenant"));
        assertFalse(decisions.requests().get(1).context().render().contains("tenant-7"));
    }

    @Test
    void shouldKeepSystemParamsOutOfContextWithBuiltInEchoTool() {
        ToolProviderRegistry registry = new ToolProviderRegistry(List.of(new EchoToolProvider()), Runnable::run);
        DefaultRunLoopEngine echoEngine = new DefaultRunLoopEngine(
                new DefaultContextBuilder(new PromptConstraintsRenderer(), 10), new PermissionEnforcer(), registry,
                new PreviewRenderer(new ObjectMapper()), PreviewLimits.defaults(), settings,
                Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC")));
        CompiledSnapshot snapshot = SnapshotFixtures.singleAgent(policy(5, 3),
                echoTool("crm", ToolParamSpec.agent("q", true), ToolParamSpec.system("tenant", true)));
        QueuedDecisionPort decisions = QueuedDecisionPort.of(
                Decision.useTool("lookup", "crm", Map.of("q", "acme")),
                Decision.respond("done", "ok"));

        RunResult result = echoEngine.run(RunRequest.builder()
                .runId("run-1")
                .snapshot(snapshot)
                .userInput(USER_INPUT)
                .systemParams(Map.of("tenant", "SECRET-TENANT-7"))
                .decisionPort(decisions)
                .build());

        assertEquals(RunStatus.DONE, result.getStatus());
        ToolExecutionRecord record = result.getToolLog().get(result.getToolLogIndex().get(0));
        assertEquals("SECRET-TENANT-7", record.params().get("tenant"));
        String context = decisions.requests().get(1).context().render();
        assertTrue(context.contains("acme"));
        assertFalse(context.contains("SECRET-TENANT-7"));
        ExecutionLogEntry.ToolStep step = (ExecutionLogEntry.ToolStep) result.getExecutionLog().get(0);
        assertFalse(step.requestPreview().contains("SECRET-TENANT-7"));
        assertFalse(step.responsePreview().contains("SECRET-TENANT-7"));
    }

    // ==================== Execution log policy ====================

    @Test
    void shouldLogToolStepWhenFieldPathIsMalformed() {
        ExecutionLogPolicy logPolicy = new ExecutionLogPolicy(null, Map.of("crm", new ExecutionLogPolicy.ToolPreview(
                null, List.of(new ExecutionLogPolicy.Field("items[0", "first", null)), null, null)));
        CompiledSnapshot snapshot = SnapshotFixtures.singleAgent(new RuntimePolicy(5, 3, null, null, logPolicy),
                echoTool("crm", ToolParamSpec.agent("q", true)));
        QueuedDecisionPort decisions = QueuedDecisionPort.of(
                Decision.useTool("lookup", "crm", Map.of("q", "acme")),
                Decision.respond("done", "ok"));

        RunResult result = run(snapshot, decisions);

        assertEquals(RunStatus.DONE, result.getStatus());
        ExecutionLogEntry.ToolStep step = (ExecutionLogEntry.ToolStep) result.getExecutionLog().get(0);
        assertEquals(result.getToolLogIndex().get(0), step.executionId());
        assertTrue(step.responsePreview().contains("acme"));
        assertNull(step.responseExcerpt());
    }

    // ==================== Permission policy ====================

    @Test
    void shouldContinueAfterRejectionWhenTolerated() {
        CompiledSnapshot snapshot = new CompiledSnapshot("v1",
                List.of(agent("solo", true, true, List.of(), List.of())), List.of(), List.of(), "solo",
                new RuntimePolicy(5, 3, PermissionFailurePolicy.TOLERATE, null, null));
        QueuedDecisionPort decisions = QueuedDecisionPort.of(Decision.routeTo("nowhere", "ghost"),
                Decision.respond("fine", "ok"));

        RunResult result = run(snapshot, decisions);

        assertEquals(RunStatus.DONE, result.getStatus());
        assertEquals(2, result.getSteps());
        assertEquals(StepStatus.ERROR, result.getExecutionLog().get(0).status());
        assertTrue(decisions.requests().get(1).context().logSummary().get(0).contains("rejected"));
    }

    @Test
    void shouldRecordMalformedDecisionAsRejection() {
        QueuedDecisionPort decisions = QueuedDecisionPort.repeating(request -> {
            throw new PermissionException(PermissionErrorKind.MALFORMED_DECISION, "Unknown action: JUMP");
        });

        RunResult result = run(SnapshotFixtures.triageWriter(), decisions);

        assertEquals(RunErrorKind.PERMISSION_DENIED, result.getError().kind());
        assertTrue(result.getError().message().startsWith("MALFORMED_DECISION"));
        assertEquals(1, result.getExecutionLog().size());
        assertNull(((ExecutionLogEntry.AgentStep) result.getExecutionLog().get(0)).action());
    }

    // ==================== Tool failures ====================

    @Test
    void shouldTripToolErrorGuardOnConsecutiveFailures() {
        doReturn(CompletableFuture.completedFuture(ToolOutcome.failure("boom"))).when(toolInvoker).invoke(any());
        QueuedDecisionPort decisions = QueuedDecisionPort.repeating(request -> lookup("a"));

        RunResult result = run(SnapshotFixtures.pingPong(policy(10, 2)), decisions);

        assertEquals(RunErrorKind.MAX_TOOL_ERRORS_EXCEEDED, result.getError().kind());
        assertEquals(2, result.getSteps());
        assertEquals(2, result.getToolLog().size());
        assertTrue(result.getToolLog().values().stream().allMatch(r -> r.status() == StepStatus.ERROR));
        assertEquals(StepStatus.ERROR, result.getExecutionLog().get(1).status());
    }

    @Test
    void shouldResetFailureCountAfterSuccess() {
        AtomicInteger calls = new AtomicInteger();
        doAnswer(invocation -> CompletableFuture.completedFuture(
                calls.incrementAndGet() == 2 ? ToolOutcome.success("ok") : ToolOutcome.failure("boom")))
                .when(toolInvoker).invoke(any());
        QueuedDecisionPort decisions = QueuedDecisionPort.of(lookup("a"), lookup("a"), lookup("a"),
                Decision.respond("done", "ok"));

        RunResult result = run(SnapshotFixtures.pingPong(policy(10, 2)), decisions);

        assertEquals(RunStatus.DONE, result.getStatus());
        assertEquals(4, result.getSteps());
    }

    @Test
    void shouldTreatToolTimeoutAsToolFailure() {
        doReturn(new CompletableFuture<ToolOutcome>()).when(toolInvoker).invoke(any());
        CompiledSnapshot snapshot = new CompiledSnapshot("v1",
                List.of(agent("solo", true, true, List.of("slow"), List.of())),
                List.of(echoTool("slow")), List.of(), "solo",
                new RuntimePolicy(5, 1, null, 50L, null));
        QueuedDecisionPort decisions = QueuedDecisionPort.repeating(
                request -> Decision.useTool("wait", "slow", Map.of()));

        RunResult result = run(snapshot, decisions);

        assertEquals(RunErrorKind.MAX_TOOL_ERRORS_EXCEEDED, result.getError().kind());
        ToolExecutionRecord record = result.getToolLog().values().iterator().next();
        assertEquals(ToolFailureKind.TIMEOUT, record.failureKind());
        assertTrue(record.error().contains("timed out"));
    }

    @Test
    void shouldRecordToolThatThrowsSynchronously() {
        doThrow(new IllegalStateException("no connection")).when(toolInvoker).invoke(any());
        QueuedDecisionPort decisions = QueuedDecisionPort.of(lookup("a"), Decision.respond("done", "ok"));

        RunResult result = run(SnapshotFixtures.pingPong(policy(10, 3)), decisions);

        assertEquals(RunStatus.DONE, result.getStatus());
        ToolExecutionRecord record = result.getToolLog().values().iterator().next();
        assertEquals(ToolFailureKind.EXECUTION_FAILED, record.failureKind());
        assertTrue(record.error().contains("no connection"));
    }

    // ==================== Other endings ====================

    @Test
    void shouldFailWhenDecisionProducerFails() {
        RunResult result = run(SnapshotFixtures.triageWriter(), QueuedDecisionPort.of());

        assertEquals(RunErrorKind.DECISION_FAILED, result.getError().kind());
        assertTrue(result.getError().message().contains("No decision planned"));
        assertTrue(result.getExecutionLog().isEmpty());
    }

    @Test
    void shouldStopAtNextStepBoundaryWhenCancelled() {
        RunCancellation cancellation = new RunCancellation();
        QueuedDecisionPort decisions = QueuedDecisionPort.repeating(request -> {
            cancellation.cancel();
            return lookup("a");
        });

        RunResult result = engine.run(RunRequest.builder()
                .snapshot(SnapshotFixtures.pingPong(policy(10, 3)))
                .userInput(USER_INPUT)
                .decisionPort(decisions)
                .cancellation(cancellation)
                .build());

        assertEquals(RunErrorKind.CANCELLED, result.getError().kind());
        assertEquals(1, result.getSteps());
        assertEquals(1, result.getToolLog().size());
        assertFalse(result.getRunId().isBlank());
    }

    @Test
    void shouldRejectUnknownEntryAgent() {
        RunResult result = engine.run(RunRequest.builder()
                .runId("run-x")
                .snapshot(SnapshotFixtures.triageWriter())
                .startAgentKey("ghost")
                .decisionPort(QueuedDecisionPort.of())
                .build());

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(RunErrorKind.INVALID_REQUEST, result.getError().kind());
        assertTrue(result.getExecutionLog().isEmpty());
    }

    @Test
    void shouldFallBackToEngineDefaultsWhenSnapshotPolicyIsUnset() {
        settings.setDefaultMaxSteps(2);
        CompiledSnapshot snapshot = SnapshotFixtures.pingPong(RuntimePolicy.defaults());

        RunResult result = run(snapshot, QueuedDecisionPort.repeating(request -> lookup("a")));

        assertEquals(RunErrorKind.MAX_STEPS_EXCEEDED, result.getError().kind());
        assertEquals(2, result.getSteps());
    }
}
