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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.graph.domain.context.ContextBuilder;
import me.golemcore.graph.domain.context.ContextPayload;
import me.golemcore.graph.domain.log.ExecutionLog;
import me.golemcore.graph.domain.log.PreviewLimits;
import me.golemcore.graph.domain.log.PreviewRenderer;
import me.golemcore.graph.domain.log.StepTiming;
import me.golemcore.graph.domain.log.ToolExecutionLog;
import me.golemcore.graph.domain.model.CompiledSnapshot;
import me.golemcore.graph.domain.model.Decision;
import me.golemcore.graph.domain.model.DecisionRequest;
import me.golemcore.graph.domain.model.PermissionFailurePolicy;
import me.golemcore.graph.domain.model.RunError;
import me.golemcore.graph.domain.model.RunErrorKind;
import me.golemcore.graph.domain.model.RunResult;
import me.golemcore.graph.domain.model.RunStatus;
import me.golemcore.graph.domain.model.StepStatus;
import me.golemcore.graph.domain.model.ToolExecutionRecord;
import me.golemcore.graph.domain.model.ToolFailureKind;
import me.golemcore.graph.domain.model.ToolInvocation;
import me.golemcore.graph.domain.model.ToolOutcome;
import me.golemcore.graph.domain.permission.PermissionCheck;
import me.golemcore.graph.domain.permission.PermissionEnforcer;
import me.golemcore.graph.domain.permission.PermissionException;
import me.golemcore.graph.domain.permission.ResolvedAction;
import me.golemcore.graph.infrastructure.config.GraphRuntimeProperties;
import me.golemcore.graph.port.outbound.DecisionPort;
import me.golemcore.graph.port.outbound.ToolInvokerPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Run loop orchestrator.
 *
 * <p>
 * Per step: build context for the current agent, obtain one decision,
 * authorize it, execute its effect, append to both logs, advance. The loop
 * stops on RESPOND, on a guard (max steps, consecutive tool failures), on a
 * fail-fast permission rejection, on decision producer failure, or on
 * cancellation. Every ending returns the log accumulated so far.
 *
 * <p>
 * All per-run state (run state and both logs) is created inside
 * {@link #run(RunRequest)}; the engine itself is stateless and shared by
 * concurrent runs.
 */
@Slf4j
public class DefaultRunLoopEngine implements RunLoopEngine {

    private static final String CONTINUED_INPUT = "(continued)";

    private final ContextBuilder contextBuilder;
    private final PermissionEnforcer permissionEnforcer;
    private final ToolInvokerPort toolInvoker;
    private final PreviewRenderer previewRenderer;
    private final PreviewLimits previewLimits;
    private final GraphRuntimeProperties.EngineProperties settings;
    private final Clock clock;

    public DefaultRunLoopEngine(ContextBuilder contextBuilder, PermissionEnforcer permissionEnforcer,
            ToolInvokerPort toolInvoker, PreviewRenderer previewRenderer, PreviewLimits previewLimits,
            GraphRuntimeProperties.EngineProperties settings, Clock clock) {
        this.contextBuilder = contextBuilder;
        this.permissionEnforcer = permissionEnforcer;
        this.toolInvoker = toolInvoker;
        this.previewRenderer = previewRenderer;
        this.previewLimits = previewLimits;
        this.settings = settings != null ? settings : new GraphRuntimeProperties.EngineProperties();
        this.clock = clock;
    }

    @Override
    public RunResult run(RunRequest request) {
        String runId = request.getRunId() != null ? request.getRunId() : UUID.randomUUID().toString();
        CompiledSnapshot snapshot = request.getSnapshot();
        if (snapshot == null) {
            return rejectRequest(runId, "No snapshot supplied");
        }
        if (request.getDecisionPort() == null) {
            return rejectRequest(runId, "No decision producer supplied");
        }
        String startAgent = request.getStartAgentKey() != null
                ? request.getStartAgentKey()
                : snapshot.resolveDefaultAgentKey().orElse(null);
        if (startAgent == null || snapshot.findAgent(startAgent).isEmpty()) {
            return rejectRequest(runId, "Unknown entry agent: " + startAgent);
        }

        RunContext run = new RunContext(runId, snapshot, request,
                EffectivePolicy.resolve(snapshot.policy(), settings), new RunState(startAgent),
                new ExecutionLog(previewRenderer, previewLimits, snapshot.policy().executionLog()),
                new ToolExecutionLog());

        log.info("[RunLoop] run {} started: snapshot={}, agent={}, maxSteps={}, maxToolErrors={}", runId,
                snapshot.versionKey(), startAgent, run.policy.maxSteps(), run.policy.maxToolErrors());

        RunState state = run.state;
        while (state.isRunning()) {
            if (state.getStep() >= run.policy.maxSteps()) {
                log.warn("[RunLoop] run {} reached max steps ({})", runId, run.policy.maxSteps());
                state.fail(new RunError(RunErrorKind.MAX_STEPS_EXCEEDED,
                        "max_steps_exceeded: no response after " + run.policy.maxSteps() + " steps"));
                break;
            }
            if (isCancelled(request)) {
                log.info("[RunLoop] run {} cancelled before step {}", runId, state.getStep());
                state.fail(new RunError(RunErrorKind.CANCELLED, "Run cancelled at step " + state.getStep()));
                break;
            }
            processStep(run);
        }

        return buildResult(run);
    }

    private void processStep(RunContext run) {
        RunState state = run.state;
        String agentKey = state.getCurrentAgentKey();
        int step = state.getStep();
        run.executionLog.enterEpoch(agentKey, state.getControlEpoch());

        String input = step == 0 ? run.request.getUserInput() : CONTINUED_INPUT;
        ContextPayload context = contextBuilder.build(run.snapshot, agentKey, run.executionLog, run.toolLog,
                run.request.getUserInput());

        Instant startedAt = clock.instant();
        Decision decision;
        try {
            decision = run.request.getDecisionPort()
                    .decide(new DecisionRequest(run.runId, step, agentKey, context))
                    .join();
        } catch (RuntimeException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof PermissionException malformed) {
                reject(run, input, null, PermissionCheck.denied(malformed), startedAt);
                return;
            }
            log.error("[RunLoop] run {} decision producer failed at step {}", run.runId, step, cause);
            state.fail(new RunError(RunErrorKind.DECISION_FAILED,
                    "Decision producer failed: " + safeCauseMessage(cause)));
            return;
        }
        if (decision == null) {
            state.fail(new RunError(RunErrorKind.DECISION_FAILED, "Decision producer returned no decision"));
            return;
        }

        PermissionCheck check = permissionEnforcer.authorize(run.snapshot, agentKey, decision,
                run.request.getSystemParams());
        if (!check.isAllowed()) {
            reject(run, input, decision, check, startedAt);
            return;
        }

        ResolvedAction action = check.action();
        switch (action.type()) {
        case USE_TOOL -> executeTool(run, decision, (ResolvedAction.ToolCall) action, startedAt);
        case ROUTE_TO_AGENT -> route(run, input, decision, (ResolvedAction.Route) action, startedAt);
        case RESPOND -> respond(run, input, decision, (ResolvedAction.Respond) action, startedAt);
        }
    }

    private void reject(RunContext run, String input, Decision decision, PermissionCheck check, Instant startedAt) {
        RunState state = run.state;
        run.executionLog.appendRejectedStep(state.getStep(), state.getControlEpoch(), state.getCurrentAgentKey(),
                input, decision, check.describeError(), timing(startedAt));
        log.warn("[RunLoop] run {} step {}: decision of agent {} rejected: {}", run.runId, state.getStep(),
                state.getCurrentAgentKey(), check.describeError());
        state.advanceStep();
        if (run.policy.permissionFailurePolicy() == PermissionFailurePolicy.FAIL_FAST) {
            state.fail(new RunError(RunErrorKind.PERMISSION_DENIED, check.describeError()));
        }
    }

    private void executeTool(RunContext run, Decision decision, ResolvedAction.ToolCall call, Instant startedAt) {
        RunState state = run.state;
        String agentKey = state.getCurrentAgentKey();
        String toolKey = call.tool().key();
        String executionId = UUID.randomUUID().toString();
        if (!call.ignoredParams().isEmpty()) {
            log.warn("[RunLoop] run {}: agent {} supplied system params {} for tool {}; ignored", run.runId,
                    agentKey, call.ignoredParams(), toolKey);
        }

        Instant toolStarted = clock.instant();
        ToolOutcome outcome = invokeWithTimeout(
                new ToolInvocation(run.runId, executionId, agentKey, call.tool(), call.params()),
                run.policy.toolTimeoutMs());
        Instant finished = clock.instant();
        long durationMs = Duration.between(toolStarted, finished).toMillis();

        StepStatus status = outcome.isSuccess() ? StepStatus.OK : StepStatus.ERROR;
        ToolExecutionRecord record = new ToolExecutionRecord(executionId, agentKey, state.getControlEpoch(),
                state.getStep(), toolKey, call.params(), outcome.getResult(), status, outcome.getError(),
                outcome.getFailureKind(), durationMs, finished);
        run.toolLog.put(executionId, record);
        run.executionLog.appendToolStep(state.getStep(), state.getControlEpoch(), agentKey, toolKey, executionId,
                decision.reasoning(), call.tool().withoutSystemParams(call.params()), responsePreviewSource(outcome),
                status, new StepTiming(startedAt, Duration.between(startedAt, finished).toMillis()));

        log.debug("[RunLoop] run {} step {}: {} called {} -> {} ({} ms)", run.runId, state.getStep(), agentKey,
                toolKey, status, durationMs);
        state.advanceStep();

        if (outcome.isSuccess()) {
            state.resetToolFailures();
            return;
        }
        int failures = state.recordToolFailure();
        log.warn("[RunLoop] run {}: tool {} failed ({} consecutive): {}", run.runId, toolKey, failures,
                outcome.getError());
        if (failures >= run.policy.maxToolErrors()) {
            state.fail(new RunError(RunErrorKind.MAX_TOOL_ERRORS_EXCEEDED,
                    "max_tool_errors_exceeded: " + failures + " consecutive tool failures"));
        }
    }

    private void route(RunContext run, String input, Decision decision, ResolvedAction.Route route,
            Instant startedAt) {
        RunState state = run.state;
        String from = state.getCurrentAgentKey();
        run.executionLog.appendAgentStep(state.getStep(), state.getControlEpoch(), from, input, decision,
                timing(startedAt));
        state.advanceStep();
        boolean switched = state.routeTo(route.targetAgentKey());
        log.debug("[RunLoop] run {}: {} routed to {} (epoch {}{})", run.runId, from, route.targetAgentKey(),
                state.getControlEpoch(), switched ? ", new" : ", unchanged");
    }

    private void respond(RunContext run, String input, Decision decision, ResolvedAction.Respond respond,
            Instant startedAt) {
        RunState state = run.state;
        run.executionLog.appendAgentStep(state.getStep(), state.getControlEpoch(), state.getCurrentAgentKey(),
                input, decision, timing(startedAt));
        state.advanceStep();
        state.complete(respond.payload());
    }

    private ToolOutcome invokeWithTimeout(ToolInvocation invocation, long timeoutMs) {
        CompletableFuture<ToolOutcome> future;
        try {
            future = toolInvoker.invoke(invocation);
        } catch (RuntimeException e) {
            log.error("[Tools] Tool invocation failed: {}", invocation.tool().key(), e);
            return ToolOutcome.failure("Tool execution failed: " + safeCauseMessage(e));
        }
        if (future == null) {
            return ToolOutcome.failure("Tool returned no outcome");
        }
        try {
            ToolOutcome outcome = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return outcome != null ? outcome : ToolOutcome.failure("Tool returned no outcome");
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] Tool {} timed out after {} ms", invocation.tool().key(), timeoutMs);
            return ToolOutcome.failure(ToolFailureKind.TIMEOUT, "Tool timed out after " + timeoutMs + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolOutcome.failure("Interrupted while waiting for tool " + invocation.tool().key());
        } catch (ExecutionException e) {
            log.error("[Tools] Tool execution failed: {}", invocation.tool().key(), e.getCause());
            return ToolOutcome.failure("Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private Object responsePreviewSource(ToolOutcome outcome) {
        if (outcome.isSuccess()) {
            return outcome.getResult();
        }
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", outcome.getError());
        if (outcome.getResult() != null) {
            error.put("result", outcome.getResult());
        }
        return error;
    }

    private boolean isCancelled(RunRequest request) {
        return (request.getCancellation() != null && request.getCancellation().isCancelled())
                || Thread.currentThread().isInterrupted();
    }

    private StepTiming timing(Instant startedAt) {
        return new StepTiming(startedAt, Duration.between(startedAt, clock.instant()).toMillis());
    }

    private RunResult buildResult(RunContext run) {
        RunState state = run.state;
        RunResult result = RunResult.builder()
                .runId(run.runId)
                .status(state.getStatus())
                .finalPayload(state.getFinalPayload())
                .executionLog(run.executionLog.snapshot())
                .toolLogIndex(run.toolLog.executionIds())
                .toolLog(run.toolLog.records())
                .error(state.getError())
                .steps(state.getStep())
                .controlEpoch(state.getControlEpoch())
                .finalAgentKey(state.getCurrentAgentKey())
                .build();
        if (result.getStatus() == RunStatus.DONE) {
            log.info("[RunLoop] run {} done after {} steps (agent {}, epoch {})", run.runId, result.getSteps(),
                    result.getFinalAgentKey(), result.getControlEpoch());
        } else {
            log.info("[RunLoop] run {} failed after {} steps: {}", run.runId, result.getSteps(), result.getError());
        }
        return result;
    }

    private RunResult rejectRequest(String runId, String message) {
        log.warn("[RunLoop] run {} not started: {}", runId, message);
        return RunResult.builder()
                .runId(runId)
                .status(RunStatus.FAILED)
                .executionLog(List.of())
                .toolLogIndex(List.of())
                .toolLog(Map.of())
                .error(new RunError(RunErrorKind.INVALID_REQUEST, message))
                .build();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while (cursor instanceof CompletionException && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    private static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private static final class RunContext {

        private final String runId;
        private final CompiledSnapshot snapshot;
        private final RunRequest request;
        private final EffectivePolicy policy;
        private final RunState state;
        private final ExecutionLog executionLog;
        private final ToolExecutionLog toolLog;

        private RunContext(String runId, CompiledSnapshot snapshot, RunRequest request, EffectivePolicy policy,
                RunState state, ExecutionLog executionLog, ToolExecutionLog toolLog) {
            this.runId = runId;
            this.snapshot = snapshot;
            this.request = request;
            this.policy = policy;
            this.state = state;
            this.executionLog = executionLog;
            this.toolLog = toolLog;
        }
    }
}
