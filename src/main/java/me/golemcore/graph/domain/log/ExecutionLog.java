package me.golemcore.graph.domain.log;

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

import me.golemcore.graph.domain.model.ActionType;
import me.golemcore.graph.domain.model.AgentAction;
import me.golemcore.graph.domain.model.Decision;
import me.golemcore.graph.domain.model.ExecutionLogEntry;
import me.golemcore.graph.domain.model.ExecutionLogPolicy;
import me.golemcore.graph.domain.model.StepStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Append-only, step-ordered summary log of one run.
 *
 * <p>
 * Owned by a single run and not thread-safe. Entries carry truncated previews
 * only; full tool payloads go to {@link ToolExecutionLog}.
 */
public class ExecutionLog {

    private final List<ExecutionLogEntry> entries = new ArrayList<>();
    private final Map<String, Integer> epochByAgent = new HashMap<>();
    private final PreviewRenderer renderer;
    private final PreviewLimits limits;
    private final ExecutionLogPolicy policy;

    public ExecutionLog(PreviewRenderer renderer, PreviewLimits limits, ExecutionLogPolicy policy) {
        this.renderer = renderer;
        this.limits = limits != null ? limits : PreviewLimits.defaults();
        this.policy = policy;
    }

    /**
     * Marks {@code agentKey} as holding control during {@code epoch}. Called when
     * an agent takes (or keeps) control, before anything is logged for the step.
     */
    public void enterEpoch(String agentKey, int epoch) {
        epochByAgent.put(agentKey, epoch);
    }

    public ExecutionLogEntry.AgentStep appendAgentStep(int step, int epoch, String agentKey, String userInput,
            Decision decision, StepTiming timing) {
        return appendAgent(step, epoch, agentKey, userInput, decision, StepStatus.OK, null, timing);
    }

    /**
     * Records a decision that was not executed (rejected by the enforcer or
     * malformed).
     */
    public ExecutionLogEntry.AgentStep appendRejectedStep(int step, int epoch, String agentKey, String userInput,
            Decision decision, String error, StepTiming timing) {
        return appendAgent(step, epoch, agentKey, userInput, decision, StepStatus.ERROR, error, timing);
    }

    public ExecutionLogEntry.ToolStep appendToolStep(int step, int epoch, String agentKey, String toolKey,
            String executionId, String reasoning, Object request, Object response, StepStatus status,
            StepTiming timing) {
        PreviewRenderer.ToolPreviews previews = renderer.renderToolPreviews(policy, toolKey, request, response,
                limits.requestMaxChars(), limits.responseMaxChars());
        ExecutionLogEntry.ToolStep entry = new ExecutionLogEntry.ToolStep(step, epoch, agentKey, toolKey,
                executionId, PreviewRenderer.truncate(reasoning, limits.decisionMaxChars()),
                previews.requestPreview(), previews.responsePreview(), previews.requestExcerpt(),
                previews.responseExcerpt(), status, timing.startedAt(), timing.durationMs());
        append(entry);
        return entry;
    }

    /**
     * Read-only copy of the entries in append order.
     */
    public List<ExecutionLogEntry> snapshot() {
        return List.copyOf(entries);
    }

    /**
     * Epoch during which {@code agentKey} most recently held control.
     */
    public OptionalInt latestEpochFor(String agentKey) {
        Integer epoch = epochByAgent.get(agentKey);
        return epoch != null ? OptionalInt.of(epoch) : OptionalInt.empty();
    }

    public int size() {
        return entries.size();
    }

    private ExecutionLogEntry.AgentStep appendAgent(int step, int epoch, String agentKey, String userInput,
            Decision decision, StepStatus status, String error, StepTiming timing) {
        AgentAction action = decision != null ? decision.action() : null;
        ActionType type = action != null ? action.type() : null;
        String reasoning = decision != null ? decision.reasoning() : null;
        ExecutionLogEntry.AgentStep entry = new ExecutionLogEntry.AgentStep(step, epoch, agentKey,
                PreviewRenderer.truncate(userInput, limits.inputMaxChars()), type,
                PreviewRenderer.truncate(reasoning != null ? reasoning : "", limits.decisionMaxChars()),
                renderer.preview(details(action), limits.decisionMaxChars()), status, error, timing.startedAt(),
                timing.durationMs());
        append(entry);
        return entry;
    }

    private void append(ExecutionLogEntry entry) {
        if (!entries.isEmpty()) {
            int last = entries.get(entries.size() - 1).step();
            if (entry.step() <= last) {
                throw new IllegalStateException(
                        "Execution log steps must strictly increase: " + entry.step() + " after " + last);
            }
        }
        entries.add(entry);
        epochByAgent.merge(entry.agentKey(), entry.epoch(), Math::max);
    }

    private Map<String, Object> details(AgentAction action) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (action == null) {
            return details;
        }
        switch (action.type()) {
        case USE_TOOL -> {
            AgentAction.UseTool useTool = (AgentAction.UseTool) action;
            details.put("tool_name", useTool.toolKey());
            details.put("tool_params", useTool.params());
        }
        case ROUTE_TO_AGENT -> {
            AgentAction.RouteToAgent route = (AgentAction.RouteToAgent) action;
            details.put("target_agent_name", route.targetAgentKey());
            if (!route.context().isEmpty()) {
                details.put("context", route.context());
            }
        }
        case RESPOND -> details.put("payload", ((AgentAction.Respond) action).payload());
        }
        return details;
    }
}
