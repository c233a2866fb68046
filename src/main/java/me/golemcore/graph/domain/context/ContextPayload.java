package me.golemcore.graph.domain.context;

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

import me.golemcore.graph.domain.model.StepStatus;

import java.util.List;
import java.util.Map;

/**
 * Request-time context handed to the decision producer for one step.
 *
 * <p>
 * {@code toolOutputs} holds only the current agent's tool records from its
 * current control epoch. System parameters are never part of the payload.
 *
 * @param agentKey
 *            agent the context is built for
 * @param epoch
 *            the agent's current control epoch, null when it has no history
 * @param userInput
 *            latest user input
 * @param promptFragment
 *            static compiled prompt plus constraints (tools, routes, contract)
 * @param toolOutputs
 *            full tool payloads of the current epoch, oldest first
 * @param logSummary
 *            truncated rendering of the trailing execution log entries
 */
public record ContextPayload(
        String agentKey,
        Integer epoch,
        String userInput,
        String promptFragment,
        List<ToolOutput> toolOutputs,
        List<String> logSummary) {

    public ContextPayload {
        toolOutputs = toolOutputs == null ? List.of() : List.copyOf(toolOutputs);
        logSummary = logSummary == null ? List.of() : List.copyOf(logSummary);
    }

    /**
     * Full input and output of one tool call, labelled by tool key and execution
     * id.
     */
    public record ToolOutput(String toolKey, String executionId, Map<String, Object> params, Object result,
            StepStatus status, String error) {
    }

    /**
     * Renders the payload as prompt text: user message, tool outputs (most recent
     * first), log summary, then the static prompt fragment.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("User message:\n").append(userInput != null ? userInput : "");
        if (!toolOutputs.isEmpty()) {
            sb.append("\n\nTool outputs (most recent first):");
            for (int i = toolOutputs.size() - 1; i >= 0; i--) {
                ToolOutput output = toolOutputs.get(i);
                sb.append("\n- ").append(output.toolKey()).append(" [").append(output.executionId()).append("]: ");
                sb.append(output.status() == StepStatus.OK ? String.valueOf(output.result()) : "error " + output.error());
            }
        }
        if (!logSummary.isEmpty()) {
            sb.append("\n\nExecution log summary:");
            logSummary.forEach(line -> sb.append("\n  ").append(line));
        }
        if (promptFragment != null && !promptFragment.isBlank()) {
            sb.append("\n\n").append(promptFragment);
        }
        return sb.toString();
    }
}
