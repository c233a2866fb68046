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

import me.golemcore.graph.domain.log.ExecutionLog;
import me.golemcore.graph.domain.log.ToolExecutionLog;
import me.golemcore.graph.domain.model.AgentSpec;
import me.golemcore.graph.domain.model.CompiledSnapshot;
import me.golemcore.graph.domain.model.ExecutionLogEntry;
import me.golemcore.graph.domain.model.StepStatus;
import me.golemcore.graph.domain.model.ToolExecutionRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Default context builder.
 *
 * <p>
 * Full tool payloads are included only for {@code (currentAgentKey, epoch)}
 * where epoch is the agent's latest control epoch. Another agent's tool
 * outputs, and the same agent's outputs from before its latest hand-back,
 * appear only as one-line log summaries without payload previews.
 */
public class DefaultContextBuilder implements ContextBuilder {

    private final PromptConstraintsRenderer constraintsRenderer;
    private final int logSummaryEntries;

    public DefaultContextBuilder(PromptConstraintsRenderer constraintsRenderer, int logSummaryEntries) {
        this.constraintsRenderer = constraintsRenderer;
        this.logSummaryEntries = logSummaryEntries;
    }

    @Override
    public ContextPayload build(CompiledSnapshot snapshot, String currentAgentKey, ExecutionLog executionLog,
            ToolExecutionLog toolLog, String latestUserInput) {
        OptionalInt epoch = executionLog.latestEpochFor(currentAgentKey);

        List<ContextPayload.ToolOutput> outputs = epoch.isPresent()
                ? toolLog.collectFullFor(currentAgentKey, epoch.getAsInt()).stream()
                        .map(record -> toOutput(snapshot, record))
                        .toList()
                : List.of();

        Optional<AgentSpec> agent = snapshot.findAgent(currentAgentKey);
        String fragment = agent.map(a -> constraintsRenderer.render(snapshot, a)).orElse("");

        return new ContextPayload(currentAgentKey, epoch.isPresent() ? epoch.getAsInt() : null, latestUserInput,
                fragment, outputs, summarize(executionLog.snapshot()));
    }

    private ContextPayload.ToolOutput toOutput(CompiledSnapshot snapshot, ToolExecutionRecord record) {
        Map<String, Object> visibleParams = snapshot.findTool(record.toolKey())
                .map(tool -> tool.withoutSystemParams(record.params()))
                .orElse(record.params());
        return new ContextPayload.ToolOutput(record.toolKey(), record.executionId(), visibleParams,
                record.result(), record.status(), record.error());
    }

    private List<String> summarize(List<ExecutionLogEntry> entries) {
        int from = logSummaryEntries > 0 ? Math.max(0, entries.size() - logSummaryEntries) : 0;
        return entries.subList(from, entries.size()).stream().map(this::summarize).toList();
    }

    private String summarize(ExecutionLogEntry entry) {
        if (entry instanceof ExecutionLogEntry.ToolStep tool) {
            return "step " + tool.step() + ": tool " + tool.toolKey() + " status=" + statusLabel(tool.status());
        }
        ExecutionLogEntry.AgentStep agent = (ExecutionLogEntry.AgentStep) entry;
        StringBuilder line = new StringBuilder("step ").append(agent.step()).append(": agent ")
                .append(agent.agentKey()).append(" → ").append(agent.action());
        if (agent.detailsPreview() != null && !agent.detailsPreview().isEmpty()) {
            line.append(' ').append(agent.detailsPreview());
        }
        if (agent.status() == StepStatus.ERROR) {
            line.append(" rejected: ").append(agent.error());
        }
        return line.toString();
    }

    private String statusLabel(StepStatus status) {
        return status == StepStatus.OK ? "ok" : "error";
    }
}
