package me.golemcore.graph.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.Map;

/**
 * Compact, truncated summary of one processed step. Entries are appended in step
 * order and never changed afterwards; full tool payloads live only in the tool
 * execution log, addressed by {@code execution_id}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ExecutionLogEntry.AgentStep.class, name = "agent"),
        @JsonSubTypes.Type(value = ExecutionLogEntry.ToolStep.class, name = "tool")
})
public sealed interface ExecutionLogEntry permits ExecutionLogEntry.AgentStep, ExecutionLogEntry.ToolStep {

    int step();

    int epoch();

    String agentKey();

    StepStatus status();

    /**
     * Agent decision that did not call a tool: a route, a response, or a rejected
     * decision (status {@code error}).
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record AgentStep(
            @JsonProperty("step") int step,
            @JsonProperty("epoch") int epoch,
            @JsonProperty("agent_key") String agentKey,
            @JsonProperty("input_preview") String inputPreview,
            @JsonProperty("action") ActionType action,
            @JsonProperty("reasoning_preview") String reasoningPreview,
            @JsonProperty("details_preview") String detailsPreview,
            @JsonProperty("status") StepStatus status,
            @JsonProperty("error") String error,
            @JsonProperty("started_at") Instant startedAt,
            @JsonProperty("duration_ms") long durationMs) implements ExecutionLogEntry {
    }

    /**
     * Tool invocation summary. Previews are bounded and lossy.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ToolStep(
            @JsonProperty("step") int step,
            @JsonProperty("epoch") int epoch,
            @JsonProperty("agent_key") String agentKey,
            @JsonProperty("tool_key") String toolKey,
            @JsonProperty("execution_id") String executionId,
            @JsonProperty("reasoning_preview") String reasoningPreview,
            @JsonProperty("request_preview") String requestPreview,
            @JsonProperty("response_preview") String responsePreview,
            @JsonProperty("request_excerpt") Map<String, String> requestExcerpt,
            @JsonProperty("response_excerpt") Map<String, String> responseExcerpt,
            @JsonProperty("status") StepStatus status,
            @JsonProperty("started_at") Instant startedAt,
            @JsonProperty("duration_ms") long durationMs) implements ExecutionLogEntry {
    }
}
