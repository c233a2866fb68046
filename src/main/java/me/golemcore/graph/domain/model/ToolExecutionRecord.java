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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full, untruncated payload of one tool call, keyed by execution id. Committed
 * only after the call resolved (successfully, with an error, or by timeout).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolExecutionRecord(
        @JsonProperty("execution_id") String executionId,
        @JsonProperty("agent_key") String agentKey,
        @JsonProperty("epoch") int epoch,
        @JsonProperty("step") int step,
        @JsonProperty("tool_key") String toolKey,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("result") Object result,
        @JsonProperty("status") StepStatus status,
        @JsonProperty("error") String error,
        @JsonProperty("failure_kind") ToolFailureKind failureKind,
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("timestamp") Instant timestamp) {

    public ToolExecutionRecord {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == StepStatus.OK;
    }
}
