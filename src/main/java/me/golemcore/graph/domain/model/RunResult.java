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
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one run: final payload (when done), the full summary log, the ids
 * of every recorded tool execution and the full tool records for replay.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunResult {

    @JsonProperty("run_id")
    String runId;

    @JsonProperty("status")
    RunStatus status;

    @JsonProperty("final_payload")
    Object finalPayload;

    @JsonProperty("execution_log")
    List<ExecutionLogEntry> executionLog;

    @JsonProperty("tool_log_index")
    List<String> toolLogIndex;

    @JsonProperty("tool_log")
    Map<String, ToolExecutionRecord> toolLog;

    @JsonProperty("error")
    RunError error;

    @JsonProperty("steps")
    int steps;

    @JsonProperty("control_epoch")
    int controlEpoch;

    @JsonProperty("final_agent_key")
    String finalAgentKey;

    @JsonIgnore
    public boolean isDone() {
        return status == RunStatus.DONE;
    }
}
