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

/**
 * Per-snapshot runtime limits. Zero or negative numbers and null values mean
 * "use the engine default".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuntimePolicy(
        @JsonProperty("max_steps") int maxSteps,
        @JsonProperty("max_tool_errors") int maxToolErrors,
        @JsonProperty("permission_failure_policy") PermissionFailurePolicy permissionFailurePolicy,
        @JsonProperty("tool_timeout_ms") Long toolTimeoutMs,
        @JsonProperty("execution_log") ExecutionLogPolicy executionLog) {

    public static RuntimePolicy of(int maxSteps, int maxToolErrors) {
        return new RuntimePolicy(maxSteps, maxToolErrors, null, null, null);
    }

    public static RuntimePolicy defaults() {
        return new RuntimePolicy(0, 0, null, null, null);
    }
}
