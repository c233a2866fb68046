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

import lombok.Builder;
import lombok.Data;

/**
 * Result of one tool invocation as reported by a tool provider: success status,
 * the full result payload and error information.
 */
@Data
@Builder
public class ToolOutcome {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private Object result;
    private String error;
    private ToolFailureKind failureKind;

    /**
     * Creates a successful outcome carrying the full result payload.
     */
    public static ToolOutcome success(Object result) {
        return ToolOutcome.builder()
                .success(true)
                .result(result)
                .build();
    }

    /**
     * Creates a failed outcome with an execution failure kind.
     */
    public static ToolOutcome failure(String error) {
        return failure(ToolFailureKind.EXECUTION_FAILED, error);
    }

    /**
     * Creates a failed outcome with an explicit failure kind.
     */
    public static ToolOutcome failure(ToolFailureKind kind, String error) {
        return ToolOutcome.builder()
                .success(false)
                .error(error)
                .failureKind(kind)
                .build();
    }
}
