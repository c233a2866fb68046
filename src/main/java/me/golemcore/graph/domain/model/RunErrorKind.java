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

/**
 * Why a run ended {@link RunStatus#FAILED}.
 */
public enum RunErrorKind {

    /**
     * The run could not start (no snapshot, unknown entry agent).
     */
    INVALID_REQUEST,

    /**
     * A decision was rejected by the permission enforcer under the fail-fast
     * policy. Malformed decisions end up here too.
     */
    PERMISSION_DENIED,

    /**
     * Step guard: {@code max_steps} reached without a response.
     */
    MAX_STEPS_EXCEEDED,

    /**
     * Consecutive tool failure guard tripped.
     */
    MAX_TOOL_ERRORS_EXCEEDED,

    /**
     * The decision producer failed or returned nothing.
     */
    DECISION_FAILED,

    /**
     * The caller cancelled the run.
     */
    CANCELLED;

    public boolean isGuardTripped() {
        return this == MAX_STEPS_EXCEEDED || this == MAX_TOOL_ERRORS_EXCEEDED;
    }
}
