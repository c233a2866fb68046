package me.golemcore.graph.domain.validation;

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
 * Kinds of topological problems found in a snapshot.
 */
public enum ValidationErrorKind {

    /**
     * Not exactly one agent flagged {@code is_default}.
     */
    DEFAULT_AGENT_UNIQUENESS,

    /**
     * {@code default_agent_key} does not name the agent flagged as default.
     */
    DEFAULT_AGENT_MISMATCH,

    /**
     * No agent has {@code allow_respond}.
     */
    RESPOND_CAPABILITY_EXISTS,

    /**
     * A route edge or {@code allowed_routes} entry names a missing agent.
     */
    ROUTE_REFERENTIAL_INTEGRITY,

    /**
     * An {@code equipped_tools} entry names a missing tool.
     */
    TOOL_REFERENTIAL_INTEGRITY,

    /**
     * Two agents or two tools share a key.
     */
    DUPLICATE_KEY,

    /**
     * An {@code execution_log} field path cannot be parsed.
     */
    EXECUTION_LOG_FIELD_PATH,

    /**
     * No route path from the default agent to any respond-capable agent.
     */
    REACHABILITY,

    /**
     * Warning only: a reachable cycle from which no respond-capable agent can be
     * reached.
     */
    NON_TERMINATING_CYCLE
}
