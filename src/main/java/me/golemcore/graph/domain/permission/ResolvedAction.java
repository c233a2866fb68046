package me.golemcore.graph.domain.permission;

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
import me.golemcore.graph.domain.model.ToolSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An authorized action with everything the run loop needs to execute it.
 */
public sealed interface ResolvedAction permits ResolvedAction.ToolCall, ResolvedAction.Route, ResolvedAction.Respond {

    ActionType type();

    /**
     * Tool call with fully resolved parameters.
     *
     * @param tool
     *            compiled tool definition
     * @param params
     *            merged agent, system and default values
     * @param ignoredParams
     *            agent-supplied names that were dropped because the tool
     *            sources them from the system
     */
    record ToolCall(ToolSpec tool, Map<String, Object> params, List<String> ignoredParams)
            implements ResolvedAction {

        public ToolCall {
            params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
            ignoredParams = ignoredParams == null ? List.of() : List.copyOf(ignoredParams);
        }

        @Override
        public ActionType type() {
            return ActionType.USE_TOOL;
        }
    }

    record Route(String targetAgentKey, Map<String, Object> context) implements ResolvedAction {

        @Override
        public ActionType type() {
            return ActionType.ROUTE_TO_AGENT;
        }
    }

    record Respond(Object payload) implements ResolvedAction {

        @Override
        public ActionType type() {
            return ActionType.RESPOND;
        }
    }
}
