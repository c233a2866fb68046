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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Action chosen by a decision. Closed: the run loop dispatches on
 * {@link #type()} with an exhaustive switch.
 */
public sealed interface AgentAction permits AgentAction.UseTool, AgentAction.RouteToAgent, AgentAction.Respond {

    ActionType type();

    /**
     * Call a tool equipped on the current agent.
     *
     * @param toolKey
     *            key of the tool
     * @param params
     *            agent-supplied arguments (system-sourced names are ignored)
     */
    record UseTool(String toolKey, Map<String, Object> params) implements AgentAction {

        public UseTool {
            params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        }

        @Override
        public ActionType type() {
            return ActionType.USE_TOOL;
        }
    }

    /**
     * Hand control to another agent.
     *
     * @param targetAgentKey
     *            agent receiving control
     * @param context
     *            optional hand-off notes kept in the log preview
     */
    record RouteToAgent(String targetAgentKey, Map<String, Object> context) implements AgentAction {

        public RouteToAgent {
            context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }

        @Override
        public ActionType type() {
            return ActionType.ROUTE_TO_AGENT;
        }
    }

    /**
     * Terminate the run with a payload.
     */
    record Respond(Object payload) implements AgentAction {

        @Override
        public ActionType type() {
            return ActionType.RESPOND;
        }
    }
}
