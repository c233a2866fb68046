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

import java.util.Map;

/**
 * One structured decision produced externally for the current step.
 *
 * @param reasoning
 *            free-form reasoning text (only a truncated preview is logged)
 * @param action
 *            the chosen action
 */
public record Decision(String reasoning, AgentAction action) {

    public static Decision useTool(String reasoning, String toolKey, Map<String, Object> params) {
        return new Decision(reasoning, new AgentAction.UseTool(toolKey, params));
    }

    public static Decision routeTo(String reasoning, String targetAgentKey) {
        return new Decision(reasoning, new AgentAction.RouteToAgent(targetAgentKey, null));
    }

    public static Decision respond(String reasoning, Object payload) {
        return new Decision(reasoning, new AgentAction.Respond(payload));
    }
}
