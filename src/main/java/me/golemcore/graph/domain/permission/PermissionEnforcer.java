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

import me.golemcore.graph.domain.model.AgentAction;
import me.golemcore.graph.domain.model.AgentSpec;
import me.golemcore.graph.domain.model.CompiledSnapshot;
import me.golemcore.graph.domain.model.Decision;
import me.golemcore.graph.domain.model.ParamSource;
import me.golemcore.graph.domain.model.ToolParamSpec;
import me.golemcore.graph.domain.model.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies a decision against the compiled permission graph and resolves tool
 * parameter sourcing. Pure: no side effects, no logging of parameter values.
 *
 * <p>
 * System-sourced parameters are read only from the run's system parameter map.
 * A same-named value in the decision is dropped and reported in
 * {@link ResolvedAction.ToolCall#ignoredParams()}.
 */
@Component
public class PermissionEnforcer {

    public PermissionCheck authorize(CompiledSnapshot snapshot, String agentKey, Decision decision,
            Map<String, Object> systemParams) {
        if (decision == null || decision.action() == null) {
            return PermissionCheck.denied(PermissionErrorKind.MALFORMED_DECISION, "Decision has no action");
        }
        Optional<AgentSpec> agent = snapshot.findAgent(agentKey);
        if (agent.isEmpty()) {
            return PermissionCheck.denied(PermissionErrorKind.UNKNOWN_AGENT,
                    "Agent '" + agentKey + "' is not part of the snapshot");
        }

        AgentAction action = decision.action();
        Map<String, Object> system = systemParams != null ? systemParams : Map.of();
        return switch (action.type()) {
        case USE_TOOL -> authorizeTool(snapshot, agent.get(), (AgentAction.UseTool) action, system);
        case ROUTE_TO_AGENT -> authorizeRoute(snapshot, agent.get(), (AgentAction.RouteToAgent) action);
        case RESPOND -> authorizeRespond(agent.get(), (AgentAction.Respond) action);
        };
    }

    private PermissionCheck authorizeTool(CompiledSnapshot snapshot, AgentSpec agent, AgentAction.UseTool action,
            Map<String, Object> systemParams) {
        String toolKey = action.toolKey();
        if (toolKey == null || toolKey.isBlank()) {
            return PermissionCheck.denied(PermissionErrorKind.MALFORMED_DECISION, "USE_TOOL without a tool name");
        }
        if (!agent.isEquippedWith(toolKey)) {
            return PermissionCheck.denied(PermissionErrorKind.UNAUTHORIZED_TOOL,
                    "Tool '" + toolKey + "' not permitted for agent " + agent.key());
        }
        Optional<ToolSpec> tool = snapshot.findTool(toolKey);
        if (tool.isEmpty()) {
            return PermissionCheck.denied(PermissionErrorKind.UNKNOWN_TOOL, "Unknown tool '" + toolKey + "'");
        }

        Map<String, Object> supplied = action.params();
        Map<String, Object> resolved = new LinkedHashMap<>();
        List<String> ignored = new ArrayList<>();

        for (ToolParamSpec param : tool.get().params()) {
            Object value = switch (param.source()) {
            case AGENT, DEFAULT -> supplied.get(param.name());
            case SYSTEM -> {
                if (supplied.containsKey(param.name())) {
                    ignored.add(param.name());
                }
                yield systemParams.get(param.name());
            }
            };
            if (value == null && param.hasDefault()) {
                value = param.defaultValue();
            }
            if (value == null) {
                if (param.required()) {
                    return param.source() == ParamSource.SYSTEM
                            ? PermissionCheck.denied(PermissionErrorKind.MISSING_SYSTEM_PARAMETER,
                                    "Missing system param: " + param.name())
                            : PermissionCheck.denied(PermissionErrorKind.MISSING_PARAMETER,
                                    "Missing required param: " + param.name());
                }
                continue;
            }
            resolved.put(param.name(), value);
        }

        // Undeclared agent arguments pass through unless the name is system-sourced.
        supplied.forEach((name, value) -> {
            if (tool.get().findParam(name).isEmpty()) {
                resolved.putIfAbsent(name, value);
            }
        });

        return PermissionCheck.allowed(new ResolvedAction.ToolCall(tool.get(), resolved, ignored));
    }

    private PermissionCheck authorizeRoute(CompiledSnapshot snapshot, AgentSpec agent,
            AgentAction.RouteToAgent action) {
        String target = action.targetAgentKey();
        if (target == null || target.isBlank()) {
            return PermissionCheck.denied(PermissionErrorKind.MALFORMED_DECISION,
                    "ROUTE_TO_AGENT without a target agent");
        }
        if (!agent.canRouteTo(target) || snapshot.findAgent(target).isEmpty()) {
            return PermissionCheck.denied(PermissionErrorKind.UNAUTHORIZED_ROUTE,
                    "Route to '" + target + "' not permitted");
        }
        return PermissionCheck.allowed(new ResolvedAction.Route(target, action.context()));
    }

    private PermissionCheck authorizeRespond(AgentSpec agent, AgentAction.Respond action) {
        if (!agent.allowRespond()) {
            return PermissionCheck.denied(PermissionErrorKind.RESPOND_NOT_ALLOWED,
                    "RESPOND not permitted for agent " + agent.key());
        }
        return PermissionCheck.allowed(new ResolvedAction.Respond(action.payload()));
    }
}
