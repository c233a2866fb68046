package me.golemcore.graph.domain.context;

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

import me.golemcore.graph.domain.model.AgentSpec;
import me.golemcore.graph.domain.model.CompiledSnapshot;
import me.golemcore.graph.domain.model.ParamSource;
import me.golemcore.graph.domain.model.ToolParamSpec;
import me.golemcore.graph.domain.model.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders the static, per-agent part of the prompt: the compiled agent prompt,
 * the decision contract, equipped tools with their agent-provided parameters,
 * and allowed routes. System-sourced parameters are never listed.
 */
@Component
public class PromptConstraintsRenderer {

    public String render(CompiledSnapshot snapshot, AgentSpec agent) {
        List<String> lines = new ArrayList<>();
        if (agent.prompt() != null && !agent.prompt().isBlank()) {
            lines.add(agent.prompt());
            lines.add("");
        }
        String actions = agent.allowRespond() ? "USE_TOOL|ROUTE_TO_AGENT|RESPOND" : "USE_TOOL|ROUTE_TO_AGENT";
        lines.add("You MUST respond as JSON with fields: action (" + actions
                + "), action_reasoning (string), action_details (object).");
        if (!agent.equippedTools().isEmpty()) {
            lines.add("Allowed tools and agent-provided params:");
            for (String toolKey : agent.equippedTools()) {
                Optional<ToolSpec> tool = snapshot.findTool(toolKey);
                if (tool.isEmpty()) {
                    continue;
                }
                List<String> params = tool.get().params().stream()
                        .filter(p -> p.source() != ParamSource.SYSTEM)
                        .map(this::describeParam)
                        .toList();
                String description = tool.get().description() != null ? " - " + tool.get().description() : "";
                lines.add("- " + toolKey + ": params=" + params + description);
            }
        }
        if (!agent.allowedRoutes().isEmpty()) {
            lines.add("Allowed routes (agent keys):");
            agent.allowedRoutes().forEach(route -> lines.add("- " + route));
        }
        lines.add("When using USE_TOOL, action_details must include tool_name and tool_params.");
        lines.add("When routing, action_details must include target_agent_name.");
        if (agent.allowRespond()) {
            lines.add("When responding, put your payload in action_details.payload.");
        } else {
            lines.add("This agent may not RESPOND; route to an agent that can.");
        }
        return String.join("\n", lines);
    }

    private String describeParam(ToolParamSpec param) {
        return param.required() ? param.name() + "*" : param.name();
    }
}
