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

import java.util.List;

/**
 * Compiled agent: a named role with its equipped tools, allowed routing targets
 * and respond capability. Never mutated at runtime.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentSpec(
        @JsonProperty("key") String key,
        @JsonProperty("allow_respond") boolean allowRespond,
        @JsonProperty("is_default") boolean isDefault,
        @JsonProperty("equipped_tools") List<String> equippedTools,
        @JsonProperty("allowed_routes") List<String> allowedRoutes,
        @JsonProperty("prompt") String prompt) {

    public AgentSpec {
        equippedTools = equippedTools == null ? List.of() : List.copyOf(equippedTools);
        allowedRoutes = allowedRoutes == null ? List.of() : List.copyOf(allowedRoutes);
    }

    public boolean isEquippedWith(String toolKey) {
        return toolKey != null && equippedTools.contains(toolKey);
    }

    public boolean canRouteTo(String agentKey) {
        return agentKey != null && allowedRoutes.contains(agentKey);
    }
}
