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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, read-only description of an agent graph. Published once (after
 * validation) and then shared by any number of concurrent runs without locking.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompiledSnapshot(
        @JsonProperty("version_key") String versionKey,
        @JsonProperty("agents") List<AgentSpec> agents,
        @JsonProperty("tools") List<ToolSpec> tools,
        @JsonProperty("routes") List<RouteEdge> routes,
        @JsonProperty("default_agent_key") String defaultAgentKey,
        @JsonProperty("policy") RuntimePolicy policy) {

    public CompiledSnapshot {
        agents = agents == null ? List.of() : List.copyOf(agents);
        tools = tools == null ? List.of() : List.copyOf(tools);
        routes = routes == null ? List.of() : List.copyOf(routes);
        policy = policy == null ? RuntimePolicy.defaults() : policy;
    }

    public Optional<AgentSpec> findAgent(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return agents.stream().filter(a -> key.equals(a.key())).findFirst();
    }

    public Optional<ToolSpec> findTool(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return tools.stream().filter(t -> key.equals(t.key())).findFirst();
    }

    @JsonIgnore
    public Set<String> agentKeys() {
        Set<String> keys = new LinkedHashSet<>();
        agents.forEach(a -> keys.add(a.key()));
        return keys;
    }

    @JsonIgnore
    public Set<String> toolKeys() {
        Set<String> keys = new LinkedHashSet<>();
        tools.forEach(t -> keys.add(t.key()));
        return keys;
    }

    /**
     * Entry agent for runs without an explicit override: the declared
     * {@code default_agent_key}, or the single agent flagged as default.
     */
    @JsonIgnore
    public Optional<String> resolveDefaultAgentKey() {
        if (defaultAgentKey != null && !defaultAgentKey.isBlank()) {
            return Optional.of(defaultAgentKey);
        }
        List<AgentSpec> defaults = agents.stream().filter(AgentSpec::isDefault).toList();
        return defaults.size() == 1 ? Optional.of(defaults.get(0).key()) : Optional.empty();
    }

    /**
     * Route adjacency: explicit edges plus every agent's {@code allowed_routes},
     * deduplicated, in declaration order.
     */
    @JsonIgnore
    public Map<String, List<String>> adjacency() {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (AgentSpec agent : agents) {
            edges.computeIfAbsent(agent.key(), k -> new LinkedHashSet<>()).addAll(agent.allowedRoutes());
        }
        for (RouteEdge edge : routes) {
            if (edge == null || edge.from() == null || edge.to() == null) {
                continue;
            }
            edges.computeIfAbsent(edge.from(), k -> new LinkedHashSet<>()).add(edge.to());
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        edges.forEach((from, targets) -> result.put(from, List.copyOf(targets)));
        return result;
    }
}
