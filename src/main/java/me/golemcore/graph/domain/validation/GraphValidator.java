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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.graph.domain.log.PreviewRenderer;
import me.golemcore.graph.domain.model.AgentSpec;
import me.golemcore.graph.domain.model.CompiledSnapshot;
import me.golemcore.graph.domain.model.ExecutionLogPolicy;
import me.golemcore.graph.domain.model.RouteEdge;
import me.golemcore.graph.domain.model.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Publish-time topology checks over a compiled snapshot.
 *
 * <p>
 * Every check runs, so a single report lists every violation. Traversals are
 * iterative breadth-first searches with a visited set; route graphs may contain
 * cycles.
 */
@Component
@Slf4j
public class GraphValidator {

    public ValidationReport validate(CompiledSnapshot snapshot) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationError> warnings = new ArrayList<>();

        checkDuplicateKeys(snapshot, errors);
        checkDefaultAgent(snapshot, errors);
        checkRespondCapability(snapshot, errors);
        checkRouteIntegrity(snapshot, errors);
        checkToolIntegrity(snapshot, errors);
        checkExecutionLogPaths(snapshot, errors);
        checkReachability(snapshot, errors, warnings);

        if (!errors.isEmpty()) {
            log.debug("[Validate] snapshot {} has {} error(s): {}", snapshot.versionKey(), errors.size(), errors);
        }
        return new ValidationReport(errors, warnings);
    }

    private void checkDuplicateKeys(CompiledSnapshot snapshot, List<ValidationError> errors) {
        Set<String> seen = new HashSet<>();
        for (AgentSpec agent : snapshot.agents()) {
            if (!seen.add(agent.key())) {
                errors.add(new ValidationError(ValidationErrorKind.DUPLICATE_KEY, agent.key(),
                        "Duplicate agent key '" + agent.key() + "'"));
            }
        }
        seen.clear();
        for (ToolSpec tool : snapshot.tools()) {
            if (!seen.add(tool.key())) {
                errors.add(new ValidationError(ValidationErrorKind.DUPLICATE_KEY, tool.key(),
                        "Duplicate tool key '" + tool.key() + "'"));
            }
        }
    }

    private void checkDefaultAgent(CompiledSnapshot snapshot, List<ValidationError> errors) {
        List<String> defaults = snapshot.agents().stream()
                .filter(AgentSpec::isDefault)
                .map(AgentSpec::key)
                .toList();
        if (defaults.size() != 1) {
            errors.add(new ValidationError(ValidationErrorKind.DEFAULT_AGENT_UNIQUENESS, null,
                    defaults.isEmpty()
                            ? "No default agent configured; mark a single default agent."
                            : "Multiple default agents configured (" + String.join(", ", defaults)
                                    + "); mark a single default agent."));
        }

        String declared = snapshot.defaultAgentKey();
        if (declared == null || declared.isBlank()) {
            return;
        }
        if (!snapshot.agentKeys().contains(declared)) {
            errors.add(new ValidationError(ValidationErrorKind.DEFAULT_AGENT_MISMATCH, declared,
                    "default_agent_key '" + declared + "' is not an agent of this snapshot"));
        } else if (defaults.size() == 1 && !defaults.get(0).equals(declared)) {
            errors.add(new ValidationError(ValidationErrorKind.DEFAULT_AGENT_MISMATCH, declared,
                    "default_agent_key '" + declared + "' differs from the agent flagged default ('"
                            + defaults.get(0) + "')"));
        }
    }

    private void checkRespondCapability(CompiledSnapshot snapshot, List<ValidationError> errors) {
        if (snapshot.agents().stream().noneMatch(AgentSpec::allowRespond)) {
            errors.add(new ValidationError(ValidationErrorKind.RESPOND_CAPABILITY_EXISTS, null,
                    "Snapshot must include at least one agent that can RESPOND."));
        }
    }

    private void checkRouteIntegrity(CompiledSnapshot snapshot, List<ValidationError> errors) {
        Set<String> agentKeys = snapshot.agentKeys();
        for (RouteEdge edge : snapshot.routes()) {
            String from = edge != null ? edge.from() : null;
            String to = edge != null ? edge.to() : null;
            if (!agentKeys.contains(from)) {
                errors.add(new ValidationError(ValidationErrorKind.ROUTE_REFERENTIAL_INTEGRITY, from,
                        "Route " + from + " -> " + to + " starts at an unknown agent"));
            }
            if (!agentKeys.contains(to)) {
                errors.add(new ValidationError(ValidationErrorKind.ROUTE_REFERENTIAL_INTEGRITY, to,
                        "Route " + from + " -> " + to + " targets an unknown agent"));
            }
        }
        for (AgentSpec agent : snapshot.agents()) {
            for (String target : agent.allowedRoutes()) {
                if (!agentKeys.contains(target)) {
                    errors.add(new ValidationError(ValidationErrorKind.ROUTE_REFERENTIAL_INTEGRITY, agent.key(),
                            "Agent '" + agent.key() + "' allows routing to unknown agent '" + target + "'"));
                }
            }
        }
    }

    private void checkToolIntegrity(CompiledSnapshot snapshot, List<ValidationError> errors) {
        Set<String> toolKeys = snapshot.toolKeys();
        for (AgentSpec agent : snapshot.agents()) {
            for (String toolKey : agent.equippedTools()) {
                if (!toolKeys.contains(toolKey)) {
                    errors.add(new ValidationError(ValidationErrorKind.TOOL_REFERENTIAL_INTEGRITY, agent.key(),
                            "Agent '" + agent.key() + "' is equipped with unknown tool '" + toolKey + "'"));
                }
            }
        }
    }

    private void checkExecutionLogPaths(CompiledSnapshot snapshot, List<ValidationError> errors) {
        ExecutionLogPolicy policy = snapshot.policy().executionLog();
        if (policy == null) {
            return;
        }
        policy.tools().forEach((toolKey, preview) -> {
            List<ExecutionLogPolicy.Field> fields = new ArrayList<>(preview.request());
            fields.addAll(preview.response());
            for (ExecutionLogPolicy.Field field : fields) {
                try {
                    PreviewRenderer.parsePath(field.path());
                } catch (IllegalArgumentException e) {
                    errors.add(new ValidationError(ValidationErrorKind.EXECUTION_LOG_FIELD_PATH, toolKey,
                            "Execution log field for tool '" + toolKey + "': " + e.getMessage()));
                }
            }
        });
    }

    private void checkReachability(CompiledSnapshot snapshot, List<ValidationError> errors,
            List<ValidationError> warnings) {
        Optional<String> start = snapshot.resolveDefaultAgentKey();
        Set<String> respondCapable = new LinkedHashSet<>();
        snapshot.agents().stream().filter(AgentSpec::allowRespond).forEach(a -> respondCapable.add(a.key()));
        if (start.isEmpty() || !snapshot.agentKeys().contains(start.get()) || respondCapable.isEmpty()) {
            // Entry or respond problems are already reported by their own checks.
            return;
        }

        Map<String, List<String>> adjacency = snapshot.adjacency();
        Set<String> reachable = traverse(List.of(start.get()), adjacency);
        if (reachable.stream().noneMatch(respondCapable::contains)) {
            errors.add(new ValidationError(ValidationErrorKind.REACHABILITY, start.get(),
                    "No route path from default agent '" + start.get() + "' to a RESPOND-capable agent"));
        }

        Set<String> canFinish = traverse(respondCapable, reverse(adjacency));
        for (String agentKey : reachable) {
            if (canFinish.contains(agentKey)) {
                continue;
            }
            if (isOnCycle(agentKey, adjacency)) {
                warnings.add(new ValidationError(ValidationErrorKind.NON_TERMINATING_CYCLE, agentKey,
                        "Agent '" + agentKey + "' is on a routing cycle that never reaches a RESPOND-capable agent"));
            }
        }
    }

    private boolean isOnCycle(String agentKey, Map<String, List<String>> adjacency) {
        return traverse(adjacency.getOrDefault(agentKey, List.of()), adjacency).contains(agentKey);
    }

    private Set<String> traverse(Collection<String> roots, Map<String, List<String>> adjacency) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String root : roots) {
            if (visited.add(root)) {
                queue.add(root);
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : adjacency.getOrDefault(current, List.of())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }

    private Map<String, List<String>> reverse(Map<String, List<String>> adjacency) {
        Map<String, List<String>> reversed = new HashMap<>();
        adjacency.forEach((from, targets) -> targets
                .forEach(to -> reversed.computeIfAbsent(to, k -> new ArrayList<>()).add(from)));
        return reversed;
    }
}
