package me.golemcore.graph.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.graph.domain.model.ActionType;
import me.golemcore.graph.domain.model.AgentAction;
import me.golemcore.graph.domain.model.Decision;
import me.golemcore.graph.domain.permission.PermissionErrorKind;
import me.golemcore.graph.domain.permission.PermissionException;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the raw decision shape produced by a model into a typed
 * {@link Decision}.
 *
 * <p>
 * Expected shape:
 *
 * <pre>
 * {"action": "USE_TOOL" | "ROUTE_TO_AGENT" | "RESPOND",
 *  "action_reasoning": "...",
 *  "action_details": {...}}
 * </pre>
 *
 * Details accept {@code tool_name}/{@code tool}, {@code tool_params}/{@code params}
 * and {@code target_agent_name}/{@code agent}. A RESPOND payload is
 * {@code action_details.payload} when present, otherwise the whole details
 * object. The text may be wrapped in a {@code ```json} fence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DecisionParser {

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(\\{.*})\\s*```", Pattern.DOTALL);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public Decision parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw malformed("Empty decision");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(raw));
        } catch (JsonProcessingException e) {
            log.debug("[Decision] Unparseable decision: {}", e.getOriginalMessage());
            throw new PermissionException(PermissionErrorKind.MALFORMED_DECISION,
                    "Decision is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public Decision parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw malformed("Decision must be a JSON object");
        }
        ActionType type = parseActionType(root.path("action").asText(""));
        String reasoning = root.hasNonNull("action_reasoning") ? root.get("action_reasoning").asText() : "";
        JsonNode details = root.path("action_details");
        if (!details.isObject()) {
            details = objectMapper.createObjectNode();
        }

        AgentAction action = switch (type) {
        case USE_TOOL -> toolAction(details);
        case ROUTE_TO_AGENT -> routeAction(details);
        case RESPOND -> new AgentAction.Respond(details.has("payload")
                ? toPlain(details.get("payload"))
                : toPlain(details));
        };
        return new Decision(reasoning, action);
    }

    private AgentAction toolAction(JsonNode details) {
        String tool = firstText(details, "tool_name", "tool");
        JsonNode params = firstPresent(details, "tool_params", "params");
        if (params != null && !params.isObject()) {
            throw malformed("tool_params must be an object");
        }
        Map<String, Object> values = params != null ? objectMapper.convertValue(params, MAP_TYPE) : Map.of();
        return new AgentAction.UseTool(tool, values);
    }

    private AgentAction routeAction(JsonNode details) {
        String target = firstText(details, "target_agent_name", "agent");
        JsonNode context = details.get("context");
        Map<String, Object> values = context != null && context.isObject()
                ? objectMapper.convertValue(context, MAP_TYPE)
                : Map.of();
        return new AgentAction.RouteToAgent(target, values);
    }

    private ActionType parseActionType(String action) {
        String normalized = action.trim().toUpperCase(Locale.ROOT);
        try {
            return ActionType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new PermissionException(PermissionErrorKind.MALFORMED_DECISION, "Unknown action: " + action, e);
        }
    }

    private Object toPlain(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return objectMapper.convertValue(node, Object.class);
    }

    private static String firstText(JsonNode details, String... names) {
        JsonNode node = firstPresent(details, names);
        return node != null ? node.asText() : "";
    }

    private static JsonNode firstPresent(JsonNode details, String... names) {
        for (String name : names) {
            JsonNode node = details.get(name);
            if (node != null && !node.isNull() && !(node.isTextual() && node.asText().isEmpty())) {
                return node;
            }
        }
        return null;
    }

    private static String extractJson(String raw) {
        Matcher matcher = FENCED_JSON.matcher(raw);
        return matcher.find() ? matcher.group(1) : raw.trim();
    }

    private static PermissionException malformed(String message) {
        return new PermissionException(PermissionErrorKind.MALFORMED_DECISION, message);
    }
}
