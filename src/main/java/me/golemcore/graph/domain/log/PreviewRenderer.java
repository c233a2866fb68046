package me.golemcore.graph.domain.log;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.graph.domain.model.ExecutionLogPolicy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders bounded, lossy previews of decisions and tool payloads.
 *
 * <p>
 * Truncation keeps {@code limit - 1} characters and appends an ellipsis. Tool
 * previews honour an {@link ExecutionLogPolicy}: when the tool lists fields and
 * any resolve, the preview is {@code label=value; label=value}; otherwise the
 * whole payload is stringified and truncated.
 */
@Component
@Slf4j
public class PreviewRenderer {

    private static final String ELLIPSIS = "…";

    private final ObjectMapper objectMapper;

    public PreviewRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static String truncate(String text, int limit) {
        if (text == null) {
            return null;
        }
        if (limit <= 0 || text.length() <= limit) {
            return text;
        }
        return text.substring(0, Math.max(0, limit - 1)) + ELLIPSIS;
    }

    public String stringify(Object value) {
        if (value instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("[Preview] falling back to toString for {}: {}", value.getClass().getSimpleName(),
                    e.getMessage());
            return String.valueOf(value);
        }
    }

    public String preview(Object value, int limit) {
        return truncate(stringify(value), limit);
    }

    public ToolPreviews renderToolPreviews(ExecutionLogPolicy policy, String toolKey, Object request,
            Object response, int fallbackRequestLimit, int fallbackResponseLimit) {
        ExecutionLogPolicy.ToolPreview toolPolicy = policy != null ? policy.toolPreview(toolKey) : null;

        int requestLimit = effectiveLimit(policy, toolPolicy, true, fallbackRequestLimit);
        int responseLimit = effectiveLimit(policy, toolPolicy, false, fallbackResponseLimit);

        Map<String, String> requestExcerpt = toolPolicy != null
                ? collectFields(request, toolPolicy.request(), requestLimit)
                : Map.of();
        Map<String, String> responseExcerpt = toolPolicy != null
                ? collectFields(response, toolPolicy.response(), responseLimit)
                : Map.of();

        String requestPreview = requestExcerpt.isEmpty() ? preview(request, requestLimit) : join(requestExcerpt);
        String responsePreview = responseExcerpt.isEmpty() ? preview(response, responseLimit) : join(responseExcerpt);

        return new ToolPreviews(requestPreview, requestExcerpt.isEmpty() ? null : requestExcerpt,
                responsePreview, responseExcerpt.isEmpty() ? null : responseExcerpt);
    }

    private int effectiveLimit(ExecutionLogPolicy policy, ExecutionLogPolicy.ToolPreview toolPolicy, boolean request,
            int fallback) {
        if (toolPolicy != null) {
            Integer limit = request ? toolPolicy.requestMaxChars() : toolPolicy.responseMaxChars();
            if (limit != null) {
                return limit;
            }
        }
        if (policy != null) {
            Integer limit = request ? policy.defaults().requestMaxChars() : policy.defaults().responseMaxChars();
            if (limit != null) {
                return limit;
            }
        }
        return fallback;
    }

    private Map<String, String> collectFields(Object payload, List<ExecutionLogPolicy.Field> fields,
            int defaultLimit) {
        if (fields.isEmpty() || payload == null) {
            return Map.of();
        }
        JsonNode root;
        try {
            root = objectMapper.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            log.debug("[Preview] payload is not tree-convertible, using flat preview: {}", e.getMessage());
            return Map.of();
        }
        Map<String, String> excerpt = new LinkedHashMap<>();
        for (ExecutionLogPolicy.Field field : fields) {
            JsonNode value;
            try {
                value = resolvePath(root, field.path());
            } catch (IllegalArgumentException e) {
                log.debug("[Preview] skipping field '{}': {}", field.effectiveLabel(), e.getMessage());
                continue;
            }
            if (value == null || value.isMissingNode()) {
                continue;
            }
            String text = value.isTextual() ? value.asText() : value.toString();
            int limit = field.maxChars() != null ? field.maxChars() : defaultLimit;
            excerpt.put(field.effectiveLabel(), truncate(text, limit));
        }
        return Collections.unmodifiableMap(excerpt);
    }

    private String join(Map<String, String> excerpt) {
        List<String> pairs = new ArrayList<>();
        excerpt.forEach((label, value) -> pairs.add(label + "=" + value));
        return String.join("; ", pairs);
    }

    /**
     * Resolves {@code a.b[0]["c.d"]} against a JSON tree. A leading segment that
     * does not exist (such as a synthetic {@code result.} root) is skipped once.
     */
    JsonNode resolvePath(JsonNode root, String path) {
        List<Object> tokens = parsePath(path);
        JsonNode value = traverse(root, tokens);
        if (value == null && !tokens.isEmpty() && tokens.get(0) instanceof String && tokens.size() > 1) {
            value = traverse(root, tokens.subList(1, tokens.size()));
        }
        return value;
    }

    private JsonNode traverse(JsonNode root, List<Object> tokens) {
        JsonNode current = root;
        for (Object token : tokens) {
            if (current == null) {
                return null;
            }
            if (token instanceof Integer index) {
                if (!current.isArray()) {
                    return null;
                }
                int size = current.size();
                int position = index < 0 ? size + index : index;
                current = position >= 0 && position < size ? current.get(position) : null;
            } else {
                current = current.isObject() ? current.get((String) token) : null;
            }
        }
        return current;
    }

    /**
     * Splits a field path into name and index tokens.
     *
     * @throws IllegalArgumentException
     *             if a bracket segment is not closed
     */
    public static List<Object> parsePath(String path) {
        List<Object> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < path.length()) {
            char ch = path.charAt(i);
            if (ch == '.') {
                flush(current, tokens);
                i++;
            } else if (ch == '[') {
                flush(current, tokens);
                int end = path.indexOf(']', i + 1);
                if (end == -1) {
                    throw new IllegalArgumentException("Invalid path segment (missing ]): " + path);
                }
                tokens.add(segment(path.substring(i + 1, end).trim()));
                i = end + 1;
            } else {
                current.append(ch);
                i++;
            }
        }
        flush(current, tokens);
        return tokens;
    }

    private static Object segment(String raw) {
        if (raw.length() >= 2 && (raw.startsWith("\"") && raw.endsWith("\"")
                || raw.startsWith("'") && raw.endsWith("'"))) {
            return raw.substring(1, raw.length() - 1);
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return raw;
        }
    }

    private static void flush(StringBuilder current, List<Object> tokens) {
        if (current.length() > 0) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }

    /**
     * Rendered previews for one tool step. Excerpts are null when no configured
     * field resolved.
     */
    public record ToolPreviews(String requestPreview, Map<String, String> requestExcerpt, String responsePreview,
            Map<String, String> responseExcerpt) {
    }
}
