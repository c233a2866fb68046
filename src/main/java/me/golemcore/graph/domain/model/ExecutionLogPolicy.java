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
import java.util.Map;

/**
 * Controls how tool request/response previews are rendered into the execution
 * log. Network-wide defaults can be overridden per tool, and a tool can list the
 * payload fields worth surfacing instead of a flat truncated dump.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionLogPolicy(
        @JsonProperty("defaults") Defaults defaults,
        @JsonProperty("tools") Map<String, ToolPreview> tools) {

    public ExecutionLogPolicy {
        defaults = defaults == null ? new Defaults(null, null) : defaults;
        tools = tools == null ? Map.of() : Map.copyOf(tools);
        for (String key : tools.keySet()) {
            if (key.isBlank()) {
                throw new IllegalArgumentException("execution log tool key must be non-empty");
            }
        }
    }

    public ToolPreview toolPreview(String toolKey) {
        if (toolKey == null || toolKey.isBlank()) {
            return null;
        }
        return tools.get(toolKey);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Defaults(
            @JsonProperty("request_max_chars") Integer requestMaxChars,
            @JsonProperty("response_max_chars") Integer responseMaxChars) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ToolPreview(
            @JsonProperty("request") List<Field> request,
            @JsonProperty("response") List<Field> response,
            @JsonProperty("request_max_chars") Integer requestMaxChars,
            @JsonProperty("response_max_chars") Integer responseMaxChars) {

        public ToolPreview {
            request = request == null ? List.of() : List.copyOf(request);
            response = response == null ? List.of() : List.copyOf(response);
        }
    }

    /**
     * A single payload field to surface.
     *
     * @param path
     *            dotted path with optional index/quoted segments, e.g.
     *            {@code items[0].title} or {@code meta["x-id"]}
     * @param label
     *            label used in the preview, defaults to the path
     * @param maxChars
     *            per-field limit overriding the side limit
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Field(
            @JsonProperty("path") String path,
            @JsonProperty("label") String label,
            @JsonProperty("max_chars") Integer maxChars) {

        public Field {
            if (path == null || path.isBlank()) {
                throw new IllegalArgumentException("execution log field path must be non-empty");
            }
            if (maxChars != null && maxChars < 0) {
                throw new IllegalArgumentException("max_chars must be >= 0");
            }
        }

        public String effectiveLabel() {
            return label != null && !label.isBlank() ? label : path;
        }
    }
}
