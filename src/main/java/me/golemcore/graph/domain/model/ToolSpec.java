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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compiled tool definition. The {@code providerType} selects the provider that
 * actually runs the call (e.g. {@code builtin:echo}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolSpec(
        @JsonProperty("key") String key,
        @JsonProperty("provider_type") String providerType,
        @JsonProperty("description") String description,
        @JsonProperty("params") List<ToolParamSpec> params,
        @JsonProperty("metadata") Map<String, Object> metadata) {

    public ToolSpec {
        params = params == null ? List.of() : List.copyOf(params);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ToolSpec of(String key, String providerType, List<ToolParamSpec> params) {
        return new ToolSpec(key, providerType, null, params, null);
    }

    public Optional<ToolParamSpec> findParam(String name) {
        return params.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * Copy of {@code values} without the parameters this tool sources from the
     * system, for anything shown to agents or written to previews.
     */
    public Map<String, Object> withoutSystemParams(Map<String, Object> values) {
        Map<String, Object> visible = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            boolean system = findParam(name).map(p -> p.source() == ParamSource.SYSTEM).orElse(false);
            if (!system) {
                visible.put(name, value);
            }
        });
        return visible;
    }
}
