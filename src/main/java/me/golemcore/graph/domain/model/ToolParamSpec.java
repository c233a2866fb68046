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

/**
 * Declared parameter of a compiled tool.
 *
 * @param name
 *            parameter name as it appears in tool params
 * @param source
 *            who is allowed to provide the value
 * @param required
 *            whether resolution fails when no value is available
 * @param defaultValue
 *            value used when nothing else is supplied (may be null)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolParamSpec(
        @JsonProperty("name") String name,
        @JsonProperty("source") ParamSource source,
        @JsonProperty("required") boolean required,
        @JsonProperty("default_value") Object defaultValue) {

    public ToolParamSpec {
        source = source == null ? ParamSource.AGENT : source;
    }

    public static ToolParamSpec agent(String name, boolean required) {
        return new ToolParamSpec(name, ParamSource.AGENT, required, null);
    }

    public static ToolParamSpec system(String name, boolean required) {
        return new ToolParamSpec(name, ParamSource.SYSTEM, required, null);
    }

    public static ToolParamSpec withDefault(String name, Object defaultValue) {
        return new ToolParamSpec(name, ParamSource.DEFAULT, false, defaultValue);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
