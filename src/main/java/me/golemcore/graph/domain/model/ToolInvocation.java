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

import java.util.Map;

/**
 * A single authorized tool call handed to a tool provider.
 *
 * @param runId
 *            owning run
 * @param executionId
 *            id the full record will be stored under
 * @param agentKey
 *            calling agent
 * @param tool
 *            compiled tool definition
 * @param params
 *            resolved parameters, system values included
 */
public record ToolInvocation(String runId, String executionId, String agentKey, ToolSpec tool,
        Map<String, Object> params) {
}
