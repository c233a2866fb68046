package me.golemcore.graph.adapter.outbound.tool;

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

import me.golemcore.graph.domain.model.ToolInvocation;
import me.golemcore.graph.domain.model.ToolOutcome;

/**
 * Implementation behind a tool's {@code provider_type}. Providers are
 * discovered as Spring beans and called on the tool executor, so
 * {@link #execute(ToolInvocation)} may block.
 */
public interface ToolProvider {

    /**
     * @return the provider type this implementation serves, e.g.
     *         {@code builtin:echo}
     */
    String getProviderType();

    /**
     * Runs the tool with fully resolved parameters. Thrown exceptions are
     * reported as failed tool calls.
     */
    ToolOutcome execute(ToolInvocation invocation);
}
