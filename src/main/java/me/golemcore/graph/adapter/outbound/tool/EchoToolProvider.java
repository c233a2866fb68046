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

import me.golemcore.graph.domain.model.ParamSource;
import me.golemcore.graph.domain.model.ToolInvocation;
import me.golemcore.graph.domain.model.ToolOutcome;
import me.golemcore.graph.domain.model.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in tool that echoes its input.
 *
 * <p>
 * The result holds the agent-visible parameters under {@code echo} and the tool
 * metadata under {@code metadata}. System-sourced values are consumed but never
 * echoed, since tool results flow back into the decision context.
 */
@Component
public class EchoToolProvider implements ToolProvider {

    public static final String PROVIDER_TYPE = "builtin:echo";

    @Override
    public String getProviderType() {
        return PROVIDER_TYPE;
    }

    @Override
    public ToolOutcome execute(ToolInvocation invocation) {
        ToolSpec tool = invocation.tool();
        Map<String, Object> echo = new LinkedHashMap<>();
        invocation.params().forEach((name, value) -> {
            boolean fromSystem = tool.findParam(name).map(p -> p.source() == ParamSource.SYSTEM).orElse(false);
            if (!fromSystem) {
                echo.put(name, value);
            }
        });

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("echo", echo);
        result.put("metadata", tool.metadata());
        return ToolOutcome.success(result);
    }
}
