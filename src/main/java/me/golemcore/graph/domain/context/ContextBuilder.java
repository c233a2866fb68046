package me.golemcore.graph.domain.context;

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

import me.golemcore.graph.domain.log.ExecutionLog;
import me.golemcore.graph.domain.log.ToolExecutionLog;
import me.golemcore.graph.domain.model.CompiledSnapshot;

/**
 * Builds the per-step context for the decision producer from the run's logs.
 */
public interface ContextBuilder {

    ContextPayload build(CompiledSnapshot snapshot, String currentAgentKey, ExecutionLog executionLog,
            ToolExecutionLog toolLog, String latestUserInput);
}
