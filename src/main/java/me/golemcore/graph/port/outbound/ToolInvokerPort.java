package me.golemcore.graph.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Hexagonal outbound port for executing a single tool call.
 *
 * <p>
 * The run loop owns timeouts: it waits on the returned future for at most the
 * policy timeout and cancels it afterwards.
 */
public interface ToolInvokerPort {

    CompletableFuture<ToolOutcome> invoke(ToolInvocation invocation);
}
