package me.golemcore.graph.adapter.outbound.decision;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.graph.domain.model.Decision;
import me.golemcore.graph.domain.model.DecisionRequest;
import me.golemcore.graph.domain.service.DecisionParser;
import me.golemcore.graph.port.outbound.DecisionPort;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Decision producer that replays raw model outputs in order, one per step.
 *
 * <p>
 * Each entry goes through {@link DecisionParser}, so malformed entries surface
 * exactly as a malformed model response would. Running out of entries fails
 * the decision future. Meant for replays, smoke runs and tests; one instance
 * serves one run.
 */
@Slf4j
public class ScriptedDecisionPort implements DecisionPort {

    private final DecisionParser parser;
    private final Deque<String> script;

    public ScriptedDecisionPort(DecisionParser parser, List<String> rawDecisions) {
        this.parser = parser;
        this.script = new ArrayDeque<>(rawDecisions);
    }

    @Override
    public synchronized CompletableFuture<Decision> decide(DecisionRequest request) {
        String raw = script.pollFirst();
        if (raw == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Script exhausted at step " + request.step()));
        }
        log.debug("[Decision] run {} step {} ({}): replaying {}", request.runId(), request.step(),
                request.agentKey(), raw);
        try {
            return CompletableFuture.completedFuture(parser.parse(raw));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public synchronized int remaining() {
        return script.size();
    }
}
