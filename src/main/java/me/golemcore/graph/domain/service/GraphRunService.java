package me.golemcore.graph.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.graph.domain.loop.RunCancellation;
import me.golemcore.graph.domain.loop.RunLoopEngine;
import me.golemcore.graph.domain.loop.RunRequest;
import me.golemcore.graph.domain.model.CompiledSnapshot;
import me.golemcore.graph.domain.model.RunResult;
import me.golemcore.graph.port.outbound.DecisionPort;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Entry point for running a published graph.
 *
 * <p>
 * Resolves the snapshot (the current one, or a specific version), merges
 * system parameters over configured defaults, assigns a run id and hands the
 * request to the {@link RunLoopEngine}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphRunService {

    private final SnapshotRegistry snapshotRegistry;
    private final SystemParameterResolver systemParameterResolver;
    private final RunLoopEngine runLoopEngine;

    public RunResult run(String userInput, DecisionPort decisionPort) {
        return run(null, null, userInput, Map.of(), decisionPort, new RunCancellation());
    }

    /**
     * @param versionKey
     *            snapshot version, or null for the current snapshot
     * @param startAgentKey
     *            entry agent override, or null for the snapshot default
     * @throws IllegalStateException
     *             if no matching snapshot has been published
     */
    public RunResult run(String versionKey, String startAgentKey, String userInput,
            Map<String, Object> systemParams, DecisionPort decisionPort, RunCancellation cancellation) {
        CompiledSnapshot snapshot = versionKey != null
                ? snapshotRegistry.find(versionKey)
                        .orElseThrow(() -> new IllegalStateException("Unknown snapshot version: " + versionKey))
                : snapshotRegistry.current()
                        .orElseThrow(() -> new IllegalStateException("No snapshot published"));

        String runId = UUID.randomUUID().toString();
        log.debug("[RunLoop] run {} uses snapshot {}", runId, snapshot.versionKey());
        RunRequest request = RunRequest.builder()
                .runId(runId)
                .snapshot(snapshot)
                .userInput(userInput)
                .startAgentKey(startAgentKey)
                .systemParams(systemParameterResolver.resolve(systemParams))
                .decisionPort(decisionPort)
                .cancellation(cancellation != null ? cancellation : new RunCancellation())
                .build();
        return runLoopEngine.run(request);
    }
}
