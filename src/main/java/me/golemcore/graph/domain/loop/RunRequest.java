package me.golemcore.graph.domain.loop;

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

import lombok.Builder;
import lombok.Data;
import me.golemcore.graph.domain.model.CompiledSnapshot;
import me.golemcore.graph.port.outbound.DecisionPort;

import java.util.HashMap;
import java.util.Map;

/**
 * Everything needed to start one run.
 */
@Data
@Builder
public class RunRequest {

    private String runId;

    private CompiledSnapshot snapshot;

    private String userInput;

    /**
     * Entry agent override; the snapshot's default agent when null.
     */
    private String startAgentKey;

    /**
     * Values for {@code source=system} tool parameters. Never shown to the
     * decision producer.
     */
    @Builder.Default
    private Map<String, Object> systemParams = new HashMap<>();

    private DecisionPort decisionPort;

    @Builder.Default
    private RunCancellation cancellation = new RunCancellation();
}
