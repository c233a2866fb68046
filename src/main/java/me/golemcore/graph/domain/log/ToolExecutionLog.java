package me.golemcore.graph.domain.log;

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

import me.golemcore.graph.domain.model.ToolExecutionRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Full, untruncated tool payloads of one run, keyed by execution id and kept in
 * recording order. Records are never overwritten.
 */
public class ToolExecutionLog {

    private final Map<String, ToolExecutionRecord> store = new LinkedHashMap<>();

    public void put(String executionId, ToolExecutionRecord record) {
        if (executionId == null || !executionId.equals(record.executionId())) {
            throw new IllegalArgumentException("Record execution id does not match key " + executionId);
        }
        if (store.containsKey(executionId)) {
            throw new IllegalStateException("Tool execution " + executionId + " is already recorded");
        }
        store.put(executionId, record);
    }

    public Optional<ToolExecutionRecord> get(String executionId) {
        return Optional.ofNullable(store.get(executionId));
    }

    /**
     * Every record made by {@code agentKey} during {@code epoch}, in recording
     * order.
     */
    public List<ToolExecutionRecord> collectFullFor(String agentKey, int epoch) {
        List<ToolExecutionRecord> result = new ArrayList<>();
        for (ToolExecutionRecord record : store.values()) {
            if (record.epoch() == epoch && record.agentKey().equals(agentKey)) {
                result.add(record);
            }
        }
        return result;
    }

    public List<String> executionIds() {
        return List.copyOf(store.keySet());
    }

    public Map<String, ToolExecutionRecord> records() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(store));
    }

    public int size() {
        return store.size();
    }
}
