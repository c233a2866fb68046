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
import me.golemcore.graph.domain.model.CompiledSnapshot;
import me.golemcore.graph.domain.validation.GraphValidator;
import me.golemcore.graph.domain.validation.SnapshotValidationException;
import me.golemcore.graph.domain.validation.ValidationError;
import me.golemcore.graph.domain.validation.ValidationReport;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Published snapshots by version key, plus the one currently served.
 *
 * <p>
 * Publishing validates first. A snapshot with any validation error is
 * rejected with {@link SnapshotValidationException} and the registry is left
 * untouched; warnings are logged and do not block. Published snapshots are
 * immutable, so concurrent runs may share them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotRegistry {

    private final GraphValidator graphValidator;

    private final Map<String, CompiledSnapshot> snapshots = new ConcurrentHashMap<>();
    private final AtomicReference<String> currentVersion = new AtomicReference<>();

    /**
     * Validates and stores {@code snapshot}, then marks it current.
     *
     * @return the validation report (errors are always empty on return)
     * @throws SnapshotValidationException
     *             if validation produced errors
     */
    public ValidationReport publish(CompiledSnapshot snapshot) {
        if (snapshot == null || snapshot.versionKey() == null || snapshot.versionKey().isBlank()) {
            throw new IllegalArgumentException("Snapshot must have a version key");
        }
        ValidationReport report = graphValidator.validate(snapshot);
        if (!report.isValid()) {
            log.warn("[Publish] snapshot {} rejected with {} error(s)", snapshot.versionKey(),
                    report.errors().size());
            throw new SnapshotValidationException(snapshot.versionKey(), report.errors());
        }
        for (ValidationError warning : report.warnings()) {
            log.warn("[Publish] snapshot {}: {}", snapshot.versionKey(), warning.message());
        }
        snapshots.put(snapshot.versionKey(), snapshot);
        currentVersion.set(snapshot.versionKey());
        log.info("[Publish] snapshot {} published ({} agents, {} tools)", snapshot.versionKey(),
                snapshot.agents().size(), snapshot.tools().size());
        return report;
    }

    public Optional<CompiledSnapshot> current() {
        String version = currentVersion.get();
        return version != null ? Optional.ofNullable(snapshots.get(version)) : Optional.empty();
    }

    public Optional<CompiledSnapshot> find(String versionKey) {
        if (versionKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshots.get(versionKey));
    }

    public List<String> versions() {
        return snapshots.keySet().stream().sorted().toList();
    }
}
