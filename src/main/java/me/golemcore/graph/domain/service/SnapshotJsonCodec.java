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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.graph.domain.model.CompiledSnapshot;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes compiled snapshots as snake_case JSON.
 */
@Service
@RequiredArgsConstructor
public class SnapshotJsonCodec {

    private final ObjectMapper objectMapper;

    public CompiledSnapshot read(String json) {
        try {
            CompiledSnapshot snapshot = objectMapper.readValue(json, CompiledSnapshot.class);
            if (snapshot == null) {
                throw new IllegalArgumentException("Snapshot JSON is empty");
            }
            return snapshot;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid snapshot JSON: " + e.getOriginalMessage(), e);
        }
    }

    public CompiledSnapshot read(Path path) {
        try {
            return read(Files.readString(path));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read snapshot file " + path, e);
        }
    }

    public String write(CompiledSnapshot snapshot) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot " + snapshot.versionKey(), e);
        }
    }
}
