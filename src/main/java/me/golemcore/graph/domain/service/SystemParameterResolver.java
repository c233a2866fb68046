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
import me.golemcore.graph.infrastructure.config.GraphRuntimeProperties;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the system parameter map for a run: configured defaults first, then
 * the caller's values on top.
 */
@Service
@RequiredArgsConstructor
public class SystemParameterResolver {

    private final GraphRuntimeProperties properties;

    public Map<String, Object> resolve(Map<String, Object> callerParams) {
        Map<String, Object> merged = new LinkedHashMap<>(properties.getSystemParams().getDefaults());
        if (callerParams != null) {
            merged.putAll(callerParams);
        }
        return merged;
    }
}
