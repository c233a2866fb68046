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

import me.golemcore.graph.domain.model.PermissionFailurePolicy;
import me.golemcore.graph.domain.model.RuntimePolicy;
import me.golemcore.graph.infrastructure.config.GraphRuntimeProperties;

/**
 * Limits a run actually uses: the snapshot policy where it sets a value, engine
 * defaults otherwise.
 */
public record EffectivePolicy(int maxSteps, int maxToolErrors, PermissionFailurePolicy permissionFailurePolicy,
        long toolTimeoutMs) {

    public static EffectivePolicy resolve(RuntimePolicy policy, GraphRuntimeProperties.EngineProperties engine) {
        RuntimePolicy snapshotPolicy = policy != null ? policy : RuntimePolicy.defaults();
        int maxSteps = snapshotPolicy.maxSteps() > 0 ? snapshotPolicy.maxSteps() : engine.getDefaultMaxSteps();
        int maxToolErrors = snapshotPolicy.maxToolErrors() > 0 ? snapshotPolicy.maxToolErrors()
                : engine.getDefaultMaxToolErrors();
        PermissionFailurePolicy onDenied = snapshotPolicy.permissionFailurePolicy() != null
                ? snapshotPolicy.permissionFailurePolicy()
                : engine.getPermissionFailurePolicy();
        long timeout = snapshotPolicy.toolTimeoutMs() != null && snapshotPolicy.toolTimeoutMs() > 0
                ? snapshotPolicy.toolTimeoutMs()
                : engine.getToolTimeoutMs();
        return new EffectivePolicy(maxSteps, maxToolErrors,
                onDenied != null ? onDenied : PermissionFailurePolicy.FAIL_FAST, timeout);
    }
}
