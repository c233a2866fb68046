package me.golemcore.graph.domain.model;

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

/**
 * What the run loop does when a decision is rejected by the permission
 * enforcer.
 */
public enum PermissionFailurePolicy {

    /**
     * Terminate the run as failed on the first rejected decision.
     */
    FAIL_FAST,

    /**
     * Record the rejection in the execution log and ask the same agent again, so
     * the decision producer can correct itself from the log.
     */
    TOLERATE
}
