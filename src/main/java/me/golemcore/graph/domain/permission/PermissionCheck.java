package me.golemcore.graph.domain.permission;

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
 * Result of authorizing a decision: either a resolved action or a rejection.
 */
public record PermissionCheck(ResolvedAction action, PermissionErrorKind errorKind, String errorMessage) {

    public static PermissionCheck allowed(ResolvedAction action) {
        return new PermissionCheck(action, null, null);
    }

    public static PermissionCheck denied(PermissionErrorKind kind, String message) {
        return new PermissionCheck(null, kind, message);
    }

    public static PermissionCheck denied(PermissionException exception) {
        return denied(exception.getKind(), exception.getMessage());
    }

    public boolean isAllowed() {
        return action != null;
    }

    public String describeError() {
        return errorKind + ": " + errorMessage;
    }
}
