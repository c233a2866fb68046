package me.golemcore.graph.domain.validation;

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
 * One validation finding.
 *
 * @param kind
 *            check that produced it
 * @param subject
 *            agent/tool key the finding is about, if any
 * @param message
 *            human-readable description
 */
public record ValidationError(ValidationErrorKind kind, String subject, String message) {

    @Override
    public String toString() {
        return kind + (subject != null ? "[" + subject + "]" : "") + ": " + message;
    }
}
