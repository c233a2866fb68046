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

import java.util.List;

/**
 * Result of validating a snapshot. Only {@link #errors()} block publishing;
 * {@link #warnings()} are reported for authors.
 */
public record ValidationReport(List<ValidationError> errors, List<ValidationError> warnings) {

    public ValidationReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasError(ValidationErrorKind kind) {
        return errors.stream().anyMatch(e -> e.kind() == kind);
    }

    public boolean hasWarning(ValidationErrorKind kind) {
        return warnings.stream().anyMatch(e -> e.kind() == kind);
    }
}
