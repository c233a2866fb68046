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

/**
 * Character caps for execution log previews. A limit of zero or below disables
 * truncation for that preview.
 */
public record PreviewLimits(int decisionMaxChars, int inputMaxChars, int requestMaxChars, int responseMaxChars) {

    public static final int DEFAULT_DECISION_MAX_CHARS = 120;
    public static final int DEFAULT_INPUT_MAX_CHARS = 80;
    public static final int DEFAULT_REQUEST_MAX_CHARS = 50;
    public static final int DEFAULT_RESPONSE_MAX_CHARS = 100;

    public static PreviewLimits defaults() {
        return new PreviewLimits(DEFAULT_DECISION_MAX_CHARS, DEFAULT_INPUT_MAX_CHARS, DEFAULT_REQUEST_MAX_CHARS,
                DEFAULT_RESPONSE_MAX_CHARS);
    }
}
