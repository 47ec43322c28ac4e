/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */


package dev.mars.courier.core.step;

import dev.mars.courier.core.StepType;

/**
 * Requests data that arrives by email, for example a verification code or provider settings.
 * The requester returns immediately; the extracted data is supplied later as the step outcome.
 */
public record SmartShareConfig(String lookFor, String subjectPattern, String senderPattern,
                               String extractionPattern, String onExtract, long timeoutMs) implements StepConfig {

    public SmartShareConfig {
        if (lookFor == null || lookFor.isBlank()) {
            throw new IllegalArgumentException("lookFor is required");
        }
    }

    @Override
    public StepType type() {
        return StepType.SMART_SHARE;
    }
}
