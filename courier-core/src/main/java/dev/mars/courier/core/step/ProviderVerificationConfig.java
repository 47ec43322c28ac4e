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

public record ProviderVerificationConfig(String providerId, String verificationType, String expectedResult,
                                         long retryDelayMs) implements StepConfig {

    public ProviderVerificationConfig {
        if (providerId == null || providerId.isBlank()) {
            throw new IllegalArgumentException("providerId is required");
        }
        if (verificationType == null || verificationType.isBlank()) {
            verificationType = "connection_test";
        }
    }

    @Override
    public StepType type() {
        return StepType.PROVIDER_VERIFICATION;
    }
}
