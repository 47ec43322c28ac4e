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
import dev.mars.courier.core.Values;

import java.util.List;

/**
 * Applies or checks a deliverability fix. When {@code targetScore} is positive the step
 * succeeds only if the resulting score reaches it.
 */
public record DeliverabilityFixConfig(String issue, int targetScore, List<String> instructions,
                                      boolean useSmartShare) implements StepConfig {

    public DeliverabilityFixConfig {
        if (issue == null || issue.isBlank()) {
            throw new IllegalArgumentException("issue is required");
        }
        instructions = Values.immutableList(instructions);
    }

    @Override
    public StepType type() {
        return StepType.DELIVERABILITY_FIX;
    }
}
