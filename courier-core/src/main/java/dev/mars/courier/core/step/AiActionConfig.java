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

import java.util.Map;

/**
 * Runs a named action through the injected action executor.
 *
 * @param actionId       action to run
 * @param params         action parameters
 * @param expectedResult optional value the action result must equal
 */
public record AiActionConfig(String actionId, Map<String, Object> params, Object expectedResult) implements StepConfig {

    public AiActionConfig {
        if (actionId == null || actionId.isBlank()) {
            throw new IllegalArgumentException("actionId is required");
        }
        params = Values.immutableMap(params);
    }

    public static AiActionConfig of(String actionId) {
        return new AiActionConfig(actionId, Map.of(), null);
    }

    @Override
    public StepType type() {
        return StepType.AI_ACTION;
    }
}
