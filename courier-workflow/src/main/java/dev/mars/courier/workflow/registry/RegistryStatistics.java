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


package dev.mars.courier.workflow.registry;

import dev.mars.courier.core.AutomationLevel;

import java.util.Map;

/**
 * Point-in-time summary of the definitions held by a {@link WorkflowDefinitionRegistry}.
 *
 * @param totalWorkflows        number of registered definitions
 * @param byCategory            definition count per category
 * @param byAutomationLevel     definition count per automation level
 * @param averageEstimatedTime  mean estimated duration in minutes, 0 when empty
 */
public record RegistryStatistics(int totalWorkflows, Map<String, Integer> byCategory,
                                 Map<AutomationLevel, Integer> byAutomationLevel, double averageEstimatedTime) {

    public RegistryStatistics {
        byCategory = Map.copyOf(byCategory);
        byAutomationLevel = Map.copyOf(byAutomationLevel);
    }
}
