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


package dev.mars.courier.workflow.reporting;

import dev.mars.courier.core.WorkflowStatus;

import java.util.Map;

/**
 * Aggregate view over stored workflow instances.
 *
 * @param totalWorkflows         number of instances considered
 * @param byStatus               instance count per status
 * @param byCategory             instance count per definition category
 * @param averageDurationMinutes mean start-to-finish time of finished instances
 * @param successRate            percentage of finished instances that completed
 */
public record WorkflowStatistics(int totalWorkflows, Map<WorkflowStatus, Integer> byStatus,
                                 Map<String, Integer> byCategory, double averageDurationMinutes,
                                 double successRate) {

    public WorkflowStatistics {
        byStatus = Map.copyOf(byStatus);
        byCategory = Map.copyOf(byCategory);
    }

    public int count(WorkflowStatus status) {
        return byStatus.getOrDefault(status, 0);
    }
}
