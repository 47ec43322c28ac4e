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

import dev.mars.courier.core.StepType;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Trend view over stored workflow instances for a trailing window of days.
 *
 * @param days                    length of the window for {@code dailyCompletions}
 * @param dailyCompletions        instances finished per UTC day inside the window, oldest first
 * @param categoryDistribution    instance count and share per category, largest first
 * @param stepSuccessRates        rounded percentage of steps per type that completed successfully
 * @param averageStepsPerWorkflow rounded mean number of steps per instance
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public record WorkflowAnalytics(int days, Map<LocalDate, Integer> dailyCompletions,
                                List<CategoryShare> categoryDistribution,
                                Map<StepType, Integer> stepSuccessRates, int averageStepsPerWorkflow) {

    public WorkflowAnalytics {
        dailyCompletions = Collections.unmodifiableMap(new TreeMap<>(dailyCompletions));
        categoryDistribution = List.copyOf(categoryDistribution);
        stepSuccessRates = stepSuccessRates.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(stepSuccessRates));
    }

    public int completionsOn(LocalDate day) {
        return dailyCompletions.getOrDefault(day, 0);
    }

    /**
     * @param percentage rounded share of all instances considered
     */
    public record CategoryShare(String category, int count, int percentage) {
    }
}
