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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.courier.core.StepStatus;
import dev.mars.courier.core.StepType;
import dev.mars.courier.core.WorkflowInstance;
import dev.mars.courier.core.WorkflowStatus;
import dev.mars.courier.core.WorkflowStep;
import dev.mars.courier.core.exceptions.CourierException;
import dev.mars.courier.core.json.CourierObjectMapper;
import dev.mars.courier.workflow.store.WorkflowInstanceStore;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Statistics, analytics and JSON export/import over the instances held by a {@link WorkflowInstanceStore}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowReporting {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowReporting.class);

    private final WorkflowInstanceStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WorkflowReporting(WorkflowInstanceStore store) {
        this(store, CourierObjectMapper.create(), Clock.systemUTC());
    }

    public WorkflowReporting(WorkflowInstanceStore store, ObjectMapper objectMapper) {
        this(store, objectMapper, Clock.systemUTC());
    }

    public WorkflowReporting(WorkflowInstanceStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = Objects.requireNonNull(store, "Instance store cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Lists one user's instances, or every instance when {@code userId} is null, optionally
     * restricted to a single status.
     */
    public Future<List<WorkflowInstance>> instances(String userId, WorkflowStatus status) {
        return store.loadForUser(userId, status);
    }

    /**
     * Computes statistics for one user's instances, or for all instances when {@code userId} is null.
     */
    public Future<WorkflowStatistics> statistics(String userId) {
        return store.loadForUser(userId).map(WorkflowReporting::summarize);
    }

    static WorkflowStatistics summarize(List<WorkflowInstance> instances) {
        Map<WorkflowStatus, Integer> byStatus = new EnumMap<>(WorkflowStatus.class);
        Map<String, Integer> byCategory = new TreeMap<>();
        long totalDurationMs = 0;
        int timed = 0;
        int finished = 0;
        int succeeded = 0;

        for (WorkflowInstance instance : instances) {
            byStatus.merge(instance.getStatus(), 1, Integer::sum);
            byCategory.merge(instance.getCategory(), 1, Integer::sum);
            Optional<Duration> duration = instance.getDuration();
            if (duration.isPresent()) {
                totalDurationMs += duration.get().toMillis();
                timed++;
            }
            if (instance.isTerminal()) {
                finished++;
                if (instance.getStatus() == WorkflowStatus.COMPLETED) {
                    succeeded++;
                }
            }
        }

        double averageMinutes = timed == 0 ? 0.0 : (totalDurationMs / (double) timed) / 60000.0;
        double successRate = finished == 0 ? 0.0 : succeeded * 100.0 / finished;
        return new WorkflowStatistics(instances.size(), byStatus, byCategory, averageMinutes, successRate);
    }

    /**
     * Computes completion trends over the last {@code days} days together with category shares and
     * per step type success rates for one user's instances, or all instances when {@code userId}
     * is null. Only the daily completions are limited to the window.
     */
    public Future<WorkflowAnalytics> analytics(String userId, int days) {
        if (days < 1) {
            return Future.failedFuture(new IllegalArgumentException("days must be positive, got " + days));
        }
        return store.loadForUser(userId).map(instances -> analyze(instances, days, clock.instant()));
    }

    static WorkflowAnalytics analyze(List<WorkflowInstance> instances, int days, Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(days));
        Map<LocalDate, Integer> daily = new TreeMap<>();
        Map<String, Integer> byCategory = new HashMap<>();
        Map<StepType, int[]> stepCounts = new EnumMap<>(StepType.class);
        int totalSteps = 0;

        for (WorkflowInstance instance : instances) {
            Instant completedAt = instance.getCompletedAt();
            if (completedAt != null && !completedAt.isBefore(cutoff)) {
                daily.merge(LocalDate.ofInstant(completedAt, ZoneOffset.UTC), 1, Integer::sum);
            }
            byCategory.merge(instance.getCategory(), 1, Integer::sum);
            for (WorkflowStep step : instance.getSteps()) {
                totalSteps++;
                // [succeeded, total]
                int[] counts = stepCounts.computeIfAbsent(step.getType(), type -> new int[2]);
                counts[1]++;
                if (step.getStatus() == StepStatus.COMPLETED && step.getResult() != null
                        && step.getResult().success()) {
                    counts[0]++;
                }
            }
        }

        int total = instances.size();
        List<WorkflowAnalytics.CategoryShare> shares = new ArrayList<>();
        byCategory.forEach((category, count) -> shares.add(
                new WorkflowAnalytics.CategoryShare(category, count, percent(count, total))));
        shares.sort(Comparator.comparingInt(WorkflowAnalytics.CategoryShare::count).reversed()
                .thenComparing(WorkflowAnalytics.CategoryShare::category));

        Map<StepType, Integer> successRates = new EnumMap<>(StepType.class);
        stepCounts.forEach((type, counts) -> successRates.put(type, percent(counts[0], counts[1])));

        int averageSteps = total == 0 ? 0 : (int) Math.round(totalSteps / (double) total);
        return new WorkflowAnalytics(days, daily, shares, successRates, averageSteps);
    }

    private static int percent(int part, int whole) {
        return whole == 0 ? 0 : (int) Math.round(part * 100.0 / whole);
    }

    /**
     * Serializes a stored instance to JSON.
     */
    public Future<String> exportInstance(String instanceId) {
        return store.load(instanceId).compose(instance -> {
            try {
                return Future.succeededFuture(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(instance));
            } catch (JsonProcessingException e) {
                return Future.failedFuture(new CourierException("Failed to export workflow " + instanceId, e));
            }
        });
    }

    /**
     * Imports an exported instance under a fresh id into the store only. An instance exported
     * while active is stored as paused. The import does not hand the instance to a running engine,
     * so it stays a record for reporting and export and is never driven again.
     *
     * @return the stored copy
     */
    public Future<WorkflowInstance> importInstance(String json) {
        WorkflowInstance parsed;
        try {
            parsed = objectMapper.readValue(json, WorkflowInstance.class);
        } catch (JsonProcessingException e) {
            return Future.failedFuture(new CourierException("Invalid workflow export: " + e.getOriginalMessage(), e));
        }
        WorkflowInstance imported = parsed.copyWithId("workflow-" + UUID.randomUUID());
        if (imported.getStatus() == WorkflowStatus.ACTIVE) {
            imported.setStatus(WorkflowStatus.PAUSED);
            imported.setPausedAt(Instant.now());
        }
        return store.save(imported).map(v -> {
            logger.info("Imported workflow {} as {} ({})", parsed.getId(), imported.getId(),
                    imported.getStatus().getWireName());
            return imported.copy();
        });
    }
}
