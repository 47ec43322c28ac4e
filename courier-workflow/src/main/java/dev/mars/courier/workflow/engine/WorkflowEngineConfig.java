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


package dev.mars.courier.workflow.engine;

import dev.mars.courier.config.CourierConfiguration;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable engine settings.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class WorkflowEngineConfig {

    private final int maxConcurrentWorkflows;
    private final long retryDelayMs;
    private final boolean persistState;
    private final long cleanupIntervalMs;
    private final Duration maxStateAge;

    private WorkflowEngineConfig(Builder builder) {
        if (builder.maxConcurrentWorkflows < 1) {
            throw new IllegalArgumentException("maxConcurrentWorkflows must be at least 1");
        }
        if (builder.retryDelayMs < 0 || builder.cleanupIntervalMs < 0) {
            throw new IllegalArgumentException("Delays and intervals cannot be negative");
        }
        this.maxConcurrentWorkflows = builder.maxConcurrentWorkflows;
        this.retryDelayMs = builder.retryDelayMs;
        this.persistState = builder.persistState;
        this.cleanupIntervalMs = builder.cleanupIntervalMs;
        this.maxStateAge = Objects.requireNonNull(builder.maxStateAge, "maxStateAge cannot be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static WorkflowEngineConfig defaults() {
        return builder().build();
    }

    public static WorkflowEngineConfig from(CourierConfiguration configuration) {
        return builder()
                .maxConcurrentWorkflows(configuration.getMaxConcurrentWorkflows())
                .retryDelayMs(configuration.getRetryDelayMs())
                .persistState(configuration.isPersistWorkflowState())
                .cleanupIntervalMs(configuration.getCleanupIntervalMs())
                .maxStateAge(Duration.ofMillis(configuration.getMaxStateAgeMs()))
                .build();
    }

    public int getMaxConcurrentWorkflows() {
        return maxConcurrentWorkflows;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    /**
     * @return whether new instances are written to the instance store
     */
    public boolean isPersistState() {
        return persistState;
    }

    /**
     * @return period of the background cleanup, 0 when disabled
     */
    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    public Duration getMaxStateAge() {
        return maxStateAge;
    }

    @Override
    public String toString() {
        return "WorkflowEngineConfig{" +
                "maxConcurrentWorkflows=" + maxConcurrentWorkflows +
                ", retryDelayMs=" + retryDelayMs +
                ", persistState=" + persistState +
                ", cleanupIntervalMs=" + cleanupIntervalMs +
                ", maxStateAge=" + maxStateAge +
                '}';
    }

    public static final class Builder {
        private int maxConcurrentWorkflows = 5;
        private long retryDelayMs = 1000;
        private boolean persistState = true;
        private long cleanupIntervalMs = 3600000;
        private Duration maxStateAge = Duration.ofDays(30);

        private Builder() {
        }

        public Builder maxConcurrentWorkflows(int maxConcurrentWorkflows) {
            this.maxConcurrentWorkflows = maxConcurrentWorkflows;
            return this;
        }

        public Builder retryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        public Builder persistState(boolean persistState) {
            this.persistState = persistState;
            return this;
        }

        public Builder cleanupIntervalMs(long cleanupIntervalMs) {
            this.cleanupIntervalMs = cleanupIntervalMs;
            return this;
        }

        public Builder maxStateAge(Duration maxStateAge) {
            this.maxStateAge = maxStateAge;
            return this;
        }

        public WorkflowEngineConfig build() {
            return new WorkflowEngineConfig(this);
        }
    }
}
