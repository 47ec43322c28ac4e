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


package dev.mars.courier.core;

import dev.mars.courier.core.step.StepConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable step template of a {@link WorkflowDefinition}. Steps refer to each other by id only.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class StepDefinition {

    private final String id;
    private final String title;
    private final String description;
    private final StepConfig config;
    private final List<String> dependencies;
    private final long timeoutMs;
    private final int maxRetries;

    private StepDefinition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Step id cannot be null");
        this.config = Objects.requireNonNull(builder.config, "Step config cannot be null for step " + builder.id);
        this.title = builder.title != null ? builder.title : builder.id;
        this.description = builder.description;
        this.dependencies = List.copyOf(Values.immutableSet(builder.dependencies));
        if (builder.timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must not be negative for step " + id);
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative for step " + id);
        }
        this.timeoutMs = builder.timeoutMs;
        this.maxRetries = builder.maxRetries;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public StepType getType() {
        return config.type();
    }

    public StepConfig getConfig() {
        return config;
    }

    /**
     * @return ids of the steps that must be completed before this one is eligible
     */
    public List<String> getDependencies() {
        return dependencies;
    }

    /**
     * @return timeout in milliseconds, {@code 0} for none
     */
    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepDefinition that = (StepDefinition) o;
        return timeoutMs == that.timeoutMs && maxRetries == that.maxRetries
                && id.equals(that.id) && config.equals(that.config)
                && dependencies.equals(that.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, config, dependencies, timeoutMs, maxRetries);
    }

    @Override
    public String toString() {
        return "StepDefinition{" +
                "id='" + id + '\'' +
                ", type=" + getType() +
                ", dependencies=" + dependencies +
                ", timeoutMs=" + timeoutMs +
                ", maxRetries=" + maxRetries +
                '}';
    }

    public static class Builder {
        private final String id;
        private String title;
        private String description;
        private StepConfig config;
        private final List<String> dependencies = new ArrayList<>();
        private long timeoutMs;
        private int maxRetries;

        private Builder(String id) {
            this.id = id;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder config(StepConfig config) {
            this.config = config;
            return this;
        }

        public Builder dependsOn(String... stepIds) {
            this.dependencies.addAll(List.of(stepIds));
            return this;
        }

        public Builder dependencies(List<String> stepIds) {
            this.dependencies.clear();
            this.dependencies.addAll(stepIds);
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(this);
        }
    }
}
