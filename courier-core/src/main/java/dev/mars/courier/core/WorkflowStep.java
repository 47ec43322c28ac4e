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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.courier.core.exceptions.InvalidTransitionException;
import dev.mars.courier.core.step.StepConfig;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Runtime copy of a {@link StepDefinition} inside one workflow instance.
 *
 * <p>Every instance owns its own step objects; {@link #copy()} produces an independent copy.
 * Template fields are fixed at construction, runtime fields are updated by the engine.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowStep {

    private final String id;
    private final String title;
    private final String description;
    private final StepConfig config;
    private final List<String> dependencies;
    private final long timeoutMs;
    private final int maxRetries;

    private StepStatus status = StepStatus.PENDING;
    private StepResult result;
    private StepError error;
    private Instant startedAt;
    private Instant completedAt;
    private int retryCount;

    @JsonCreator
    public WorkflowStep(@JsonProperty("id") String id,
                        @JsonProperty("title") String title,
                        @JsonProperty("description") String description,
                        @JsonProperty("config") StepConfig config,
                        @JsonProperty("dependencies") List<String> dependencies,
                        @JsonProperty("timeoutMs") long timeoutMs,
                        @JsonProperty("maxRetries") int maxRetries) {
        this.id = Objects.requireNonNull(id, "Step id cannot be null");
        this.title = title != null ? title : id;
        this.description = description;
        this.config = Objects.requireNonNull(config, "Step config cannot be null");
        this.dependencies = Values.immutableList(dependencies);
        this.timeoutMs = timeoutMs;
        this.maxRetries = maxRetries;
    }

    public static WorkflowStep fromDefinition(StepDefinition definition) {
        return new WorkflowStep(definition.getId(), definition.getTitle(), definition.getDescription(),
                definition.getConfig(), definition.getDependencies(), definition.getTimeoutMs(),
                definition.getMaxRetries());
    }

    /**
     * @return an independent copy with the same template and runtime state
     */
    public WorkflowStep copy() {
        WorkflowStep copy = new WorkflowStep(id, title, description, config, dependencies, timeoutMs, maxRetries);
        copy.status = status;
        copy.result = result;
        copy.error = error;
        copy.startedAt = startedAt;
        copy.completedAt = completedAt;
        copy.retryCount = retryCount;
        return copy;
    }

    /**
     * Moves the step to {@code target}, enforcing the step state machine.
     *
     * @param target the requested status
     * @throws InvalidTransitionException if the transition is not allowed from the current status
     */
    public void transitionTo(StepStatus target) throws InvalidTransitionException {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target, status.getValidTransitions());
        }
        this.status = target;
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

    @JsonIgnore
    public StepType getType() {
        return config.type();
    }

    public StepConfig getConfig() {
        return config;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public StepStatus getStatus() {
        return status;
    }

    /**
     * Sets the status without state machine checks. Used when restoring persisted state.
     */
    public void setStatus(StepStatus status) {
        this.status = Objects.requireNonNull(status, "Step status cannot be null");
    }

    public StepResult getResult() {
        return result;
    }

    public void setResult(StepResult result) {
        this.result = result;
    }

    public StepError getError() {
        return error;
    }

    public void setError(StepError error) {
        this.error = error;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    /**
     * @return {@code true} if the step is parked until an outcome is supplied from outside
     */
    @JsonIgnore
    public boolean isAwaitingExternalCompletion() {
        return status == StepStatus.PAUSED && result != null && result.awaitingExternalCompletion();
    }

    @Override
    public String toString() {
        return "WorkflowStep{" +
                "id='" + id + '\'' +
                ", type=" + getType() +
                ", status=" + status +
                ", retryCount=" + retryCount +
                '}';
    }
}
