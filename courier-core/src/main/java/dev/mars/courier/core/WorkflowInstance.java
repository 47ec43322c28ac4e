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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One execution of a {@link WorkflowDefinition}, with its own copy of every step.
 *
 * <p>Instances are created in {@link WorkflowStatus#DRAFT} and are mutated only by the
 * engine that runs them. Callers receive copies.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowInstance {

    private final String id;
    private final String definitionId;
    private final Map<String, WorkflowStep> steps;

    private String userId;
    private WorkflowStatus status = WorkflowStatus.DRAFT;
    private String currentStepId;
    private ContextSnapshot context = ContextSnapshot.empty();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final List<Artifact> artifacts = new ArrayList<>();
    private final List<String> completedStepOrder = new ArrayList<>();
    private Instant startedAt;
    private Instant pausedAt;
    private Instant completedAt;
    private WorkflowResult result;
    private WorkflowError error;
    private boolean persistent = true;

    @JsonCreator
    public WorkflowInstance(@JsonProperty("id") String id,
                            @JsonProperty("definitionId") String definitionId,
                            @JsonProperty("steps") List<WorkflowStep> steps) {
        this.id = Objects.requireNonNull(id, "Instance id cannot be null");
        this.definitionId = Objects.requireNonNull(definitionId, "Definition id cannot be null");
        this.steps = new LinkedHashMap<>();
        if (steps != null) {
            for (WorkflowStep step : steps) {
                this.steps.put(step.getId(), step);
            }
        }
    }

    /**
     * Creates a draft instance with fresh copies of the definition's steps.
     *
     * @param definition the template
     * @param context    context snapshot captured at start
     * @param userId     owning user, may be {@code null}
     * @param persistent whether the instance is written to the instance store
     * @return the new instance
     */
    public static WorkflowInstance create(WorkflowDefinition definition, ContextSnapshot context,
                                          String userId, boolean persistent) {
        List<WorkflowStep> steps = new ArrayList<>();
        for (StepDefinition step : definition.getSteps()) {
            steps.add(WorkflowStep.fromDefinition(step));
        }
        WorkflowInstance instance = new WorkflowInstance("workflow-" + UUID.randomUUID(), definition.getId(), steps);
        instance.userId = userId;
        instance.context = context != null ? context : ContextSnapshot.empty();
        instance.currentStepId = definition.getEntryStepId();
        instance.persistent = persistent;
        instance.metadata.put("definitionName", definition.getName());
        instance.metadata.put("category", definition.getCategory());
        instance.metadata.put("definitionVersion", definition.getVersion());
        return instance;
    }

    /**
     * @return a deep copy sharing no mutable state with this instance
     */
    public WorkflowInstance copy() {
        return copyWithId(id);
    }

    /**
     * @return a deep copy carrying a different id
     */
    public WorkflowInstance copyWithId(String newId) {
        List<WorkflowStep> stepCopies = new ArrayList<>();
        for (WorkflowStep step : steps.values()) {
            stepCopies.add(step.copy());
        }
        WorkflowInstance copy = new WorkflowInstance(newId, definitionId, stepCopies);
        copy.userId = userId;
        copy.status = status;
        copy.currentStepId = currentStepId;
        copy.context = context;
        copy.setMetadata(metadata);
        copy.artifacts.addAll(artifacts);
        copy.completedStepOrder.addAll(completedStepOrder);
        copy.startedAt = startedAt;
        copy.pausedAt = pausedAt;
        copy.completedAt = completedAt;
        copy.result = result;
        copy.error = error;
        copy.persistent = persistent;
        return copy;
    }

    /**
     * Moves the instance to {@code target}, enforcing the workflow state machine.
     *
     * @throws InvalidTransitionException if the transition is not allowed from the current status
     */
    public void transitionTo(WorkflowStatus target) throws InvalidTransitionException {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target, status.getValidTransitions());
        }
        this.status = target;
    }

    public String getId() {
        return id;
    }

    public String getDefinitionId() {
        return definitionId;
    }

    public List<WorkflowStep> getSteps() {
        return Collections.unmodifiableList(new ArrayList<>(steps.values()));
    }

    public Optional<WorkflowStep> getStep(String stepId) {
        return Optional.ofNullable(steps.get(stepId));
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    /**
     * Sets the status without state machine checks. Used when restoring persisted state.
     */
    public void setStatus(WorkflowStatus status) {
        this.status = Objects.requireNonNull(status, "Workflow status cannot be null");
    }

    public String getCurrentStepId() {
        return currentStepId;
    }

    public void setCurrentStepId(String currentStepId) {
        this.currentStepId = currentStepId;
    }

    public ContextSnapshot getContext() {
        return context;
    }

    public void setContext(ContextSnapshot context) {
        this.context = context != null ? context : ContextSnapshot.empty();
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata.clear();
        if (metadata != null) {
            metadata.forEach((k, v) -> this.metadata.put(k, Values.deepCopy(v)));
        }
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    @JsonIgnore
    public String getCategory() {
        Object category = metadata.get("category");
        return category != null ? category.toString() : "unknown";
    }

    public List<Artifact> getArtifacts() {
        return Collections.unmodifiableList(artifacts);
    }

    public void setArtifacts(List<Artifact> artifacts) {
        this.artifacts.clear();
        if (artifacts != null) {
            this.artifacts.addAll(artifacts);
        }
    }

    public void addArtifacts(List<Artifact> produced) {
        artifacts.addAll(produced);
    }

    /**
     * @return ids of the completed steps, in the order they completed
     */
    public List<String> getCompletedStepOrder() {
        return Collections.unmodifiableList(completedStepOrder);
    }

    public void setCompletedStepOrder(List<String> order) {
        this.completedStepOrder.clear();
        if (order != null) {
            this.completedStepOrder.addAll(order);
        }
    }

    public void recordStepCompletion(String stepId) {
        completedStepOrder.add(stepId);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getPausedAt() {
        return pausedAt;
    }

    public void setPausedAt(Instant pausedAt) {
        this.pausedAt = pausedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public WorkflowResult getResult() {
        return result;
    }

    public void setResult(WorkflowResult result) {
        this.result = result;
    }

    public WorkflowError getError() {
        return error;
    }

    public void setError(WorkflowError error) {
        this.error = error;
    }

    public boolean isPersistent() {
        return persistent;
    }

    public void setPersistent(boolean persistent) {
        this.persistent = persistent;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * @return time from start to completion, if both are known
     */
    @JsonIgnore
    public Optional<Duration> getDuration() {
        if (startedAt == null || completedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt, completedAt));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((WorkflowInstance) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowInstance{" +
                "id='" + id + '\'' +
                ", definitionId='" + definitionId + '\'' +
                ", status=" + status +
                ", currentStepId='" + currentStepId + '\'' +
                '}';
    }
}
