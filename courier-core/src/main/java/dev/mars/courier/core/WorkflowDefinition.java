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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable workflow template: an ordered set of dependency-linked steps plus catalog metadata.
 *
 * <p>Steps are held in an id-indexed map that preserves declaration order. Steps refer to
 * each other only by id.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class WorkflowDefinition {

    private final String id;
    private final String name;
    private final String description;
    private final String category;
    private final String version;
    private final Map<String, StepDefinition> steps;
    private final String entryStepId;
    private final int estimatedTimeMinutes;
    private final int priority;
    private final AutomationLevel automationLevel;
    private final Map<String, Object> requiredContext;
    private final Set<String> tags;

    private WorkflowDefinition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Workflow id cannot be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.description = builder.description;
        this.category = builder.category != null ? builder.category : "general";
        this.version = builder.version != null ? builder.version : "1.0.0";
        Map<String, StepDefinition> indexed = new LinkedHashMap<>();
        for (StepDefinition step : builder.steps) {
            if (indexed.put(step.getId(), step) != null) {
                throw new IllegalArgumentException("Duplicate step id '" + step.getId() + "' in workflow " + id);
            }
        }
        if (indexed.isEmpty()) {
            throw new IllegalArgumentException("Workflow " + id + " has no steps");
        }
        this.steps = Collections.unmodifiableMap(indexed);
        this.entryStepId = builder.entryStepId != null ? builder.entryStepId : indexed.keySet().iterator().next();
        this.estimatedTimeMinutes = builder.estimatedTimeMinutes;
        this.priority = builder.priority;
        this.automationLevel = builder.automationLevel != null ? builder.automationLevel : AutomationLevel.SEMI_AUTO;
        this.requiredContext = ContextSnapshot.of(builder.requiredContext).asMap();
        this.tags = Values.immutableSet(builder.tags);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getCategory() {
        return category;
    }

    public String getVersion() {
        return version;
    }

    /**
     * @return steps in declaration order
     */
    public List<StepDefinition> getSteps() {
        return List.copyOf(steps.values());
    }

    public Optional<StepDefinition> getStep(String stepId) {
        return Optional.ofNullable(steps.get(stepId));
    }

    public Set<String> getStepIds() {
        return steps.keySet();
    }

    public String getEntryStepId() {
        return entryStepId;
    }

    public int getEstimatedTimeMinutes() {
        return estimatedTimeMinutes;
    }

    public int getPriority() {
        return priority;
    }

    public AutomationLevel getAutomationLevel() {
        return automationLevel;
    }

    /**
     * @return dotted context paths and the values they must hold for this workflow to be offered
     */
    public Map<String, Object> getRequiredContext() {
        return requiredContext;
    }

    public Set<String> getTags() {
        return tags;
    }

    public boolean appliesTo(ContextSnapshot context) {
        return (context != null ? context : ContextSnapshot.empty()).matches(requiredContext);
    }

    /**
     * @return a builder pre-populated with this definition's values
     */
    public Builder toBuilder() {
        return new Builder(id)
                .name(name)
                .description(description)
                .category(category)
                .version(version)
                .steps(new ArrayList<>(steps.values()))
                .entryStepId(entryStepId)
                .estimatedTimeMinutes(estimatedTimeMinutes)
                .priority(priority)
                .automationLevel(automationLevel)
                .requiredContext(requiredContext)
                .tags(new ArrayList<>(tags));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return id.equals(that.id) && version.equals(that.version) && steps.equals(that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, steps);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
                "id='" + id + '\'' +
                ", category='" + category + '\'' +
                ", steps=" + steps.keySet() +
                ", entryStepId='" + entryStepId + '\'' +
                ", priority=" + priority +
                '}';
    }

    public static class Builder {
        private final String id;
        private String name;
        private String description;
        private String category;
        private String version;
        private final List<StepDefinition> steps = new ArrayList<>();
        private String entryStepId;
        private int estimatedTimeMinutes;
        private int priority;
        private AutomationLevel automationLevel;
        private Map<String, Object> requiredContext = new LinkedHashMap<>();
        private final List<String> tags = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder step(StepDefinition step) {
            this.steps.add(step);
            return this;
        }

        public Builder steps(List<StepDefinition> steps) {
            this.steps.clear();
            this.steps.addAll(steps);
            return this;
        }

        public Builder entryStepId(String entryStepId) {
            this.entryStepId = entryStepId;
            return this;
        }

        public Builder estimatedTimeMinutes(int estimatedTimeMinutes) {
            this.estimatedTimeMinutes = estimatedTimeMinutes;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder automationLevel(AutomationLevel automationLevel) {
            this.automationLevel = automationLevel;
            return this;
        }

        public Builder requiredContext(Map<String, Object> requiredContext) {
            this.requiredContext = requiredContext;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags.clear();
            this.tags.addAll(tags);
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(this);
        }
    }
}
