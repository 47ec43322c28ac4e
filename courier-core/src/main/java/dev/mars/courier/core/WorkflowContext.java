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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mutable context shared by the handlers of one workflow instance.
 *
 * <p>Handlers may read the start-time snapshot, put intermediate values into {@link #getData()}
 * and append produced artifacts to {@link #getArtifacts()}. The engine records step results,
 * user inputs and Smart Share results as the workflow advances.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowContext {

    private final String instanceId;
    private final String definitionId;
    private final ContextSnapshot snapshot;
    private final Map<String, Object> data = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<Artifact> artifacts = new CopyOnWriteArrayList<>();
    private final Map<String, StepResult> stepResults = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Object> userInputs = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Object> smartShareResults = Collections.synchronizedMap(new LinkedHashMap<>());

    public WorkflowContext(String instanceId, String definitionId, ContextSnapshot snapshot) {
        this.instanceId = Objects.requireNonNull(instanceId, "Instance id cannot be null");
        this.definitionId = Objects.requireNonNull(definitionId, "Definition id cannot be null");
        this.snapshot = snapshot != null ? snapshot : ContextSnapshot.empty();
    }

    /**
     * Rebuilds a context for an instance, restoring the step results it already holds.
     */
    public static WorkflowContext forInstance(WorkflowInstance instance) {
        WorkflowContext context = new WorkflowContext(instance.getId(), instance.getDefinitionId(), instance.getContext());
        for (WorkflowStep step : instance.getSteps()) {
            if (step.getStatus() == StepStatus.COMPLETED && step.getResult() != null) {
                context.stepResults.put(step.getId(), step.getResult());
            }
        }
        return context;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getDefinitionId() {
        return definitionId;
    }

    public ContextSnapshot getSnapshot() {
        return snapshot;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public List<Artifact> getArtifacts() {
        return artifacts;
    }

    public Map<String, StepResult> getStepResults() {
        return stepResults;
    }

    public Map<String, Object> getUserInputs() {
        return userInputs;
    }

    public Map<String, Object> getSmartShareResults() {
        return smartShareResults;
    }

    /**
     * Resolves a dotted path, looking in {@link #getData()} first and then in the snapshot.
     *
     * @param path dotted path
     * @return the value, or {@code null}
     */
    public Object lookup(String path) {
        Object value;
        synchronized (data) {
            value = ContextSnapshot.resolve(data, path);
        }
        return value != null ? value : snapshot.get(path);
    }
}
