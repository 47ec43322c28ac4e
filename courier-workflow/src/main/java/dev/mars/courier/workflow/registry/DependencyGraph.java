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

import dev.mars.courier.core.StepDefinition;
import dev.mars.courier.core.WorkflowDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Dependency graph over the steps of one workflow definition.
 * Provides topological ordering, cycle detection and reachability from the entry step.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class DependencyGraph {

    private final Map<String, Set<String>> dependencies;
    private final Map<String, StepDefinition> steps;
    private String entryStepId;

    public DependencyGraph() {
        this.dependencies = new LinkedHashMap<>();
        this.steps = new LinkedHashMap<>();
    }

    /**
     * Builds the graph for every step of a definition.
     *
     * @param definition the workflow definition
     * @return the populated graph
     */
    public static DependencyGraph of(WorkflowDefinition definition) {
        DependencyGraph graph = new DependencyGraph();
        for (StepDefinition step : definition.getSteps()) {
            graph.addStep(step);
        }
        graph.entryStepId = definition.getEntryStepId();
        return graph;
    }

    public void addStep(StepDefinition step) {
        Objects.requireNonNull(step, "Step cannot be null");
        steps.put(step.getId(), step);
        dependencies.put(step.getId(), new LinkedHashSet<>(step.getDependencies()));
    }

    public Set<String> getDependencies(String stepId) {
        return dependencies.getOrDefault(stepId, Set.of());
    }

    /**
     * Orders the steps so that each step follows all of its dependencies. Ties keep
     * declaration order.
     *
     * @return the ordered steps, or empty if the graph has a cycle
     */
    public Optional<List<StepDefinition>> topologicalSort() {
        // Kahn's algorithm
        Map<String, Integer> inDegree = calculateInDegree();
        Deque<String> queue = new ArrayDeque<>();
        List<StepDefinition> result = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(steps.get(current));
            for (String dependent : findDependents(current)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(dependent);
                }
            }
        }

        return result.size() == steps.size() ? Optional.of(result) : Optional.empty();
    }

    public boolean hasCycles() {
        return topologicalSort().isEmpty();
    }

    /**
     * Collects the steps reachable from the entry step by following dependent edges.
     */
    public Set<String> reachableFromEntry() {
        Set<String> visited = new LinkedHashSet<>();
        if (entryStepId == null || !steps.containsKey(entryStepId)) {
            return visited;
        }
        Deque<String> pending = new ArrayDeque<>();
        pending.push(entryStepId);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (visited.add(current)) {
                findDependents(current).forEach(pending::push);
            }
        }
        return visited;
    }

    /**
     * Validates the graph for consistency.
     *
     * @return validation result
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();

        if (steps.isEmpty()) {
            result.addError("steps", "Workflow has no steps");
            return result;
        }

        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            String stepId = entry.getKey();
            for (String dependency : entry.getValue()) {
                if (dependency.equals(stepId)) {
                    result.addError("steps." + stepId + ".dependsOn", "Step cannot depend on itself");
                } else if (!steps.containsKey(dependency)) {
                    result.addError("steps." + stepId + ".dependsOn",
                            "Dependency '" + dependency + "' not found");
                }
            }
        }

        for (StepDefinition step : steps.values()) {
            if (step.getTimeoutMs() == 0) {
                result.addWarning("steps." + step.getId() + ".timeoutMs", "Step has no timeout");
            }
        }

        if (hasCycles()) {
            result.addError("Circular dependencies detected among steps");
        }

        if (entryStepId == null || !steps.containsKey(entryStepId)) {
            result.addError("entryStepId", "Entry step '" + entryStepId + "' not found");
        } else {
            if (!getDependencies(entryStepId).isEmpty()) {
                result.addError("entryStepId", "Entry step '" + entryStepId + "' must not have dependencies");
            }
            Set<String> reachable = reachableFromEntry();
            for (String stepId : steps.keySet()) {
                if (!reachable.contains(stepId)) {
                    result.addError("steps." + stepId, "Step is not reachable from entry step '" + entryStepId + "'");
                }
            }
        }

        return result;
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String stepId : steps.keySet()) {
            inDegree.put(stepId, 0);
        }
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            for (String dependency : entry.getValue()) {
                if (steps.containsKey(dependency)) {
                    inDegree.merge(entry.getKey(), 1, Integer::sum);
                }
            }
        }
        return inDegree;
    }

    private Set<String> findDependents(String stepId) {
        Set<String> dependents = new LinkedHashSet<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            if (entry.getValue().contains(stepId)) {
                dependents.add(entry.getKey());
            }
        }
        return dependents;
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "steps=" + steps.keySet() +
               ", dependencies=" + dependencies +
               '}';
    }
}
