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

import dev.mars.courier.core.AutomationLevel;
import dev.mars.courier.core.ContextSnapshot;
import dev.mars.courier.core.WorkflowDefinition;
import dev.mars.courier.core.exceptions.DuplicateDefinitionException;
import dev.mars.courier.core.exceptions.InvalidDefinitionException;
import dev.mars.courier.core.exceptions.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Holds the workflow definitions an engine can start, keyed by id.
 *
 * <p>Definitions are validated on registration: the step dependency graph must be
 * acyclic, every dependency must name a step of the same definition and every step must
 * be reachable from the entry step. Validation can be switched off to accept definitions
 * as they are, in which case broken graphs surface as runtime deadlocks.</p>
 *
 * <p>All operations are thread-safe. Listing operations return definitions in
 * registration order.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowDefinitionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowDefinitionRegistry.class);

    private static final Comparator<WorkflowDefinition> SUGGESTION_ORDER =
            Comparator.comparingInt(WorkflowDefinition::getPriority).reversed()
                    .thenComparingInt(WorkflowDefinition::getEstimatedTimeMinutes);

    private final Map<String, WorkflowDefinition> definitions = new LinkedHashMap<>();
    private final boolean validateGraphs;

    public WorkflowDefinitionRegistry() {
        this(true);
    }

    public WorkflowDefinitionRegistry(boolean validateGraphs) {
        this.validateGraphs = validateGraphs;
    }

    /**
     * Registers a definition.
     *
     * @param definition the definition to add
     * @throws DuplicateDefinitionException if a definition with the same id is registered
     * @throws InvalidDefinitionException   if graph validation is enabled and the step graph is invalid
     */
    public void register(WorkflowDefinition definition)
            throws DuplicateDefinitionException, InvalidDefinitionException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");

        if (validateGraphs) {
            ValidationResult validation = DependencyGraph.of(definition).validate();
            if (!validation.isValid()) {
                logger.warn("Rejected workflow definition {}: {}", definition.getId(), validation.getErrorMessages());
                throw new InvalidDefinitionException(definition.getId(), validation.getErrorMessages());
            }
            if (validation.hasWarnings()) {
                logger.debug("Workflow definition {} has warnings: {}", definition.getId(), validation.getWarnings());
            }
        }

        synchronized (definitions) {
            if (definitions.containsKey(definition.getId())) {
                throw new DuplicateDefinitionException(definition.getId());
            }
            definitions.put(definition.getId(), definition.toBuilder().build());
        }
        logger.debug("Registered workflow definition {} ({} steps)", definition.getId(), definition.getSteps().size());
    }

    /**
     * @throws NotFoundException if no definition has the given id
     */
    public WorkflowDefinition get(String definitionId) throws NotFoundException {
        synchronized (definitions) {
            WorkflowDefinition definition = definitions.get(definitionId);
            if (definition == null) {
                throw NotFoundException.definition(definitionId);
            }
            return definition;
        }
    }

    public boolean contains(String definitionId) {
        synchronized (definitions) {
            return definitions.containsKey(definitionId);
        }
    }

    public List<WorkflowDefinition> listAll() {
        synchronized (definitions) {
            return List.copyOf(definitions.values());
        }
    }

    /**
     * @return {@code true} if a definition was removed
     */
    public boolean unregister(String definitionId) {
        synchronized (definitions) {
            boolean removed = definitions.remove(definitionId) != null;
            if (removed) {
                logger.debug("Unregistered workflow definition {}", definitionId);
            }
            return removed;
        }
    }

    /**
     * Lists the definitions whose required context matches the given snapshot.
     */
    public List<WorkflowDefinition> listForContext(ContextSnapshot context) {
        ContextSnapshot snapshot = context != null ? context : ContextSnapshot.empty();
        return listAll().stream()
                .filter(definition -> definition.appliesTo(snapshot))
                .collect(Collectors.toList());
    }

    /**
     * Lists the applicable definitions ordered by priority (highest first), then by
     * estimated duration (shortest first).
     */
    public List<WorkflowDefinition> suggest(ContextSnapshot context) {
        List<WorkflowDefinition> applicable = new ArrayList<>(listForContext(context));
        applicable.sort(SUGGESTION_ORDER);
        return applicable;
    }

    public Set<String> getCategories() {
        Set<String> categories = new LinkedHashSet<>();
        for (WorkflowDefinition definition : listAll()) {
            categories.add(definition.getCategory());
        }
        return categories;
    }

    public List<WorkflowDefinition> getWorkflowsByCategory(String category) {
        return listAll().stream()
                .filter(definition -> definition.getCategory().equals(category))
                .collect(Collectors.toList());
    }

    /**
     * @return {@code true} if the definition may run without a user driving each step
     * @throws NotFoundException if no definition has the given id
     */
    public boolean canAutomate(String definitionId) throws NotFoundException {
        return get(definitionId).getAutomationLevel().isAutomatable();
    }

    public RegistryStatistics getStatistics() {
        List<WorkflowDefinition> all = listAll();
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        Map<AutomationLevel, Integer> byAutomationLevel = new EnumMap<>(AutomationLevel.class);
        long totalMinutes = 0;
        for (WorkflowDefinition definition : all) {
            byCategory.merge(definition.getCategory(), 1, Integer::sum);
            byAutomationLevel.merge(definition.getAutomationLevel(), 1, Integer::sum);
            totalMinutes += definition.getEstimatedTimeMinutes();
        }
        double average = all.isEmpty() ? 0.0 : (double) totalMinutes / all.size();
        return new RegistryStatistics(all.size(), byCategory, byAutomationLevel, average);
    }

    public boolean isGraphValidationEnabled() {
        return validateGraphs;
    }

    public int size() {
        synchronized (definitions) {
            return definitions.size();
        }
    }
}
