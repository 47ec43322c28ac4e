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

import dev.mars.courier.core.ContextSnapshot;
import dev.mars.courier.core.StepResult;
import dev.mars.courier.core.WorkflowInstance;
import dev.mars.courier.core.exceptions.InvalidTransitionException;
import dev.mars.courier.core.exceptions.NotFoundException;
import dev.mars.courier.core.exceptions.ResourceExhaustedException;
import dev.mars.courier.workflow.event.Subscription;
import dev.mars.courier.workflow.event.WorkflowEventListener;
import io.vertx.core.Future;

import java.util.List;
import java.util.Optional;

/**
 * Runs workflow instances: starts them, drives their steps and manages their lifecycle.
 *
 * <p>Lifecycle calls return snapshot copies. Step execution happens asynchronously on the
 * engine's event loop; terminal failures are reported through the instance error and a
 * {@code workflow_failed} event rather than as exceptions.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public interface WorkflowEngine {

    /**
     * Opens the instance store and schedules periodic cleanup.
     *
     * @return future completed once the engine accepts workflows
     */
    Future<Void> start();

    /**
     * Stops accepting workflows, invalidates running attempts, persists live instances
     * and closes the store.
     */
    Future<Void> shutdown();

    boolean isRunning();

    /**
     * Starts a workflow using the engine's persistence default.
     *
     * @param definitionId registered definition id
     * @param context      context snapshot, or {@code null} to ask the context provider
     * @return snapshot of the new active instance
     * @throws NotFoundException          if the definition is unknown
     * @throws ResourceExhaustedException if the concurrency bound is reached
     */
    WorkflowInstance startWorkflow(String definitionId, ContextSnapshot context)
            throws NotFoundException, ResourceExhaustedException;

    WorkflowInstance startWorkflow(String definitionId, ContextSnapshot context, String userId)
            throws NotFoundException, ResourceExhaustedException;

    WorkflowInstance startWorkflow(String definitionId, ContextSnapshot context, String userId, boolean persistent)
            throws NotFoundException, ResourceExhaustedException;

    WorkflowInstance pauseWorkflow(String instanceId) throws NotFoundException, InvalidTransitionException;

    WorkflowInstance resumeWorkflow(String instanceId)
            throws NotFoundException, InvalidTransitionException, ResourceExhaustedException;

    WorkflowInstance cancelWorkflow(String instanceId) throws NotFoundException, InvalidTransitionException;

    /**
     * Completes a step that is paused awaiting external input, such as a form submission
     * or an extracted email.
     *
     * @param instanceId workflow instance id
     * @param stepId     the awaiting step
     * @param outcome    result supplied by the outside party
     * @return snapshot of the instance after the outcome was applied
     * @throws InvalidTransitionException if the instance is not active or the step is not awaiting
     */
    WorkflowInstance completeStep(String instanceId, String stepId, StepResult outcome)
            throws NotFoundException, InvalidTransitionException;

    Optional<WorkflowInstance> getWorkflow(String instanceId);

    List<WorkflowInstance> getActiveWorkflows();

    List<WorkflowInstance> getPausedWorkflows();

    List<WorkflowInstance> getCompletedWorkflows();

    int getActiveCount();

    /**
     * Deletes a terminated instance from memory and from the store.
     *
     * @throws IllegalStateException if the instance is still active or paused
     */
    Future<Boolean> removeWorkflow(String instanceId);

    /**
     * Removes terminated instances older than the configured maximum age.
     *
     * @return number of instances deleted from the store
     */
    Future<Integer> cleanup();

    Subscription onEvent(WorkflowEventListener listener);
}
