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


package dev.mars.courier.workflow.store;

import dev.mars.courier.core.StepResult;
import dev.mars.courier.core.StepStatus;
import dev.mars.courier.core.WorkflowError;
import dev.mars.courier.core.WorkflowInstance;
import dev.mars.courier.core.WorkflowResult;
import dev.mars.courier.core.WorkflowStatus;
import io.vertx.core.Future;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Persistence contract for workflow instances.
 *
 * <p>Stores keep their own copies: an instance passed to {@link #save} may be changed
 * afterwards without affecting the stored record, and every load returns a fresh copy.
 * Operations on a store that is not open fail with {@link IllegalStateException}; a lookup
 * by an unknown id fails with {@link dev.mars.courier.core.exceptions.NotFoundException}.</p>
 *
 * <p><b>Implementations:</b></p>
 * <ul>
 *   <li>{@link FileWorkflowInstanceStore} - one directory per instance with small overlay files</li>
 *   <li>{@link InMemoryWorkflowInstanceStore} - in-memory storage (testing only, not durable)</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public interface WorkflowInstanceStore {

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Opens the store. Idempotent while the store is open.
     *
     * @return a Future that completes when the store is ready for operations
     */
    Future<Void> open();

    /**
     * Closes the store. Further operations fail.
     */
    Future<Void> close();

    // =========================================================================
    // Instance records
    // =========================================================================

    /**
     * Inserts or replaces the full record of an instance.
     */
    Future<Void> save(WorkflowInstance instance);

    Future<WorkflowInstance> load(String instanceId);

    /**
     * @param userId the owning user, or {@code null} for every instance
     */
    Future<List<WorkflowInstance>> loadForUser(String userId);

    /**
     * Same as {@link #loadForUser(String)}, keeping only instances in {@code status}; a null
     * status keeps all of them.
     */
    default Future<List<WorkflowInstance>> loadForUser(String userId, WorkflowStatus status) {
        if (status == null) {
            return loadForUser(userId);
        }
        return loadForUser(userId).map(instances -> instances.stream()
                .filter(instance -> instance.getStatus() == status)
                .collect(Collectors.toList()));
    }

    Future<List<WorkflowInstance>> loadAll();

    /**
     * @return a Future completing with {@code true} if a record was removed
     */
    Future<Boolean> delete(String instanceId);

    /**
     * Removes terminal instances whose completion time is older than {@code now - maxAge}.
     *
     * @return a Future completing with the number of removed instances
     */
    Future<Integer> deleteOlderThan(Duration maxAge);

    // =========================================================================
    // Partial updates
    // =========================================================================

    Future<Void> updateStatus(String instanceId, WorkflowStatus status);

    Future<Void> updateStepStatus(String instanceId, String stepId, StepStatus status);

    Future<Void> saveStepResult(String instanceId, String stepId, StepResult result);

    Future<Void> saveWorkflowResult(String instanceId, WorkflowResult result);

    Future<Void> saveWorkflowError(String instanceId, WorkflowError error);
}
