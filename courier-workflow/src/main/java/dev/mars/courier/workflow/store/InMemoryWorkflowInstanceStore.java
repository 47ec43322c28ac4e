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
import dev.mars.courier.core.WorkflowStep;
import dev.mars.courier.core.exceptions.NotFoundException;
import io.vertx.core.Future;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link WorkflowInstanceStore}.
 *
 * <p><b>WARNING: NOT FOR PRODUCTION USE.</b> All data is lost when the process
 * terminates. Write failures can be simulated with {@link #setFailWrites(boolean)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public final class InMemoryWorkflowInstanceStore implements WorkflowInstanceStore {

    private final Map<String, WorkflowInstance> instances = new ConcurrentHashMap<>();

    private volatile boolean opened = false;
    private volatile boolean failWrites = false;

    // =========================================================================
    // Lifecycle
    // =========================================================================

    @Override
    public Future<Void> open() {
        opened = true;
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> close() {
        opened = false;
        return Future.succeededFuture();
    }

    // =========================================================================
    // Instance records
    // =========================================================================

    @Override
    public Future<Void> save(WorkflowInstance instance) {
        Objects.requireNonNull(instance, "Instance cannot be null");
        if (!opened) {
            return notOpen();
        }
        if (failWrites) {
            return simulatedFailure();
        }
        instances.put(instance.getId(), instance.copy());
        return Future.succeededFuture();
    }

    @Override
    public Future<WorkflowInstance> load(String instanceId) {
        if (!opened) {
            return notOpen();
        }
        WorkflowInstance instance = instances.get(instanceId);
        if (instance == null) {
            return Future.failedFuture(NotFoundException.instance(instanceId));
        }
        return Future.succeededFuture(snapshot(instance));
    }

    @Override
    public Future<List<WorkflowInstance>> loadForUser(String userId) {
        if (!opened) {
            return notOpen();
        }
        List<WorkflowInstance> result = new ArrayList<>();
        for (WorkflowInstance instance : instances.values()) {
            if (userId == null || userId.equals(instance.getUserId())) {
                result.add(snapshot(instance));
            }
        }
        return Future.succeededFuture(result);
    }

    @Override
    public Future<List<WorkflowInstance>> loadAll() {
        return loadForUser(null);
    }

    @Override
    public Future<Boolean> delete(String instanceId) {
        if (!opened) {
            return notOpen();
        }
        if (failWrites) {
            return simulatedFailure();
        }
        return Future.succeededFuture(instances.remove(instanceId) != null);
    }

    @Override
    public Future<Integer> deleteOlderThan(Duration maxAge) {
        if (!opened) {
            return notOpen();
        }
        Instant cutoff = Instant.now().minus(maxAge);
        int removed = 0;
        Iterator<WorkflowInstance> it = instances.values().iterator();
        while (it.hasNext()) {
            WorkflowInstance instance = it.next();
            if (instance.isTerminal() && instance.getCompletedAt() != null
                    && instance.getCompletedAt().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return Future.succeededFuture(removed);
    }

    // =========================================================================
    // Partial updates
    // =========================================================================

    @Override
    public Future<Void> updateStatus(String instanceId, WorkflowStatus status) {
        return modify(instanceId, instance -> instance.setStatus(status));
    }

    @Override
    public Future<Void> updateStepStatus(String instanceId, String stepId, StepStatus status) {
        return modifyStep(instanceId, stepId, step -> step.setStatus(status));
    }

    @Override
    public Future<Void> saveStepResult(String instanceId, String stepId, StepResult result) {
        return modifyStep(instanceId, stepId, step -> step.setResult(result));
    }

    @Override
    public Future<Void> saveWorkflowResult(String instanceId, WorkflowResult result) {
        return modify(instanceId, instance -> instance.setResult(result));
    }

    @Override
    public Future<Void> saveWorkflowError(String instanceId, WorkflowError error) {
        return modify(instanceId, instance -> instance.setError(error));
    }

    // =========================================================================
    // Test hooks
    // =========================================================================

    /**
     * Makes every subsequent write fail with an {@link IOException}.
     */
    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    public boolean isOpen() {
        return opened;
    }

    public int size() {
        return instances.size();
    }

    private Future<Void> modifyStep(String instanceId, String stepId, Consumer<WorkflowStep> change) {
        return modify(instanceId, instance -> {
            WorkflowStep step = instance.getStep(stepId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown step " + stepId + " in " + instanceId));
            change.accept(step);
        });
    }

    private Future<Void> modify(String instanceId, Consumer<WorkflowInstance> change) {
        if (!opened) {
            return notOpen();
        }
        if (failWrites) {
            return simulatedFailure();
        }
        WorkflowInstance instance = instances.get(instanceId);
        if (instance == null) {
            return Future.failedFuture(NotFoundException.instance(instanceId));
        }
        try {
            synchronized (instance) {
                change.accept(instance);
            }
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        return Future.succeededFuture();
    }

    private static WorkflowInstance snapshot(WorkflowInstance instance) {
        synchronized (instance) {
            return instance.copy();
        }
    }

    private static <T> Future<T> notOpen() {
        return Future.failedFuture(new IllegalStateException("Store not open"));
    }

    private static <T> Future<T> simulatedFailure() {
        return Future.failedFuture(new IOException("Simulated write failure"));
    }
}
