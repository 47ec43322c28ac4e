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

import dev.mars.courier.core.Artifact;
import dev.mars.courier.core.ContextSnapshot;
import dev.mars.courier.core.StepError;
import dev.mars.courier.core.StepResult;
import dev.mars.courier.core.StepStatus;
import dev.mars.courier.core.StepType;
import dev.mars.courier.core.WorkflowContext;
import dev.mars.courier.core.WorkflowDefinition;
import dev.mars.courier.core.WorkflowError;
import dev.mars.courier.core.WorkflowErrorCode;
import dev.mars.courier.core.WorkflowEvent;
import dev.mars.courier.core.WorkflowEventType;
import dev.mars.courier.core.WorkflowInstance;
import dev.mars.courier.core.WorkflowResult;
import dev.mars.courier.core.WorkflowResultType;
import dev.mars.courier.core.WorkflowStatus;
import dev.mars.courier.core.WorkflowStep;
import dev.mars.courier.core.exceptions.InvalidTransitionException;
import dev.mars.courier.core.exceptions.NotFoundException;
import dev.mars.courier.core.exceptions.ResourceExhaustedException;
import dev.mars.courier.core.exceptions.StepExecutionException;
import dev.mars.courier.core.exceptions.StepTimeoutException;
import dev.mars.courier.workflow.event.Subscription;
import dev.mars.courier.workflow.event.WorkflowEventBus;
import dev.mars.courier.workflow.event.WorkflowEventListener;
import dev.mars.courier.workflow.handler.StepHandler;
import dev.mars.courier.workflow.handler.StepHandlerRegistry;
import dev.mars.courier.workflow.observability.WorkflowMetrics;
import dev.mars.courier.workflow.registry.WorkflowDefinitionRegistry;
import dev.mars.courier.workflow.store.WorkflowInstanceStore;
import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Vert.x implementation of {@link WorkflowEngine}.
 *
 * <p>All step driving runs on a single event-loop context captured at {@link #start()}.
 * Lifecycle calls may come from any thread; every state change happens while holding the
 * engine lock, and events are published inside it so listeners observe them in order.</p>
 *
 * <p>Each live instance carries an execution epoch. Pause, resume, cancel and shutdown
 * advance it, which turns any outstanding handler outcome or retry timer for the old
 * epoch into a no-op.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class DefaultWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(DefaultWorkflowEngine.class);

    private enum State {
        NEW,
        RUNNING,
        SHUT_DOWN
    }

    private final Vertx vertx;
    private final WorkflowDefinitionRegistry registry;
    private final StepHandlerRegistry handlers;
    private final WorkflowInstanceStore store;
    private final WorkflowEngineConfig config;
    private final ContextProvider contextProvider;
    private final WorkflowMetrics metrics;
    private final WorkflowEventBus eventBus = new WorkflowEventBus();

    private final Object lock = new Object();
    private final Map<String, Execution> live = new LinkedHashMap<>();
    private final Map<String, WorkflowInstance> completed = new LinkedHashMap<>();

    private volatile State state = State.NEW;
    private volatile Context engineContext;
    private long cleanupTimerId = -1;

    public DefaultWorkflowEngine(Vertx vertx,
                                 WorkflowDefinitionRegistry registry,
                                 StepHandlerRegistry handlers,
                                 WorkflowInstanceStore store,
                                 WorkflowEngineConfig config,
                                 ContextProvider contextProvider,
                                 WorkflowMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.registry = Objects.requireNonNull(registry, "Definition registry cannot be null");
        this.handlers = Objects.requireNonNull(handlers, "Handler registry cannot be null");
        this.store = Objects.requireNonNull(store, "Instance store cannot be null");
        this.config = config != null ? config : WorkflowEngineConfig.defaults();
        this.contextProvider = contextProvider != null ? contextProvider : ContextProvider.empty();
        this.metrics = metrics != null ? metrics : WorkflowMetrics.noop();
        this.metrics.bindActiveCount(this::getActiveCount);
        this.eventBus.subscribe(this.metrics);
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    @Override
    public Future<Void> start() {
        synchronized (lock) {
            if (state != State.NEW) {
                return Future.failedFuture(new IllegalStateException("Workflow engine already started or shut down"));
            }
            engineContext = vertx.getOrCreateContext();
        }
        return store.open().onSuccess(v -> {
            synchronized (lock) {
                state = State.RUNNING;
                if (config.getCleanupIntervalMs() > 0) {
                    cleanupTimerId = vertx.setPeriodic(config.getCleanupIntervalMs(), id -> runScheduledCleanup());
                }
            }
            logger.info("Workflow engine started: {}", config);
        });
    }

    @Override
    public Future<Void> shutdown() {
        List<Future<Void>> saves = new ArrayList<>();
        boolean wasRunning;
        synchronized (lock) {
            if (state == State.SHUT_DOWN) {
                return Future.succeededFuture();
            }
            wasRunning = state == State.RUNNING;
            state = State.SHUT_DOWN;
            if (cleanupTimerId >= 0) {
                vertx.cancelTimer(cleanupTimerId);
                cleanupTimerId = -1;
            }
            for (Execution execution : live.values()) {
                execution.invalidate(vertx);
                WorkflowInstance instance = execution.instance;
                instance.getStep(instance.getCurrentStepId())
                        .filter(step -> step.getStatus() == StepStatus.IN_PROGRESS)
                        .ifPresent(step -> step.setError(StepError.of(WorkflowErrorCode.ENGINE_SHUTDOWN,
                                "Engine shut down while the step was running")));
                if (instance.isPersistent()) {
                    saves.add(store.save(instance.copy()));
                }
            }
            logger.info("Workflow engine shutting down with {} live workflows", live.size());
        }
        if (!wasRunning) {
            return Future.succeededFuture();
        }
        return Future.all(saves)
                .<Void>mapEmpty()
                .recover(err -> {
                    logger.error("Failed to persist live workflows during shutdown: {}", err.getMessage());
                    metrics.recordStoreError(null, "shutdown");
                    return Future.succeededFuture();
                })
                .compose(v -> store.close())
                .onSuccess(v -> logger.info("Workflow engine shutdown complete"));
    }

    @Override
    public boolean isRunning() {
        return state == State.RUNNING;
    }

    // =========================================================================
    // Workflow lifecycle operations
    // =========================================================================

    @Override
    public WorkflowInstance startWorkflow(String definitionId, ContextSnapshot context)
            throws NotFoundException, ResourceExhaustedException {
        return startWorkflow(definitionId, context, null, config.isPersistState());
    }

    @Override
    public WorkflowInstance startWorkflow(String definitionId, ContextSnapshot context, String userId)
            throws NotFoundException, ResourceExhaustedException {
        return startWorkflow(definitionId, context, userId, config.isPersistState());
    }

    @Override
    public WorkflowInstance startWorkflow(String definitionId, ContextSnapshot context, String userId,
                                          boolean persistent) throws NotFoundException, ResourceExhaustedException {
        ensureRunning();
        WorkflowDefinition definition = registry.get(definitionId);
        ContextSnapshot snapshot = context != null ? context : contextProvider.currentContext();
        String owner = userId != null ? userId
                : snapshot != null ? snapshot.getString("user.id").orElse(null) : null;

        synchronized (lock) {
            ensureRunning();
            if (countActive() >= config.getMaxConcurrentWorkflows()) {
                throw new ResourceExhaustedException(config.getMaxConcurrentWorkflows());
            }
            WorkflowInstance instance = WorkflowInstance.create(definition, snapshot, owner, persistent);
            moveWorkflow(instance, WorkflowStatus.ACTIVE);
            instance.setStartedAt(Instant.now());

            Execution execution = new Execution(instance, WorkflowContext.forInstance(instance));
            live.put(instance.getId(), execution);
            persist(instance, "save", () -> store.save(instance.copy()));

            Map<String, Object> data = workflowData(instance);
            data.put("definitionName", definition.getName());
            if (owner != null) {
                data.put("userId", owner);
            }
            emit(WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_STARTED, instance.getId(), data));
            logger.info("Started workflow {} ({}) for user {}", instance.getId(), definitionId, owner);

            scheduleDrive(execution);
            return instance.copy();
        }
    }

    @Override
    public WorkflowInstance pauseWorkflow(String instanceId) throws NotFoundException, InvalidTransitionException {
        synchronized (lock) {
            WorkflowInstance instance = findInstance(instanceId);
            instance.transitionTo(WorkflowStatus.PAUSED);
            Execution execution = live.get(instanceId);
            execution.invalidate(vertx);
            instance.setPausedAt(Instant.now());

            Optional<WorkflowStep> current = instance.getStep(instance.getCurrentStepId());
            if (current.isPresent() && current.get().getStatus() == StepStatus.IN_PROGRESS) {
                WorkflowStep step = current.get();
                moveStep(step, StepStatus.PAUSED);
                Map<String, Object> data = stepData(instance, step);
                data.put("reason", "workflow_paused");
                emit(WorkflowEvent.step(WorkflowEventType.STEP_PAUSED, instanceId, step.getId(), data));
            }
            persist(instance, "save", () -> store.save(instance.copy()));
            emit(WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_PAUSED, instanceId, workflowData(instance)));
            logger.info("Paused workflow {} at step {}", instanceId, instance.getCurrentStepId());
            return instance.copy();
        }
    }

    @Override
    public WorkflowInstance resumeWorkflow(String instanceId)
            throws NotFoundException, InvalidTransitionException, ResourceExhaustedException {
        synchronized (lock) {
            WorkflowInstance instance = findInstance(instanceId);
            if (!instance.getStatus().canTransitionTo(WorkflowStatus.ACTIVE)) {
                throw new InvalidTransitionException(instanceId, instance.getStatus(), WorkflowStatus.ACTIVE,
                        instance.getStatus().getValidTransitions());
            }
            if (countActive() >= config.getMaxConcurrentWorkflows()) {
                throw new ResourceExhaustedException(config.getMaxConcurrentWorkflows());
            }
            instance.transitionTo(WorkflowStatus.ACTIVE);
            instance.setPausedAt(null);
            Execution execution = live.get(instanceId);
            execution.invalidate(vertx);
            emit(WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_RESUMED, instanceId, workflowData(instance)));

            Optional<WorkflowStep> current = instance.getStep(instance.getCurrentStepId());
            if (current.isPresent() && current.get().getStatus() == StepStatus.FAILED
                    && current.get().getError() != null) {
                // paused between a final failed attempt and the workflow failure
                failOnStep(execution, current.get(), current.get().getError());
            } else if (current.isPresent() && current.get().isAwaitingExternalCompletion()) {
                logger.debug("Workflow {} resumed; step {} still awaits external completion",
                        instanceId, current.get().getId());
            } else if (current.isPresent() && current.get().getStatus() == StepStatus.PAUSED) {
                WorkflowStep step = current.get();
                moveStep(step, StepStatus.IN_PROGRESS);
                step.setStartedAt(Instant.now());
                emit(WorkflowEvent.step(WorkflowEventType.STEP_RESUMED, instanceId, step.getId(),
                        stepData(instance, step)));
                scheduleRedispatch(execution, step.getId());
            } else {
                scheduleDrive(execution);
            }
            persist(instance, "save", () -> store.save(instance.copy()));
            logger.info("Resumed workflow {} at step {}", instanceId, instance.getCurrentStepId());
            return instance.copy();
        }
    }

    @Override
    public WorkflowInstance cancelWorkflow(String instanceId) throws NotFoundException, InvalidTransitionException {
        synchronized (lock) {
            WorkflowInstance instance = findInstance(instanceId);
            instance.transitionTo(WorkflowStatus.CANCELLED);
            Execution execution = live.remove(instanceId);
            execution.invalidate(vertx);

            instance.getStep(instance.getCurrentStepId())
                    .filter(step -> step.getStatus() == StepStatus.IN_PROGRESS || step.getStatus() == StepStatus.PAUSED)
                    .ifPresent(step -> {
                        moveStep(step, StepStatus.SKIPPED);
                        step.setCompletedAt(Instant.now());
                    });
            instance.setCompletedAt(Instant.now());
            instance.setResult(new WorkflowResult(WorkflowResultType.CANCELLED, "Workflow cancelled",
                    completedTitles(instance), List.of(), instance.getArtifacts(), Map.of()));
            completed.put(instanceId, instance);

            persist(instance, "save", () -> store.save(instance.copy()));
            Map<String, Object> data = workflowData(instance);
            data.put("durationMs", elapsedMs(instance.getStartedAt()));
            emit(WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_CANCELLED, instanceId, data));
            logger.info("Cancelled workflow {}", instanceId);
            return instance.copy();
        }
    }

    @Override
    public WorkflowInstance completeStep(String instanceId, String stepId, StepResult outcome)
            throws NotFoundException, InvalidTransitionException {
        Objects.requireNonNull(outcome, "Step outcome cannot be null");
        synchronized (lock) {
            WorkflowInstance instance = findInstance(instanceId);
            if (instance.getStatus() != WorkflowStatus.ACTIVE) {
                throw new InvalidTransitionException(instanceId, instance.getStatus(),
                        "steps can only be completed on an active workflow");
            }
            Optional<WorkflowStep> found = instance.getStep(stepId);
            if (found.isEmpty()) {
                throw new InvalidTransitionException(stepId, instance.getStatus(), "no such step in workflow " + instanceId);
            }
            WorkflowStep step = found.get();
            if (!step.isAwaitingExternalCompletion()) {
                throw new InvalidTransitionException(stepId, step.getStatus(), "step is not awaiting external completion");
            }
            Execution execution = live.get(instanceId);
            if (step.getType() == StepType.USER_ACTION) {
                execution.context.getUserInputs().put(stepId, outcome.data());
            } else if (step.getType() == StepType.SMART_SHARE) {
                execution.context.getSmartShareResults().put(stepId, outcome.data());
            }

            if (outcome.success()) {
                StepResult result = new StepResult(step.getType(), true, outcome.data(), outcome.message(),
                        outcome.metadata(), outcome.nextSteps(), false);
                onStepSucceeded(execution, step, result);
            } else {
                String message = outcome.message() != null ? outcome.message() : "Step completed with failure";
                onStepFailed(execution, step, new StepError(WorkflowErrorCode.STEP_EXECUTION_ERROR, message,
                        outcome.data(), true));
            }
            return instance.copy();
        }
    }

    // =========================================================================
    // Queries
    // =========================================================================

    @Override
    public Optional<WorkflowInstance> getWorkflow(String instanceId) {
        synchronized (lock) {
            Execution execution = live.get(instanceId);
            if (execution != null) {
                return Optional.of(execution.instance.copy());
            }
            WorkflowInstance instance = completed.get(instanceId);
            return instance != null ? Optional.of(instance.copy()) : Optional.empty();
        }
    }

    @Override
    public List<WorkflowInstance> getActiveWorkflows() {
        return liveWithStatus(WorkflowStatus.ACTIVE);
    }

    @Override
    public List<WorkflowInstance> getPausedWorkflows() {
        return liveWithStatus(WorkflowStatus.PAUSED);
    }

    @Override
    public List<WorkflowInstance> getCompletedWorkflows() {
        synchronized (lock) {
            return completed.values().stream().map(WorkflowInstance::copy).collect(Collectors.toList());
        }
    }

    @Override
    public int getActiveCount() {
        synchronized (lock) {
            return countActive();
        }
    }

    // =========================================================================
    // Retention
    // =========================================================================

    @Override
    public Future<Boolean> removeWorkflow(String instanceId) {
        boolean removed;
        synchronized (lock) {
            if (live.containsKey(instanceId)) {
                throw new IllegalStateException("Workflow " + instanceId + " is still "
                        + live.get(instanceId).instance.getStatus().getWireName());
            }
            removed = completed.remove(instanceId) != null;
        }
        return store.delete(instanceId).map(deleted -> deleted || removed);
    }

    @Override
    public Future<Integer> cleanup() {
        Instant cutoff = Instant.now().minus(config.getMaxStateAge());
        int evicted;
        synchronized (lock) {
            int before = completed.size();
            completed.values().removeIf(instance ->
                    instance.getCompletedAt() != null && instance.getCompletedAt().isBefore(cutoff));
            evicted = before - completed.size();
        }
        return store.deleteOlderThan(config.getMaxStateAge())
                .onSuccess(count -> logger.info("Cleanup evicted {} workflows from memory and {} from the store",
                        evicted, count));
    }

    @Override
    public Subscription onEvent(WorkflowEventListener listener) {
        return eventBus.subscribe(listener);
    }

    // =========================================================================
    // Step driving
    // =========================================================================

    private void scheduleDrive(Execution execution) {
        long epoch = execution.epoch;
        String instanceId = execution.instance.getId();
        engineContext.runOnContext(v -> drive(instanceId, epoch));
    }

    private void scheduleRedispatch(Execution execution, String stepId) {
        long epoch = execution.epoch;
        String instanceId = execution.instance.getId();
        engineContext.runOnContext(v -> redispatch(instanceId, stepId, epoch));
    }

    private void drive(String instanceId, long epoch) {
        Attempt attempt;
        synchronized (lock) {
            Execution execution = currentExecution(instanceId, epoch);
            if (execution == null) {
                logger.debug("Skipping stale drive of workflow {}", instanceId);
                return;
            }
            attempt = beginNextAttempt(execution);
        }
        if (attempt != null) {
            launch(attempt);
        }
    }

    private void redispatch(String instanceId, String stepId, long epoch) {
        Attempt attempt;
        synchronized (lock) {
            Execution execution = currentExecution(instanceId, epoch);
            WorkflowStep step = execution != null ? execution.instance.getStep(stepId).orElse(null) : null;
            if (step == null || step.getStatus() != StepStatus.IN_PROGRESS) {
                logger.debug("Skipping stale re-dispatch of step {} in workflow {}", stepId, instanceId);
                return;
            }
            attempt = new Attempt(instanceId, step.copy(), execution.context, epoch);
        }
        launch(attempt);
    }

    private Attempt beginNextAttempt(Execution execution) {
        WorkflowInstance instance = execution.instance;
        Optional<WorkflowStep> current = instance.getStep(instance.getCurrentStepId());
        if (current.isEmpty()) {
            failWorkflow(execution, new WorkflowError(WorkflowErrorCode.STEP_NOT_FOUND,
                    "Step not found: " + instance.getCurrentStepId(), instance.getCurrentStepId(),
                    Map.of(), false, null));
            return null;
        }
        WorkflowStep step = current.get();
        if (step.getStatus() != StepStatus.PENDING || !dependenciesCompleted(instance, step)) {
            if (instance.getSteps().stream().noneMatch(s -> s.getStatus() == StepStatus.PENDING)) {
                completeWorkflow(execution);
                return null;
            }
            Optional<WorkflowStep> runnable = instance.getSteps().stream()
                    .filter(s -> s.getStatus() == StepStatus.PENDING && dependenciesCompleted(instance, s))
                    .findFirst();
            if (runnable.isEmpty()) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("blockedStep", step.getId());
                details.put("pendingSteps", instance.getSteps().stream()
                        .filter(s -> s.getStatus() == StepStatus.PENDING)
                        .map(WorkflowStep::getId)
                        .collect(Collectors.toList()));
                failWorkflow(execution, new WorkflowError(WorkflowErrorCode.DEADLOCK,
                        "No pending step has all of its dependencies completed", step.getId(),
                        details, false, null));
                return null;
            }
            step = runnable.get();
            instance.setCurrentStepId(step.getId());
        }

        if (!handlers.isRegistered(step.getType())) {
            String wireName = step.getType().getWireName();
            step.setError(new StepError(WorkflowErrorCode.HANDLER_NOT_REGISTERED,
                    "No handler registered for step type " + wireName, Map.of("stepType", wireName), false));
            failWorkflow(execution, new WorkflowError(WorkflowErrorCode.HANDLER_NOT_REGISTERED,
                    "No handler registered for step type " + wireName, step.getId(),
                    Map.of("stepType", wireName), false, "register a handler for " + wireName));
            return null;
        }

        moveStep(step, StepStatus.IN_PROGRESS);
        step.setStartedAt(Instant.now());
        step.setError(null);
        step.setResult(null);
        String stepId = step.getId();
        persist(instance, "updateStepStatus",
                () -> store.updateStepStatus(instance.getId(), stepId, StepStatus.IN_PROGRESS));
        Map<String, Object> data = stepData(instance, step);
        data.put("attempt", step.getRetryCount() + 1);
        emit(WorkflowEvent.step(WorkflowEventType.STEP_STARTED, instance.getId(), stepId, data));
        logger.debug("Workflow {} step {} -> in_progress (attempt {})", instance.getId(), stepId,
                step.getRetryCount() + 1);
        return new Attempt(instance.getId(), step.copy(), execution.context, execution.epoch);
    }

    private void launch(Attempt attempt) {
        WorkflowStep step = attempt.step();
        withTimeout(invoke(step, attempt.context()), step.getId(), step.getTimeoutMs())
                .onComplete(ar -> engineContext.runOnContext(v ->
                        onAttemptComplete(attempt.instanceId(), step.getId(), attempt.epoch(), ar)));
    }

    private Future<StepResult> invoke(WorkflowStep step, WorkflowContext context) {
        Optional<StepHandler> handler = handlers.find(step.getType());
        if (handler.isEmpty()) {
            return Future.failedFuture(new StepExecutionException(step.getId(),
                    new StepError(WorkflowErrorCode.HANDLER_NOT_REGISTERED,
                            "No handler registered for step type " + step.getType().getWireName(),
                            Map.of("stepType", step.getType().getWireName()), false)));
        }
        try {
            Future<StepResult> future = handler.get().handle(step, context);
            if (future == null) {
                return Future.failedFuture(new IllegalStateException(
                        "Handler for " + step.getType().getWireName() + " returned no future"));
            }
            return future;
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    private Future<StepResult> withTimeout(Future<StepResult> attempt, String stepId, long timeoutMs) {
        if (timeoutMs <= 0) {
            return attempt;
        }
        Promise<StepResult> promise = Promise.promise();
        long timerId = vertx.setTimer(timeoutMs, id -> promise.tryFail(
                new StepTimeoutException(stepId, timeoutMs)));
        attempt.onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.succeeded()) {
                promise.tryComplete(ar.result());
            } else {
                promise.tryFail(ar.cause());
            }
        });
        return promise.future();
    }

    private void onAttemptComplete(String instanceId, String stepId, long epoch, AsyncResult<StepResult> outcome) {
        synchronized (lock) {
            Execution execution = currentExecution(instanceId, epoch);
            WorkflowStep step = execution != null ? execution.instance.getStep(stepId).orElse(null) : null;
            if (step == null || step.getStatus() != StepStatus.IN_PROGRESS) {
                logger.debug("Discarding late outcome of step {} in workflow {}", stepId, instanceId);
                return;
            }
            if (outcome.failed()) {
                onStepFailed(execution, step, toStepError(stepId, outcome.cause()));
                return;
            }
            StepResult result = outcome.result();
            if (result == null) {
                onStepFailed(execution, step, StepError.of(WorkflowErrorCode.STEP_EXECUTION_ERROR,
                        "Handler completed without a result"));
            } else if (!result.success()) {
                String message = result.message() != null ? result.message() : "Step reported failure";
                onStepFailed(execution, step, new StepError(WorkflowErrorCode.STEP_EXECUTION_ERROR, message,
                        result.data(), true));
            } else if (result.awaitingExternalCompletion()) {
                onStepAwaiting(execution, step, result);
            } else {
                onStepSucceeded(execution, step, result);
            }
        }
    }

    private void onStepAwaiting(Execution execution, WorkflowStep step, StepResult result) {
        WorkflowInstance instance = execution.instance;
        moveStep(step, StepStatus.PAUSED);
        step.setResult(result);
        String stepId = step.getId();
        persist(instance, "updateStepStatus",
                () -> store.updateStepStatus(instance.getId(), stepId, StepStatus.PAUSED));
        persist(instance, "saveStepResult", () -> store.saveStepResult(instance.getId(), stepId, result));
        Map<String, Object> data = stepData(instance, step);
        data.put("awaitingExternalCompletion", true);
        if (result.message() != null) {
            data.put("message", result.message());
        }
        emit(WorkflowEvent.step(WorkflowEventType.STEP_PAUSED, instance.getId(), stepId, data));
        logger.debug("Workflow {} step {} awaits external completion", instance.getId(), stepId);
    }

    private void onStepSucceeded(Execution execution, WorkflowStep step, StepResult result) {
        WorkflowInstance instance = execution.instance;
        moveStep(step, StepStatus.COMPLETED);
        step.setCompletedAt(Instant.now());
        step.setResult(result);
        step.setError(null);

        List<Artifact> produced = execution.drainArtifacts();
        if (!produced.isEmpty()) {
            instance.addArtifacts(produced);
        }
        execution.context.getStepResults().put(step.getId(), result);
        instance.recordStepCompletion(step.getId());
        persist(instance, "save", () -> store.save(instance.copy()));

        Map<String, Object> data = stepData(instance, step);
        data.put("durationMs", elapsedMs(step.getStartedAt()));
        data.put("artifacts", produced.size());
        long epoch = execution.epoch;
        emit(WorkflowEvent.step(WorkflowEventType.STEP_COMPLETED, instance.getId(), step.getId(), data));
        logger.debug("Workflow {} step {} -> completed", instance.getId(), step.getId());
        if (interrupted(execution, epoch)) {
            // a resume drives the next step
            return;
        }

        String completedId = step.getId();
        Optional<WorkflowStep> next = instance.getSteps().stream()
                .filter(s -> s.getStatus() == StepStatus.PENDING && s.getDependencies().contains(completedId))
                .findFirst();
        if (next.isEmpty()) {
            next = instance.getSteps().stream().filter(s -> s.getStatus() == StepStatus.PENDING).findFirst();
        }
        if (next.isEmpty()) {
            completeWorkflow(execution);
            return;
        }
        instance.setCurrentStepId(next.get().getId());
        scheduleDrive(execution);
    }

    private void onStepFailed(Execution execution, WorkflowStep step, StepError error) {
        WorkflowInstance instance = execution.instance;
        step.setRetryCount(step.getRetryCount() + 1);
        moveStep(step, StepStatus.FAILED);
        step.setError(error);

        boolean fatal = error.code().isFatal();
        boolean willRetry = !fatal && step.getRetryCount() <= step.getMaxRetries();
        String stepId = step.getId();
        persist(instance, "updateStepStatus",
                () -> store.updateStepStatus(instance.getId(), stepId, StepStatus.FAILED));

        Map<String, Object> data = stepData(instance, step);
        data.put("errorCode", error.code().name());
        data.put("message", error.message());
        data.put("attempt", step.getRetryCount());
        data.put("willRetry", willRetry);
        data.put("durationMs", elapsedMs(step.getStartedAt()));
        long epoch = execution.epoch;
        emit(WorkflowEvent.step(WorkflowEventType.STEP_FAILED, instance.getId(), stepId, data));

        if (interrupted(execution, epoch)) {
            if (willRetry && instance.getStatus() == WorkflowStatus.PAUSED) {
                moveStep(step, StepStatus.PENDING);
                persist(instance, "updateStepStatus",
                        () -> store.updateStepStatus(instance.getId(), stepId, StepStatus.PENDING));
            }
            return;
        }
        if (willRetry) {
            logger.warn("Workflow {} step {} failed (attempt {} of {}), retrying in {}ms: {}",
                    instance.getId(), stepId, step.getRetryCount(), step.getMaxRetries() + 1,
                    config.getRetryDelayMs(), error.message());
            moveStep(step, StepStatus.PENDING);
            persist(instance, "updateStepStatus",
                    () -> store.updateStepStatus(instance.getId(), stepId, StepStatus.PENDING));
            scheduleRetry(execution);
            return;
        }
        failOnStep(execution, step, error);
    }

    /**
     * Fails the workflow for a step whose failure is fatal or whose retries are used up.
     */
    private void failOnStep(Execution execution, WorkflowStep step, StepError error) {
        String stepId = step.getId();
        if (error.code().isFatal()) {
            failWorkflow(execution, new WorkflowError(error.code(), error.message(), stepId,
                    error.details(), false, null));
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("lastErrorCode", error.code().name());
        details.put("lastErrorMessage", error.message());
        details.put("attempts", step.getRetryCount());
        failWorkflow(execution, new WorkflowError(WorkflowErrorCode.MAX_RETRIES_EXCEEDED,
                "Step '" + step.getTitle() + "' failed after " + step.getRetryCount() + " attempts: " + error.message(),
                stepId, details, false, "retry the workflow once the cause is fixed"));
    }

    private void scheduleRetry(Execution execution) {
        if (config.getRetryDelayMs() <= 0) {
            scheduleDrive(execution);
            return;
        }
        long epoch = execution.epoch;
        String instanceId = execution.instance.getId();
        execution.retryTimerId = vertx.setTimer(config.getRetryDelayMs(),
                id -> engineContext.runOnContext(v -> drive(instanceId, epoch)));
    }

    private void completeWorkflow(Execution execution) {
        WorkflowInstance instance = execution.instance;
        moveWorkflow(instance, WorkflowStatus.COMPLETED);
        instance.setCompletedAt(Instant.now());

        List<String> order = instance.getCompletedStepOrder();
        List<String> nextSteps = List.of();
        if (!order.isEmpty()) {
            nextSteps = instance.getStep(order.get(order.size() - 1))
                    .map(WorkflowStep::getResult)
                    .map(StepResult::nextSteps)
                    .orElse(List.of());
        }
        instance.setResult(new WorkflowResult(WorkflowResultType.SUCCESS, "Workflow completed successfully",
                completedTitles(instance), nextSteps, instance.getArtifacts(),
                Map.of("completedSteps", order.size())));
        retire(execution);
        persist(instance, "save", () -> store.save(instance.copy()));

        Map<String, Object> data = workflowData(instance);
        data.put("durationMs", elapsedMs(instance.getStartedAt()));
        emit(WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_COMPLETED, instance.getId(), data));
        logger.info("Workflow {} ({}) completed: {} steps", instance.getId(), instance.getDefinitionId(), order.size());
    }

    private void failWorkflow(Execution execution, WorkflowError error) {
        WorkflowInstance instance = execution.instance;
        moveWorkflow(instance, WorkflowStatus.FAILED);
        instance.setCompletedAt(Instant.now());
        instance.setError(error);
        retire(execution);
        persist(instance, "save", () -> store.save(instance.copy()));

        Map<String, Object> data = workflowData(instance);
        data.put("errorCode", error.code().name());
        data.put("message", error.message());
        data.put("durationMs", elapsedMs(instance.getStartedAt()));
        emit(WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_FAILED, instance.getId(), data));
        logger.error("Workflow {} ({}) failed at step {}: {} {}", instance.getId(), instance.getDefinitionId(),
                error.stepId(), error.code(), error.message());
    }

    /**
     * @return {@code true} if a listener paused, cancelled or otherwise took over the instance
     *         while an event was being delivered
     */
    private boolean interrupted(Execution execution, long epoch) {
        return execution.epoch != epoch
                || live.get(execution.instance.getId()) != execution
                || execution.instance.getStatus() != WorkflowStatus.ACTIVE;
    }

    private void retire(Execution execution) {
        execution.invalidate(vertx);
        live.remove(execution.instance.getId());
        completed.put(execution.instance.getId(), execution.instance);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void runScheduledCleanup() {
        cleanup().onFailure(err -> logger.error("Scheduled cleanup failed: {}", err.getMessage()));
    }

    private void ensureRunning() {
        if (state != State.RUNNING) {
            throw new IllegalStateException("Workflow engine is not running (state " + state + ")");
        }
    }

    private WorkflowInstance findInstance(String instanceId) throws NotFoundException {
        Execution execution = live.get(instanceId);
        if (execution != null) {
            return execution.instance;
        }
        WorkflowInstance instance = completed.get(instanceId);
        if (instance == null) {
            throw NotFoundException.instance(instanceId);
        }
        return instance;
    }

    private Execution currentExecution(String instanceId, long epoch) {
        Execution execution = live.get(instanceId);
        if (execution == null || execution.epoch != epoch
                || execution.instance.getStatus() != WorkflowStatus.ACTIVE || state == State.SHUT_DOWN) {
            return null;
        }
        return execution;
    }

    private int countActive() {
        int count = 0;
        for (Execution execution : live.values()) {
            if (execution.instance.getStatus() == WorkflowStatus.ACTIVE) {
                count++;
            }
        }
        return count;
    }

    private List<WorkflowInstance> liveWithStatus(WorkflowStatus status) {
        synchronized (lock) {
            return live.values().stream()
                    .map(execution -> execution.instance)
                    .filter(instance -> instance.getStatus() == status)
                    .map(WorkflowInstance::copy)
                    .collect(Collectors.toList());
        }
    }

    private static boolean dependenciesCompleted(WorkflowInstance instance, WorkflowStep step) {
        for (String dependency : step.getDependencies()) {
            Optional<WorkflowStep> required = instance.getStep(dependency);
            if (required.isEmpty() || required.get().getStatus() != StepStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private static List<String> completedTitles(WorkflowInstance instance) {
        List<String> titles = new ArrayList<>();
        for (String stepId : instance.getCompletedStepOrder()) {
            instance.getStep(stepId).ifPresent(step -> titles.add(step.getTitle()));
        }
        return titles;
    }

    private static StepError toStepError(String stepId, Throwable cause) {
        if (cause instanceof StepExecutionException) {
            return ((StepExecutionException) cause).getStepError();
        }
        return StepExecutionException.wrap(stepId, cause).getStepError();
    }

    private static void moveStep(WorkflowStep step, StepStatus target) {
        try {
            step.transitionTo(target);
        } catch (InvalidTransitionException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private static void moveWorkflow(WorkflowInstance instance, WorkflowStatus target) {
        try {
            instance.transitionTo(target);
        } catch (InvalidTransitionException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private static long elapsedMs(Instant since) {
        return since != null ? Duration.between(since, Instant.now()).toMillis() : 0L;
    }

    private static Map<String, Object> workflowData(WorkflowInstance instance) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("definitionId", instance.getDefinitionId());
        return data;
    }

    private static Map<String, Object> stepData(WorkflowInstance instance, WorkflowStep step) {
        Map<String, Object> data = workflowData(instance);
        data.put("stepType", step.getType().getWireName());
        data.put("title", step.getTitle());
        return data;
    }

    private void emit(WorkflowEvent event) {
        eventBus.publish(event);
    }

    private void persist(WorkflowInstance instance, String operation, Supplier<Future<Void>> write) {
        if (!instance.isPersistent()) {
            return;
        }
        Future<Void> result;
        try {
            result = write.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        result.onFailure(err -> {
            logger.error("Store {} failed for workflow {}: {}", operation, instance.getId(), err.getMessage());
            metrics.recordStoreError(instance.getDefinitionId(), operation);
        });
    }

    /**
     * Runtime state of one live instance.
     */
    private static final class Execution {
        private final WorkflowInstance instance;
        private final WorkflowContext context;
        private long epoch;
        private long retryTimerId = -1;
        private int mergedArtifacts;

        private Execution(WorkflowInstance instance, WorkflowContext context) {
            this.instance = instance;
            this.context = context;
        }

        private void invalidate(Vertx vertx) {
            epoch++;
            if (retryTimerId >= 0) {
                vertx.cancelTimer(retryTimerId);
                retryTimerId = -1;
            }
        }

        private List<Artifact> drainArtifacts() {
            List<Artifact> all = new ArrayList<>(context.getArtifacts());
            if (all.size() <= mergedArtifacts) {
                return List.of();
            }
            List<Artifact> produced = new ArrayList<>(all.subList(mergedArtifacts, all.size()));
            mergedArtifacts = all.size();
            return produced;
        }
    }

    private record Attempt(String instanceId, WorkflowStep step, WorkflowContext context, long epoch) {
    }
}
