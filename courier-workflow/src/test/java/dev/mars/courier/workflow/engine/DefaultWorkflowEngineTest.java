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
import dev.mars.courier.core.StepDefinition;
import dev.mars.courier.core.StepResult;
import dev.mars.courier.core.StepStatus;
import dev.mars.courier.core.StepType;
import dev.mars.courier.core.WorkflowDefinition;
import dev.mars.courier.core.WorkflowErrorCode;
import dev.mars.courier.core.WorkflowEvent;
import dev.mars.courier.core.WorkflowEventType;
import dev.mars.courier.core.WorkflowInstance;
import dev.mars.courier.core.WorkflowResultType;
import dev.mars.courier.core.WorkflowStatus;
import dev.mars.courier.core.WorkflowStep;
import dev.mars.courier.core.exceptions.InvalidTransitionException;
import dev.mars.courier.core.exceptions.NotFoundException;
import dev.mars.courier.core.exceptions.ResourceExhaustedException;
import dev.mars.courier.core.step.AiActionConfig;
import dev.mars.courier.core.step.EmailSendConfig;
import dev.mars.courier.core.step.UserActionConfig;
import dev.mars.courier.workflow.event.Subscription;
import dev.mars.courier.workflow.handler.StepCapabilities;
import dev.mars.courier.workflow.handler.StepHandlerRegistry;
import dev.mars.courier.workflow.observability.WorkflowMetrics;
import dev.mars.courier.workflow.registry.WorkflowDefinitionRegistry;
import dev.mars.courier.workflow.store.InMemoryWorkflowInstanceStore;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavioural tests for {@link DefaultWorkflowEngine} running on a real Vert.x instance.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
class DefaultWorkflowEngineTest {

    private Vertx vertx;
    private WorkflowDefinitionRegistry registry;
    private StepHandlerRegistry handlers;
    private ScriptedStepHandler scripted;
    private InMemoryWorkflowInstanceStore store;
    private DefaultWorkflowEngine engine;
    private final List<WorkflowEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp(Vertx vertx) throws Exception {
        this.vertx = vertx;
        registry = new WorkflowDefinitionRegistry();
        scripted = new ScriptedStepHandler();
        handlers = StepHandlerRegistry.withCapabilities(vertx, StepCapabilities.none());
        handlers.register(StepType.AI_ACTION, scripted);
        store = new InMemoryWorkflowInstanceStore();
        registry.register(definition("linear",
                step("a").build(),
                step("b").dependsOn("a").build(),
                step("c").dependsOn("b").build()));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (engine != null) {
            join(engine.shutdown());
        }
    }

    private DefaultWorkflowEngine startEngine(WorkflowEngineConfig config) throws Exception {
        engine = new DefaultWorkflowEngine(vertx, registry, handlers, store, config,
                ContextProvider.fixed(ContextSnapshot.builder().put("user.id", "provided-user").build()),
                WorkflowMetrics.noop());
        engine.onEvent(events::add);
        join(engine.start());
        return engine;
    }

    private DefaultWorkflowEngine startEngine() throws Exception {
        return startEngine(fastConfig().build());
    }

    private static WorkflowEngineConfig.Builder fastConfig() {
        return WorkflowEngineConfig.builder().retryDelayMs(10).cleanupIntervalMs(0);
    }

    // =========================================================================
    // Happy path
    // =========================================================================

    @Test
    @DisplayName("A linear workflow runs every step once, in dependency order")
    void testLinearWorkflowCompletesInOrder() throws Exception {
        startEngine();

        WorkflowInstance started = engine.startWorkflow("linear", ContextSnapshot.empty(), "user-1");
        assertEquals(WorkflowStatus.ACTIVE, started.getStatus());
        assertEquals("a", started.getCurrentStepId());

        WorkflowInstance done = awaitStatus(started.getId(), WorkflowStatus.COMPLETED);

        assertEquals(List.of("a", "b", "c"), scripted.invocations());
        assertEquals(List.of("a", "b", "c"), done.getCompletedStepOrder());
        assertTrue(done.getSteps().stream().allMatch(s -> s.getStatus() == StepStatus.COMPLETED));
        assertEquals(WorkflowResultType.SUCCESS, done.getResult().type());
        assertEquals(List.of("Step a", "Step b", "Step c"), done.getResult().summary());
        assertNotNull(done.getCompletedAt());
        assertEquals(0, engine.getActiveCount());
        assertThat(engine.getCompletedWorkflows()).extracting(WorkflowInstance::getId).containsExactly(done.getId());
    }

    @Test
    @DisplayName("Events for one instance follow execution order")
    void testEventOrdering() throws Exception {
        startEngine();
        WorkflowInstance started = engine.startWorkflow("linear", ContextSnapshot.empty());
        awaitStatus(started.getId(), WorkflowStatus.COMPLETED);

        List<String> sequence = events.stream()
                .filter(e -> started.getId().equals(e.workflowInstanceId()))
                .map(e -> e.type().getWireName() + (e.stepId() != null ? ":" + e.stepId() : ""))
                .collect(Collectors.toList());
        assertEquals(List.of(
                "workflow_started",
                "step_started:a", "step_completed:a",
                "step_started:b", "step_completed:b",
                "step_started:c", "step_completed:c",
                "workflow_completed"), sequence);
        assertEquals("linear", events.get(0).data().get("definitionId"));
    }

    @Test
    @DisplayName("Next step prefers a dependent of the completed step over declaration order")
    void testNextStepPrefersDependents() throws Exception {
        registry.register(definition("fan",
                step("root").build(),
                step("left").dependsOn("root").build(),
                step("right").dependsOn("root").build(),
                step("leaf").dependsOn("left").build()));
        startEngine();

        WorkflowInstance done = awaitStatus(engine.startWorkflow("fan", null).getId(), WorkflowStatus.COMPLETED);

        assertEquals(List.of("root", "left", "leaf", "right"), done.getCompletedStepOrder());
    }

    @Test
    @DisplayName("Artifacts produced by handlers and the last step's suggestions reach the result")
    void testArtifactsAndNextSteps() throws Exception {
        scripted.on("b", (step, context, attempt) -> {
            context.getArtifacts().add(Artifact.of("document", "report.pdf", "file://report.pdf"));
            return Future.succeededFuture(StepResult.success(step.getType(), Map.of()));
        });
        scripted.on("c", (step, context, attempt) -> Future.succeededFuture(
                StepResult.success(step.getType(), Map.of()).withNextSteps(List.of("review the report"))));
        startEngine();

        WorkflowInstance done = awaitStatus(engine.startWorkflow("linear", null).getId(), WorkflowStatus.COMPLETED);

        assertEquals(1, done.getArtifacts().size());
        assertEquals("report.pdf", done.getResult().artifacts().get(0).name());
        assertEquals(List.of("review the report"), done.getResult().nextSteps());
    }

    @Test
    @DisplayName("A null context falls back to the context provider and supplies the user id")
    void testContextProviderFallback() throws Exception {
        startEngine();

        WorkflowInstance started = engine.startWorkflow("linear", null);

        assertEquals("provided-user", started.getUserId());
        assertEquals("provided-user", started.getContext().get("user.id"));
    }

    // =========================================================================
    // Lifecycle guards
    // =========================================================================

    @Test
    @DisplayName("Starting before start() or with an unknown definition is rejected")
    void testStartGuards() throws Exception {
        engine = new DefaultWorkflowEngine(vertx, registry, handlers, store, fastConfig().build(), null, null);
        assertThrows(IllegalStateException.class, () -> engine.startWorkflow("linear", null));

        join(engine.start());
        NotFoundException notFound = assertThrows(NotFoundException.class,
                () -> engine.startWorkflow("missing", null));
        assertEquals(NotFoundException.EntityKind.DEFINITION, notFound.getEntityKind());
        assertThrows(NotFoundException.class, () -> engine.pauseWorkflow("workflow-unknown"));
    }

    @Test
    @DisplayName("The concurrency bound is enforced on start and resume")
    void testConcurrencyBound() throws Exception {
        scripted.hold("a");
        startEngine(fastConfig().maxConcurrentWorkflows(2).build());

        WorkflowInstance first = engine.startWorkflow("linear", null);
        WorkflowInstance second = engine.startWorkflow("linear", null);
        ResourceExhaustedException exhausted = assertThrows(ResourceExhaustedException.class,
                () -> engine.startWorkflow("linear", null));
        assertEquals(2, exhausted.getLimit());
        assertEquals(2, engine.getActiveCount());

        engine.pauseWorkflow(first.getId());
        WorkflowInstance third = engine.startWorkflow("linear", null);
        assertThrows(ResourceExhaustedException.class, () -> engine.resumeWorkflow(first.getId()));

        engine.cancelWorkflow(third.getId());
        engine.resumeWorkflow(first.getId());
        assertEquals(2, engine.getActiveCount());
        assertThat(engine.getActiveWorkflows()).extracting(WorkflowInstance::getId)
                .containsExactlyInAnyOrder(first.getId(), second.getId());
    }

    @Test
    @DisplayName("Pause then resume keeps the current step and re-dispatches it")
    void testPauseResumeRoundTrip() throws Exception {
        scripted.hold("b");
        startEngine();
        String id = engine.startWorkflow("linear", null).getId();
        await().atMost(5, TimeUnit.SECONDS).until(() -> scripted.heldCount("b") == 1);
        Map<String, StepStatus> before = stepStatuses(engine.getWorkflow(id).orElseThrow());

        WorkflowInstance paused = engine.pauseWorkflow(id);
        assertEquals(WorkflowStatus.PAUSED, paused.getStatus());
        assertNotNull(paused.getPausedAt());
        assertEquals("b", paused.getCurrentStepId());
        assertEquals(StepStatus.PAUSED, paused.getStep("b").orElseThrow().getStatus());
        assertThat(engine.getPausedWorkflows()).hasSize(1);

        // the interrupted attempt finishing late is ignored
        scripted.heldPromise("b", 0).complete(StepResult.success(StepType.AI_ACTION, Map.of()));
        Thread.sleep(100);
        WorkflowInstance stillPaused = engine.getWorkflow(id).orElseThrow();
        assertEquals(WorkflowStatus.PAUSED, stillPaused.getStatus());
        assertEquals(StepStatus.PAUSED, stillPaused.getStep("b").orElseThrow().getStatus());

        assertThrows(InvalidTransitionException.class, () -> engine.pauseWorkflow(id));

        WorkflowInstance resumed = engine.resumeWorkflow(id);
        assertEquals(WorkflowStatus.ACTIVE, resumed.getStatus());
        assertEquals("b", resumed.getCurrentStepId());
        assertEquals(StepStatus.IN_PROGRESS, resumed.getStep("b").orElseThrow().getStatus());
        assertEquals(before, stepStatuses(resumed));

        await().atMost(5, TimeUnit.SECONDS).until(() -> scripted.heldCount("b") == 2);
        scripted.heldPromise("b", 1).complete(StepResult.success(StepType.AI_ACTION, Map.of()));
        awaitStatus(id, WorkflowStatus.COMPLETED);

        assertThat(events).extracting(WorkflowEvent::type).contains(
                WorkflowEventType.STEP_PAUSED, WorkflowEventType.WORKFLOW_PAUSED,
                WorkflowEventType.WORKFLOW_RESUMED, WorkflowEventType.STEP_RESUMED);
    }

    @Test
    @DisplayName("Cancel is terminal and drops late results")
    void testCancelIsTerminal() throws Exception {
        scripted.hold("a");
        startEngine();
        String id = engine.startWorkflow("linear", null).getId();
        await().atMost(5, TimeUnit.SECONDS).until(() -> scripted.heldCount("a") == 1);

        WorkflowInstance cancelled = engine.cancelWorkflow(id);

        assertEquals(WorkflowStatus.CANCELLED, cancelled.getStatus());
        assertEquals(StepStatus.SKIPPED, cancelled.getStep("a").orElseThrow().getStatus());
        assertEquals(WorkflowResultType.CANCELLED, cancelled.getResult().type());
        assertThrows(InvalidTransitionException.class, () -> engine.cancelWorkflow(id));
        assertThrows(InvalidTransitionException.class, () -> engine.resumeWorkflow(id));
        assertThrows(InvalidTransitionException.class, () -> engine.pauseWorkflow(id));

        scripted.heldPromise("a", 0).complete(StepResult.success(StepType.AI_ACTION, Map.of()));
        Thread.sleep(100);
        WorkflowInstance after = engine.getWorkflow(id).orElseThrow();
        assertEquals(WorkflowStatus.CANCELLED, after.getStatus());
        assertEquals(StepStatus.SKIPPED, after.getStep("a").orElseThrow().getStatus());
        assertEquals(1, scripted.attempts("a"));
        assertEquals(0, scripted.attempts("b"));
        assertThat(engine.getCompletedWorkflows()).extracting(WorkflowInstance::getId).contains(id);
    }

    // =========================================================================
    // Failures and retries
    // =========================================================================

    @Test
    @DisplayName("maxRetries = 2 means three invocations, then MAX_RETRIES_EXCEEDED")
    void testRetriesExhausted() throws Exception {
        registry.register(definition("flaky", step("x").maxRetries(2).build()));
        scripted.failAlways("x");
        startEngine();

        WorkflowInstance failed = awaitStatus(engine.startWorkflow("flaky", null).getId(), WorkflowStatus.FAILED);

        assertEquals(3, scripted.attempts("x"));
        assertEquals(WorkflowErrorCode.MAX_RETRIES_EXCEEDED, failed.getError().code());
        assertEquals("x", failed.getError().stepId());
        assertEquals(3, failed.getError().details().get("attempts"));
        assertEquals("STEP_EXECUTION_ERROR", failed.getError().details().get("lastErrorCode"));
        WorkflowStep step = failed.getStep("x").orElseThrow();
        assertEquals(StepStatus.FAILED, step.getStatus());
        assertEquals(3, step.getRetryCount());
        assertEquals("scripted failure 3", step.getError().message());

        long retriedFailures = events.stream()
                .filter(e -> e.type() == WorkflowEventType.STEP_FAILED)
                .filter(e -> Boolean.TRUE.equals(e.data().get("willRetry")))
                .count();
        assertEquals(2, retriedFailures);
    }

    @Test
    @DisplayName("A timed-out attempt is retried and a later success completes the workflow")
    void testTimeoutThenRetrySucceeds() throws Exception {
        registry.register(definition("slow", step("s").timeoutMs(100).maxRetries(2).build()));
        scripted.on("s", (step, context, attempt) -> attempt == 1
                ? Promise.<StepResult>promise().future()
                : Future.succeededFuture(StepResult.success(step.getType(), Map.of("attempt", attempt))));
        startEngine();

        WorkflowInstance done = awaitStatus(engine.startWorkflow("slow", null).getId(), WorkflowStatus.COMPLETED);

        assertEquals(2, scripted.attempts("s"));
        assertEquals(1, done.getStep("s").orElseThrow().getRetryCount());
        assertThat(events).anySatisfy(e -> {
            assertEquals(WorkflowEventType.STEP_FAILED, e.type());
            assertEquals("STEP_TIMEOUT", e.data().get("errorCode"));
        });
    }

    @Test
    @DisplayName("Timeout on the middle step: A succeeds, B times out once then succeeds, C completes")
    void testTimeoutRetryScenario() throws Exception {
        registry.register(definition("abc",
                step("A").build(),
                step("B").dependsOn("A").timeoutMs(200).maxRetries(1).build(),
                step("C").dependsOn("B").build()));
        List<String> currentAtB = new CopyOnWriteArrayList<>();
        scripted.on("B", (step, context, attempt) -> {
            engine.getWorkflow(context.getInstanceId()).ifPresent(i -> currentAtB.add(i.getCurrentStepId()));
            return attempt == 1
                    ? Promise.<StepResult>promise().future()
                    : Future.succeededFuture(StepResult.success(step.getType(), Map.of()));
        });
        startEngine();

        WorkflowInstance done = awaitStatus(engine.startWorkflow("abc", null).getId(), WorkflowStatus.COMPLETED);

        assertEquals(List.of("B", "B"), currentAtB);
        assertEquals(List.of("A", "B", "B", "C"), scripted.invocations());
        assertEquals(List.of("Step A", "Step B", "Step C"), done.getResult().summary());
        assertEquals("C", done.getCurrentStepId());
    }

    @Test
    @DisplayName("A step that always times out fails the workflow with the timeout as last cause")
    void testTimeoutExhaustsRetries() throws Exception {
        registry.register(definition("stuck", step("s").timeoutMs(50).maxRetries(1).build()));
        scripted.hold("s");
        startEngine();

        WorkflowInstance failed = awaitStatus(engine.startWorkflow("stuck", null).getId(), WorkflowStatus.FAILED);

        assertEquals(2, scripted.attempts("s"));
        assertEquals(WorkflowErrorCode.MAX_RETRIES_EXCEEDED, failed.getError().code());
        assertEquals("STEP_TIMEOUT", failed.getError().details().get("lastErrorCode"));
        assertEquals(WorkflowErrorCode.STEP_TIMEOUT, failed.getStep("s").orElseThrow().getError().code());
    }

    @Test
    @DisplayName("A handler that throws synchronously counts as a failed attempt")
    void testSynchronousThrow() throws Exception {
        registry.register(definition("throws", step("t").build()));
        scripted.on("t", (step, context, attempt) -> {
            throw new IllegalStateException("boom");
        });
        startEngine();

        WorkflowInstance failed = awaitStatus(engine.startWorkflow("throws", null).getId(), WorkflowStatus.FAILED);

        assertEquals(WorkflowErrorCode.MAX_RETRIES_EXCEEDED, failed.getError().code());
        assertEquals("boom", failed.getError().details().get("lastErrorMessage"));
    }

    @Test
    @DisplayName("Unsatisfiable dependencies fail the workflow with DEADLOCK")
    void testDeadlock() throws Exception {
        registry = new WorkflowDefinitionRegistry(false);
        registry.register(definition("cyclic",
                step("p").dependsOn("q").build(),
                step("q").dependsOn("p").build()));
        startEngine();

        WorkflowInstance failed = awaitStatus(engine.startWorkflow("cyclic", null).getId(), WorkflowStatus.FAILED);

        assertEquals(WorkflowErrorCode.DEADLOCK, failed.getError().code());
        assertEquals(0, scripted.invocations().size());
    }

    @Test
    @DisplayName("An entry step that does not exist fails the workflow with STEP_NOT_FOUND")
    void testStepNotFound() throws Exception {
        registry = new WorkflowDefinitionRegistry(false);
        registry.register(WorkflowDefinition.builder("broken")
                .step(step("only").build())
                .entryStepId("ghost")
                .build());
        startEngine();

        WorkflowInstance failed = awaitStatus(engine.startWorkflow("broken", null).getId(), WorkflowStatus.FAILED);

        assertEquals(WorkflowErrorCode.STEP_NOT_FOUND, failed.getError().code());
        assertEquals("ghost", failed.getError().stepId());
    }

    @Test
    @DisplayName("A step type without a handler fails the workflow on first occurrence")
    void testUnregisteredHandler() throws Exception {
        registry.register(definition("mail", StepDefinition.builder("send")
                .config(new EmailSendConfig("welcome", List.of("a@example.com"), "Hi", null, List.of(), false, null))
                .maxRetries(3)
                .build()));
        startEngine();

        WorkflowInstance failed = awaitStatus(engine.startWorkflow("mail", null).getId(), WorkflowStatus.FAILED);

        assertEquals(WorkflowErrorCode.HANDLER_NOT_REGISTERED, failed.getError().code());
        assertEquals("email_send", failed.getError().details().get("stepType"));
    }

    // =========================================================================
    // Interactive steps
    // =========================================================================

    @Nested
    @DisplayName("User action completion")
    class UserActionCompletion {

        private String instanceId;

        @BeforeEach
        void startAwaitingWorkflow() throws Exception {
            registry.register(definition("confirm",
                    step("prepare").build(),
                    StepDefinition.builder("approve")
                            .title("Approve")
                            .config(UserActionConfig.confirmation("Approve the change"))
                            .dependsOn("prepare")
                            .build(),
                    step("apply").dependsOn("approve").build()));
            startEngine();
            instanceId = engine.startWorkflow("confirm", null).getId();
            await().atMost(5, TimeUnit.SECONDS).until(() -> engine.getWorkflow(instanceId)
                    .flatMap(i -> i.getStep("approve"))
                    .map(WorkflowStep::isAwaitingExternalCompletion)
                    .orElse(false));
        }

        @Test
        @DisplayName("An awaiting step parks the workflow until completed externally")
        void testCompletionContinuesWorkflow() throws Exception {
            WorkflowInstance waiting = engine.getWorkflow(instanceId).orElseThrow();
            assertEquals(WorkflowStatus.ACTIVE, waiting.getStatus());
            assertEquals(StepStatus.PENDING, waiting.getStep("apply").orElseThrow().getStatus());
            assertThat(events).anySatisfy(e -> {
                assertEquals(WorkflowEventType.STEP_PAUSED, e.type());
                assertEquals(true, e.data().get("awaitingExternalCompletion"));
            });

            engine.completeStep(instanceId, "approve",
                    StepResult.success(StepType.USER_ACTION, Map.of("approved", true)));

            WorkflowInstance done = awaitStatus(instanceId, WorkflowStatus.COMPLETED);
            assertEquals(List.of("prepare", "approve", "apply"), done.getCompletedStepOrder());
            assertEquals(Map.of("approved", true), done.getStep("approve").orElseThrow().getResult().data());
            assertFalse(done.getStep("approve").orElseThrow().getResult().awaitingExternalCompletion());
        }

        @Test
        @DisplayName("Completing a step that is not awaiting is rejected")
        void testCompletionOfWrongStepRejected() {
            assertThrows(InvalidTransitionException.class, () -> engine.completeStep(instanceId, "apply",
                    StepResult.success(StepType.AI_ACTION, Map.of())));
            assertThrows(InvalidTransitionException.class, () -> engine.completeStep(instanceId, "nope",
                    StepResult.success(StepType.AI_ACTION, Map.of())));
        }

        @Test
        @DisplayName("A paused workflow cannot have steps completed, and resume keeps the step awaiting")
        void testCompletionRequiresActiveWorkflow() throws Exception {
            engine.pauseWorkflow(instanceId);
            assertThrows(InvalidTransitionException.class, () -> engine.completeStep(instanceId, "approve",
                    StepResult.success(StepType.USER_ACTION, Map.of())));

            WorkflowInstance resumed = engine.resumeWorkflow(instanceId);
            assertTrue(resumed.getStep("approve").orElseThrow().isAwaitingExternalCompletion());
        }

        @Test
        @DisplayName("A failed external outcome goes through the retry path")
        void testFailedOutcomeFailsStep() throws Exception {
            engine.completeStep(instanceId, "approve", StepResult.failure(StepType.USER_ACTION, "rejected"));

            WorkflowInstance failed = awaitStatus(instanceId, WorkflowStatus.FAILED);
            assertEquals(WorkflowErrorCode.MAX_RETRIES_EXCEEDED, failed.getError().code());
            assertEquals("rejected", failed.getError().details().get("lastErrorMessage"));
        }

        @Test
        @DisplayName("A retried step starts without its earlier awaiting result and survives pause and resume")
        void testRetryAfterFailedOutcomeClearsAwaitingResult() throws Exception {
            registry.register(definition("review",
                    step("draft").maxRetries(2).build()));
            scripted.on("draft", (step, context, attempt) -> attempt == 1
                    ? Future.succeededFuture(StepResult.awaiting(StepType.AI_ACTION, Map.of(), "waiting for review"))
                    : Promise.<StepResult>promise().future());
            String reviewId = engine.startWorkflow("review", null).getId();
            await().atMost(5, TimeUnit.SECONDS).until(() -> engine.getWorkflow(reviewId)
                    .flatMap(i -> i.getStep("draft"))
                    .map(WorkflowStep::isAwaitingExternalCompletion)
                    .orElse(false));

            engine.completeStep(reviewId, "draft", StepResult.failure(StepType.AI_ACTION, "needs changes"));
            await().atMost(5, TimeUnit.SECONDS).until(() -> scripted.attempts("draft") == 2);

            WorkflowStep running = engine.getWorkflow(reviewId).orElseThrow().getStep("draft").orElseThrow();
            assertEquals(StepStatus.IN_PROGRESS, running.getStatus());
            assertNull(running.getResult());

            engine.pauseWorkflow(reviewId);
            engine.resumeWorkflow(reviewId);

            await().atMost(5, TimeUnit.SECONDS).until(() -> scripted.attempts("draft") == 3);
            assertEquals(StepStatus.IN_PROGRESS,
                    engine.getWorkflow(reviewId).orElseThrow().getStep("draft").orElseThrow().getStatus());
        }
    }

    // =========================================================================
    // Listeners driving the lifecycle
    // =========================================================================

    @Test
    @DisplayName("A listener that cancels on the last step_completed leaves the workflow cancelled")
    void testListenerCancelsOnLastStepCompleted() throws Exception {
        List<Throwable> uncaught = new CopyOnWriteArrayList<>();
        vertx.exceptionHandler(uncaught::add);
        registry.register(definition("single", step("only").build()));
        startEngine();
        engine.onEvent(event -> {
            if (event.type() == WorkflowEventType.STEP_COMPLETED) {
                try {
                    engine.cancelWorkflow(event.workflowInstanceId());
                } catch (NotFoundException | InvalidTransitionException e) {
                    throw new IllegalStateException(e);
                }
            }
        });

        String instanceId = engine.startWorkflow("single", ContextSnapshot.empty()).getId();

        WorkflowInstance cancelled = awaitStatus(instanceId, WorkflowStatus.CANCELLED);
        assertEquals(StepStatus.COMPLETED, cancelled.getStep("only").orElseThrow().getStatus());
        assertEquals(WorkflowResultType.CANCELLED, cancelled.getResult().type());
        await().during(100, TimeUnit.MILLISECONDS).atMost(1, TimeUnit.SECONDS).until(() ->
                engine.getWorkflow(instanceId).map(WorkflowInstance::getStatus).orElse(null)
                        == WorkflowStatus.CANCELLED);
        assertTrue(uncaught.isEmpty(), () -> "Unexpected errors: " + uncaught);
        assertTrue(events.stream().noneMatch(e -> e.type() == WorkflowEventType.WORKFLOW_COMPLETED));
        assertEquals(0, engine.getActiveCount());
    }

    @Test
    @DisplayName("A listener that pauses on step_completed stops driving until resume")
    void testListenerPausesOnStepCompleted() throws Exception {
        startEngine();
        engine.onEvent(event -> {
            if (event.type() == WorkflowEventType.STEP_COMPLETED && "a".equals(event.stepId())) {
                try {
                    engine.pauseWorkflow(event.workflowInstanceId());
                } catch (NotFoundException | InvalidTransitionException e) {
                    throw new IllegalStateException(e);
                }
            }
        });

        String instanceId = engine.startWorkflow("linear", ContextSnapshot.empty()).getId();
        awaitStatus(instanceId, WorkflowStatus.PAUSED);
        await().during(100, TimeUnit.MILLISECONDS).atMost(1, TimeUnit.SECONDS)
                .until(() -> scripted.invocations().equals(List.of("a")));

        engine.resumeWorkflow(instanceId);

        WorkflowInstance done = awaitStatus(instanceId, WorkflowStatus.COMPLETED);
        assertEquals(List.of("a", "b", "c"), done.getCompletedStepOrder());
        assertEquals(List.of("a", "b", "c"), scripted.invocations());
    }

    @Test
    @DisplayName("A listener that pauses on the final step_failed fails the workflow on resume")
    void testListenerPausesOnFinalStepFailure() throws Exception {
        registry.register(definition("fragile", step("x").build()));
        scripted.failAlways("x");
        startEngine();
        engine.onEvent(event -> {
            if (event.type() == WorkflowEventType.STEP_FAILED) {
                try {
                    engine.pauseWorkflow(event.workflowInstanceId());
                } catch (NotFoundException | InvalidTransitionException e) {
                    throw new IllegalStateException(e);
                }
            }
        });

        String instanceId = engine.startWorkflow("fragile", ContextSnapshot.empty()).getId();
        WorkflowInstance paused = awaitStatus(instanceId, WorkflowStatus.PAUSED);
        assertEquals(StepStatus.FAILED, paused.getStep("x").orElseThrow().getStatus());

        WorkflowInstance resumed = engine.resumeWorkflow(instanceId);

        assertEquals(WorkflowStatus.FAILED, resumed.getStatus());
        assertEquals(WorkflowErrorCode.MAX_RETRIES_EXCEEDED, resumed.getError().code());
        assertEquals(1, scripted.attempts("x"));
    }

    // =========================================================================
    // Isolation, persistence and retention
    // =========================================================================

    @Test
    @DisplayName("A paused instance that exists only in the store is not resumable")
    void testStoredInstanceIsNotAdopted() throws Exception {
        startEngine();
        WorkflowInstance stored = WorkflowInstance.create(registry.get("linear"),
                ContextSnapshot.empty(), "user-1", true);
        stored.setStatus(WorkflowStatus.PAUSED);
        join(store.save(stored));

        assertThrows(NotFoundException.class, () -> engine.resumeWorkflow(stored.getId()));
        assertTrue(engine.getWorkflow(stored.getId()).isEmpty());
        assertEquals(WorkflowStatus.PAUSED, join(store.load(stored.getId())).getStatus());
        assertTrue(scripted.invocations().isEmpty());
    }

    @Test
    @DisplayName("Instances of the same definition never share step state")
    void testIndependentStepArrays() throws Exception {
        scripted.on("a", (step, context, attempt) -> attempt == 1
                ? Promise.<StepResult>promise().future()
                : Future.succeededFuture(StepResult.success(step.getType(), Map.of())));
        startEngine();

        String held = engine.startWorkflow("linear", null).getId();
        await().atMost(5, TimeUnit.SECONDS).until(() -> scripted.attempts("a") == 1);
        String finished = engine.startWorkflow("linear", null).getId();
        awaitStatus(finished, WorkflowStatus.COMPLETED);

        WorkflowInstance other = engine.getWorkflow(held).orElseThrow();
        assertEquals(StepStatus.IN_PROGRESS, other.getStep("a").orElseThrow().getStatus());
        assertEquals(StepStatus.PENDING, other.getStep("b").orElseThrow().getStatus());
        assertEquals(StepStatus.PENDING, other.getStep("c").orElseThrow().getStatus());

        other.getStep("b").orElseThrow().setStatus(StepStatus.SKIPPED);
        assertEquals(StepStatus.PENDING,
                engine.getWorkflow(held).orElseThrow().getStep("b").orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Persistent instances are stored; non-persistent ones never are")
    void testPersistence() throws Exception {
        startEngine();

        String persisted = engine.startWorkflow("linear", null, "u1", true).getId();
        String transientId = engine.startWorkflow("linear", null, "u1", false).getId();
        awaitStatus(persisted, WorkflowStatus.COMPLETED);
        awaitStatus(transientId, WorkflowStatus.COMPLETED);

        WorkflowInstance stored = join(store.load(persisted));
        assertEquals(WorkflowStatus.COMPLETED, stored.getStatus());
        assertEquals(List.of("a", "b", "c"), stored.getCompletedStepOrder());
        assertThrows(Exception.class, () -> join(store.load(transientId)));
    }

    @Test
    @DisplayName("Store failures are logged but never fail the workflow")
    void testStoreFailureDoesNotFailWorkflow() throws Exception {
        startEngine();
        store.setFailWrites(true);

        WorkflowInstance done = awaitStatus(engine.startWorkflow("linear", null).getId(), WorkflowStatus.COMPLETED);

        assertEquals(WorkflowResultType.SUCCESS, done.getResult().type());
    }

    @Test
    @DisplayName("Only terminated workflows can be removed")
    void testRemoveWorkflow() throws Exception {
        scripted.hold("a");
        startEngine();
        String live = engine.startWorkflow("linear", null).getId();
        assertThrows(IllegalStateException.class, () -> engine.removeWorkflow(live));

        engine.cancelWorkflow(live);
        assertTrue(join(engine.removeWorkflow(live)));
        assertTrue(engine.getWorkflow(live).isEmpty());
        assertFalse(join(engine.removeWorkflow(live)));
    }

    @Test
    @DisplayName("Cleanup evicts terminated workflows older than the maximum age")
    void testCleanup() throws Exception {
        startEngine(fastConfig().maxStateAge(Duration.ofMillis(20)).build());
        String id = engine.startWorkflow("linear", null).getId();
        awaitStatus(id, WorkflowStatus.COMPLETED);
        Thread.sleep(50);

        int deleted = join(engine.cleanup());

        assertEquals(1, deleted);
        assertTrue(engine.getWorkflow(id).isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Shutdown persists live workflows and stops accepting new ones")
    void testShutdown() throws Exception {
        scripted.hold("a");
        startEngine();
        String id = engine.startWorkflow("linear", null).getId();
        await().atMost(5, TimeUnit.SECONDS).until(() -> scripted.heldCount("a") == 1);

        join(engine.shutdown());

        assertFalse(engine.isRunning());
        assertFalse(store.isOpen());
        assertThrows(IllegalStateException.class, () -> engine.startWorkflow("linear", null));
        assertEquals(WorkflowErrorCode.ENGINE_SHUTDOWN,
                engine.getWorkflow(id).orElseThrow().getStep("a").orElseThrow().getError().code());
    }

    @Test
    @DisplayName("Unsubscribed listeners stop receiving events")
    void testUnsubscribe() throws Exception {
        startEngine();
        List<WorkflowEvent> received = new CopyOnWriteArrayList<>();
        Subscription subscription = engine.onEvent(received::add);
        engine.onEvent(e -> {
            throw new IllegalStateException("listener failure");
        });

        String first = engine.startWorkflow("linear", null).getId();
        awaitStatus(first, WorkflowStatus.COMPLETED);
        int seen = received.size();
        assertEquals(8, seen);

        subscription.close();
        awaitStatus(engine.startWorkflow("linear", null).getId(), WorkflowStatus.COMPLETED);
        assertEquals(seen, received.size());
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private WorkflowInstance awaitStatus(String instanceId, WorkflowStatus status) {
        await().atMost(5, TimeUnit.SECONDS).until(() -> engine.getWorkflow(instanceId)
                .map(WorkflowInstance::getStatus)
                .orElse(null) == status);
        return engine.getWorkflow(instanceId).orElseThrow();
    }

    private static Map<String, StepStatus> stepStatuses(WorkflowInstance instance) {
        return instance.getSteps().stream().collect(Collectors.toMap(WorkflowStep::getId, WorkflowStep::getStatus));
    }

    static StepDefinition.Builder step(String id) {
        return StepDefinition.builder(id).title("Step " + id).config(AiActionConfig.of("action-" + id));
    }

    static WorkflowDefinition definition(String id, StepDefinition... steps) {
        return WorkflowDefinition.builder(id).name(id).steps(List.of(steps)).build();
    }

    static <T> T join(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }
}
