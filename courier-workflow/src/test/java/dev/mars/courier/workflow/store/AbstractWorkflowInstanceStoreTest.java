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

import dev.mars.courier.core.ContextSnapshot;
import dev.mars.courier.core.StepDefinition;
import dev.mars.courier.core.StepResult;
import dev.mars.courier.core.StepStatus;
import dev.mars.courier.core.StepType;
import dev.mars.courier.core.WorkflowDefinition;
import dev.mars.courier.core.WorkflowError;
import dev.mars.courier.core.WorkflowErrorCode;
import dev.mars.courier.core.WorkflowInstance;
import dev.mars.courier.core.WorkflowResult;
import dev.mars.courier.core.WorkflowResultType;
import dev.mars.courier.core.WorkflowStatus;
import dev.mars.courier.core.exceptions.NotFoundException;
import dev.mars.courier.core.step.AiActionConfig;
import io.vertx.core.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour shared by every {@link WorkflowInstanceStore} implementation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
abstract class AbstractWorkflowInstanceStoreTest {

    protected WorkflowInstanceStore store;

    protected abstract WorkflowInstanceStore createStore() throws Exception;

    @BeforeEach
    void openStore() throws Exception {
        store = createStore();
        join(store.open());
    }

    @AfterEach
    void closeStore() throws Exception {
        join(store.close());
        afterClose();
    }

    protected void afterClose() throws Exception {
    }

    @Test
    void testSaveAndLoad() throws Exception {
        WorkflowInstance instance = instance("user-1");
        join(store.save(instance));

        WorkflowInstance loaded = join(store.load(instance.getId()));
        assertEquals(instance.getId(), loaded.getId());
        assertEquals("two_steps", loaded.getDefinitionId());
        assertEquals("user-1", loaded.getUserId());
        assertEquals(WorkflowStatus.ACTIVE, loaded.getStatus());
        assertEquals(List.of("first", "second"), loaded.getSteps().stream().map(s -> s.getId()).toList());
        assertEquals("gmail", loaded.getContext().getString("provider.type").orElse(null));
        assertEquals(AiActionConfig.of("action-first"), loaded.getStep("first").orElseThrow().getConfig());
    }

    @Test
    void testSaveIsUpsert() throws Exception {
        WorkflowInstance instance = instance("user-1");
        join(store.save(instance));

        instance.setStatus(WorkflowStatus.PAUSED);
        instance.setPausedAt(Instant.now());
        join(store.save(instance));

        WorkflowInstance loaded = join(store.load(instance.getId()));
        assertEquals(WorkflowStatus.PAUSED, loaded.getStatus());
        assertNotNull(loaded.getPausedAt());
        assertEquals(1, join(store.loadAll()).size());
    }

    @Test
    void testLoadMissingInstance() {
        Throwable cause = failure(store.load("workflow-missing"));
        assertInstanceOf(NotFoundException.class, cause);
    }

    @Test
    void testLoadForUserFiltersByOwner() throws Exception {
        join(store.save(instance("alice")));
        join(store.save(instance("alice")));
        join(store.save(instance("bob")));

        assertEquals(2, join(store.loadForUser("alice")).size());
        assertEquals(1, join(store.loadForUser("bob")).size());
        assertTrue(join(store.loadForUser("carol")).isEmpty());
        assertEquals(3, join(store.loadAll()).size());
    }

    @Test
    void testLoadForUserWithStatusFilter() throws Exception {
        WorkflowInstance paused = instance("alice");
        paused.setStatus(WorkflowStatus.PAUSED);
        join(store.save(paused));
        join(store.save(instance("alice")));
        join(store.save(instance("bob")));

        List<WorkflowInstance> alicePaused = join(store.loadForUser("alice", WorkflowStatus.PAUSED));
        assertEquals(1, alicePaused.size());
        assertEquals(paused.getId(), alicePaused.get(0).getId());
        assertEquals(2, join(store.loadForUser(null, WorkflowStatus.ACTIVE)).size());
        assertEquals(2, join(store.loadForUser("alice", null)).size());
        assertTrue(join(store.loadForUser("bob", WorkflowStatus.COMPLETED)).isEmpty());
    }

    @Test
    void testDelete() throws Exception {
        WorkflowInstance instance = instance("user-1");
        join(store.save(instance));

        assertTrue(join(store.delete(instance.getId())));
        assertFalse(join(store.delete(instance.getId())));
        assertInstanceOf(NotFoundException.class, failure(store.load(instance.getId())));
    }

    @Test
    void testDeleteOlderThanOnlyRemovesOldTerminalInstances() throws Exception {
        WorkflowInstance oldCompleted = instance("user-1");
        oldCompleted.setStatus(WorkflowStatus.COMPLETED);
        oldCompleted.setCompletedAt(Instant.now().minus(Duration.ofDays(40)));

        WorkflowInstance recentCompleted = instance("user-1");
        recentCompleted.setStatus(WorkflowStatus.COMPLETED);
        recentCompleted.setCompletedAt(Instant.now().minus(Duration.ofDays(1)));

        WorkflowInstance oldActive = instance("user-1");
        oldActive.setStartedAt(Instant.now().minus(Duration.ofDays(60)));

        join(store.save(oldCompleted));
        join(store.save(recentCompleted));
        join(store.save(oldActive));

        assertEquals(1, join(store.deleteOlderThan(Duration.ofDays(30))));

        List<String> remaining = join(store.loadAll()).stream().map(WorkflowInstance::getId).toList();
        assertEquals(2, remaining.size());
        assertTrue(remaining.contains(recentCompleted.getId()));
        assertTrue(remaining.contains(oldActive.getId()));
    }

    @Test
    void testPartialUpdatesAreVisibleOnLoad() throws Exception {
        WorkflowInstance instance = instance("user-1");
        join(store.save(instance));

        StepResult result = StepResult.success(StepType.AI_ACTION, Map.of("score", 9));
        join(store.updateStepStatus(instance.getId(), "first", StepStatus.COMPLETED));
        join(store.saveStepResult(instance.getId(), "first", result));
        join(store.updateStatus(instance.getId(), WorkflowStatus.FAILED));
        WorkflowError error = new WorkflowError(WorkflowErrorCode.DEADLOCK, "stuck", "second",
                Map.of("blockedStep", "second"), false, null);
        join(store.saveWorkflowError(instance.getId(), error));

        WorkflowInstance loaded = join(store.load(instance.getId()));
        assertEquals(StepStatus.COMPLETED, loaded.getStep("first").orElseThrow().getStatus());
        assertEquals(result, loaded.getStep("first").orElseThrow().getResult());
        assertEquals(StepStatus.PENDING, loaded.getStep("second").orElseThrow().getStatus());
        assertEquals(WorkflowStatus.FAILED, loaded.getStatus());
        assertEquals(WorkflowErrorCode.DEADLOCK, loaded.getError().code());
        assertEquals("second", loaded.getError().details().get("blockedStep"));
    }

    @Test
    void testSaveWorkflowResult() throws Exception {
        WorkflowInstance instance = instance("user-1");
        join(store.save(instance));

        WorkflowResult result = new WorkflowResult(WorkflowResultType.SUCCESS, "done",
                List.of("First", "Second"), List.of(), List.of(), Map.of("completedSteps", 2));
        join(store.saveWorkflowResult(instance.getId(), result));

        assertEquals(result, join(store.load(instance.getId())).getResult());
    }

    @Test
    void testPartialUpdateOfMissingInstanceFails() {
        assertInstanceOf(NotFoundException.class, failure(store.updateStatus("workflow-missing",
                WorkflowStatus.PAUSED)));
    }

    @Test
    void testLoadedInstancesAreIndependentCopies() throws Exception {
        WorkflowInstance instance = instance("user-1");
        join(store.save(instance));

        instance.setStatus(WorkflowStatus.CANCELLED);
        WorkflowInstance loaded = join(store.load(instance.getId()));
        assertEquals(WorkflowStatus.ACTIVE, loaded.getStatus());

        loaded.getStep("first").orElseThrow().setStatus(StepStatus.FAILED);
        assertEquals(StepStatus.PENDING,
                join(store.load(instance.getId())).getStep("first").orElseThrow().getStatus());
    }

    @Test
    void testClosedStoreRejectsOperations() throws Exception {
        join(store.close());

        assertInstanceOf(IllegalStateException.class, failure(store.save(instance("user-1"))));
        assertInstanceOf(IllegalStateException.class, failure(store.loadAll()));

        join(store.open());
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    protected static WorkflowInstance instance(String userId) {
        WorkflowDefinition definition = WorkflowDefinition.builder("two_steps")
                .name("Two steps")
                .category("testing")
                .step(StepDefinition.builder("first").title("First").config(AiActionConfig.of("action-first")).build())
                .step(StepDefinition.builder("second").title("Second").dependsOn("first")
                        .config(AiActionConfig.of("action-second")).build())
                .build();
        ContextSnapshot context = ContextSnapshot.builder().put("provider.type", "gmail").build();
        WorkflowInstance instance = WorkflowInstance.create(definition, context, userId, true);
        instance.setStatus(WorkflowStatus.ACTIVE);
        instance.setStartedAt(Instant.now());
        return instance;
    }

    protected static <T> T join(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    protected static Throwable failure(Future<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> join(future));
        return e.getCause();
    }
}
