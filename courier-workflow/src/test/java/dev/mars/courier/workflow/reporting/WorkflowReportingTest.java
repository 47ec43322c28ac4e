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


package dev.mars.courier.workflow.reporting;

import dev.mars.courier.core.ContextSnapshot;
import dev.mars.courier.core.StepDefinition;
import dev.mars.courier.core.StepResult;
import dev.mars.courier.core.StepStatus;
import dev.mars.courier.core.StepType;
import dev.mars.courier.core.WorkflowDefinition;
import dev.mars.courier.core.WorkflowInstance;
import dev.mars.courier.core.WorkflowStatus;
import dev.mars.courier.core.WorkflowStep;
import dev.mars.courier.core.exceptions.CourierException;
import dev.mars.courier.core.exceptions.NotFoundException;
import dev.mars.courier.core.json.CourierObjectMapper;
import dev.mars.courier.core.step.UserActionConfig;
import dev.mars.courier.workflow.store.InMemoryWorkflowInstanceStore;
import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Description for WorkflowReportingTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
class WorkflowReportingTest {

    private InMemoryWorkflowInstanceStore store;
    private WorkflowReporting reporting;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryWorkflowInstanceStore();
        join(store.open());
        reporting = new WorkflowReporting(store);
    }

    @Test
    void testStatisticsForUser() throws Exception {
        join(store.save(finished("alice", "onboarding", WorkflowStatus.COMPLETED, Duration.ofMinutes(10))));
        join(store.save(finished("alice", "onboarding", WorkflowStatus.COMPLETED, Duration.ofMinutes(20))));
        join(store.save(finished("alice", "deliverability", WorkflowStatus.FAILED, Duration.ofMinutes(30))));
        join(store.save(finished("alice", "deliverability", WorkflowStatus.CANCELLED, Duration.ofMinutes(40))));
        join(store.save(running("alice", "onboarding")));
        join(store.save(finished("bob", "onboarding", WorkflowStatus.COMPLETED, Duration.ofMinutes(5))));

        WorkflowStatistics stats = join(reporting.statistics("alice"));

        assertEquals(5, stats.totalWorkflows());
        assertEquals(2, stats.count(WorkflowStatus.COMPLETED));
        assertEquals(1, stats.count(WorkflowStatus.FAILED));
        assertEquals(1, stats.count(WorkflowStatus.ACTIVE));
        assertEquals(0, stats.count(WorkflowStatus.PAUSED));
        assertEquals(3, stats.byCategory().get("onboarding"));
        assertEquals(2, stats.byCategory().get("deliverability"));
        assertEquals(25.0, stats.averageDurationMinutes(), 0.001);
        assertEquals(50.0, stats.successRate(), 0.001);

        assertEquals(6, join(reporting.statistics(null)).totalWorkflows());
    }

    @Test
    void testStatisticsWithNoInstances() throws Exception {
        WorkflowStatistics stats = join(reporting.statistics("nobody"));

        assertEquals(0, stats.totalWorkflows());
        assertEquals(0.0, stats.averageDurationMinutes());
        assertEquals(0.0, stats.successRate());
        assertTrue(stats.byCategory().isEmpty());
    }

    @Test
    void testInstancesFilteredByStatus() throws Exception {
        join(store.save(finished("alice", "onboarding", WorkflowStatus.COMPLETED, Duration.ofMinutes(10))));
        join(store.save(finished("alice", "onboarding", WorkflowStatus.FAILED, Duration.ofMinutes(10))));
        join(store.save(running("alice", "onboarding")));
        join(store.save(finished("bob", "onboarding", WorkflowStatus.COMPLETED, Duration.ofMinutes(5))));

        assertThat(join(reporting.instances("alice", WorkflowStatus.COMPLETED)))
                .extracting(WorkflowInstance::getStatus)
                .containsExactly(WorkflowStatus.COMPLETED);
        assertEquals(3, join(reporting.instances("alice", null)).size());
        assertEquals(2, join(reporting.instances(null, WorkflowStatus.COMPLETED)).size());
        assertTrue(join(reporting.instances("alice", WorkflowStatus.PAUSED)).isEmpty());
    }

    @Test
    void testAnalyticsOverTrailingWindow() throws Exception {
        Instant now = Instant.parse("2025-09-10T12:00:00Z");
        reporting = new WorkflowReporting(store, CourierObjectMapper.create(),
                Clock.fixed(now, ZoneOffset.UTC));
        join(store.save(succeeded(finishedAt("alice", "onboarding", WorkflowStatus.COMPLETED, now.minus(Duration.ofHours(1))))));
        join(store.save(succeeded(finishedAt("alice", "onboarding", WorkflowStatus.COMPLETED, now.minus(Duration.ofHours(26))))));
        join(store.save(succeeded(finishedAt("alice", "onboarding", WorkflowStatus.COMPLETED, now.minus(Duration.ofDays(40))))));
        WorkflowInstance failed = finishedAt("alice", "deliverability", WorkflowStatus.FAILED, now.minus(Duration.ofHours(2)));
        failed.getStep("approve").orElseThrow().setStatus(StepStatus.FAILED);
        join(store.save(failed));
        join(store.save(running("alice", "onboarding")));
        join(store.save(finishedAt("bob", "reporting", WorkflowStatus.COMPLETED, now)));

        WorkflowAnalytics analytics = join(reporting.analytics("alice", 30));

        assertEquals(30, analytics.days());
        assertEquals(List.of(LocalDate.of(2025, 9, 9), LocalDate.of(2025, 9, 10)),
                List.copyOf(analytics.dailyCompletions().keySet()));
        assertEquals(1, analytics.completionsOn(LocalDate.of(2025, 9, 9)));
        assertEquals(2, analytics.completionsOn(LocalDate.of(2025, 9, 10)));
        assertEquals(0, analytics.completionsOn(LocalDate.of(2025, 8, 1)));
        assertEquals(List.of(new WorkflowAnalytics.CategoryShare("onboarding", 4, 80),
                        new WorkflowAnalytics.CategoryShare("deliverability", 1, 20)),
                analytics.categoryDistribution());
        assertEquals(Map.of(StepType.USER_ACTION, 60), analytics.stepSuccessRates());
        assertEquals(1, analytics.averageStepsPerWorkflow());

        assertEquals(3, join(reporting.analytics(null, 30)).categoryDistribution().size());
    }

    @Test
    void testAnalyticsWithNoInstances() throws Exception {
        WorkflowAnalytics analytics = join(reporting.analytics("nobody", 7));

        assertTrue(analytics.dailyCompletions().isEmpty());
        assertTrue(analytics.categoryDistribution().isEmpty());
        assertTrue(analytics.stepSuccessRates().isEmpty());
        assertEquals(0, analytics.averageStepsPerWorkflow());
    }

    @Test
    void testAnalyticsRejectsEmptyWindow() {
        ExecutionException e = assertThrows(ExecutionException.class, () -> join(reporting.analytics("alice", 0)));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void testExportProducesReadableJson() throws Exception {
        WorkflowInstance instance = running("alice", "onboarding");
        join(store.save(instance));

        String json = join(reporting.exportInstance(instance.getId()));

        assertThat(json).contains("\"id\" : \"" + instance.getId() + "\"")
                .contains("\"definitionId\" : \"approval\"")
                .contains("\"status\" : \"active\"")
                .contains("user_action");
    }

    @Test
    void testExportOfUnknownInstanceFails() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> join(reporting.exportInstance("workflow-missing")));
        assertInstanceOf(NotFoundException.class, e.getCause());
    }

    @Test
    void testImportAssignsNewIdAndPausesActiveInstances() throws Exception {
        WorkflowInstance instance = running("alice", "onboarding");
        instance.getStep("approve").orElseThrow().setStatus(StepStatus.IN_PROGRESS);
        join(store.save(instance));
        String json = join(reporting.exportInstance(instance.getId()));

        WorkflowInstance imported = join(reporting.importInstance(json));

        assertNotEquals(instance.getId(), imported.getId());
        assertTrue(imported.getId().startsWith("workflow-"));
        assertEquals(WorkflowStatus.PAUSED, imported.getStatus());
        assertNotNull(imported.getPausedAt());
        assertEquals("alice", imported.getUserId());
        assertEquals(StepStatus.IN_PROGRESS, imported.getStep("approve").orElseThrow().getStatus());
        assertEquals("onboarding", imported.getCategory());
        assertEquals(2, store.size());
        assertEquals(WorkflowStatus.PAUSED, join(store.load(imported.getId())).getStatus());
    }

    @Test
    void testImportKeepsTerminalStatus() throws Exception {
        WorkflowInstance instance = finished("alice", "onboarding", WorkflowStatus.COMPLETED, Duration.ofMinutes(1));
        join(store.save(instance));

        WorkflowInstance imported = join(reporting.importInstance(join(reporting.exportInstance(instance.getId()))));

        assertEquals(WorkflowStatus.COMPLETED, imported.getStatus());
        assertNull(imported.getPausedAt());
    }

    @Test
    void testImportRejectsMalformedJson() {
        ExecutionException e = assertThrows(ExecutionException.class, () -> join(reporting.importInstance("{oops")));
        assertInstanceOf(CourierException.class, e.getCause());
        assertEquals(0, store.size());
    }

    private static WorkflowInstance running(String userId, String category) {
        WorkflowDefinition definition = WorkflowDefinition.builder("approval")
                .name("Approval")
                .category(category)
                .step(StepDefinition.builder("approve").title("Approve")
                        .config(UserActionConfig.confirmation("Approve")).build())
                .build();
        WorkflowInstance instance = WorkflowInstance.create(definition, ContextSnapshot.empty(), userId, true);
        instance.setStatus(WorkflowStatus.ACTIVE);
        instance.setStartedAt(Instant.now());
        return instance;
    }

    private static WorkflowInstance finished(String userId, String category, WorkflowStatus status,
                                             Duration duration) {
        WorkflowInstance instance = running(userId, category);
        Instant completedAt = Instant.now();
        instance.setStatus(status);
        instance.setStartedAt(completedAt.minus(duration));
        instance.setCompletedAt(completedAt);
        return instance;
    }

    private static WorkflowInstance finishedAt(String userId, String category, WorkflowStatus status,
                                               Instant completedAt) {
        WorkflowInstance instance = running(userId, category);
        instance.setStatus(status);
        instance.setStartedAt(completedAt.minus(Duration.ofMinutes(5)));
        instance.setCompletedAt(completedAt);
        return instance;
    }

    private static WorkflowInstance succeeded(WorkflowInstance instance) {
        WorkflowStep step = instance.getStep("approve").orElseThrow();
        step.setStatus(StepStatus.COMPLETED);
        step.setResult(StepResult.success(StepType.USER_ACTION, Map.of(), "Approved"));
        return instance;
    }

    private static <T> T join(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }
}
