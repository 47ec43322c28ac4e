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


package dev.mars.courier.workflow.observability;

import dev.mars.courier.core.WorkflowEvent;
import dev.mars.courier.workflow.event.WorkflowEventListener;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongSupplier;

/**
 * OpenTelemetry metrics for the Courier workflow engine, fed from workflow events.
 *
 * Provides 11 workflow-specific metrics:
 * - courier.workflow.active (gauge) - Currently active workflow instances
 * - courier.workflow.started (counter) - Workflows started
 * - courier.workflow.completed (counter) - Successfully completed workflows
 * - courier.workflow.failed (counter) - Failed workflows
 * - courier.workflow.cancelled (counter) - Cancelled workflows
 * - courier.workflow.step.completed (counter) - Completed step attempts
 * - courier.workflow.step.failed (counter) - Failed step attempts
 * - courier.workflow.step.retried (counter) - Failed attempts that were scheduled for retry
 * - courier.workflow.store.errors (counter) - Instance store write failures
 * - courier.workflow.step.duration (histogram) - Step attempt duration in milliseconds
 * - courier.workflow.duration (histogram) - Workflow duration in milliseconds
 *
 * <p>The engine publishes {@code definitionId}, {@code stepType}, {@code durationMs} and
 * {@code willRetry} in the event data; they become the {@code definition.id} and
 * {@code step.type} attributes and the recorded values.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0 (OpenTelemetry)
 */
public class WorkflowMetrics implements WorkflowEventListener {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "courier-workflow";

    // Counters
    private final LongCounter workflowsStarted;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter stepsCompleted;
    private final LongCounter stepsFailed;
    private final LongCounter stepsRetried;
    private final LongCounter storeErrors;

    // Histograms
    private final DoubleHistogram stepDuration;
    private final DoubleHistogram workflowDuration;

    private volatile LongSupplier activeCount = () -> 0L;

    // Attribute keys
    private static final AttributeKey<String> DEFINITION_ID_KEY = AttributeKey.stringKey("definition.id");
    private static final AttributeKey<String> STEP_TYPE_KEY = AttributeKey.stringKey("step.type");
    private static final AttributeKey<String> OPERATION_KEY = AttributeKey.stringKey("operation");

    public WorkflowMetrics() {
        this(GlobalOpenTelemetry.get());
    }

    public WorkflowMetrics(OpenTelemetry openTelemetry) {
        Meter meter = openTelemetry.getMeter(METER_NAME);

        workflowsStarted = meter.counterBuilder("courier.workflow.started")
                .setDescription("Number of workflows started")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("courier.workflow.completed")
                .setDescription("Number of successfully completed workflows")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("courier.workflow.failed")
                .setDescription("Number of failed workflows")
                .setUnit("1")
                .build();

        workflowsCancelled = meter.counterBuilder("courier.workflow.cancelled")
                .setDescription("Number of cancelled workflows")
                .setUnit("1")
                .build();

        stepsCompleted = meter.counterBuilder("courier.workflow.step.completed")
                .setDescription("Number of completed workflow steps")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("courier.workflow.step.failed")
                .setDescription("Number of failed workflow step attempts")
                .setUnit("1")
                .build();

        stepsRetried = meter.counterBuilder("courier.workflow.step.retried")
                .setDescription("Number of failed step attempts scheduled for retry")
                .setUnit("1")
                .build();

        storeErrors = meter.counterBuilder("courier.workflow.store.errors")
                .setDescription("Number of failed instance store operations")
                .setUnit("1")
                .build();

        stepDuration = meter.histogramBuilder("courier.workflow.step.duration")
                .setDescription("Step attempt duration in milliseconds")
                .setUnit("ms")
                .build();

        workflowDuration = meter.histogramBuilder("courier.workflow.duration")
                .setDescription("Workflow duration in milliseconds")
                .setUnit("ms")
                .build();

        meter.gaugeBuilder("courier.workflow.active")
                .setDescription("Number of currently active workflow instances")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeCount.getAsLong()));

        logger.debug("WorkflowMetrics initialized");
    }

    /**
     * Creates metrics that record nothing.
     */
    public static WorkflowMetrics noop() {
        return new WorkflowMetrics(OpenTelemetry.noop());
    }

    /**
     * Sets the source of the active-workflow gauge.
     */
    public void bindActiveCount(LongSupplier supplier) {
        this.activeCount = supplier;
    }

    @Override
    public void onEvent(WorkflowEvent event) {
        Attributes attrs = attributes(event);
        switch (event.type()) {
            case WORKFLOW_STARTED:
                workflowsStarted.add(1, attrs);
                break;
            case WORKFLOW_COMPLETED:
                workflowsCompleted.add(1, attrs);
                recordDuration(workflowDuration, event, attrs);
                break;
            case WORKFLOW_FAILED:
                workflowsFailed.add(1, attrs);
                recordDuration(workflowDuration, event, attrs);
                break;
            case WORKFLOW_CANCELLED:
                workflowsCancelled.add(1, attrs);
                recordDuration(workflowDuration, event, attrs);
                break;
            case STEP_COMPLETED:
                stepsCompleted.add(1, attrs);
                recordDuration(stepDuration, event, attrs);
                break;
            case STEP_FAILED:
                stepsFailed.add(1, attrs);
                recordDuration(stepDuration, event, attrs);
                if (Boolean.TRUE.equals(event.data().get("willRetry"))) {
                    stepsRetried.add(1, attrs);
                }
                break;
            default:
                break;
        }
    }

    /**
     * Record an instance store operation that failed.
     */
    public void recordStoreError(String definitionId, String operation) {
        storeErrors.add(1, Attributes.builder()
                .put(DEFINITION_ID_KEY, definitionId != null ? definitionId : "unknown")
                .put(OPERATION_KEY, operation)
                .build());
    }

    private static void recordDuration(DoubleHistogram histogram, WorkflowEvent event, Attributes attrs) {
        Object duration = event.data().get("durationMs");
        if (duration instanceof Number) {
            histogram.record(((Number) duration).doubleValue(), attrs);
        }
    }

    private static Attributes attributes(WorkflowEvent event) {
        AttributesBuilder builder = Attributes.builder();
        Object definitionId = event.data().get("definitionId");
        builder.put(DEFINITION_ID_KEY, definitionId != null ? definitionId.toString() : "unknown");
        Object stepType = event.data().get("stepType");
        if (event.type().isStepEvent() && stepType != null) {
            builder.put(STEP_TYPE_KEY, stepType.toString());
        }
        return builder.build();
    }
}
