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


package dev.mars.courier.core;

import java.time.Instant;
import java.util.Map;

/**
 * Lifecycle event emitted by the workflow engine.
 *
 * @param type               event type
 * @param workflowInstanceId the instance the event belongs to
 * @param stepId             the step concerned, or {@code null} for workflow events
 * @param data               event payload
 * @param timestamp          emission time
 */
public record WorkflowEvent(WorkflowEventType type, String workflowInstanceId, String stepId,
                            Map<String, Object> data, Instant timestamp) {

    public WorkflowEvent {
        data = Values.immutableMap(data);
    }

    public static WorkflowEvent workflow(WorkflowEventType type, String instanceId, Map<String, Object> data) {
        return new WorkflowEvent(type, instanceId, null, data, Instant.now());
    }

    public static WorkflowEvent step(WorkflowEventType type, String instanceId, String stepId,
                                     Map<String, Object> data) {
        return new WorkflowEvent(type, instanceId, stepId, data, Instant.now());
    }
}
