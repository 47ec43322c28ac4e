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


package dev.mars.courier.workflow.event;

import dev.mars.courier.core.WorkflowEvent;

/**
 * Receives workflow and step lifecycle events. Called synchronously on the emitting
 * thread; implementations should return quickly.
 */
@FunctionalInterface
public interface WorkflowEventListener {

    void onEvent(WorkflowEvent event);
}
