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


package dev.mars.courier.workflow.handler;

import dev.mars.courier.core.StepResult;
import dev.mars.courier.core.WorkflowContext;
import dev.mars.courier.core.WorkflowStep;
import io.vertx.core.Future;

/**
 * Performs the work of one step type.
 *
 * <p>Handlers must not change the step or the instance; the engine applies the outcome.
 * They may append produced documents to {@link WorkflowContext#getArtifacts()}. A failed
 * future, an unsuccessful {@link StepResult}, a synchronous exception or a {@code null}
 * return all count as a failed attempt.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
@FunctionalInterface
public interface StepHandler {

    /**
     * Executes one attempt of a step.
     *
     * @param step the step being executed, read-only
     * @param context the execution context of the owning instance
     * @return a future completed with the step result
     */
    Future<StepResult> handle(WorkflowStep step, WorkflowContext context);
}
