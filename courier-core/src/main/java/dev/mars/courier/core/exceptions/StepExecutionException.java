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


package dev.mars.courier.core.exceptions;

import dev.mars.courier.core.StepError;
import dev.mars.courier.core.WorkflowErrorCode;

import java.util.Map;

/**
 * Failure of a single step attempt. Handlers complete their future with this exception
 * to report a structured {@link StepError}; any other throwable is wrapped into one with
 * code {@link WorkflowErrorCode#STEP_EXECUTION_ERROR}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class StepExecutionException extends CourierException {

    private final String stepId;
    private final StepError stepError;

    public StepExecutionException(String stepId, StepError stepError) {
        super("Step '" + stepId + "' failed: " + stepError.message());
        this.stepId = stepId;
        this.stepError = stepError;
    }

    public StepExecutionException(String stepId, StepError stepError, Throwable cause) {
        super("Step '" + stepId + "' failed: " + stepError.message(), cause);
        this.stepId = stepId;
        this.stepError = stepError;
    }

    /**
     * Wraps an arbitrary handler failure.
     */
    public static StepExecutionException wrap(String stepId, Throwable cause) {
        if (cause instanceof StepExecutionException) {
            return (StepExecutionException) cause;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        StepError error = new StepError(WorkflowErrorCode.STEP_EXECUTION_ERROR, message,
                Map.of("exception", cause.getClass().getName()), true);
        return new StepExecutionException(stepId, error, cause);
    }

    public String getStepId() {
        return stepId;
    }

    public StepError getStepError() {
        return stepError;
    }
}
