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

/**
 * Codes carried by {@link StepError} and {@link WorkflowError}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public enum WorkflowErrorCode {

    /** The current step id does not resolve to a step of the instance. Fatal. */
    STEP_NOT_FOUND(true),

    /** Pending steps remain but none has all of its dependencies completed. Fatal. */
    DEADLOCK(true),

    /** No handler is registered for the step type. Fatal. */
    HANDLER_NOT_REGISTERED(true),

    /** A handler did not answer within the step timeout. Retried. */
    STEP_TIMEOUT(false),

    /** A handler failed or reported an unsuccessful result. Retried. */
    STEP_EXECUTION_ERROR(false),

    /** A context check step found an unexpected value. Retried like any failed attempt. */
    CONTEXT_CHECK_FAILED(false),

    /** The retry budget of a step was used up. Terminal for the workflow. */
    MAX_RETRIES_EXCEEDED(true),

    /** The engine was shut down while the workflow was running. */
    ENGINE_SHUTDOWN(true);

    private final boolean fatal;

    WorkflowErrorCode(boolean fatal) {
        this.fatal = fatal;
    }

    /**
     * @return {@code true} if an error with this code terminates the workflow without a retry
     */
    public boolean isFatal() {
        return fatal;
    }
}
