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
 * Raised by the engine when a step handler does not answer within the step's timeout.
 * The handler's underlying work is not aborted.
 */
public class StepTimeoutException extends StepExecutionException {

    private final long timeoutMs;

    public StepTimeoutException(String stepId, long timeoutMs) {
        super(stepId, new StepError(WorkflowErrorCode.STEP_TIMEOUT,
                "Step timed out after " + timeoutMs + "ms",
                Map.of("timeoutMs", timeoutMs), true));
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
