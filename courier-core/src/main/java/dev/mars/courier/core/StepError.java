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

import java.util.Map;

/**
 * Failure of one step attempt, as reported by a handler or produced by the engine.
 *
 * @param code        error code
 * @param message     human readable message
 * @param details     additional structured details
 * @param recoverable whether a later attempt may succeed
 */
public record StepError(WorkflowErrorCode code, String message, Map<String, Object> details, boolean recoverable) {

    public StepError {
        details = Values.immutableMap(details);
    }

    public static StepError of(WorkflowErrorCode code, String message) {
        return new StepError(code, message, Map.of(), !code.isFatal());
    }
}
