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
 * Terminal failure of a workflow instance.
 *
 * @param code           error code
 * @param message        human readable message
 * @param stepId         the step that caused the failure, or {@code null}
 * @param details        additional structured details such as the last step error code
 * @param recoverable    whether starting the workflow again may succeed
 * @param recoveryAction optional hint for the caller
 */
public record WorkflowError(WorkflowErrorCode code, String message, String stepId,
                            Map<String, Object> details, boolean recoverable, String recoveryAction) {

    public WorkflowError {
        details = Values.immutableMap(details);
    }
}
