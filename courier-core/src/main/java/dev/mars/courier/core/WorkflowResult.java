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

import java.util.List;
import java.util.Map;

/**
 * Outcome recorded on an instance when it completes or is cancelled.
 *
 * @param type      outcome type
 * @param message   human readable message
 * @param summary   titles of the completed steps, in execution order
 * @param nextSteps follow-up suggestions taken from the last step result
 * @param artifacts artifacts produced while the workflow ran
 * @param data      additional structured data
 */
public record WorkflowResult(WorkflowResultType type, String message, List<String> summary,
                             List<String> nextSteps, List<Artifact> artifacts, Map<String, Object> data) {

    public WorkflowResult {
        summary = Values.immutableList(summary);
        nextSteps = Values.immutableList(nextSteps);
        artifacts = Values.immutableList(artifacts);
        data = Values.immutableMap(data);
    }
}
