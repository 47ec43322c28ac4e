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
 * Outcome of one handler invocation.
 *
 * <p>A result with {@code awaitingExternalCompletion} set reports that the handler has
 * started an interaction (a user prompt, an email request) whose outcome will be supplied
 * later. The engine parks the step until that happens.</p>
 *
 * @param stepType                   type of the step that produced the result
 * @param success                    whether the attempt succeeded
 * @param data                       result data, recorded in the workflow context
 * @param message                    optional human readable message
 * @param metadata                   additional metadata
 * @param nextSteps                  follow-up suggestions for the caller
 * @param awaitingExternalCompletion whether the real outcome is still outstanding
 */
public record StepResult(StepType stepType, boolean success, Map<String, Object> data, String message,
                         Map<String, Object> metadata, List<String> nextSteps,
                         boolean awaitingExternalCompletion) {

    public StepResult {
        data = Values.immutableMap(data);
        metadata = Values.immutableMap(metadata);
        nextSteps = Values.immutableList(nextSteps);
    }

    public static StepResult success(StepType stepType, Map<String, Object> data) {
        return new StepResult(stepType, true, data, null, Map.of(), List.of(), false);
    }

    public static StepResult success(StepType stepType, Map<String, Object> data, String message) {
        return new StepResult(stepType, true, data, message, Map.of(), List.of(), false);
    }

    public static StepResult failure(StepType stepType, String message) {
        return new StepResult(stepType, false, Map.of(), message, Map.of(), List.of(), false);
    }

    public static StepResult awaiting(StepType stepType, Map<String, Object> data, String message) {
        return new StepResult(stepType, true, data, message, Map.of(), List.of(), true);
    }

    public StepResult withNextSteps(List<String> suggestions) {
        return new StepResult(stepType, success, data, message, metadata, suggestions, awaitingExternalCompletion);
    }
}
