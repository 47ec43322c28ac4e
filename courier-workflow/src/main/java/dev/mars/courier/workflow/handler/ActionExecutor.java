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

import dev.mars.courier.core.WorkflowContext;
import io.vertx.core.Future;

import java.util.Map;

/**
 * Runs a named assistant action for {@code ai_action} steps.
 */
@FunctionalInterface
public interface ActionExecutor {

    /**
     * @param actionId the action to run
     * @param params   action parameters from the step configuration
     * @param context  the execution context
     * @return the action output; a {@code result} entry is compared with the step's expected result
     */
    Future<Map<String, Object>> execute(String actionId, Map<String, Object> params, WorkflowContext context);
}
