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

import java.util.List;

/**
 * Thrown when a workflow definition is rejected at registration, for example because
 * its step dependencies form a cycle or a step cannot be reached from the entry step.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class InvalidDefinitionException extends CourierException {

    private final String definitionId;
    private final List<String> issues;

    public InvalidDefinitionException(String definitionId, List<String> issues) {
        super(buildMessage(definitionId, issues));
        this.definitionId = definitionId;
        this.issues = List.copyOf(issues);
    }

    public String getDefinitionId() {
        return definitionId;
    }

    public List<String> getIssues() {
        return issues;
    }

    private static String buildMessage(String definitionId, List<String> issues) {
        StringBuilder sb = new StringBuilder("Workflow definition '")
                .append(definitionId)
                .append("' is invalid:");
        for (String issue : issues) {
            sb.append("\n  - ").append(issue);
        }
        return sb.toString();
    }
}
