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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states of a workflow instance.
 * <p>
 * Instances follow a defined lifecycle:
 * <pre>
 *   DRAFT → ACTIVE → COMPLETED | FAILED | CANCELLED
 *   ACTIVE → PAUSED (manual) → ACTIVE (resume)
 *   PAUSED → CANCELLED
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public enum WorkflowStatus {

    /**
     * Instance has been created but not yet started.
     */
    DRAFT("draft"),

    /**
     * Instance is running and occupies a concurrency slot.
     */
    ACTIVE("active"),

    /**
     * Instance was paused by a caller. Outcomes of steps still in flight are discarded.
     */
    PAUSED("paused"),

    /**
     * All steps completed. Terminal state.
     */
    COMPLETED("completed"),

    /**
     * A step failed fatally or used up its retries. Terminal state.
     */
    FAILED("failed"),

    /**
     * Instance was cancelled by a caller. Terminal state.
     */
    CANCELLED("cancelled");

    private final String wireName;

    WorkflowStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static WorkflowStatus fromWireName(String value) {
        for (WorkflowStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown workflow status: " + value);
    }

    /**
     * @return {@code true} if the instance accepts no further transitions
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Checks whether a transition from this status to the given target status is valid.
     *
     * <p><strong>Valid transitions:</strong></p>
     * <pre>
     *   DRAFT     → ACTIVE
     *   ACTIVE    → PAUSED, COMPLETED, FAILED, CANCELLED
     *   PAUSED    → ACTIVE, CANCELLED
     *   COMPLETED, FAILED, CANCELLED → (terminal)
     * </pre>
     *
     * @param target the target status
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(WorkflowStatus target) {
        return switch (this) {
            case DRAFT -> target == ACTIVE;
            case ACTIVE -> target == PAUSED || target == COMPLETED
                        || target == FAILED || target == CANCELLED;
            case PAUSED -> target == ACTIVE || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    /**
     * Returns all valid target statuses that this status can transition to.
     *
     * @return array of valid target statuses (empty for terminal states)
     */
    public WorkflowStatus[] getValidTransitions() {
        return switch (this) {
            case DRAFT -> new WorkflowStatus[]{ACTIVE};
            case ACTIVE -> new WorkflowStatus[]{PAUSED, COMPLETED, FAILED, CANCELLED};
            case PAUSED -> new WorkflowStatus[]{ACTIVE, CANCELLED};
            case COMPLETED, FAILED, CANCELLED -> new WorkflowStatus[0];
        };
    }
}
