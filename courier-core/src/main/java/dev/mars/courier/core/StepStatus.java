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
 * Lifecycle states of a single step within a workflow instance.
 * <pre>
 *   PENDING → IN_PROGRESS → COMPLETED | FAILED | PAUSED | SKIPPED
 *   FAILED → PENDING (retry)
 *   PAUSED → IN_PROGRESS (resume) | COMPLETED | FAILED (external completion) | SKIPPED (cancel)
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public enum StepStatus {

    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    /** Waiting for the workflow to be resumed or for external input. */
    PAUSED("paused"),
    COMPLETED("completed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String wireName;

    StepStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static StepStatus fromWireName(String value) {
        for (StepStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown step status: " + value);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED;
    }

    public boolean canTransitionTo(StepStatus target) {
        return switch (this) {
            case PENDING -> target == IN_PROGRESS || target == SKIPPED;
            case IN_PROGRESS -> target == COMPLETED || target == FAILED
                             || target == PAUSED || target == SKIPPED;
            case PAUSED -> target == IN_PROGRESS || target == COMPLETED
                        || target == FAILED || target == SKIPPED;
            case FAILED -> target == PENDING;
            case COMPLETED, SKIPPED -> false;
        };
    }

    public StepStatus[] getValidTransitions() {
        return switch (this) {
            case PENDING -> new StepStatus[]{IN_PROGRESS, SKIPPED};
            case IN_PROGRESS -> new StepStatus[]{COMPLETED, FAILED, PAUSED, SKIPPED};
            case PAUSED -> new StepStatus[]{IN_PROGRESS, COMPLETED, FAILED, SKIPPED};
            case FAILED -> new StepStatus[]{PENDING};
            case COMPLETED, SKIPPED -> new StepStatus[0];
        };
    }
}
