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


package dev.mars.courier.core.step;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.mars.courier.core.StepType;

import java.util.Locale;

/**
 * Compares a value in the workflow context against an expected value.
 */
public record ContextCheckConfig(String contextPath, Object expectedValue, Operator operator,
                                 OnFailure onFailure) implements StepConfig {

    public enum Operator {
        EQUALS, NOT_EQUALS, EXISTS, CONTAINS, GREATER_THAN, LESS_THAN;

        @JsonValue
        public String getWireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Operator fromWireName(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    /** What a failed check does to the step. */
    public enum OnFailure {
        FAIL, CONTINUE;

        @JsonValue
        public String getWireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static OnFailure fromWireName(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    public ContextCheckConfig {
        if (contextPath == null || contextPath.isBlank()) {
            throw new IllegalArgumentException("contextPath is required");
        }
        if (operator == null) {
            operator = Operator.EQUALS;
        }
        if (onFailure == null) {
            onFailure = OnFailure.FAIL;
        }
    }

    @Override
    public StepType type() {
        return StepType.CONTEXT_CHECK;
    }
}
