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
 * Waits for a fixed time, checks a context condition, or waits for an external event.
 */
public record WaitConfig(WaitType waitType, long durationMs, String conditionPath, String eventName)
        implements StepConfig {

    public enum WaitType {
        TIME, CONDITION, EVENT;

        @JsonValue
        public String getWireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static WaitType fromWireName(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    public WaitConfig {
        if (waitType == null) {
            waitType = WaitType.TIME;
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must not be negative");
        }
    }

    public static WaitConfig time(long durationMs) {
        return new WaitConfig(WaitType.TIME, durationMs, null, null);
    }

    @Override
    public StepType type() {
        return StepType.WAIT;
    }
}
