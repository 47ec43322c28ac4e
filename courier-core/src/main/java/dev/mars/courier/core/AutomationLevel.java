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
 * How much of a workflow can run without user involvement.
 */
public enum AutomationLevel {
    FULL_AUTO("full_auto"),
    SEMI_AUTO("semi_auto"),
    MANUAL("manual");

    private final String wireName;

    AutomationLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * @return {@code true} for levels the engine may drive on its own
     */
    public boolean isAutomatable() {
        return this == FULL_AUTO || this == SEMI_AUTO;
    }

    @JsonCreator
    public static AutomationLevel fromWireName(String value) {
        for (AutomationLevel level : values()) {
            if (level.wireName.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown automation level: " + value);
    }
}
