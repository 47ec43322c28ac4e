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
import dev.mars.courier.core.Values;

import java.util.List;
import java.util.Locale;

/**
 * Asks the user for a confirmation, a choice or form input. The step stays paused until
 * the outcome is supplied through the engine.
 */
public record UserActionConfig(String actionTitle, String actionDescription, ActionType actionType,
                               List<Option> options, Object defaultValue, boolean required) implements StepConfig {

    public enum ActionType {
        BUTTON, FORM, CHOICE, CONFIRMATION;

        @JsonValue
        public String getWireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static ActionType fromWireName(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    public record Option(String label, Object value) {
    }

    public UserActionConfig {
        if (actionType == null) {
            actionType = ActionType.CONFIRMATION;
        }
        options = Values.immutableList(options);
    }

    public static UserActionConfig confirmation(String title) {
        return new UserActionConfig(title, null, ActionType.CONFIRMATION, List.of(), Boolean.TRUE, false);
    }

    @Override
    public StepType type() {
        return StepType.USER_ACTION;
    }
}
