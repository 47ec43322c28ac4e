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
 * Discriminator of the step configuration variants.
 */
public enum StepType {
    AI_ACTION("ai_action"),
    USER_ACTION("user_action"),
    SMART_SHARE("smart_share"),
    PROVIDER_VERIFICATION("provider_verification"),
    DELIVERABILITY_FIX("deliverability_fix"),
    DOCUMENT_GENERATION("document_generation"),
    EMAIL_SEND("email_send"),
    WAIT("wait"),
    CONTEXT_CHECK("context_check");

    private final String wireName;

    StepType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static StepType fromWireName(String value) {
        for (StepType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown step type: " + value);
    }
}
