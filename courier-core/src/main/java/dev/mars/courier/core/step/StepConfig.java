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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import dev.mars.courier.core.StepType;

/**
 * Configuration payload of a step. One immutable record exists per {@link StepType};
 * handlers select the variant with a {@code switch} on {@link #type()} and cast.
 *
 * <p>The JSON and YAML forms carry the discriminator as a {@code type} property using the
 * wire name of the step type.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AiActionConfig.class, name = "ai_action"),
        @JsonSubTypes.Type(value = UserActionConfig.class, name = "user_action"),
        @JsonSubTypes.Type(value = SmartShareConfig.class, name = "smart_share"),
        @JsonSubTypes.Type(value = ProviderVerificationConfig.class, name = "provider_verification"),
        @JsonSubTypes.Type(value = DeliverabilityFixConfig.class, name = "deliverability_fix"),
        @JsonSubTypes.Type(value = DocumentGenerationConfig.class, name = "document_generation"),
        @JsonSubTypes.Type(value = EmailSendConfig.class, name = "email_send"),
        @JsonSubTypes.Type(value = WaitConfig.class, name = "wait"),
        @JsonSubTypes.Type(value = ContextCheckConfig.class, name = "context_check")
})
public interface StepConfig {

    /**
     * @return the step type this configuration belongs to
     */
    @JsonIgnore
    StepType type();
}
