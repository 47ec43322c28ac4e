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

import java.util.Optional;

/**
 * The external services available to {@link CapabilityStepHandler}. Every capability is
 * optional; step types whose capability is missing are left unregistered.
 *
 * <pre>
 * StepCapabilities capabilities = StepCapabilities.builder()
 *         .actionExecutor(assistant::run)
 *         .mailer(mailService::send)
 *         .build();
 * </pre>
 */
public final class StepCapabilities {

    private final ActionExecutor actionExecutor;
    private final SmartShareRequester smartShareRequester;
    private final ProviderVerifier providerVerifier;
    private final DeliverabilityFixer deliverabilityFixer;
    private final DocumentGenerator documentGenerator;
    private final Mailer mailer;

    private StepCapabilities(Builder builder) {
        this.actionExecutor = builder.actionExecutor;
        this.smartShareRequester = builder.smartShareRequester;
        this.providerVerifier = builder.providerVerifier;
        this.deliverabilityFixer = builder.deliverabilityFixer;
        this.documentGenerator = builder.documentGenerator;
        this.mailer = builder.mailer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StepCapabilities none() {
        return new Builder().build();
    }

    public Optional<ActionExecutor> getActionExecutor() {
        return Optional.ofNullable(actionExecutor);
    }

    public Optional<SmartShareRequester> getSmartShareRequester() {
        return Optional.ofNullable(smartShareRequester);
    }

    public Optional<ProviderVerifier> getProviderVerifier() {
        return Optional.ofNullable(providerVerifier);
    }

    public Optional<DeliverabilityFixer> getDeliverabilityFixer() {
        return Optional.ofNullable(deliverabilityFixer);
    }

    public Optional<DocumentGenerator> getDocumentGenerator() {
        return Optional.ofNullable(documentGenerator);
    }

    public Optional<Mailer> getMailer() {
        return Optional.ofNullable(mailer);
    }

    public static class Builder {
        private ActionExecutor actionExecutor;
        private SmartShareRequester smartShareRequester;
        private ProviderVerifier providerVerifier;
        private DeliverabilityFixer deliverabilityFixer;
        private DocumentGenerator documentGenerator;
        private Mailer mailer;

        private Builder() {
        }

        public Builder actionExecutor(ActionExecutor actionExecutor) {
            this.actionExecutor = actionExecutor;
            return this;
        }

        public Builder smartShareRequester(SmartShareRequester smartShareRequester) {
            this.smartShareRequester = smartShareRequester;
            return this;
        }

        public Builder providerVerifier(ProviderVerifier providerVerifier) {
            this.providerVerifier = providerVerifier;
            return this;
        }

        public Builder deliverabilityFixer(DeliverabilityFixer deliverabilityFixer) {
            this.deliverabilityFixer = deliverabilityFixer;
            return this;
        }

        public Builder documentGenerator(DocumentGenerator documentGenerator) {
            this.documentGenerator = documentGenerator;
            return this;
        }

        public Builder mailer(Mailer mailer) {
            this.mailer = mailer;
            return this;
        }

        public StepCapabilities build() {
            return new StepCapabilities(this);
        }
    }
}
