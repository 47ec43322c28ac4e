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

import dev.mars.courier.core.StepType;
import dev.mars.courier.core.Values;

import java.util.List;

/**
 * Sends an email through the injected mailer.
 *
 * @param templateId          optional template to render
 * @param to                  recipients, at least one
 * @param subject             subject line
 * @param bodySource          where the body comes from, such as {@code generated} or {@code template}
 * @param attachments         artifact names or references to attach
 * @param checkDeliverability whether the mailer should run a deliverability check first
 * @param priority            mailer priority hint
 */
public record EmailSendConfig(String templateId, List<String> to, String subject, String bodySource,
                              List<String> attachments, boolean checkDeliverability,
                              String priority) implements StepConfig {

    public EmailSendConfig {
        to = Values.immutableList(to);
        if (to.isEmpty()) {
            throw new IllegalArgumentException("at least one recipient is required");
        }
        attachments = Values.immutableList(attachments);
        if (priority == null) {
            priority = "normal";
        }
    }

    @Override
    public StepType type() {
        return StepType.EMAIL_SEND;
    }
}
