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


package dev.mars.courier.workflow.registry;

import dev.mars.courier.config.CourierConfiguration;
import dev.mars.courier.core.ContextSnapshot;
import dev.mars.courier.core.StepType;
import dev.mars.courier.core.WorkflowDefinition;
import dev.mars.courier.core.step.EmailSendConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DefaultWorkflowCatalogTest {

    @Test
    void testAllDefaultWorkflowsLoadAndValidate() throws Exception {
        WorkflowDefinitionRegistry registry = new WorkflowDefinitionRegistry();

        int registered = new DefaultWorkflowCatalog(new YamlWorkflowDefinitionParser()).registerInto(registry);

        assertEquals(8, registered);
        assertThat(registry.listAll()).extracting(WorkflowDefinition::getId).containsExactly(
                "provider_setup", "deliverability_repair", "document_generation", "inbox_cleanup",
                "email_campaign", "client_onboarding", "risk_assessment", "smart_share_verification");
    }

    @Test
    void testCatalogContent() throws Exception {
        List<WorkflowDefinition> definitions = new DefaultWorkflowCatalog(new YamlWorkflowDefinitionParser()).load();

        WorkflowDefinition providerSetup = definitions.get(0);
        assertEquals("Provider Setup", providerSetup.getName());
        assertEquals("detect_provider", providerSetup.getEntryStepId());
        assertEquals(StepType.SMART_SHARE, providerSetup.getStep("smart_share_credentials").orElseThrow().getType());
        assertEquals(0, providerSetup.getStep("user_confirmation").orElseThrow().getTimeoutMs());

        boolean hasEmailSend = definitions.stream()
                .flatMap(d -> d.getSteps().stream())
                .anyMatch(s -> s.getConfig() instanceof EmailSendConfig);
        assertTrue(hasEmailSend);
    }

    @Test
    void testSuggestionOrderOverCatalog() throws Exception {
        WorkflowDefinitionRegistry registry = DefaultWorkflowCatalog.createRegistry(new CourierConfiguration(new Properties()));

        assertThat(registry.suggest(ContextSnapshot.empty())).extracting(WorkflowDefinition::getId).startsWith(
                "smart_share_verification", "client_onboarding", "provider_setup", "risk_assessment");
    }

    @Test
    void testCatalogCanBeDisabled() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(CourierConfiguration.CATALOG_DEFAULTS_ENABLED, "false");
        properties.setProperty(CourierConfiguration.VALIDATE_GRAPHS, "false");

        WorkflowDefinitionRegistry registry = DefaultWorkflowCatalog.createRegistry(new CourierConfiguration(properties));

        assertEquals(0, registry.size());
        assertFalse(registry.isGraphValidationEnabled());
    }
}
