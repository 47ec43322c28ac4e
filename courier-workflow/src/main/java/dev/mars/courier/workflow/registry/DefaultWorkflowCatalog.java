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
import dev.mars.courier.core.WorkflowDefinition;
import dev.mars.courier.core.exceptions.CourierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads the built-in workflow definitions shipped on the classpath.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class DefaultWorkflowCatalog {

    private static final Logger logger = LoggerFactory.getLogger(DefaultWorkflowCatalog.class);

    public static final String RESOURCE = "workflows/default-workflows.yaml";

    private final YamlWorkflowDefinitionParser parser;

    public DefaultWorkflowCatalog(YamlWorkflowDefinitionParser parser) {
        this.parser = parser;
    }

    public List<WorkflowDefinition> load() throws WorkflowParseException {
        try (InputStream input = DefaultWorkflowCatalog.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (input == null) {
                throw new WorkflowParseException("Default workflow catalog not found on classpath: " + RESOURCE);
            }
            return parser.parse(input);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read default workflow catalog", e);
        }
    }

    /**
     * Registers every catalog definition.
     *
     * @return number of definitions registered
     */
    public int registerInto(WorkflowDefinitionRegistry registry) throws CourierException {
        List<WorkflowDefinition> definitions = load();
        for (WorkflowDefinition definition : definitions) {
            registry.register(definition);
        }
        logger.info("Registered {} default workflow definitions", definitions.size());
        return definitions.size();
    }

    /**
     * Creates a registry as configured, pre-loaded with the catalog when
     * {@code courier.catalog.defaults.enabled} is set.
     */
    public static WorkflowDefinitionRegistry createRegistry(CourierConfiguration configuration) throws CourierException {
        WorkflowDefinitionRegistry registry = new WorkflowDefinitionRegistry(configuration.isGraphValidationEnabled());
        if (configuration.isDefaultCatalogEnabled()) {
            new DefaultWorkflowCatalog(new YamlWorkflowDefinitionParser(configuration)).registerInto(registry);
        }
        return registry;
    }
}
