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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.courier.config.CourierConfiguration;
import dev.mars.courier.core.AutomationLevel;
import dev.mars.courier.core.StepDefinition;
import dev.mars.courier.core.WorkflowDefinition;
import dev.mars.courier.core.json.CourierObjectMapper;
import dev.mars.courier.core.step.StepConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses workflow definitions from YAML using SnakeYAML.
 *
 * <p>A document holds either a single definition at the root or a {@code workflows} list.
 * Each step names its {@code type} and carries a {@code config} map that is bound to the
 * matching {@link StepConfig} record; unknown config fields are rejected. Steps without
 * {@code timeoutMs} or {@code maxRetries} get the configured defaults.</p>
 *
 * <pre>
 * workflows:
 *   - id: provider_setup
 *     name: Provider Setup
 *     steps:
 *       - id: detect_provider
 *         type: ai_action
 *         timeoutMs: 30000
 *         config:
 *           actionId: detect_email_provider
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class YamlWorkflowDefinitionParser {

    private final Yaml yaml;
    private final ObjectMapper configMapper;
    private final long defaultTimeoutMs;
    private final int defaultMaxRetries;

    public YamlWorkflowDefinitionParser() {
        this(new CourierConfiguration());
    }

    public YamlWorkflowDefinitionParser(CourierConfiguration configuration) {
        this(configuration.getDefaultStepTimeoutMs(), configuration.getDefaultStepMaxRetries());
    }

    public YamlWorkflowDefinitionParser(long defaultTimeoutMs, int defaultMaxRetries) {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.configMapper = CourierObjectMapper.createStrict();
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public List<WorkflowDefinition> parse(Path yamlFile) throws WorkflowParseException {
        try {
            return parseAll(Files.readString(yamlFile));
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + yamlFile, e);
        }
    }

    public List<WorkflowDefinition> parse(InputStream input) throws WorkflowParseException {
        try {
            return toDefinitions(yaml.load(input));
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed", e);
        }
    }

    /**
     * Parses a document that contains exactly one definition.
     */
    public WorkflowDefinition parseFromString(String yamlContent) throws WorkflowParseException {
        List<WorkflowDefinition> definitions = parseAll(yamlContent);
        if (definitions.size() != 1) {
            throw new WorkflowParseException("Expected one workflow definition but found " + definitions.size());
        }
        return definitions.get(0);
    }

    public List<WorkflowDefinition> parseAll(String yamlContent) throws WorkflowParseException {
        try {
            return toDefinitions(yaml.load(yamlContent));
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed", e);
        }
    }

    private List<WorkflowDefinition> toDefinitions(Object document) throws WorkflowParseException {
        if (!(document instanceof Map)) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        Map<String, Object> data = asMap(document);

        if (!data.containsKey("workflows")) {
            return List.of(parseWorkflow(data, "workflow"));
        }

        List<Map<String, Object>> workflows = getListValue(data, "workflows", "workflows");
        List<WorkflowDefinition> definitions = new ArrayList<>();
        for (int i = 0; i < workflows.size(); i++) {
            definitions.add(parseWorkflow(workflows.get(i), "workflows[" + i + "]"));
        }
        return definitions;
    }

    private WorkflowDefinition parseWorkflow(Map<String, Object> data, String path) throws WorkflowParseException {
        String id = requireString(data, "id", path);

        WorkflowDefinition.Builder builder = WorkflowDefinition.builder(id)
                .name(getStringValue(data, "name", id))
                .description(getStringValue(data, "description", null))
                .category(getStringValue(data, "category", null))
                .version(getStringValue(data, "version", null))
                .entryStepId(getStringValue(data, "entryStepId", null))
                .estimatedTimeMinutes(getIntValue(data, "estimatedTimeMinutes", 0, path))
                .priority(getIntValue(data, "priority", 0, path))
                .tags(parseStringList(data.get("tags")));

        String automationLevel = getStringValue(data, "automationLevel", null);
        if (automationLevel != null) {
            try {
                builder.automationLevel(AutomationLevel.fromWireName(automationLevel));
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException(path + ".automationLevel", e.getMessage(), e);
            }
        }

        Object requiredContext = data.get("requiredContext");
        if (requiredContext instanceof Map) {
            builder.requiredContext(asMap(requiredContext));
        } else if (requiredContext != null) {
            throw new WorkflowParseException(path + ".requiredContext", "must be a mapping", null);
        }

        List<Map<String, Object>> stepsList = getListValue(data, "steps", path + ".steps");
        for (int i = 0; i < stepsList.size(); i++) {
            builder.step(parseStep(stepsList.get(i), path + ".steps[" + i + "]"));
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage(), e);
        }
    }

    private StepDefinition parseStep(Map<String, Object> data, String path) throws WorkflowParseException {
        String id = requireString(data, "id", path);
        String type = requireString(data, "type", path);

        Map<String, Object> configData = new LinkedHashMap<>();
        Object rawConfig = data.get("config");
        if (rawConfig instanceof Map) {
            configData.putAll(asMap(rawConfig));
        } else if (rawConfig != null) {
            throw new WorkflowParseException(path + ".config", "must be a mapping", null);
        }
        configData.put("type", type);

        StepConfig config;
        try {
            config = configMapper.convertValue(configData, StepConfig.class);
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".config", rootMessage(e), e);
        }

        try {
            return StepDefinition.builder(id)
                    .title(getStringValue(data, "title", null))
                    .description(getStringValue(data, "description", null))
                    .config(config)
                    .dependencies(parseStringList(data.get("dependsOn")))
                    .timeoutMs(getLongValue(data, "timeoutMs", defaultTimeoutMs, path))
                    .maxRetries(getIntValue(data, "maxRetries", defaultMaxRetries, path))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage(), e);
        }
    }

    // Utility methods for safe type conversion

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static String requireString(Map<String, Object> data, String key, String path) throws WorkflowParseException {
        String value = getStringValue(data, key, null);
        if (value == null || value.trim().isEmpty()) {
            throw new WorkflowParseException(path + "." + key, "Required field '" + key + "' is missing", null);
        }
        return value;
    }

    private static String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> getListValue(Map<String, Object> data, String key, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (!(value instanceof List)) {
            throw new WorkflowParseException(path, "Required list '" + key + "' is missing", null);
        }
        List<Object> items = (List<Object>) value;
        List<Map<String, Object>> maps = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof Map)) {
                throw new WorkflowParseException(path + "[" + i + "]", "must be a mapping", null);
            }
            maps.add((Map<String, Object>) items.get(i));
        }
        return maps;
    }

    private static int getIntValue(Map<String, Object> data, String key, int defaultValue, String path)
            throws WorkflowParseException {
        return Math.toIntExact(getLongValue(data, key, defaultValue, path));
    }

    private static long getLongValue(Map<String, Object> data, String key, long defaultValue, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(path + "." + key, "Expected a number but found '" + value + "'", e);
        }
    }

    private static List<String> parseStringList(Object value) {
        if (!(value instanceof List)) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static String rootMessage(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return message != null ? message.lines().findFirst().orElse(message) : current.getClass().getSimpleName();
    }
}
