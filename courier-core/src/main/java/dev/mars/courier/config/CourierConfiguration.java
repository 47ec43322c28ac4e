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


package dev.mars.courier.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration management for Courier.
 * Values are layered: built-in defaults, {@code courier.properties} on the classpath, the first
 * readable file location, then system properties starting with {@code courier.}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class CourierConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(CourierConfiguration.class);

    public static final String MAX_CONCURRENT_WORKFLOWS = "courier.workflow.max.concurrent";
    public static final String RETRY_DELAY_MS = "courier.workflow.retry.delay.ms";
    public static final String DEFAULT_STEP_TIMEOUT_MS = "courier.workflow.step.timeout.ms";
    public static final String DEFAULT_STEP_MAX_RETRIES = "courier.workflow.step.max.retries";
    public static final String PERSIST_STATE = "courier.workflow.persist.state";
    public static final String STORE_TYPE = "courier.store.type";
    public static final String STORE_PATH = "courier.store.path";
    public static final String CLEANUP_INTERVAL_MS = "courier.cleanup.interval.ms";
    public static final String CLEANUP_MAX_AGE_MS = "courier.cleanup.max.age.ms";
    public static final String CATALOG_DEFAULTS_ENABLED = "courier.catalog.defaults.enabled";
    public static final String VALIDATE_GRAPHS = "courier.registry.validate.graphs";

    // Default configuration values
    private static final int DEFAULT_MAX_CONCURRENT = 5;
    private static final long DEFAULT_RETRY_DELAY = 1000;
    private static final long DEFAULT_STEP_TIMEOUT = 30000;
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final String DEFAULT_STORE_TYPE = "memory";
    private static final String DEFAULT_STORE_PATH = "data/workflows";
    private static final long DEFAULT_CLEANUP_INTERVAL = 3600000; // 1 hour
    private static final long DEFAULT_MAX_AGE = 30L * 24 * 3600000; // 30 days

    private final Properties properties;

    public CourierConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromClasspath();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public CourierConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Engine configuration
    public int getMaxConcurrentWorkflows() {
        return getIntProperty(MAX_CONCURRENT_WORKFLOWS, DEFAULT_MAX_CONCURRENT);
    }

    public long getRetryDelayMs() {
        return getLongProperty(RETRY_DELAY_MS, DEFAULT_RETRY_DELAY);
    }

    public long getDefaultStepTimeoutMs() {
        return getLongProperty(DEFAULT_STEP_TIMEOUT_MS, DEFAULT_STEP_TIMEOUT);
    }

    public int getDefaultStepMaxRetries() {
        return getIntProperty(DEFAULT_STEP_MAX_RETRIES, DEFAULT_MAX_RETRIES);
    }

    public boolean isPersistWorkflowState() {
        return getBooleanProperty(PERSIST_STATE, true);
    }

    // Store configuration
    public String getStoreType() {
        return getStringProperty(STORE_TYPE, DEFAULT_STORE_TYPE);
    }

    public Path getStorePath() {
        return Paths.get(getStringProperty(STORE_PATH, DEFAULT_STORE_PATH));
    }

    // Retention
    public long getCleanupIntervalMs() {
        return getLongProperty(CLEANUP_INTERVAL_MS, DEFAULT_CLEANUP_INTERVAL);
    }

    public long getMaxStateAgeMs() {
        return getLongProperty(CLEANUP_MAX_AGE_MS, DEFAULT_MAX_AGE);
    }

    // Registry
    public boolean isDefaultCatalogEnabled() {
        return getBooleanProperty(CATALOG_DEFAULTS_ENABLED, true);
    }

    public boolean isGraphValidationEnabled() {
        return getBooleanProperty(VALIDATE_GRAPHS, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(MAX_CONCURRENT_WORKFLOWS, String.valueOf(DEFAULT_MAX_CONCURRENT));
        properties.setProperty(RETRY_DELAY_MS, String.valueOf(DEFAULT_RETRY_DELAY));
        properties.setProperty(DEFAULT_STEP_TIMEOUT_MS, String.valueOf(DEFAULT_STEP_TIMEOUT));
        properties.setProperty(DEFAULT_STEP_MAX_RETRIES, String.valueOf(DEFAULT_MAX_RETRIES));
        properties.setProperty(PERSIST_STATE, "true");
        properties.setProperty(STORE_TYPE, DEFAULT_STORE_TYPE);
        properties.setProperty(STORE_PATH, DEFAULT_STORE_PATH);
        properties.setProperty(CLEANUP_INTERVAL_MS, String.valueOf(DEFAULT_CLEANUP_INTERVAL));
        properties.setProperty(CLEANUP_MAX_AGE_MS, String.valueOf(DEFAULT_MAX_AGE));
        properties.setProperty(CATALOG_DEFAULTS_ENABLED, "true");
        properties.setProperty(VALIDATE_GRAPHS, "true");
    }

    private void loadConfigurationFromClasspath() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream("courier.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "courier.properties",
                "config/courier.properties",
                System.getProperty("user.home") + "/.courier/courier.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("courier."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "CourierConfiguration{" +
                "maxConcurrentWorkflows=" + getMaxConcurrentWorkflows() +
                ", retryDelayMs=" + getRetryDelayMs() +
                ", storeType='" + getStoreType() + '\'' +
                ", persistWorkflowState=" + isPersistWorkflowState() +
                '}';
    }
}
