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


package dev.mars.courier.workflow.store;

import dev.mars.courier.config.CourierConfiguration;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Factory for creating {@link WorkflowInstanceStore} instances based on configuration.
 *
 * <p>The returned store is not yet open; the engine opens it on start.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public final class WorkflowInstanceStoreFactory {

    private static final Logger LOG = LoggerFactory.getLogger(WorkflowInstanceStoreFactory.class);

    /**
     * Supported storage backend types.
     */
    public enum StoreType {
        /** In-memory storage (testing only, not durable) */
        MEMORY,
        /** One directory per instance under the store path */
        FILE;

        public static StoreType parse(String value) {
            if (value == null || value.isBlank()) {
                return MEMORY;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown store type '" + value + "'. Supported: memory, file", e);
            }
        }
    }

    private WorkflowInstanceStoreFactory() {
        // Utility class
    }

    public static WorkflowInstanceStore create(Vertx vertx, CourierConfiguration configuration) {
        return create(vertx, StoreType.parse(configuration.getStoreType()), configuration.getStorePath());
    }

    public static WorkflowInstanceStore create(Vertx vertx, StoreType type, Path storePath) {
        LOG.info("Creating WorkflowInstanceStore: type={}, path={}", type, storePath);
        return switch (type) {
            case FILE -> new FileWorkflowInstanceStore(vertx, storePath);
            case MEMORY -> {
                LOG.warn("Using InMemoryWorkflowInstanceStore - WORKFLOW STATE WILL NOT SURVIVE RESTART!");
                yield new InMemoryWorkflowInstanceStore();
            }
        };
    }
}
