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

import dev.mars.courier.core.StepType;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps each {@link StepType} to the handler that executes it.
 */
public class StepHandlerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(StepHandlerRegistry.class);

    private final Map<StepType, StepHandler> handlers = Collections.synchronizedMap(new EnumMap<>(StepType.class));

    /**
     * Creates a registry wired to a {@link CapabilityStepHandler}. The built-in types
     * (user action, wait, context check) are always registered; the other types only when
     * the matching capability is present.
     */
    public static StepHandlerRegistry withCapabilities(Vertx vertx, StepCapabilities capabilities) {
        StepHandlerRegistry registry = new StepHandlerRegistry();
        CapabilityStepHandler handler = new CapabilityStepHandler(vertx, capabilities);
        for (StepType type : handler.getSupportedTypes()) {
            registry.register(type, handler);
        }
        logger.info("Registered capability step handler for {}", handler.getSupportedTypes());
        return registry;
    }

    public void register(StepType type, StepHandler handler) {
        Objects.requireNonNull(type, "Step type cannot be null");
        Objects.requireNonNull(handler, "Step handler cannot be null");
        StepHandler previous = handlers.put(type, handler);
        if (previous != null && previous != handler) {
            logger.debug("Replaced step handler for {}", type);
        }
    }

    public void unregister(StepType type) {
        if (handlers.remove(type) != null) {
            logger.debug("Unregistered step handler for {}", type);
        }
    }

    public Optional<StepHandler> find(StepType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public boolean isRegistered(StepType type) {
        return handlers.containsKey(type);
    }

    public Set<StepType> getRegisteredTypes() {
        synchronized (handlers) {
            return Set.copyOf(handlers.keySet());
        }
    }
}
