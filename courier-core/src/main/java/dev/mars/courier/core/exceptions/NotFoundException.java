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

package dev.mars.courier.core.exceptions;

/**
 * Thrown when a workflow definition or workflow instance id is unknown.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class NotFoundException extends CourierException {

    /**
     * Kind of entity that could not be found.
     */
    public enum EntityKind {
        DEFINITION,
        INSTANCE
    }

    private final EntityKind entityKind;
    private final String entityId;

    public NotFoundException(EntityKind entityKind, String entityId) {
        super(describe(entityKind) + " not found: " + entityId);
        this.entityKind = entityKind;
        this.entityId = entityId;
    }

    public static NotFoundException definition(String definitionId) {
        return new NotFoundException(EntityKind.DEFINITION, definitionId);
    }

    public static NotFoundException instance(String instanceId) {
        return new NotFoundException(EntityKind.INSTANCE, instanceId);
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    public String getEntityId() {
        return entityId;
    }

    private static String describe(EntityKind kind) {
        return kind == EntityKind.DEFINITION ? "Workflow definition" : "Workflow instance";
    }
}
