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


package dev.mars.courier.core;

import java.util.Map;

/**
 * Something a step produced, such as a generated document or a sent message.
 *
 * @param type       artifact kind, for example {@code document} or {@code email}
 * @param name       display name
 * @param reference  where the artifact can be found (URI, message id, storage key)
 * @param attributes additional attributes
 */
public record Artifact(String type, String name, String reference, Map<String, Object> attributes) {

    public Artifact {
        attributes = Values.immutableMap(attributes);
    }

    public static Artifact of(String type, String name, String reference) {
        return new Artifact(type, name, reference, Map.of());
    }
}
