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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of the caller's context, captured when a workflow starts.
 * Nested values are addressed with dotted paths such as {@code user.id}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class ContextSnapshot {

    private static final ContextSnapshot EMPTY = new ContextSnapshot(Map.of());

    private final Map<String, Object> values;

    private ContextSnapshot(Map<String, Object> values) {
        this.values = values;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    @SuppressWarnings("unchecked")
    public static ContextSnapshot of(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new ContextSnapshot((Map<String, Object>) freeze(values));
    }

    public static ContextSnapshot empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Resolves a dotted path.
     *
     * @param path dotted path, for example {@code provider.status}
     * @return the value, or {@code null} if any segment is missing
     */
    public Object get(String path) {
        return resolve(values, path);
    }

    public Optional<String> getString(String path) {
        Object value = get(path);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    public boolean contains(String path) {
        return get(path) != null;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Checks every required path against this snapshot. Numbers compare by value, so
     * {@code 5} matches {@code 5L}. An empty requirement matches any snapshot.
     *
     * @param required map of dotted path to expected value
     * @return {@code true} if every entry matches
     */
    public boolean matches(Map<String, Object> required) {
        if (required == null || required.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> entry : required.entrySet()) {
            if (!valuesEqual(get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a snapshot with the top-level entries of {@code overlay} replacing those of this one.
     */
    public ContextSnapshot merge(Map<String, Object> overlay) {
        if (overlay == null || overlay.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(overlay);
        return of(merged);
    }

    /**
     * Resolves a dotted path in an arbitrary nested map.
     */
    @SuppressWarnings("unchecked")
    public static Object resolve(Map<String, Object> root, String path) {
        if (root == null || path == null || path.isEmpty()) {
            return null;
        }
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    public static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            return new BigDecimal(actual.toString()).compareTo(new BigDecimal(expected.toString())) == 0;
        }
        if (actual != null && expected != null && actual.getClass() != expected.getClass()) {
            return actual.toString().equals(expected.toString());
        }
        return Objects.equals(actual, expected);
    }

    @SuppressWarnings("unchecked")
    private static Object freeze(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<Object, Object>) value).forEach((k, v) -> copy.put(String.valueOf(k), freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            ((List<Object>) value).forEach(v -> copy.add(freeze(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((ContextSnapshot) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ContextSnapshot" + values;
    }

    /**
     * Builds a snapshot from dotted paths; intermediate maps are created as needed.
     */
    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        @SuppressWarnings("unchecked")
        public Builder put(String path, Object value) {
            String[] segments = path.split("\\.");
            Map<String, Object> current = values;
            for (int i = 0; i < segments.length - 1; i++) {
                Object next = current.get(segments[i]);
                if (!(next instanceof Map)) {
                    next = new LinkedHashMap<String, Object>();
                    current.put(segments[i], next);
                }
                current = (Map<String, Object>) next;
            }
            current.put(segments[segments.length - 1], value);
            return this;
        }

        public ContextSnapshot build() {
            return of(values);
        }
    }
}
