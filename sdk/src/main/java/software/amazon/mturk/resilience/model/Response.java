// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded remote result: an unordered mapping of tag to payload.
 *
 * <p>Payloads are plain Java values as produced by a decoder: nested {@link Map}s, {@link List}s, strings, numbers and
 * so on. Iteration order of the top-level tags is the order in which the relay supplied them.
 */
public final class Response {
    private final Map<String, Object> entries;

    private Response(Map<String, ?> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Creates a response from decoded entries. The map is copied.
     *
     * @param entries top-level tags and their payloads
     * @return the response
     * @throws NullPointerException if entries or any of its tags is null
     */
    public static Response of(Map<String, ?> entries) {
        Objects.requireNonNull(entries, "entries cannot be null");
        for (String tag : entries.keySet()) {
            Objects.requireNonNull(tag, "Response tags cannot be null");
        }
        return new Response(entries);
    }

    /** @return the top-level tags in relay order */
    public List<String> tags() {
        return List.copyOf(entries.keySet());
    }

    public boolean hasTag(String tag) {
        return entries.containsKey(tag);
    }

    /** @return the payload under {@code tag}, or null if absent */
    public Object get(String tag) {
        return entries.get(tag);
    }

    /**
     * Walks nested maps from the top level.
     *
     * @param path tags to descend through, outermost first
     * @return the value at the end of the path, or null if any step is missing or is not a map
     */
    public Object find(String... path) {
        Object current = entries;
        for (String key : path) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(key);
        }
        return current;
    }

    /** @return the underlying entries, unmodifiable */
    @JsonValue
    public Map<String, Object> asMap() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Response)) {
            return false;
        }
        return entries.equals(((Response) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Response" + entries;
    }
}
