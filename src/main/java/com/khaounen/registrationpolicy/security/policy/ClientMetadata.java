package com.khaounen.registrationpolicy.security.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registration metadata as submitted by the client. The key set is open:
 * rules look values up by name and fall back when the type is not the one
 * they expect.
 */
public final class ClientMetadata {

    private static final ClientMetadata EMPTY = new ClientMetadata(Map.of());

    private final Map<String, Object> values;

    private ClientMetadata(Map<String, Object> values) {
        this.values = values;
    }

    public static ClientMetadata of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new ClientMetadata(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static ClientMetadata empty() {
        return EMPTY;
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Optional<String> getString(String key) {
        Object value = values.get(key);
        return value instanceof String text ? Optional.of(text) : Optional.empty();
    }

    /**
     * Returns the value as a list of strings, or empty when the key is absent or
     * the value is not an array made only of strings.
     */
    public Optional<List<String>> getStringList(String key) {
        Object value = values.get(key);
        if (!(value instanceof List<?> items)) {
            return Optional.empty();
        }
        List<String> strings = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof String text)) {
                return Optional.empty();
            }
            strings.add(text);
        }
        return Optional.of(List.copyOf(strings));
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ClientMetadata other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ClientMetadata" + values.keySet();
    }
}
