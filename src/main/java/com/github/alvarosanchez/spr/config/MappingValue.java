package com.github.alvarosanchez.spr.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Insertion-ordered mapping of keys to config values.
 *
 * @param entries mapping entries
 */
public record MappingValue(Map<String, ConfigValue> entries) implements ConfigValue {

    /**
     * Empty mapping.
     */
    public static final MappingValue EMPTY = new MappingValue(Map.of());

    public MappingValue {
        entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Returns the value stored under a key.
     *
     * @param key entry key
     * @return value, or empty when the key is absent
     */
    public Optional<ConfigValue> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Returns the scalar text stored under a key.
     *
     * @param key entry key
     * @return text of a non-null scalar, or empty otherwise
     */
    public Optional<String> text(String key) {
        if (entries.get(key) instanceof ScalarValue scalar && scalar.value() != null) {
            return Optional.of(scalar.asText());
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns a copy of this mapping without the given keys.
     *
     * @param keys keys to drop
     * @return filtered mapping
     */
    public MappingValue without(String... keys) {
        Map<String, ConfigValue> copy = new LinkedHashMap<>(entries);
        for (String key : keys) {
            copy.remove(key);
        }
        return new MappingValue(copy);
    }

    @Override
    public Object toPlain() {
        Map<String, Object> plain = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : entries.entrySet()) {
            plain.put(entry.getKey(), entry.getValue().toPlain());
        }
        return plain;
    }
}
