package com.github.alvarosanchez.spr.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node of a schemaless config tree: a scalar, a sequence or a mapping.
 */
public sealed interface ConfigValue permits ScalarValue, SequenceValue, MappingValue {

    /**
     * Converts a parsed JSON value (maps, lists, strings, numbers, booleans or {@code null}) into a config tree.
     *
     * @param raw parsed value
     * @return config tree node
     */
    static ConfigValue of(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            Map<String, ConfigValue> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), of(entry.getValue()));
            }
            return new MappingValue(entries);
        }
        if (raw instanceof List<?> list) {
            List<ConfigValue> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(of(item));
            }
            return new SequenceValue(items);
        }
        if (raw == null || raw instanceof String || raw instanceof Number || raw instanceof Boolean) {
            return new ScalarValue(raw);
        }
        throw new IllegalArgumentException("Unsupported config value type: " + raw.getClass().getName());
    }

    /**
     * Converts this node back into plain maps, lists and scalars for serialization.
     *
     * @return plain representation
     */
    Object toPlain();
}
