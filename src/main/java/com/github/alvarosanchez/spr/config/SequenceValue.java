package com.github.alvarosanchez.spr.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of config values. Sequences are always replaced as a whole when merged.
 *
 * @param items sequence items
 */
public record SequenceValue(List<ConfigValue> items) implements ConfigValue {

    public SequenceValue {
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public Object toPlain() {
        List<Object> plain = new ArrayList<>(items.size());
        for (ConfigValue item : items) {
            plain.add(item.toPlain());
        }
        return plain;
    }
}
