package com.github.alvarosanchez.spr.config;

/**
 * String, number, boolean or {@code null} leaf.
 *
 * @param value scalar value
 */
public record ScalarValue(Object value) implements ConfigValue {

    /**
     * Returns the scalar as text, or {@code null} for a null scalar.
     *
     * @return textual value
     */
    public String asText() {
        return value == null ? null : String.valueOf(value);
    }

    @Override
    public Object toPlain() {
        return value;
    }
}
