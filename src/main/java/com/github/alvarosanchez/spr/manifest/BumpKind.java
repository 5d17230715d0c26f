package com.github.alvarosanchez.spr.manifest;

import java.util.Locale;
import java.util.Optional;

/**
 * Semantic version component to increment for a modified profile.
 */
public enum BumpKind {
    MAJOR,
    MINOR,
    PATCH;

    /**
     * Parses a bump kind name, ignoring case and surrounding blanks.
     *
     * @param value user input
     * @return bump kind, or empty when the input names none
     */
    public static Optional<BumpKind> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (BumpKind kind : values()) {
            if (kind.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
