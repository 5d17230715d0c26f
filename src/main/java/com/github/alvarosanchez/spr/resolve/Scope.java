package com.github.alvarosanchez.spr.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Source scope of a config, deciding where a named base is looked up.
 */
public enum Scope {

    SYSTEM {
        @Override
        public List<String> searchPaths(String slicer, String type, String name) {
            return List.of(
                slicer + "/system/" + name + JSON,
                slicer + "/base/" + name + JSON,
                slicer + "/" + type + "/base/" + name + JSON
            );
        }
    },
    VENDOR {
        @Override
        public List<String> searchPaths(String slicer, String type, String name) {
            List<String> paths = new ArrayList<>();
            paths.add(slicer + "/vendor/" + name + JSON);
            paths.addAll(SYSTEM.searchPaths(slicer, type, name));
            return List.copyOf(paths);
        }
    },
    USER {
        @Override
        public List<String> searchPaths(String slicer, String type, String name) {
            return List.of(
                slicer + "/user/" + name + JSON,
                slicer + "/" + type + "/user/" + name + JSON
            );
        }
    };

    private static final String JSON = ".json";

    /**
     * Candidate locations, relative to the configs directory, in lookup order.
     *
     * @param slicer slicer directory
     * @param type profile type directory
     * @param name config name
     * @return candidate relative paths
     */
    public abstract List<String> searchPaths(String slicer, String type, String name);

    /**
     * Returns the lowercase name used in {@code from} fields and URLs.
     *
     * @return wire name
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a {@code from} value, ignoring case.
     *
     * @param value declared scope
     * @return parsed scope, or empty when unknown
     */
    public static Optional<Scope> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Scope scope : values()) {
            if (scope.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }

    /**
     * Infers the scope of a file from the directories of its relative location.
     *
     * @param relativePath location relative to the configs directory
     * @return {@link #USER} or {@link #VENDOR} when a matching directory appears, {@link #SYSTEM} otherwise
     */
    public static Scope ofLocation(String relativePath) {
        String[] segments = relativePath.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            if ("user".equalsIgnoreCase(segments[i])) {
                return USER;
            }
            if ("vendor".equalsIgnoreCase(segments[i])) {
                return VENDOR;
            }
        }
        return SYSTEM;
    }
}
