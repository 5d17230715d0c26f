package com.github.alvarosanchez.spr.config;

import java.util.Map;
import java.util.Optional;

/**
 * Parsed config file split into its {@code metadata} and {@code config} sections.
 *
 * <p>Files without a {@code config} mapping are treated as slicer-native flat documents: the whole file is the
 * {@code config} section and {@code metadata} is empty.
 *
 * @param metadata authorship, tags and compatibility, opaque to the resolver
 * @param config slicer-native settings, including {@code inherits}, {@code from} and {@code instantiation}
 */
public record ConfigDocument(MappingValue metadata, MappingValue config) {

    public static final String METADATA = "metadata";
    public static final String CONFIG = "config";
    public static final String NAME = "name";
    public static final String INHERITS = "inherits";
    public static final String FROM = "from";
    public static final String INSTANTIATION = "instantiation";

    public ConfigDocument {
        metadata = metadata == null ? MappingValue.EMPTY : metadata;
        config = config == null ? MappingValue.EMPTY : config;
    }

    /**
     * Builds a document from a parsed JSON object.
     *
     * @param raw parsed JSON object
     * @return config document
     */
    public static ConfigDocument of(Map<String, Object> raw) {
        MappingValue root = (MappingValue) ConfigValue.of(raw == null ? Map.of() : raw);
        if (root.get(CONFIG).orElse(null) instanceof MappingValue config) {
            MappingValue metadata = root.get(METADATA).orElse(null) instanceof MappingValue mapping ? mapping : MappingValue.EMPTY;
            return new ConfigDocument(metadata, config);
        }
        return new ConfigDocument(MappingValue.EMPTY, root);
    }

    public Optional<String> name() {
        return config.text(NAME).filter(name -> !name.isBlank());
    }

    /**
     * Returns the raw {@code inherits} value, if declared.
     *
     * @return declared parent reference
     */
    public Optional<ConfigValue> inherits() {
        return config.get(INHERITS).filter(value -> !(value instanceof ScalarValue scalar && isBlank(scalar)));
    }

    public Optional<ConfigValue> from() {
        return config.get(FROM).filter(value -> !(value instanceof ScalarValue scalar && isBlank(scalar)));
    }

    /**
     * Returns the settings that take part in a merge: the {@code config} section without the inheritance edge.
     *
     * @return mergeable settings
     */
    public MappingValue settings() {
        return config.without(INHERITS, FROM);
    }

    private static boolean isBlank(ScalarValue scalar) {
        return scalar.value() == null || scalar.asText().isBlank();
    }
}
