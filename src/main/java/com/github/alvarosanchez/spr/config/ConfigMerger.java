package com.github.alvarosanchez.spr.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Child-overrides-parent merge for config trees.
 *
 * <p>Scalars and sequences supplied by the child replace the parent value outright. Mappings present on both sides
 * merge key by key with the same rule. Every leaf the child supplies is attributed to the child in the source map;
 * untouched leaves keep their previous attribution.
 */
public final class ConfigMerger {

    private static final String PATH_SEPARATOR = ".";

    private ConfigMerger() {
    }

    /**
     * Merges a child mapping over a parent mapping, discarding attribution.
     *
     * @param parent parent tree
     * @param child child tree
     * @return merged tree
     */
    public static MappingValue merge(MappingValue parent, MappingValue child) {
        return mergeInto(parent, child, "", new LinkedHashMap<>(), "");
    }

    /**
     * Merges a child mapping over an attributed parent mapping.
     *
     * @param parent parent tree and its source map
     * @param child child tree
     * @param childName name recorded for every field the child supplies
     * @return merged tree and updated source map
     */
    public static Merged merge(Merged parent, MappingValue child, String childName) {
        Map<String, String> sources = new LinkedHashMap<>(parent.sourceMap());
        MappingValue tree = mergeInto(parent.tree(), child, "", sources, childName);
        return new Merged(tree, sources);
    }

    /**
     * Attributes every leaf of a root tree to a single name.
     *
     * @param root root tree
     * @param name owning config name
     * @return root tree with its source map
     */
    public static Merged root(MappingValue root, String name) {
        Map<String, String> sources = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : root.entries().entrySet()) {
            attribute(entry.getValue(), entry.getKey(), sources, name);
        }
        return new Merged(root, sources);
    }

    private static MappingValue mergeInto(
        MappingValue base,
        MappingValue overlay,
        String prefix,
        Map<String, String> sources,
        String name
    ) {
        Map<String, ConfigValue> merged = new LinkedHashMap<>(base.entries());
        for (Map.Entry<String, ConfigValue> entry : overlay.entries().entrySet()) {
            String key = entry.getKey();
            String path = prefix + key;
            ConfigValue existing = merged.get(key);
            ConfigValue incoming = entry.getValue();
            if (existing instanceof MappingValue existingMapping && incoming instanceof MappingValue incomingMapping) {
                if (existingMapping.isEmpty() && incomingMapping.isEmpty()) {
                    sources.put(path, name);
                } else if (existingMapping.isEmpty()) {
                    sources.remove(path);
                }
                merged.put(key, mergeInto(existingMapping, incomingMapping, path + PATH_SEPARATOR, sources, name));
                continue;
            }
            clearAttribution(sources, path);
            merged.put(key, incoming);
            attribute(incoming, path, sources, name);
        }
        return new MappingValue(merged);
    }

    private static void attribute(ConfigValue value, String path, Map<String, String> sources, String name) {
        if (value instanceof MappingValue mapping && !mapping.isEmpty()) {
            for (Map.Entry<String, ConfigValue> entry : mapping.entries().entrySet()) {
                attribute(entry.getValue(), path + PATH_SEPARATOR + entry.getKey(), sources, name);
            }
            return;
        }
        sources.put(path, name);
    }

    private static void clearAttribution(Map<String, String> sources, String path) {
        String nestedPrefix = path + PATH_SEPARATOR;
        sources.keySet().removeIf(candidate -> candidate.equals(path) || candidate.startsWith(nestedPrefix));
    }

    /**
     * Merged tree with per-field attribution.
     *
     * @param tree merged config tree
     * @param sourceMap dotted field path to contributing config name
     */
    public record Merged(MappingValue tree, Map<String, String> sourceMap) {

        public Merged {
            sourceMap = Collections.unmodifiableMap(new LinkedHashMap<>(sourceMap));
        }
    }
}
