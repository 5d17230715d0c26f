package com.github.alvarosanchez.spr.resolve;

import com.github.alvarosanchez.spr.config.ConfigDocument;
import com.github.alvarosanchez.spr.config.MappingValue;
import com.github.alvarosanchez.spr.config.ScalarValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fully merged config with per-field provenance.
 *
 * @param resolvedConfig merged settings
 * @param sourceMap dotted field path to the name of the config that last set it
 * @param links configs consulted, root first
 */
public record Resolution(MappingValue resolvedConfig, Map<String, String> sourceMap, List<ChainLink> links) {

    public Resolution {
        sourceMap = Collections.unmodifiableMap(new LinkedHashMap<>(sourceMap));
        links = List.copyOf(links);
    }

    /**
     * Returns the names of the merged configs, root to leaf.
     *
     * @return inheritance chain
     */
    public List<String> inheritanceChain() {
        return links.stream().map(ChainLink::name).toList();
    }

    /**
     * Returns the resolved target, the last link of the chain.
     *
     * @return target link
     */
    public ChainLink target() {
        return links.get(links.size() - 1);
    }

    /**
     * Returns whether the merged config may be instantiated. Bases declare {@code instantiation: false}.
     *
     * @return {@code false} when the merged {@code instantiation} is {@code false} or {@code "false"}
     */
    public boolean instantiable() {
        return !(resolvedConfig.get(ConfigDocument.INSTANTIATION).orElse(null) instanceof ScalarValue scalar
            && scalar.value() != null
            && "false".equalsIgnoreCase(scalar.asText().trim()));
    }

    /**
     * Returns the checksum of every file the result was derived from.
     *
     * @return location to checksum
     */
    public Map<String, String> checksums() {
        Map<String, String> checksums = new LinkedHashMap<>();
        for (ChainLink link : links) {
            checksums.put(link.location(), link.checksum());
        }
        return checksums;
    }

    /**
     * One config in an inheritance chain.
     *
     * @param name config name
     * @param key key the config was resolved under
     * @param location repository-relative file location
     * @param checksum checksum of the file when it was read
     * @param document parsed document
     */
    public record ChainLink(String name, ConfigKey key, String location, String checksum, ConfigDocument document) {
    }
}
