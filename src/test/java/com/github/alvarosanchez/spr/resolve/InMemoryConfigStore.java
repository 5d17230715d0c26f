package com.github.alvarosanchez.spr.resolve;

import com.github.alvarosanchez.spr.checksum.ChecksumEngine;
import com.github.alvarosanchez.spr.config.ConfigDocument;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Config store backed by a map of locations, for resolver tests.
 */
final class InMemoryConfigStore implements ConfigStore {

    private final ChecksumEngine checksumEngine = new ChecksumEngine();
    private final Map<String, Map<String, Object>> documents = new HashMap<>();

    InMemoryConfigStore put(String location, Map<String, Object> document) {
        documents.put(location, document);
        return this;
    }

    @Override
    public Optional<StoredConfig> find(ConfigKey key) {
        for (String candidate : key.scope().searchPaths(key.slicer(), key.type(), key.name())) {
            Map<String, Object> raw = documents.get(candidate);
            if (raw != null) {
                return Optional.of(new StoredConfig(key, candidate, ConfigDocument.of(raw), checksum(raw)));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<StoredConfig> findByPath(String slicer, String type, String path) {
        String location = slicer + "/" + type + "/" + path;
        Map<String, Object> raw = documents.get(location);
        if (raw == null) {
            return Optional.empty();
        }
        ConfigDocument document = ConfigDocument.of(raw);
        String name = document.name().orElse(path.replace(".json", ""));
        ConfigKey key = new ConfigKey(slicer, type, Scope.ofLocation(location), name);
        return Optional.of(new StoredConfig(key, location, document, checksum(raw)));
    }

    @Override
    public Optional<String> checksumAt(String location) {
        return Optional.ofNullable(documents.get(location)).map(this::checksum);
    }

    private String checksum(Map<String, Object> raw) {
        return checksumEngine.digest(String.valueOf(raw).getBytes(StandardCharsets.UTF_8));
    }
}
