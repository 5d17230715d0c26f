package com.github.alvarosanchez.spr.manifest;

import io.micronaut.core.type.Argument;
import io.micronaut.serde.ObjectMapper;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads manifests and writes their canonical byte form.
 *
 * <p>The byte form written here is the one that gets signed. Known fields are emitted in a fixed order, profiles keep
 * their list order, checksums are sorted by path, and fields the pipeline does not own are appended after the known
 * ones. Equal manifests always produce equal bytes.
 */
@Singleton
public final class ManifestCodec {

    static final String SPEC_VERSION = "spec_version";
    static final String NAMESPACE = "namespace";
    static final String PROFILES = "profiles";
    static final String CHECKSUMS = "checksums";

    static final String UUID = "uuid";
    static final String NAME = "name";
    static final String TYPE = "type";
    static final String SLICER = "slicer";
    static final String VERSION = "version";
    static final String PATH = "path";
    static final String DEPENDENCIES = "dependencies";
    static final String LAST_UPDATED = "last_updated";

    private static final Set<String> MANIFEST_FIELDS = Set.of(SPEC_VERSION, NAMESPACE, PROFILES, CHECKSUMS);
    private static final Set<String> PROFILE_FIELDS = Set.of(
        UUID, NAME, TYPE, SLICER, VERSION, PATH, DEPENDENCIES, LAST_UPDATED
    );
    private static final Argument<Map<String, Object>> JSON_OBJECT = Argument.mapOf(String.class, Object.class);

    private final ObjectMapper objectMapper;

    ManifestCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses manifest bytes.
     *
     * @param content manifest JSON
     * @return parsed manifest
     * @throws IllegalStateException when required fields are missing or have the wrong type
     */
    public Manifest read(byte[] content) {
        Map<String, Object> raw;
        try {
            raw = objectMapper.readValue(content, JSON_OBJECT);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse manifest JSON", e);
        }
        if (raw == null) {
            throw new IllegalStateException("Manifest is empty.");
        }

        List<ProfileEntry> profiles = new ArrayList<>();
        for (Object rawProfile : list(raw.get(PROFILES), PROFILES)) {
            profiles.add(readProfile(map(rawProfile, PROFILES + "[]")));
        }

        Map<String, String> checksums = new TreeMap<>();
        for (Map.Entry<String, Object> entry : map(raw.getOrDefault(CHECKSUMS, Map.of()), CHECKSUMS).entrySet()) {
            checksums.put(entry.getKey(), text(entry.getValue(), CHECKSUMS + "." + entry.getKey(), true));
        }

        return new Manifest(
            text(raw.get(SPEC_VERSION), SPEC_VERSION, true),
            text(raw.get(NAMESPACE), NAMESPACE, true),
            profiles,
            new TreeMap<>(checksums),
            unknownFields(raw, MANIFEST_FIELDS)
        );
    }

    /**
     * Serializes a manifest into its canonical bytes.
     *
     * @param manifest manifest to serialize
     * @return canonical JSON bytes
     */
    public byte[] write(Manifest manifest) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(SPEC_VERSION, manifest.specVersion());
        document.put(NAMESPACE, manifest.namespace());
        List<Object> profiles = new ArrayList<>();
        for (ProfileEntry profile : manifest.profiles()) {
            profiles.add(writeProfile(profile));
        }
        document.put(PROFILES, profiles);
        document.put(CHECKSUMS, new LinkedHashMap<>(manifest.checksums()));
        manifest.extra().forEach(document::putIfAbsent);
        try {
            return objectMapper.writeValueAsBytes(document);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize manifest", e);
        }
    }

    private ProfileEntry readProfile(Map<String, Object> raw) {
        List<String> dependencies = new ArrayList<>();
        for (Object dependency : list(raw.getOrDefault(DEPENDENCIES, List.of()), DEPENDENCIES)) {
            dependencies.add(text(dependency, DEPENDENCIES + "[]", true));
        }
        return new ProfileEntry(
            text(raw.get(UUID), UUID, true),
            text(raw.get(NAME), NAME, true),
            text(raw.get(TYPE), TYPE, false),
            text(raw.get(SLICER), SLICER, false),
            text(raw.get(VERSION), VERSION, true),
            text(raw.get(PATH), PATH, true),
            dependencies,
            text(raw.get(LAST_UPDATED), LAST_UPDATED, false),
            unknownFields(raw, PROFILE_FIELDS)
        );
    }

    private Map<String, Object> writeProfile(ProfileEntry profile) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(UUID, profile.uuid());
        document.put(NAME, profile.name());
        document.put(TYPE, profile.type());
        document.put(SLICER, profile.slicer());
        document.put(VERSION, profile.version());
        document.put(PATH, profile.path());
        document.put(DEPENDENCIES, profile.dependencies());
        document.put(LAST_UPDATED, profile.lastUpdated());
        profile.extra().forEach(document::putIfAbsent);
        return document;
    }

    private static Map<String, Object> unknownFields(Map<String, Object> raw, Set<String> knownFields) {
        Map<String, Object> unknown = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            if (!knownFields.contains(entry.getKey())) {
                unknown.put(entry.getKey(), entry.getValue());
            }
        }
        return unknown;
    }

    private static String text(Object value, String field, boolean required) {
        if (value == null) {
            if (required) {
                throw new IllegalStateException("Manifest field `" + field + "` is required.");
            }
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalStateException("Manifest field `" + field + "` must be a string.");
        }
        return text;
    }

    private static List<?> list(Object value, String field) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalStateException("Manifest field `" + field + "` must be an array.");
        }
        return list;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object value, String field) {
        if (!(value instanceof Map<?, ?>)) {
            throw new IllegalStateException("Manifest field `" + field + "` must be an object.");
        }
        return (Map<String, Object>) value;
    }
}
