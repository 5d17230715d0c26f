package com.github.alvarosanchez.spr.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Signed index of the profiles and file checksums of a repository.
 *
 * @param specVersion manifest format version
 * @param namespace repository namespace
 * @param profiles tracked profiles
 * @param checksums repository-relative path to {@code sha256:<hex>} digest, sorted by path
 * @param extra top-level fields not owned by the build pipeline
 */
public record Manifest(
    String specVersion,
    String namespace,
    List<ProfileEntry> profiles,
    SortedMap<String, String> checksums,
    Map<String, Object> extra
) {

    public Manifest {
        profiles = profiles == null ? List.of() : List.copyOf(profiles);
        checksums = Collections.unmodifiableSortedMap(checksums == null ? new TreeMap<>() : new TreeMap<>(checksums));
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    /**
     * Finds a profile by uuid.
     *
     * @param uuid profile uuid
     * @return matching profile, or empty
     */
    public Optional<ProfileEntry> profile(String uuid) {
        return profiles.stream().filter(profile -> profile.uuid().equals(uuid)).findFirst();
    }

    /**
     * Lists manifest invariant violations: profile paths without a checksum.
     *
     * @return paths referenced by profiles but absent from {@code checksums}
     */
    public List<String> pathsWithoutChecksum() {
        return profiles.stream().map(ProfileEntry::path).filter(path -> !checksums.containsKey(path)).toList();
    }
}
