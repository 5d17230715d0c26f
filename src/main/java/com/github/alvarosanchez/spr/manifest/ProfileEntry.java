package com.github.alvarosanchez.spr.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Profile tracked by a manifest.
 *
 * <p>{@code uuid} is assigned once and is the only stable cross-reference. {@code dependencies} and every field in
 * {@code extra} are maintained by hand and are carried forward unchanged on every rebuild.
 *
 * @param uuid stable profile identity
 * @param name display name
 * @param type profile type, for example {@code printer}, {@code filament} or {@code process}
 * @param slicer slicer identifier
 * @param version semantic version of the file content
 * @param path repository-relative path of the profile file
 * @param dependencies uuids of profiles this profile needs, in order
 * @param lastUpdated ISO-8601 instant of the last content change
 * @param extra fields not owned by the build pipeline
 */
public record ProfileEntry(
    String uuid,
    String name,
    String type,
    String slicer,
    String version,
    String path,
    List<String> dependencies,
    String lastUpdated,
    Map<String, Object> extra
) {

    public ProfileEntry {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    /**
     * Returns a copy recording a content change.
     *
     * @param nextVersion bumped version
     * @param updatedAt instant of the change
     * @return updated entry with every other field preserved
     */
    public ProfileEntry withContentChange(String nextVersion, String updatedAt) {
        return new ProfileEntry(uuid, name, type, slicer, nextVersion, path, dependencies, updatedAt, extra);
    }

    /**
     * Returns a copy with a different dependency list.
     *
     * @param nextDependencies dependency uuids
     * @return updated entry
     */
    public ProfileEntry withDependencies(List<String> nextDependencies) {
        return new ProfileEntry(uuid, name, type, slicer, version, path, nextDependencies, lastUpdated, extra);
    }
}
