package com.github.alvarosanchez.spr.resolve;

import java.util.Optional;

/**
 * Read-only access to the config documents of one repository snapshot.
 */
public interface ConfigStore {

    /**
     * Looks up a config by name using the search path of its scope.
     *
     * @param key lookup key
     * @return first matching config, or empty when none exists
     */
    Optional<StoredConfig> find(ConfigKey key);

    /**
     * Loads a config addressed by its path below {@code <slicer>/<type>/}.
     *
     * @param slicer slicer directory
     * @param type profile type directory
     * @param path path of the file within the type directory
     * @return config, or empty when the file does not exist
     */
    Optional<StoredConfig> findByPath(String slicer, String type, String path);

    /**
     * Returns the current checksum of the file at a location previously reported by this store.
     *
     * @param location repository-relative location
     * @return current checksum, or empty when the file no longer exists
     */
    Optional<String> checksumAt(String location);
}
