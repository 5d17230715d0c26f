package com.github.alvarosanchez.spr.resolve;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoized resolutions keyed by config key and the location of the file the key was resolved to.
 *
 * <p>Entries are immutable and replaced atomically per key. Concurrent first computations of the same key may both
 * complete; the last write wins.
 */
public final class ResolutionCache {

    private static final Logger LOG = LoggerFactory.getLogger(ResolutionCache.class);

    private final Map<Slot, Resolution> entries = new ConcurrentHashMap<>();

    public Optional<Resolution> get(ConfigKey key, String location) {
        return Optional.ofNullable(entries.get(new Slot(key, location)));
    }

    public void put(ConfigKey key, String location, Resolution resolution) {
        entries.put(new Slot(key, location), resolution);
    }

    /**
     * Evicts a single entry, only if it still holds the given resolution.
     *
     * @param key config key
     * @param location location the key was resolved to
     * @param stale resolution found to be out of date
     */
    public void evict(ConfigKey key, String location, Resolution stale) {
        if (entries.remove(new Slot(key, location), stale)) {
            LOG.debug("Evicted stale resolution for {} at {}", key, location);
        }
    }

    /**
     * Evicts every entry derived from the file at a location, directly or through a parent.
     *
     * @param location repository-relative location of a changed file
     * @return number of evicted entries
     */
    public int invalidateLocation(String location) {
        int before = entries.size();
        entries.values().removeIf(resolution -> resolution.checksums().containsKey(location));
        int evicted = before - entries.size();
        if (evicted > 0) {
            LOG.debug("Evicted {} resolution(s) depending on {}", evicted, location);
        }
        return evicted;
    }

    public void invalidateAll() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private record Slot(ConfigKey key, String location) {
    }
}
