package com.github.alvarosanchez.spr.resolve;

import com.github.alvarosanchez.spr.config.ConfigDocument;
import com.github.alvarosanchez.spr.config.ConfigMerger;
import com.github.alvarosanchez.spr.config.ConfigMerger.Merged;
import com.github.alvarosanchez.spr.config.ConfigValue;
import com.github.alvarosanchez.spr.config.ScalarValue;
import com.github.alvarosanchez.spr.resolve.Resolution.ChainLink;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves multi-level config inheritance into merged configs with provenance.
 *
 * <p>Parents are resolved depth-first by following {@code inherits}/{@code from} upwards. A node of the graph is a
 * file, so cycles are detected by location and results are cached per key and location. Cached results are tagged
 * with the checksums of every file in their chain and used only while all of those checksums are unchanged. Instances are safe for concurrent use against an immutable snapshot.
 */
public final class DependencyResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyResolver.class);

    private final ConfigStore store;
    private final ResolutionCache cache;
    private final int defaultMaxDepth;

    /**
     * Creates a resolver.
     *
     * @param store config lookup
     * @param cache shared resolution cache
     * @param defaultMaxDepth maximum number of inheritance edges when none is requested
     */
    public DependencyResolver(ConfigStore store, ResolutionCache cache, int defaultMaxDepth) {
        if (defaultMaxDepth < 0) {
            throw new IllegalArgumentException("Maximum depth must not be negative: " + defaultMaxDepth);
        }
        this.store = store;
        this.cache = cache;
        this.defaultMaxDepth = defaultMaxDepth;
    }

    public Resolution resolve(ConfigKey key) {
        return resolve(key, defaultMaxDepth);
    }

    /**
     * Resolves a config referenced by scope and name.
     *
     * @param key config to resolve
     * @param maxDepth maximum number of inheritance edges
     * @return merged config, source map and chain
     * @throws ResolutionException when the config or one of its parents cannot be resolved
     */
    public Resolution resolve(ConfigKey key, int maxDepth) {
        StoredConfig stored = store.find(key).orElseThrow(() -> new ConfigNotFoundException(key.toString(), List.of()));
        return resolve(stored, maxDepth);
    }

    /**
     * Resolves a config addressed by its file path.
     *
     * @param slicer slicer directory
     * @param type profile type directory
     * @param path file path within the type directory
     * @param maxDepth maximum number of inheritance edges
     * @return merged config, source map and chain
     * @throws ResolutionException when the config or one of its parents cannot be resolved
     */
    public Resolution resolvePath(String slicer, String type, String path, int maxDepth) {
        StoredConfig stored = store
            .findByPath(slicer, type, path)
            .orElseThrow(() -> new ConfigNotFoundException(slicer + "/" + type + "/" + path, List.of()));
        return resolve(stored, maxDepth);
    }

    public int defaultMaxDepth() {
        return defaultMaxDepth;
    }

    public ResolutionCache cache() {
        return cache;
    }

    private Resolution resolve(StoredConfig stored, int maxDepth) {
        return resolveNode(stored, new ArrayDeque<>(), new HashSet<>(), maxDepth);
    }

    private Resolution resolveNode(StoredConfig stored, Deque<StoredConfig> path, Set<String> visiting, int maxDepth) {
        Optional<Resolution> cached = currentCacheEntry(stored);
        if (cached.isPresent() && path.size() + cached.get().links().size() - 1 <= maxDepth) {
            return cached.get();
        }
        if (!visiting.add(stored.location())) {
            throw new CircularDependencyException(cycle(path, stored));
        }
        path.addLast(stored);
        try {
            Resolution resolution = stored.document().inherits().isEmpty()
                ? resolveRoot(stored)
                : resolveChild(stored, path, visiting, maxDepth);
            cache.put(stored.key(), stored.location(), resolution);
            return resolution;
        } finally {
            path.removeLast();
            visiting.remove(stored.location());
        }
    }

    private Resolution resolveRoot(StoredConfig stored) {
        String name = stored.key().name();
        Merged root = ConfigMerger.root(stored.document().settings(), name);
        return new Resolution(root.tree(), root.sourceMap(), List.of(link(stored)));
    }

    private Resolution resolveChild(StoredConfig stored, Deque<StoredConfig> path, Set<String> visiting, int maxDepth) {
        ConfigKey parentKey = parentKey(stored, path);
        StoredConfig parent = store.find(parentKey).orElseThrow(() -> {
            List<String> chain = names(path);
            chain.add(parentKey.name());
            return new ConfigNotFoundException(parentKey.toString(), chain);
        });
        if (visiting.contains(parent.location())) {
            throw new CircularDependencyException(cycle(path, parent));
        }
        if (path.size() > maxDepth) {
            List<String> chain = names(path);
            chain.add(parentKey.name());
            throw new DepthExceededException(maxDepth, chain);
        }
        Resolution parentResolution = resolveNode(parent, path, visiting, maxDepth);

        Merged merged = ConfigMerger.merge(
            new Merged(parentResolution.resolvedConfig(), parentResolution.sourceMap()),
            stored.document().settings(),
            stored.key().name()
        );
        List<ChainLink> links = new ArrayList<>(parentResolution.links());
        links.add(link(stored));
        return new Resolution(merged.tree(), merged.sourceMap(), links);
    }

    private ConfigKey parentKey(StoredConfig stored, Deque<StoredConfig> path) {
        ConfigDocument document = stored.document();
        ConfigValue inherits = document.inherits().orElseThrow();
        if (!(inherits instanceof ScalarValue scalar) || !(scalar.value() instanceof String parentName)) {
            throw new InvalidInheritanceException(
                "Config `" + stored.key().name() + "` declares a non-text `inherits` value.",
                names(path)
            );
        }
        String trimmedName = parentName.trim();
        if (trimmedName.contains("/") || trimmedName.contains("\\") || trimmedName.contains("..")) {
            throw new InvalidInheritanceException(
                "Config `" + stored.key().name() + "` inherits from an invalid name `" + trimmedName + "`.",
                names(path)
            );
        }

        Scope parentScope = Scope.SYSTEM;
        Optional<ConfigValue> from = document.from();
        if (from.isPresent()) {
            Optional<Scope> parsed = from.get() instanceof ScalarValue fromScalar && fromScalar.value() instanceof String text
                ? Scope.parse(text)
                : Optional.empty();
            if (parsed.isEmpty()) {
                throw new InvalidInheritanceException(
                    "Config `" + stored.key().name() + "` declares an unknown `from` scope: " + from.get().toPlain(),
                    names(path)
                );
            }
            parentScope = parsed.get();
        }
        return new ConfigKey(stored.key().slicer(), stored.key().type(), parentScope, trimmedName);
    }

    private Optional<Resolution> currentCacheEntry(StoredConfig stored) {
        Optional<Resolution> cached = cache.get(stored.key(), stored.location());
        if (cached.isEmpty()) {
            return cached;
        }
        for (Map.Entry<String, String> entry : cached.get().checksums().entrySet()) {
            Optional<String> current = store.checksumAt(entry.getKey());
            if (current.isEmpty() || !current.get().equals(entry.getValue())) {
                LOG.debug("Cached resolution for {} is stale: {} changed", stored.key(), entry.getKey());
                cache.evict(stored.key(), stored.location(), cached.get());
                return Optional.empty();
            }
        }
        return cached;
    }

    private static ChainLink link(StoredConfig stored) {
        return new ChainLink(stored.key().name(), stored.key(), stored.location(), stored.checksum(), stored.document());
    }

    private static List<String> cycle(Deque<StoredConfig> path, StoredConfig repeated) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (StoredConfig node : path) {
            if (node.location().equals(repeated.location())) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(node.key().name());
            }
        }
        cycle.add(repeated.key().name());
        return cycle;
    }

    private static List<String> names(Deque<StoredConfig> path) {
        List<String> names = new ArrayList<>();
        for (StoredConfig node : path) {
            names.add(node.key().name());
        }
        return names;
    }
}
