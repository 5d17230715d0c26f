package com.github.alvarosanchez.spr.service;

import com.github.alvarosanchez.spr.SprConfiguration;
import com.github.alvarosanchez.spr.checksum.ChecksumEngine;
import com.github.alvarosanchez.spr.config.ConfigDocument;
import com.github.alvarosanchez.spr.config.ConfigValue;
import com.github.alvarosanchez.spr.resolve.DependencyResolver;
import com.github.alvarosanchez.spr.resolve.FileSystemConfigStore;
import com.github.alvarosanchez.spr.resolve.Resolution;
import com.github.alvarosanchez.spr.resolve.Resolution.ChainLink;
import com.github.alvarosanchez.spr.resolve.ResolutionCache;
import com.github.alvarosanchez.spr.service.DependencyReport.ConfigNode;
import com.github.alvarosanchez.spr.service.DependencyReport.TreeNode;
import io.micronaut.serde.ObjectMapper;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers resolution queries against repositories on disk.
 *
 * <p>One resolver, with its own cache, is kept per repository root for the life of the process.
 */
@Singleton
public final class ResolutionService {

    private final ObjectMapper objectMapper;
    private final ChecksumEngine checksumEngine;
    private final SprConfiguration configuration;
    private final Map<Path, DependencyResolver> resolvers = new ConcurrentHashMap<>();

    ResolutionService(ObjectMapper objectMapper, ChecksumEngine checksumEngine, SprConfiguration configuration) {
        this.objectMapper = objectMapper;
        this.checksumEngine = checksumEngine;
        this.configuration = configuration;
    }

    /**
     * Returns the root of the repository configured for the read API.
     *
     * @return configured repository root
     */
    public Path defaultRepository() {
        return Path.of(configuration.getRepository().getRoot());
    }

    /**
     * Resolves the config stored at {@code <slicer>/<type>/<path>}.
     *
     * @param repositoryRoot repository root
     * @param slicer slicer directory
     * @param type profile type directory
     * @param path file path within the type directory
     * @param depth maximum inheritance depth, or {@code null} for the configured default
     * @return resolution
     */
    public Resolution resolve(Path repositoryRoot, String slicer, String type, String path, Integer depth) {
        DependencyResolver resolver = resolver(repositoryRoot);
        int maxDepth = depth == null ? resolver.defaultMaxDepth() : depth;
        if (maxDepth < 0) {
            throw new IllegalArgumentException("Depth must not be negative: " + maxDepth);
        }
        return resolver.resolvePath(slicer, type, path, maxDepth);
    }

    /**
     * Describes the inheritance dependencies of a config.
     *
     * @param repositoryRoot repository root
     * @param slicer slicer directory
     * @param type profile type directory
     * @param path file path within the type directory
     * @param tree whether to include the nested dependency tree
     * @param depth maximum inheritance depth, or {@code null} for the configured default
     * @param includeMetadata whether to include checksums and metadata sections
     * @return dependency report
     */
    public DependencyReport dependencies(
        Path repositoryRoot,
        String slicer,
        String type,
        String path,
        boolean tree,
        Integer depth,
        boolean includeMetadata
    ) {
        Resolution resolution = resolve(repositoryRoot, slicer, type, path, depth);
        List<ChainLink> links = resolution.links();
        List<ConfigNode> dependencies = new ArrayList<>();
        for (ChainLink link : links.subList(0, links.size() - 1)) {
            dependencies.add(node(link, includeMetadata));
        }

        TreeNode dependencyTree = null;
        if (tree) {
            for (ChainLink link : links) {
                dependencyTree = new TreeNode(
                    link.name(),
                    link.location(),
                    dependencyTree == null ? List.of() : List.of(dependencyTree)
                );
            }
        }
        return new DependencyReport(
            node(resolution.target(), includeMetadata),
            dependencies,
            resolution.inheritanceChain(),
            dependencyTree
        );
    }

    /**
     * Returns the resolved view of a config.
     *
     * @param repositoryRoot repository root
     * @param slicer slicer directory
     * @param type profile type directory
     * @param path file path within the type directory
     * @param includeSourceMap whether to include per-field provenance
     * @param validate whether to run structural checks
     * @return resolved view
     */
    @SuppressWarnings("unchecked")
    public ResolvedView resolved(
        Path repositoryRoot,
        String slicer,
        String type,
        String path,
        boolean includeSourceMap,
        boolean validate
    ) {
        Resolution resolution = resolve(repositoryRoot, slicer, type, path, null);
        List<String> validationErrors = null;
        if (validate) {
            validationErrors = new ArrayList<>();
            if (resolution.resolvedConfig().text(ConfigDocument.NAME).filter(name -> !name.isBlank()).isEmpty()) {
                validationErrors.add("Resolved config has no `name`.");
            }
            if (!resolution.instantiable()) {
                validationErrors.add("Config `" + resolution.target().name() + "` is not instantiable.");
            }
        }
        return new ResolvedView(
            (Map<String, Object>) resolution.resolvedConfig().toPlain(),
            resolution.inheritanceChain(),
            resolution.instantiable(),
            includeSourceMap ? resolution.sourceMap() : null,
            validationErrors
        );
    }

    /**
     * Drops every cached resolution of a repository.
     *
     * @param repositoryRoot repository root
     */
    public void invalidate(Path repositoryRoot) {
        DependencyResolver resolver = resolvers.get(normalize(repositoryRoot));
        if (resolver != null) {
            resolver.cache().invalidateAll();
        }
    }

    DependencyResolver resolver(Path repositoryRoot) {
        return resolvers.computeIfAbsent(
            normalize(repositoryRoot),
            root -> new DependencyResolver(
                new FileSystemConfigStore(root, configuration.getRepository().getConfigsDir(), objectMapper, checksumEngine),
                new ResolutionCache(),
                configuration.getResolver().getMaxDepth()
            )
        );
    }

    @SuppressWarnings("unchecked")
    private static ConfigNode node(ChainLink link, boolean includeMetadata) {
        ConfigDocument document = link.document();
        return new ConfigNode(
            link.name(),
            link.location(),
            document.inherits().map(ResolutionService::text).orElse(null),
            document.from().map(ResolutionService::text).orElse(null),
            includeMetadata ? link.checksum() : null,
            includeMetadata ? (Map<String, Object>) document.metadata().toPlain() : null
        );
    }

    private static String text(ConfigValue value) {
        return String.valueOf(value.toPlain());
    }

    private static Path normalize(Path repositoryRoot) {
        return repositoryRoot.toAbsolutePath().normalize();
    }
}
