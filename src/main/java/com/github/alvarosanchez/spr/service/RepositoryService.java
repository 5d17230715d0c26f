package com.github.alvarosanchez.spr.service;

import com.github.alvarosanchez.spr.manifest.Manifest;
import com.github.alvarosanchez.spr.registry.RegistryFile;
import com.github.alvarosanchez.spr.registry.RegistryFile.RepositoryEntry;
import io.micronaut.serde.ObjectMapper;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service that manages the registry of trusted local repositories.
 *
 * <p>Adding a repository pins its {@code public-key.asc} by copying it into the config directory. Later reads verify
 * the repository against the pinned copy, never against the key currently shipped in the repository.
 */
@Singleton
public final class RepositoryService {

    private static final Logger LOG = LoggerFactory.getLogger(RepositoryService.class);

    private final ObjectMapper objectMapper;
    private final ManifestService manifestService;

    RepositoryService(ObjectMapper objectMapper, ManifestService manifestService) {
        this.objectMapper = objectMapper;
        this.manifestService = manifestService;
    }

    /**
     * Loads registered repositories.
     *
     * @return repository entries
     */
    public List<RepositoryEntry> load() {
        return loadRegistry().repositories();
    }

    /**
     * Registers a local repository after pinning and checking its public key.
     *
     * @param repositoryPath repository root, absolute or relative to the working directory
     * @return added repository entry
     */
    public RepositoryEntry add(String repositoryPath) {
        String path = repositoryPath == null ? "" : repositoryPath.trim();
        if (path.isBlank()) {
            throw new IllegalStateException("Repository path is required.");
        }
        Path root = workingDirectory().resolve(path).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IllegalStateException("Repository directory does not exist: " + root);
        }
        Path shippedKey = root.resolve(ManifestService.PUBLIC_KEY_FILE);
        if (!Files.isRegularFile(shippedKey)) {
            throw new IllegalStateException("Repository has no " + ManifestService.PUBLIC_KEY_FILE + ": " + root);
        }

        String repositoryName = root.getFileName() == null ? "" : root.getFileName().toString();
        List<RepositoryEntry> repositories = new ArrayList<>(load());
        for (RepositoryEntry repository : repositories) {
            if (repository.name().equals(repositoryName)) {
                throw new IllegalStateException("Repository `" + repositoryName + "` is already configured.");
            }
        }

        byte[] publicKey = read(shippedKey);
        Manifest manifest = manifestService.verify(root, publicKey);

        Path pinnedKey = keysDirectory().resolve(repositoryName + ".asc");
        try {
            Files.createDirectories(pinnedKey.getParent());
            Files.copy(shippedKey, pinnedKey, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to pin public key of " + repositoryName, e);
        }

        RepositoryEntry added = new RepositoryEntry(repositoryName, manifest.namespace(), root.toString(), pinnedKey.toString());
        repositories.add(added);
        saveRegistry(new RegistryFile(repositories));
        LOG.info("Registered repository {} ({}) from {}", repositoryName, manifest.namespace(), root);
        return added;
    }

    /**
     * Removes a repository from the registry and deletes its pinned key. The repository itself is left untouched.
     *
     * @param repositoryName repository name to delete
     * @return deleted repository entry
     */
    public RepositoryEntry delete(String repositoryName) {
        if (repositoryName == null || repositoryName.isBlank()) {
            throw new IllegalStateException("Repository name is required.");
        }

        RepositoryEntry deletedRepository = null;
        List<RepositoryEntry> remaining = new ArrayList<>();
        for (RepositoryEntry repository : load()) {
            if (repository.name().equals(repositoryName)) {
                deletedRepository = repository;
                continue;
            }
            remaining.add(repository);
        }

        if (deletedRepository == null) {
            throw new IllegalStateException("Repository `" + repositoryName + "` is not configured.");
        }

        saveRegistry(new RegistryFile(remaining));
        try {
            Files.deleteIfExists(Path.of(deletedRepository.publicKey()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete pinned key of " + repositoryName, e);
        }
        return deletedRepository;
    }

    /**
     * Verifies a registered repository against its pinned key.
     *
     * @param repository registered repository
     * @return verified manifest
     */
    public Manifest verify(RepositoryEntry repository) {
        return manifestService.verify(Path.of(repository.localPath()), read(Path.of(repository.publicKey())));
    }

    RegistryFile loadRegistry() {
        Path file = registryFile();
        if (!Files.exists(file)) {
            return new RegistryFile(List.of());
        }
        try {
            String content = Files.readString(file);
            return objectMapper.readValue(content, RegistryFile.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read repository registry", e);
        }
    }

    void saveRegistry(RegistryFile registryFile) {
        try {
            Files.createDirectories(configDirectory());
            Files.writeString(registryFile(), objectMapper.writeValueAsString(registryFile));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write repository registry", e);
        }
    }

    private static byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private Path registryFile() {
        return configDirectory().resolve("config.json");
    }

    private Path keysDirectory() {
        return configDirectory().resolve("keys");
    }

    static Path configDirectory() {
        String configuredPath = System.getProperty("spr.config.dir");
        if (configuredPath != null && !configuredPath.isBlank()) {
            return Path.of(configuredPath);
        }
        return Path.of(System.getProperty("user.home"), ".config", "spr");
    }

    static Path cacheDirectory() {
        String configuredPath = System.getProperty("spr.cache.dir");
        if (configuredPath != null && !configuredPath.isBlank()) {
            return Path.of(configuredPath);
        }
        return Path.of(System.getProperty("user.home"), ".cache", "spr");
    }

    static Path workingDirectory() {
        String configuredPath = System.getProperty("spr.working.dir");
        if (configuredPath != null && !configuredPath.isBlank()) {
            return Path.of(configuredPath);
        }
        return Path.of(System.getProperty("user.dir"));
    }
}
