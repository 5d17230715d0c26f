package com.github.alvarosanchez.spr.resolve;

import com.github.alvarosanchez.spr.checksum.ChecksumEngine;
import com.github.alvarosanchez.spr.config.ConfigDocument;
import io.micronaut.core.type.Argument;
import io.micronaut.serde.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Config store reading JSON files below {@code <repository>/<configs-dir>}.
 *
 * <p>Targets are addressed as {@code <slicer>/<type>/<path>}; named bases are searched with the
 * {@link Scope#searchPaths(String, String, String) search path} of their scope. Locations reported by this store are
 * relative to the repository root, the same form manifest checksums are keyed by.
 */
public final class FileSystemConfigStore implements ConfigStore {

    private static final Argument<Map<String, Object>> JSON_OBJECT = Argument.mapOf(String.class, Object.class);

    private final Path repositoryRoot;
    private final Path configsRoot;
    private final String configsDirectory;
    private final ObjectMapper objectMapper;
    private final ChecksumEngine checksumEngine;

    /**
     * Creates a store for a repository.
     *
     * @param repositoryRoot repository root directory
     * @param configsDirectory config tree directory below the root
     * @param objectMapper JSON mapper
     * @param checksumEngine digest used to tag documents
     */
    public FileSystemConfigStore(
        Path repositoryRoot,
        String configsDirectory,
        ObjectMapper objectMapper,
        ChecksumEngine checksumEngine
    ) {
        this.repositoryRoot = repositoryRoot.toAbsolutePath().normalize();
        this.configsRoot = this.repositoryRoot.resolve(configsDirectory).normalize();
        this.configsDirectory = configsDirectory;
        this.objectMapper = objectMapper;
        this.checksumEngine = checksumEngine;
    }

    @Override
    public Optional<StoredConfig> find(ConfigKey key) {
        for (String candidate : key.scope().searchPaths(key.slicer(), key.type(), key.name())) {
            Optional<Path> file = insideConfigs(candidate);
            if (file.isPresent() && Files.isRegularFile(file.get())) {
                return Optional.of(load(key, file.get()));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<StoredConfig> findByPath(String slicer, String type, String path) {
        String relativePath = slicer + "/" + type + "/" + path;
        Optional<Path> file = insideConfigs(relativePath);
        if (file.isEmpty() || !Files.isRegularFile(file.get())) {
            return Optional.empty();
        }

        byte[] content = read(file.get());
        ConfigDocument document = parse(content, location(file.get()));
        String name = document.name().orElseGet(() -> stem(file.get()));
        String withinConfigs = configsRoot.relativize(file.get()).toString().replace('\\', '/');
        ConfigKey key = new ConfigKey(slicer, type, Scope.ofLocation(withinConfigs), name);
        return Optional.of(new StoredConfig(key, location(file.get()), document, checksumEngine.digest(content)));
    }

    @Override
    public Optional<String> checksumAt(String location) {
        Path file = repositoryRoot.resolve(location).normalize();
        if (!file.startsWith(repositoryRoot) || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(checksumEngine.digest(read(file)));
    }

    public Path repositoryRoot() {
        return repositoryRoot;
    }

    public String configsDirectory() {
        return configsDirectory;
    }

    private StoredConfig load(ConfigKey key, Path file) {
        byte[] content = read(file);
        return new StoredConfig(key, location(file), parse(content, location(file)), checksumEngine.digest(content));
    }

    private ConfigDocument parse(byte[] content, String location) {
        try {
            Map<String, Object> raw = objectMapper.readValue(content, JSON_OBJECT);
            if (raw == null) {
                throw new MalformedConfigException(location, null);
            }
            return ConfigDocument.of(raw);
        } catch (IOException | IllegalArgumentException | ClassCastException e) {
            throw new MalformedConfigException(location, e);
        }
    }

    private Optional<Path> insideConfigs(String relativePath) {
        Path file = configsRoot.resolve(relativePath).normalize();
        if (!file.startsWith(configsRoot)) {
            return Optional.empty();
        }
        return Optional.of(file);
    }

    private String location(Path file) {
        return repositoryRoot.relativize(file).toString().replace('\\', '/');
    }

    private static String stem(Path file) {
        String fileName = file.getFileName().toString();
        int extension = fileName.lastIndexOf('.');
        return extension > 0 ? fileName.substring(0, extension) : fileName;
    }

    private static byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config file " + file, e);
        }
    }
}
