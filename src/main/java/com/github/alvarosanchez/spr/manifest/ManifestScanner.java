package com.github.alvarosanchez.spr.manifest;

import com.github.alvarosanchez.spr.checksum.ChecksumEngine;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Walks a config tree and classifies every file against the previous manifest.
 */
@Singleton
public final class ManifestScanner {

    private final ChecksumEngine checksumEngine;

    ManifestScanner(ChecksumEngine checksumEngine) {
        this.checksumEngine = checksumEngine;
    }

    /**
     * Lists config files below {@code <repositoryRoot>/<configsDirectory>}, sorted by path.
     *
     * <p>Hidden files and directories, documentation ({@code .md}) and signatures ({@code .sig}) are skipped.
     *
     * @param repositoryRoot repository root
     * @param configsDirectory config tree directory below the root
     * @return scanned files with repository-relative paths
     */
    public List<ScannedFile> scan(Path repositoryRoot, String configsDirectory) {
        Path root = repositoryRoot.toAbsolutePath().normalize();
        Path configsRoot = root.resolve(configsDirectory).normalize();
        if (!Files.isDirectory(configsRoot)) {
            throw new ManifestBuildException("Config directory does not exist: " + configsRoot);
        }

        List<ScannedFile> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(configsRoot)) {
            List<Path> candidates = walk
                .filter(Files::isRegularFile)
                .filter(file -> isTracked(configsRoot.relativize(file)))
                .sorted(Comparator.comparing(file -> relativePath(root, file)))
                .toList();
            for (Path file : candidates) {
                files.add(new ScannedFile(relativePath(root, file), checksumEngine.digest(file)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan config directory " + configsRoot, e);
        }
        return files;
    }

    /**
     * Classifies scanned files against the previous manifest.
     *
     * @param files scanned files
     * @param previous previous manifest, or {@code null} on the first build
     * @return classification plus tracked paths that disappeared
     */
    public ScanResult diff(List<ScannedFile> files, Manifest previous) {
        Set<String> trackedPaths = new HashSet<>();
        Map<String, String> previousChecksums = new HashMap<>();
        if (previous != null) {
            for (ProfileEntry profile : previous.profiles()) {
                trackedPaths.add(profile.path());
            }
            previousChecksums.putAll(previous.checksums());
        }

        List<FileChange> changes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ScannedFile file : files) {
            seen.add(file.path());
            String previousChecksum = previousChecksums.get(file.path());
            if (!trackedPaths.contains(file.path())) {
                changes.add(new FileChange(ChangeKind.NEW, file.path(), file.checksum(), null));
            } else if (!file.checksum().equals(previousChecksum)) {
                changes.add(new FileChange(ChangeKind.MODIFIED, file.path(), file.checksum(), previousChecksum));
            } else {
                changes.add(new FileChange(ChangeKind.UNCHANGED, file.path(), file.checksum(), previousChecksum));
            }
        }

        List<String> missing = new ArrayList<>();
        if (previous != null) {
            for (ProfileEntry profile : previous.profiles()) {
                if (!seen.contains(profile.path())) {
                    missing.add(profile.path());
                }
            }
        }
        return new ScanResult(changes, missing);
    }

    private static boolean isTracked(Path relativeToConfigs) {
        for (Path segment : relativeToConfigs) {
            if (segment.toString().startsWith(".")) {
                return false;
            }
        }
        String fileName = relativeToConfigs.getFileName().toString();
        return !fileName.endsWith(".md") && !fileName.endsWith(".sig");
    }

    private static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
