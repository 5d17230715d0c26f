package com.github.alvarosanchez.spr.service;

import com.github.alvarosanchez.spr.SprConfiguration;
import com.github.alvarosanchez.spr.checksum.ChecksumEngine;
import com.github.alvarosanchez.spr.manifest.ChangeKind;
import com.github.alvarosanchez.spr.manifest.ChecksumMismatchException;
import com.github.alvarosanchez.spr.manifest.FileChange;
import com.github.alvarosanchez.spr.manifest.Manifest;
import com.github.alvarosanchez.spr.manifest.ManifestBuildException;
import com.github.alvarosanchez.spr.manifest.ManifestBuilder;
import com.github.alvarosanchez.spr.manifest.ManifestCodec;
import com.github.alvarosanchez.spr.manifest.ManifestScanner;
import com.github.alvarosanchez.spr.manifest.ManifestSigner;
import com.github.alvarosanchez.spr.manifest.ProfileDecisionProvider;
import com.github.alvarosanchez.spr.manifest.ProfileEntry;
import com.github.alvarosanchez.spr.manifest.ScanResult;
import com.github.alvarosanchez.spr.manifest.ScannedFile;
import com.github.alvarosanchez.spr.manifest.SignatureInvalidException;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes, unpublishes and verifies signed repository manifests.
 *
 * <p>Every write replaces {@code manifest.json}, its signature and, on first publish, the public key together. All
 * content is produced and signed before the first file is touched, and a failed replacement restores the previous
 * files. Concurrent publishes of the same repository are not coordinated; the last writer wins.
 */
@Singleton
public final class ManifestService {

    public static final String MANIFEST_FILE = "manifest.json";
    public static final String SIGNATURE_FILE = "manifest.json.sig";
    public static final String PUBLIC_KEY_FILE = "public-key.asc";

    private static final Logger LOG = LoggerFactory.getLogger(ManifestService.class);

    private final ManifestScanner scanner;
    private final ManifestBuilder builder;
    private final ManifestCodec codec;
    private final ManifestSigner signer;
    private final ChecksumEngine checksumEngine;
    private final SprConfiguration configuration;

    ManifestService(
        ManifestScanner scanner,
        ManifestBuilder builder,
        ManifestCodec codec,
        ManifestSigner signer,
        ChecksumEngine checksumEngine,
        SprConfiguration configuration
    ) {
        this.scanner = scanner;
        this.builder = builder;
        this.codec = codec;
        this.signer = signer;
        this.checksumEngine = checksumEngine;
        this.configuration = configuration;
    }

    /**
     * Scans a repository, builds the next manifest, signs it and writes it.
     *
     * @param repositoryRoot repository root
     * @param keyId signing key identifier
     * @param decisions source of namespace, new-profile metadata and bump kinds
     * @return publish outcome
     * @throws ManifestBuildException when the manifest cannot be built; nothing is written
     */
    public PublishResult publish(Path repositoryRoot, String keyId, ProfileDecisionProvider decisions) {
        Path root = repositoryRoot.toAbsolutePath().normalize();
        String configsDirectory = configuration.getRepository().getConfigsDir();
        Optional<Manifest> previous = readManifest(root);
        if (previous.isPresent()) {
            LOG.info("Loaded manifest with {} profile(s) from {}", previous.get().profiles().size(), root);
        } else {
            LOG.info("No manifest found in {}, creating a new one", root);
        }

        List<ScannedFile> files = scanner.scan(root, configsDirectory);
        ScanResult scan = scanner.diff(files, previous.orElse(null));
        List<FileChange> changes = new ArrayList<>(scan.ofKind(ChangeKind.NEW));
        changes.addAll(scan.ofKind(ChangeKind.MODIFIED));

        if (previous.isPresent()
            && scan.missing().isEmpty()
            && !scan.hasContentChanges()
            && Files.isRegularFile(root.resolve(SIGNATURE_FILE))
        ) {
            LOG.info("No profile changes in {}", root);
            return new PublishResult(previous.get(), List.of(), false);
        }

        Manifest manifest = builder.build(
            scan,
            previous.orElse(null),
            configsDirectory,
            configuration.getManifest().getSpecVersion(),
            decisions
        );
        writeSigned(root, manifest, keyId);
        return new PublishResult(manifest, changes, true);
    }

    /**
     * Removes a profile and its checksum from the manifest and re-signs it. The profile file itself stays on disk.
     *
     * @param repositoryRoot repository root
     * @param uuid uuid of the profile to remove
     * @param keyId signing key identifier
     * @return removed profile
     */
    public ProfileEntry unpublish(Path repositoryRoot, String uuid, String keyId) {
        Path root = repositoryRoot.toAbsolutePath().normalize();
        Manifest previous = readManifest(root)
            .orElseThrow(() -> new IllegalStateException("No manifest found in " + root));
        ProfileEntry removed = previous
            .profile(uuid)
            .orElseThrow(() -> new IllegalStateException("Profile `" + uuid + "` is not published."));

        List<String> dependents = new ArrayList<>();
        for (ProfileEntry profile : previous.profiles()) {
            if (profile.dependencies().contains(uuid)) {
                dependents.add(profile.name());
            }
        }
        if (!dependents.isEmpty()) {
            throw new IllegalStateException(
                "Profile `" + removed.name() + "` is a dependency of: " + String.join(", ", dependents)
            );
        }

        List<ProfileEntry> profiles = new ArrayList<>(previous.profiles());
        profiles.remove(removed);
        Map<String, String> checksums = new TreeMap<>(previous.checksums());
        checksums.remove(removed.path());
        writeSigned(
            root,
            new Manifest(previous.specVersion(), previous.namespace(), profiles, new TreeMap<>(checksums), previous.extra()),
            keyId
        );
        LOG.info("Unpublished profile {} ({})", removed.name(), removed.uuid());
        return removed;
    }

    /**
     * Verifies a repository against its own {@code public-key.asc}.
     *
     * @param repositoryRoot repository root
     * @return the verified manifest
     */
    public Manifest verify(Path repositoryRoot) {
        Path keyFile = repositoryRoot.toAbsolutePath().normalize().resolve(PUBLIC_KEY_FILE);
        if (!Files.isRegularFile(keyFile)) {
            throw new SignatureInvalidException("No public key found at " + keyFile);
        }
        return verify(repositoryRoot, read(keyFile));
    }

    /**
     * Verifies the manifest signature, then every checksum it lists.
     *
     * @param repositoryRoot repository root
     * @param publicKey trusted armored public key
     * @return the verified manifest
     * @throws SignatureInvalidException when the signature is missing or does not verify
     * @throws ChecksumMismatchException when any listed file is missing or altered
     */
    public Manifest verify(Path repositoryRoot, byte[] publicKey) {
        Path root = repositoryRoot.toAbsolutePath().normalize();
        Path manifestFile = root.resolve(MANIFEST_FILE);
        Path signatureFile = root.resolve(SIGNATURE_FILE);
        if (!Files.isRegularFile(manifestFile)) {
            throw new IllegalStateException("No manifest found in " + root);
        }
        if (!Files.isRegularFile(signatureFile)) {
            LOG.error("Manifest signature is missing in {}", root);
            throw new SignatureInvalidException("Manifest signature is missing: " + signatureFile);
        }

        byte[] manifestBytes = read(manifestFile);
        if (!signer.verify(manifestBytes, read(signatureFile), publicKey)) {
            LOG.error("Manifest signature does not verify in {}", root);
            throw new SignatureInvalidException("Manifest signature does not verify for " + manifestFile);
        }

        Manifest manifest = codec.read(manifestBytes);
        verifyFiles(root, manifest, manifest.checksums().keySet());
        return manifest;
    }

    /**
     * Checks files of a verified manifest against their recorded checksums.
     *
     * @param repositoryRoot repository root
     * @param manifest verified manifest
     * @param paths repository-relative paths to check
     * @return the verified bytes of every file, by path, in the given order
     */
    public Map<String, byte[]> verifyFiles(Path repositoryRoot, Manifest manifest, Collection<String> paths) {
        Path root = repositoryRoot.toAbsolutePath().normalize();
        Map<String, byte[]> verified = new LinkedHashMap<>();
        for (String path : paths) {
            String expected = manifest.checksums().get(path);
            Path file = root.resolve(path).normalize();
            if (expected == null
                || !expected.startsWith(ChecksumEngine.ALGORITHM_PREFIX)
                || !file.startsWith(root)
                || !Files.isRegularFile(file)
            ) {
                LOG.error("File {} listed in the manifest of {} is missing", path, root);
                throw new ChecksumMismatchException(path, expected, null);
            }
            byte[] content = read(file);
            if (!checksumEngine.matches(content, expected)) {
                LOG.error("Checksum mismatch for {} in {}", path, root);
                throw new ChecksumMismatchException(path, expected, checksumEngine.digest(content));
            }
            verified.put(path, content);
        }
        return verified;
    }

    /**
     * Reads the manifest of a repository without verifying it.
     *
     * @param repositoryRoot repository root
     * @return manifest, or empty when the repository has none
     */
    public Optional<Manifest> readManifest(Path repositoryRoot) {
        Path manifestFile = repositoryRoot.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifestFile)) {
            return Optional.empty();
        }
        return Optional.of(codec.read(read(manifestFile)));
    }

    private void writeSigned(Path root, Manifest manifest, String keyId) {
        byte[] manifestBytes = codec.write(manifest);
        byte[] signature;
        byte[] publicKey = null;
        try {
            signature = signer.sign(manifestBytes, keyId);
            if (!Files.exists(root.resolve(PUBLIC_KEY_FILE))) {
                publicKey = signer.exportPublicKey(keyId);
            }
        } catch (RuntimeException e) {
            throw new ManifestBuildException("Failed to sign manifest with key " + keyId + ": " + e.getMessage(), e);
        }

        Map<Path, byte[]> outputs = new LinkedHashMap<>();
        outputs.put(root.resolve(MANIFEST_FILE), manifestBytes);
        outputs.put(root.resolve(SIGNATURE_FILE), signature);
        if (publicKey != null) {
            outputs.put(root.resolve(PUBLIC_KEY_FILE), publicKey);
        }
        replaceAll(outputs);
        LOG.info("Wrote signed manifest with {} profile(s) to {}", manifest.profiles().size(), root);
    }

    private void replaceAll(Map<Path, byte[]> outputs) {
        List<Path> targets = new ArrayList<>(outputs.keySet());
        List<Path> stagedFiles = new ArrayList<>();
        List<FileWriteState> writeStates = new ArrayList<>();
        try {
            for (Map.Entry<Path, byte[]> output : outputs.entrySet()) {
                Path staged = sibling(output.getKey(), ".tmp");
                Files.write(staged, output.getValue());
                stagedFiles.add(staged);
            }
            for (int i = 0; i < stagedFiles.size(); i++) {
                Path target = targets.get(i);
                Path backup = null;
                if (Files.exists(target)) {
                    backup = sibling(target, ".bak");
                    Files.move(target, backup, StandardCopyOption.REPLACE_EXISTING);
                }
                writeStates.add(new FileWriteState(target, backup));
                Files.move(stagedFiles.get(i), target, StandardCopyOption.ATOMIC_MOVE);
            }
        } catch (IOException e) {
            IOException rollbackFailure = rollbackWrite(writeStates, stagedFiles);
            if (rollbackFailure != null) {
                e.addSuppressed(rollbackFailure);
            }
            throw new UncheckedIOException("Failed to write manifest files", e);
        }

        for (FileWriteState state : writeStates) {
            if (state.backup() != null) {
                try {
                    Files.deleteIfExists(state.backup());
                } catch (IOException e) {
                    LOG.warn("Failed to delete backup {}", state.backup(), e);
                }
            }
        }
    }

    private IOException rollbackWrite(List<FileWriteState> writeStates, List<Path> stagedFiles) {
        IOException rollbackFailure = null;
        for (FileWriteState state : writeStates) {
            try {
                Files.deleteIfExists(state.target());
                if (state.backup() != null && Files.exists(state.backup())) {
                    Files.move(state.backup(), state.target());
                }
            } catch (IOException e) {
                if (rollbackFailure == null) {
                    rollbackFailure = new IOException("Failed to restore previous manifest files");
                }
                rollbackFailure.addSuppressed(e);
            }
        }
        for (Path staged : stagedFiles) {
            try {
                Files.deleteIfExists(staged);
            } catch (IOException e) {
                if (rollbackFailure == null) {
                    rollbackFailure = new IOException("Failed to restore previous manifest files");
                }
                rollbackFailure.addSuppressed(e);
            }
        }
        return rollbackFailure;
    }

    private static Path sibling(Path file, String suffix) {
        return file.resolveSibling(file.getFileName().toString() + suffix);
    }

    private static byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private record FileWriteState(Path target, Path backup) {
    }

    /**
     * Outcome of a publish.
     *
     * @param manifest manifest now on disk
     * @param changes new and modified files
     * @param written whether new files were written
     */
    public record PublishResult(Manifest manifest, List<FileChange> changes, boolean written) {

        public PublishResult {
            changes = List.copyOf(changes);
        }
    }
}
