package com.github.alvarosanchez.spr.gpg;

import com.github.alvarosanchez.spr.manifest.ManifestSigner;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manifest signer backed by the external {@code gpg} executable.
 *
 * <p>Signing uses the caller's keyring, or the one under the {@code spr.gpg.homedir} system property when set.
 * Verification imports the given public key into a throwaway keyring, so only that key can make a signature valid.
 */
@Singleton
public final class GpgManifestSigner implements ManifestSigner {

    private static final Logger LOG = LoggerFactory.getLogger(GpgManifestSigner.class);
    private static final String GPG = "gpg";

    private final GpgProcessExecutor processExecutor;

    /**
     * Creates a gpg signer.
     *
     * @param processExecutor process launcher used to run gpg commands
     */
    public GpgManifestSigner(GpgProcessExecutor processExecutor) {
        this.processExecutor = processExecutor;
    }

    @Override
    public byte[] sign(byte[] content, String keyId) {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalStateException("A signing key identifier is required.");
        }
        Path workDirectory = createWorkDirectory();
        try {
            Path data = Files.write(workDirectory.resolve("manifest.json"), content);
            Path signature = workDirectory.resolve("manifest.json.sig");
            List<String> command = baseCommand(configuredHome());
            command.addAll(List.of("--yes", "--local-user", keyId, "--output", signature.toString(), "--detach-sign", data.toString()));
            run("sign", command);
            if (!Files.isRegularFile(signature)) {
                throw new IllegalStateException("gpg sign did not produce a signature for key " + keyId);
            }
            return Files.readAllBytes(signature);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to sign manifest with key " + keyId, e);
        } finally {
            deleteRecursively(workDirectory);
        }
    }

    @Override
    public boolean verify(byte[] content, byte[] signature, byte[] publicKey) {
        Path workDirectory = createWorkDirectory();
        try {
            Path home = Files.createDirectory(workDirectory.resolve("keyring"));
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                Files.setPosixFilePermissions(home, PosixFilePermissions.fromString("rwx------"));
            }
            Path key = Files.write(workDirectory.resolve("public-key.asc"), publicKey);
            Path data = Files.write(workDirectory.resolve("manifest.json"), content);
            Path signatureFile = Files.write(workDirectory.resolve("manifest.json.sig"), signature);

            List<String> importCommand = baseCommand(home.toString());
            importCommand.addAll(List.of("--import", key.toString()));
            run("import", importCommand);

            List<String> verifyCommand = baseCommand(home.toString());
            verifyCommand.addAll(List.of("--verify", signatureFile.toString(), data.toString()));
            Process process = processExecutor.start(verifyCommand);
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                LOG.debug("gpg verify rejected the signature (exit code {}): {}", exitCode, output.trim());
            }
            return exitCode == 0;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to run gpg verify", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running gpg verify", e);
        } finally {
            deleteRecursively(workDirectory);
        }
    }

    @Override
    public byte[] exportPublicKey(String keyId) {
        Path workDirectory = createWorkDirectory();
        try {
            Path exported = workDirectory.resolve("public-key.asc");
            List<String> command = baseCommand(configuredHome());
            command.addAll(List.of("--armor", "--output", exported.toString(), "--export", keyId));
            run("export", command);
            byte[] key = Files.isRegularFile(exported) ? Files.readAllBytes(exported) : new byte[0];
            if (key.length == 0) {
                throw new IllegalStateException("No public key found for " + keyId);
            }
            return key;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export public key " + keyId, e);
        } finally {
            deleteRecursively(workDirectory);
        }
    }

    private void run(String operation, List<String> command) {
        try {
            Process process = processExecutor.start(command);
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new IllegalStateException("gpg " + operation + " failed (exit code " + exitCode + "): " + output.trim());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to run gpg " + operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running gpg " + operation, e);
        }
    }

    private static List<String> baseCommand(String home) {
        List<String> command = new ArrayList<>();
        command.add(GPG);
        if (home != null && !home.isBlank()) {
            command.add("--homedir");
            command.add(home);
        }
        command.add("--batch");
        return command;
    }

    private static String configuredHome() {
        return System.getProperty("spr.gpg.homedir");
    }

    private static Path createWorkDirectory() {
        try {
            return Files.createTempDirectory("spr-gpg");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create gpg work directory", e);
        }
    }

    private static void deleteRecursively(Path path) {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path file : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(file);
            }
        } catch (IOException e) {
            LOG.warn("Failed to delete gpg work directory {}", path, e);
        }
    }
}
