package com.github.alvarosanchez.spr.checksum;

import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Computes content digests in the {@code sha256:<hex>} wire format shared by manifest builds and
 * post-download integrity checks.
 */
@Singleton
public final class ChecksumEngine {

    /**
     * Algorithm prefix used in every digest string.
     */
    public static final String ALGORITHM_PREFIX = "sha256:";

    private static final String ALGORITHM = "SHA-256";

    /**
     * Digests raw bytes.
     *
     * @param content bytes to digest
     * @return digest string, for example {@code sha256:9f86d0...}
     */
    public String digest(byte[] content) {
        return ALGORITHM_PREFIX + HexFormat.of().formatHex(messageDigest().digest(content));
    }

    /**
     * Digests the content of a file.
     *
     * @param file file to read
     * @return digest string of the file bytes
     */
    public String digest(Path file) {
        try {
            return digest(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file + " for checksum", e);
        }
    }

    /**
     * Returns whether content matches an expected digest string.
     *
     * @param content bytes to check
     * @param expected expected digest string
     * @return {@code true} when the digest matches
     * @throws IllegalArgumentException when the expected digest uses another algorithm
     */
    public boolean matches(byte[] content, String expected) {
        if (expected == null || !expected.startsWith(ALGORITHM_PREFIX)) {
            throw new IllegalArgumentException("Unsupported checksum format: " + expected);
        }
        byte[] actual = digest(content).getBytes(StandardCharsets.US_ASCII);
        byte[] wanted = expected.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(actual, wanted);
    }

    private static MessageDigest messageDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available in this JVM", e);
        }
    }
}
