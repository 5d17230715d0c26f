package com.github.alvarosanchez.spr.support;

import com.github.alvarosanchez.spr.checksum.ChecksumEngine;
import com.github.alvarosanchez.spr.gpg.GpgManifestSigner;
import com.github.alvarosanchez.spr.manifest.ManifestSigner;
import io.micronaut.context.annotation.Replaces;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Deterministic signer standing in for gpg in tests.
 *
 * <p>The "public key" of a key id is {@code stub-key:<id>} and a signature is the digest of the key id followed by the
 * signed bytes, so a signature only verifies for the same content and the same key. Key ids starting with
 * {@code unknown} behave like keys missing from the keyring.
 */
@Singleton
@Replaces(GpgManifestSigner.class)
@Requires(property = StubManifestSigner.PROPERTY, value = "stub")
public class StubManifestSigner implements ManifestSigner {

    public static final String PROPERTY = "spr.test.signer";

    private static final String KEY_PREFIX = "stub-key:";

    private final ChecksumEngine checksumEngine = new ChecksumEngine();

    @Override
    public byte[] sign(byte[] content, String keyId) {
        if (keyId == null || keyId.startsWith("unknown")) {
            throw new IllegalStateException("gpg sign failed (exit code 2): No secret key");
        }
        return signature(content, keyId);
    }

    @Override
    public boolean verify(byte[] content, byte[] signature, byte[] publicKey) {
        String key = new String(publicKey, StandardCharsets.UTF_8);
        if (!key.startsWith(KEY_PREFIX)) {
            return false;
        }
        return Arrays.equals(signature(content, key.substring(KEY_PREFIX.length())), signature);
    }

    @Override
    public byte[] exportPublicKey(String keyId) {
        return (KEY_PREFIX + keyId).getBytes(StandardCharsets.UTF_8);
    }

    private byte[] signature(byte[] content, String keyId) {
        ByteArrayOutputStream signed = new ByteArrayOutputStream();
        signed.writeBytes(keyId.getBytes(StandardCharsets.UTF_8));
        signed.writeBytes(content);
        return checksumEngine.digest(signed.toByteArray()).getBytes(StandardCharsets.UTF_8);
    }
}
