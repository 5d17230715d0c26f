package com.github.alvarosanchez.spr.manifest;

/**
 * Detached signatures over exact manifest bytes.
 */
public interface ManifestSigner {

    /**
     * Signs content with a private key.
     *
     * @param content bytes to sign
     * @param keyId signing key identifier
     * @return detached signature
     */
    byte[] sign(byte[] content, String keyId);

    /**
     * Checks a detached signature against a public key.
     *
     * @param content signed bytes
     * @param signature detached signature
     * @param publicKey armored public key
     * @return {@code true} when the signature is valid for the content and key
     */
    boolean verify(byte[] content, byte[] signature, byte[] publicKey);

    /**
     * Exports the armored public key of a signing key.
     *
     * @param keyId signing key identifier
     * @return armored public key
     */
    byte[] exportPublicKey(String keyId);
}
