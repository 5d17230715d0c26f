package com.github.alvarosanchez.spr.manifest;

import com.github.alvarosanchez.spr.ErrorKind;

/**
 * The manifest signature is missing, forged or does not match the manifest bytes.
 */
public final class SignatureInvalidException extends RepositoryIntegrityException {

    private static final long serialVersionUID = 1L;

    public SignatureInvalidException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SIGNATURE_INVALID;
    }
}
