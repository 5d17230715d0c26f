package com.github.alvarosanchez.spr.manifest;

import com.github.alvarosanchez.spr.ErrorKind;

/**
 * A repository snapshot failed integrity checks and must not be trusted as a whole.
 */
public abstract class RepositoryIntegrityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    RepositoryIntegrityException(String message) {
        super(message);
    }

    public abstract ErrorKind kind();
}
