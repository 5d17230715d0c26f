package com.github.alvarosanchez.spr.manifest;

/**
 * Raised when a manifest cannot be built. Nothing has been written when this is thrown.
 */
public class ManifestBuildException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ManifestBuildException(String message) {
        super(message);
    }

    public ManifestBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
