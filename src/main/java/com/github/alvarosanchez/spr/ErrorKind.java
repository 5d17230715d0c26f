package com.github.alvarosanchez.spr;

/**
 * Machine-readable failure kinds reported by resolution and repository verification.
 */
public enum ErrorKind {
    CONFIG_NOT_FOUND,
    CIRCULAR_DEPENDENCY,
    INVALID_INHERITANCE,
    MALFORMED_CONFIG,
    DEPTH_EXCEEDED,
    CHECKSUM_MISMATCH,
    SIGNATURE_INVALID
}
