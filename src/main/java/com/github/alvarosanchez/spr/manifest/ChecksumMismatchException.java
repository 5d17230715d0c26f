package com.github.alvarosanchez.spr.manifest;

import com.github.alvarosanchez.spr.ErrorKind;

/**
 * A file does not match the checksum recorded in the manifest.
 */
public final class ChecksumMismatchException extends RepositoryIntegrityException {

    private static final long serialVersionUID = 1L;

    private final String path;
    private final String expected;
    private final String actual;

    public ChecksumMismatchException(String path, String expected, String actual) {
        super(actual == null
            ? "File `" + path + "` listed in the manifest is missing."
            : "Checksum mismatch for `" + path + "`: expected " + expected + " but found " + actual + ".");
        this.path = path;
        this.expected = expected;
        this.actual = actual;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CHECKSUM_MISMATCH;
    }

    public String path() {
        return path;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}
