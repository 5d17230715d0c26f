package com.github.alvarosanchez.spr.manifest;

/**
 * Config file found on disk.
 *
 * @param path repository-relative path with {@code /} separators
 * @param checksum content digest
 */
public record ScannedFile(String path, String checksum) {
}
