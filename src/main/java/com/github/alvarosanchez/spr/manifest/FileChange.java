package com.github.alvarosanchez.spr.manifest;

/**
 * Scanned file classified against the previous manifest.
 *
 * @param kind classification
 * @param path repository-relative path
 * @param checksum current digest
 * @param previousChecksum digest recorded in the previous manifest, or {@code null} for new files
 */
public record FileChange(ChangeKind kind, String path, String checksum, String previousChecksum) {
}
