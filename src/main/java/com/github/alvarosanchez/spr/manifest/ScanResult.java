package com.github.alvarosanchez.spr.manifest;

import java.util.List;

/**
 * Outcome of comparing a scan with the previous manifest.
 *
 * @param changes one entry per scanned file, in path order
 * @param missing tracked profile paths with no file on disk
 */
public record ScanResult(List<FileChange> changes, List<String> missing) {

    public ScanResult {
        changes = changes == null ? List.of() : List.copyOf(changes);
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public List<FileChange> ofKind(ChangeKind kind) {
        return changes.stream().filter(change -> change.kind() == kind).toList();
    }

    public boolean hasContentChanges() {
        return changes.stream().anyMatch(change -> change.kind() != ChangeKind.UNCHANGED);
    }
}
