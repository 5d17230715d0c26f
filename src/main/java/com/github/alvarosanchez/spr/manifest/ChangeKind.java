package com.github.alvarosanchez.spr.manifest;

/**
 * Classification of a scanned file against the previous manifest.
 */
public enum ChangeKind {
    NEW,
    MODIFIED,
    UNCHANGED
}
