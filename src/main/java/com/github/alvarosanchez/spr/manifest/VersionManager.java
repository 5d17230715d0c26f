package com.github.alvarosanchez.spr.manifest;

import jakarta.inject.Singleton;

/**
 * Assigns initial versions and bumps existing ones.
 */
@Singleton
public final class VersionManager {

    static final String INITIAL_VERSION = "0.1.0";

    public String initialVersion() {
        return INITIAL_VERSION;
    }

    /**
     * Bumps a profile version after a content change.
     *
     * @param current current version text
     * @param kind component to increment
     * @return next version, strictly greater than {@code current}
     * @throws ManifestBuildException when the current version cannot be parsed
     */
    public String bump(String current, BumpKind kind) {
        SemanticVersion version;
        try {
            version = SemanticVersion.parse(current);
        } catch (IllegalArgumentException e) {
            throw new ManifestBuildException("Cannot bump version `" + current + "`: " + e.getMessage(), e);
        }
        SemanticVersion next = version.bump(kind);
        if (next.compareTo(version) <= 0) {
            throw new ManifestBuildException("Bumped version " + next + " does not increase " + version + ".");
        }
        return next.toString();
    }
}
