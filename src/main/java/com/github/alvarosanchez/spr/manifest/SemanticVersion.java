package com.github.alvarosanchez.spr.manifest;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic version with optional pre-release tag. Build metadata is accepted and ignored for ordering.
 *
 * @param major major component
 * @param minor minor component
 * @param patch patch component
 * @param preRelease dot-separated pre-release identifiers, or {@code null}
 */
public record SemanticVersion(int major, int minor, int patch, String preRelease) implements Comparable<SemanticVersion> {

    private static final Pattern FORMAT = Pattern.compile(
        "(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)(?:-([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?(?:\\+[0-9A-Za-z.-]+)?"
    );

    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must not be negative.");
        }
        if (preRelease != null && preRelease.isBlank()) {
            preRelease = null;
        }
    }

    /**
     * Parses a version string such as {@code 1.4.2} or {@code 2.0.0-rc.1}.
     *
     * @param value version text
     * @return parsed version
     * @throws IllegalArgumentException when the text is not a semantic version
     */
    public static SemanticVersion parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Version is required.");
        }
        Matcher matcher = FORMAT.matcher(value.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a semantic version: `" + value + "`");
        }
        try {
            return new SemanticVersion(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)),
                matcher.group(4)
            );
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version component out of range: `" + value + "`", e);
        }
    }

    /**
     * Returns the next release version for a bump kind. Pre-release tags are dropped.
     *
     * @param kind component to increment
     * @return bumped version
     */
    public SemanticVersion bump(BumpKind kind) {
        return switch (kind) {
            case MAJOR -> new SemanticVersion(major + 1, 0, 0, null);
            case MINOR -> new SemanticVersion(major, minor + 1, 0, null);
            case PATCH -> new SemanticVersion(major, minor, patch + 1, null);
        };
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int result = Integer.compare(major, other.major);
        if (result == 0) {
            result = Integer.compare(minor, other.minor);
        }
        if (result == 0) {
            result = Integer.compare(patch, other.patch);
        }
        if (result != 0) {
            return result;
        }
        if (preRelease == null || other.preRelease == null) {
            // a release ranks above any of its pre-releases
            return preRelease == null ? (other.preRelease == null ? 0 : 1) : -1;
        }
        return comparePreRelease(preRelease, other.preRelease);
    }

    @Override
    public String toString() {
        String core = major + "." + minor + "." + patch;
        return preRelease == null ? core : core + "-" + preRelease;
    }

    private static int comparePreRelease(String left, String right) {
        String[] leftParts = left.split("\\.");
        String[] rightParts = right.split("\\.");
        for (int i = 0; i < Math.min(leftParts.length, rightParts.length); i++) {
            int result = compareIdentifier(leftParts[i], rightParts[i]);
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(leftParts.length, rightParts.length);
    }

    private static int compareIdentifier(String left, String right) {
        boolean leftNumeric = left.chars().allMatch(Character::isDigit);
        boolean rightNumeric = right.chars().allMatch(Character::isDigit);
        if (leftNumeric && rightNumeric) {
            return Long.compare(Long.parseLong(left), Long.parseLong(right));
        }
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        return left.compareTo(right);
    }
}
