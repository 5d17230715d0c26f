package com.github.alvarosanchez.spr.manifest;

/**
 * Supplies the human decisions a manifest build needs.
 */
public interface ProfileDecisionProvider {

    /**
     * Namespace for a repository that has no manifest yet.
     *
     * @return namespace
     */
    String namespace();

    /**
     * Metadata for a file seen for the first time.
     *
     * @param path repository-relative path
     * @param guess metadata derived from the path
     * @return metadata to record
     */
    NewProfileMetadata describe(String path, NewProfileMetadata guess);

    /**
     * Bump kind for a profile whose content changed.
     *
     * @param profile profile as recorded in the previous manifest
     * @param change detected change
     * @return component to increment
     */
    BumpKind bump(ProfileEntry profile, FileChange change);
}
