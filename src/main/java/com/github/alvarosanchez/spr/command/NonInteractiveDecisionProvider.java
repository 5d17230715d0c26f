package com.github.alvarosanchez.spr.command;

import com.github.alvarosanchez.spr.manifest.BumpKind;
import com.github.alvarosanchez.spr.manifest.FileChange;
import com.github.alvarosanchez.spr.manifest.NewProfileMetadata;
import com.github.alvarosanchez.spr.manifest.ProfileDecisionProvider;
import com.github.alvarosanchez.spr.manifest.ProfileEntry;

/**
 * Takes guessed metadata for new profiles and a patch bump for modified ones.
 */
final class NonInteractiveDecisionProvider implements ProfileDecisionProvider {

    static final String DEFAULT_NAMESPACE = "default_namespace";

    private final String namespace;

    NonInteractiveDecisionProvider(String namespace) {
        this.namespace = namespace == null || namespace.isBlank() ? DEFAULT_NAMESPACE : namespace.trim();
    }

    @Override
    public String namespace() {
        return namespace;
    }

    @Override
    public NewProfileMetadata describe(String path, NewProfileMetadata guess) {
        return guess;
    }

    @Override
    public BumpKind bump(ProfileEntry profile, FileChange change) {
        return BumpKind.PATCH;
    }
}
