package com.github.alvarosanchez.spr.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.serde.annotation.Serdeable;
import java.util.List;

/**
 * Root JSON model for the user registry file, {@code config.json}.
 *
 * @param repositories registered repositories
 */
@Serdeable
public record RegistryFile(List<RepositoryEntry> repositories) {

    /**
     * Creates a registry instance.
     *
     * @param repositories registered repositories
     */
    public RegistryFile {
        repositories = repositories == null ? List.of() : List.copyOf(repositories);
    }

    /**
     * Registered repository.
     *
     * @param name repository display name
     * @param namespace namespace declared by the repository manifest
     * @param localPath local filesystem path of the repository root
     * @param publicKey path of the pinned public key
     */
    @Serdeable
    public record RepositoryEntry(
        String name,
        String namespace,
        @JsonProperty("local_path") String localPath,
        @JsonProperty("public_key") String publicKey
    ) {
    }
}
