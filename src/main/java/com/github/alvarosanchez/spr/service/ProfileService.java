package com.github.alvarosanchez.spr.service;

import com.github.alvarosanchez.spr.manifest.Manifest;
import com.github.alvarosanchez.spr.manifest.ProfileEntry;
import com.github.alvarosanchez.spr.manifest.RepositoryIntegrityException;
import com.github.alvarosanchez.spr.registry.RegistryFile.RepositoryEntry;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service that lists and installs profiles from registered repositories.
 *
 * <p>Only manifests that verify against their pinned key are read. A repository that fails verification is untrusted
 * as a whole and contributes no profiles.
 */
@Singleton
public final class ProfileService {

    private static final Logger LOG = LoggerFactory.getLogger(ProfileService.class);

    private final RepositoryService repositoryService;
    private final ManifestService manifestService;

    ProfileService(RepositoryService repositoryService, ManifestService manifestService) {
        this.repositoryService = repositoryService;
        this.manifestService = manifestService;
    }

    /**
     * Lists profiles of every trusted repository.
     *
     * @param slicer slicer to filter by, or {@code null} for all
     * @return table rows plus the repositories that failed verification
     */
    public ProfileListResult listProfiles(String slicer) {
        List<ProfileListRow> rows = new ArrayList<>();
        Set<String> untrustedRepositories = new TreeSet<>();
        for (TrustedRepository repository : trustedRepositories(untrustedRepositories)) {
            for (ProfileEntry profile : repository.manifest().profiles()) {
                if (slicer != null && !slicer.isBlank() && !slicer.equals(profile.slicer())) {
                    continue;
                }
                rows.add(
                    new ProfileListRow(
                        repository.manifest().namespace(),
                        profile.name(),
                        profile.type(),
                        profile.slicer(),
                        profile.version(),
                        profile.lastUpdated(),
                        profile.uuid()
                    )
                );
            }
        }
        rows.sort(Comparator.comparing(ProfileListRow::namespace).thenComparing(ProfileListRow::name));
        return new ProfileListResult(rows, List.copyOf(untrustedRepositories));
    }

    /**
     * Installs a profile and its transitive dependencies.
     *
     * <p>Every file is checked against the manifest before the first one is copied.
     *
     * @param reference profile name, or {@code namespace/name}
     * @param slicer slicer the profile belongs to
     * @param targetDirectory install root, or {@code null} for the cache directory
     * @return installed profiles, dependencies first
     */
    public InstallResult install(String reference, String slicer, Path targetDirectory) {
        String normalizedReference = reference == null ? "" : reference.trim();
        if (normalizedReference.isBlank()) {
            throw new IllegalStateException("Profile name is required.");
        }
        if (slicer == null || slicer.isBlank()) {
            throw new IllegalStateException("Slicer is required.");
        }
        int separator = normalizedReference.indexOf('/');
        String namespace = separator > 0 ? normalizedReference.substring(0, separator) : null;
        String name = separator > 0 ? normalizedReference.substring(separator + 1) : normalizedReference;

        List<Candidate> candidates = new ArrayList<>();
        for (TrustedRepository repository : trustedRepositories(new TreeSet<>())) {
            if (namespace != null && !namespace.equals(repository.manifest().namespace())) {
                continue;
            }
            for (ProfileEntry profile : repository.manifest().profiles()) {
                if (name.equals(profile.name()) && slicer.equals(profile.slicer())) {
                    candidates.add(new Candidate(repository, profile));
                }
            }
        }
        if (candidates.isEmpty()) {
            throw new IllegalStateException("Profile `" + normalizedReference + "` was not found for slicer " + slicer + ".");
        }
        if (candidates.size() > 1) {
            Set<String> alternatives = new TreeSet<>();
            for (Candidate candidate : candidates) {
                alternatives.add(candidate.repository().manifest().namespace() + "/" + candidate.profile().name());
            }
            throw new AmbiguousProfileException(normalizedReference, alternatives);
        }

        Candidate selected = candidates.get(0);
        Manifest manifest = selected.repository().manifest();
        List<ProfileEntry> profiles = withDependencies(manifest, selected.profile());
        Path repositoryRoot = Path.of(selected.repository().entry().localPath());
        Map<String, byte[]> verified = manifestService.verifyFiles(
            repositoryRoot,
            manifest,
            profiles.stream().map(ProfileEntry::path).toList()
        );

        Path target = (targetDirectory == null ? RepositoryService.cacheDirectory().resolve("profiles") : targetDirectory)
            .resolve(manifest.namespace())
            .toAbsolutePath()
            .normalize();
        writeAll(target, profiles, verified);
        LOG.info("Installed {} with {} dependency file(s) into {}", selected.profile().name(), profiles.size() - 1, target);
        return new InstallResult(profiles, target);
    }

    private List<TrustedRepository> trustedRepositories(Set<String> untrustedRepositories) {
        List<TrustedRepository> trusted = new ArrayList<>();
        for (RepositoryEntry entry : repositoryService.load()) {
            try {
                trusted.add(new TrustedRepository(entry, repositoryService.verify(entry)));
            } catch (RepositoryIntegrityException e) {
                LOG.error("Repository {} failed verification: {}", entry.name(), e.getMessage());
                untrustedRepositories.add(entry.name());
            }
        }
        return trusted;
    }

    private static List<ProfileEntry> withDependencies(Manifest manifest, ProfileEntry profile) {
        Set<String> ordered = new LinkedHashSet<>();
        Set<String> visiting = new LinkedHashSet<>();
        Deque<String> trail = new ArrayDeque<>();
        collect(manifest, profile.uuid(), ordered, visiting, trail);

        List<ProfileEntry> profiles = new ArrayList<>();
        for (String uuid : ordered) {
            profiles.add(manifest.profile(uuid).orElseThrow());
        }
        return profiles;
    }

    private static void collect(Manifest manifest, String uuid, Set<String> ordered, Set<String> visiting, Deque<String> trail) {
        if (ordered.contains(uuid) || !visiting.add(uuid)) {
            return;
        }
        trail.push(uuid);
        ProfileEntry profile = manifest
            .profile(uuid)
            .orElseThrow(() -> new IllegalStateException(
                "Dependency `" + uuid + "` required by `" + trail.stream().skip(1).findFirst().orElse(uuid) + "` is not published."
            ));
        for (String dependency : profile.dependencies()) {
            collect(manifest, dependency, ordered, visiting, trail);
        }
        trail.pop();
        ordered.add(uuid);
    }

    // writes the bytes that passed verification
    private static void writeAll(Path target, List<ProfileEntry> profiles, Map<String, byte[]> verified) {
        List<Path> copied = new ArrayList<>();
        try {
            for (ProfileEntry profile : profiles) {
                Path destination = target.resolve(profile.path()).normalize();
                if (!destination.startsWith(target)) {
                    throw new IllegalStateException("Profile path escapes the install directory: " + profile.path());
                }
                Files.createDirectories(destination.getParent());
                Files.write(destination, verified.get(profile.path()));
                copied.add(destination);
            }
        } catch (IOException e) {
            for (Path file : copied) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException cleanupFailure) {
                    e.addSuppressed(cleanupFailure);
                }
            }
            throw new UncheckedIOException("Failed to install profiles into " + target, e);
        }
    }

    private record TrustedRepository(RepositoryEntry entry, Manifest manifest) {
    }

    private record Candidate(TrustedRepository repository, ProfileEntry profile) {
    }

    /**
     * Row data for `spr profile list` table output.
     *
     * @param namespace repository namespace
     * @param name profile name
     * @param type profile type
     * @param slicer slicer identifier
     * @param version profile version
     * @param lastUpdated last content change
     * @param uuid profile uuid
     */
    public record ProfileListRow(
        String namespace,
        String name,
        String type,
        String slicer,
        String version,
        String lastUpdated,
        String uuid
    ) {
    }

    /**
     * Result for profile table rendering.
     *
     * @param rows rows to render in table output
     * @param untrustedRepositories repositories skipped because they failed verification
     */
    public record ProfileListResult(List<ProfileListRow> rows, List<String> untrustedRepositories) {

        public ProfileListResult {
            rows = List.copyOf(rows);
            untrustedRepositories = List.copyOf(untrustedRepositories);
        }
    }

    /**
     * Installed profiles.
     *
     * @param profiles installed profiles, dependencies first
     * @param target directory the files were copied into
     */
    public record InstallResult(List<ProfileEntry> profiles, Path target) {

        public InstallResult {
            profiles = List.copyOf(profiles);
        }
    }

    /**
     * Exception thrown when a profile name matches profiles in several namespaces.
     */
    public static final class AmbiguousProfileException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final Set<String> alternatives;

        AmbiguousProfileException(String reference, Set<String> alternatives) {
            super("Profile `" + reference + "` is ambiguous, use one of: " + String.join(", ", alternatives));
            this.alternatives = Set.copyOf(alternatives);
        }

        /**
         * Returns the qualified names matching the reference.
         *
         * @return {@code namespace/name} alternatives
         */
        public Set<String> alternatives() {
            return alternatives;
        }
    }
}
