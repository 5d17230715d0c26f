package com.github.alvarosanchez.spr.manifest;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the next manifest from a scan and the previous manifest.
 *
 * <p>Previously tracked profiles keep their position, uuid, dependencies and extra fields. Only a checksum change
 * bumps a version and refreshes {@code last_updated}. New files are appended in path order. The result is fully
 * validated before it is returned, so callers never see a partial manifest.
 */
@Singleton
public final class ManifestBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(ManifestBuilder.class);

    private final VersionManager versionManager;
    private final Clock clock;
    private final Supplier<String> uuidGenerator;

    @Inject
    ManifestBuilder(VersionManager versionManager) {
        this(versionManager, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    ManifestBuilder(VersionManager versionManager, Clock clock, Supplier<String> uuidGenerator) {
        this.versionManager = versionManager;
        this.clock = clock;
        this.uuidGenerator = uuidGenerator;
    }

    /**
     * Builds the next manifest.
     *
     * @param scan classified scan of the config tree
     * @param previous previous manifest, or {@code null} on the first build
     * @param configsDirectory config tree directory, used to guess metadata of new files
     * @param specVersion manifest format version for a first build
     * @param decisions source of namespace, new-profile metadata and bump kinds
     * @return complete manifest
     * @throws ManifestBuildException when the manifest cannot be built consistently
     */
    public Manifest build(
        ScanResult scan,
        Manifest previous,
        String configsDirectory,
        String specVersion,
        ProfileDecisionProvider decisions
    ) {
        if (!scan.missing().isEmpty()) {
            throw new ManifestBuildException(
                "Tracked profile files are missing: " + String.join(", ", scan.missing())
                    + ". Restore them or unpublish the profiles first."
            );
        }

        String namespace = previous == null ? decisions.namespace() : previous.namespace();
        if (namespace == null || namespace.isBlank()) {
            throw new ManifestBuildException("Repository namespace is required.");
        }

        String now = DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));
        Map<String, FileChange> changesByPath = new HashMap<>();
        for (FileChange change : scan.changes()) {
            changesByPath.put(change.path(), change);
        }

        List<ProfileEntry> profiles = new ArrayList<>();
        if (previous != null) {
            for (ProfileEntry profile : previous.profiles()) {
                FileChange change = changesByPath.get(profile.path());
                if (change.kind() == ChangeKind.MODIFIED) {
                    BumpKind kind = decisions.bump(profile, change);
                    if (kind == null) {
                        throw new ManifestBuildException("A bump kind is required for `" + profile.path() + "`.");
                    }
                    String nextVersion = versionManager.bump(profile.version(), kind);
                    LOG.info("Profile {} changed: {} -> {}", profile.name(), profile.version(), nextVersion);
                    profiles.add(profile.withContentChange(nextVersion, now));
                } else {
                    profiles.add(profile);
                }
            }
        }

        for (FileChange change : scan.ofKind(ChangeKind.NEW)) {
            NewProfileMetadata metadata = decisions.describe(
                change.path(),
                NewProfileMetadata.guess(change.path(), configsDirectory)
            );
            if (metadata == null || !metadata.isComplete()) {
                throw new ManifestBuildException("Name, slicer and type are required for new profile `" + change.path() + "`.");
            }
            ProfileEntry created = new ProfileEntry(
                uuidGenerator.get(),
                metadata.name().trim(),
                metadata.type().trim(),
                metadata.slicer().trim(),
                versionManager.initialVersion(),
                change.path(),
                List.of(),
                now,
                Map.of()
            );
            LOG.info("New profile {} ({}) at {}", created.name(), created.uuid(), created.path());
            profiles.add(created);
        }

        Map<String, String> checksums = new TreeMap<>();
        for (FileChange change : scan.changes()) {
            checksums.put(change.path(), change.checksum());
        }

        Manifest manifest = new Manifest(
            previous == null ? specVersion : previous.specVersion(),
            namespace,
            profiles,
            new TreeMap<>(checksums),
            previous == null ? Map.of() : previous.extra()
        );
        validate(manifest);
        return manifest;
    }

    private static void validate(Manifest manifest) {
        List<String> withoutChecksum = manifest.pathsWithoutChecksum();
        if (!withoutChecksum.isEmpty()) {
            throw new ManifestBuildException("Profiles without checksum: " + String.join(", ", withoutChecksum));
        }

        Set<String> uuids = new HashSet<>();
        for (ProfileEntry profile : manifest.profiles()) {
            if (!uuids.add(profile.uuid())) {
                throw new ManifestBuildException("Duplicate profile uuid `" + profile.uuid() + "`.");
            }
        }
        for (ProfileEntry profile : manifest.profiles()) {
            for (String dependency : profile.dependencies()) {
                if (!uuids.contains(dependency)) {
                    LOG.warn("Profile {} depends on unknown uuid {}", profile.name(), dependency);
                }
            }
        }
    }
}
