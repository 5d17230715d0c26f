package com.github.alvarosanchez.spr.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.alvarosanchez.spr.ErrorKind;
import com.github.alvarosanchez.spr.manifest.BumpKind;
import com.github.alvarosanchez.spr.manifest.ChangeKind;
import com.github.alvarosanchez.spr.manifest.ChecksumMismatchException;
import com.github.alvarosanchez.spr.manifest.FileChange;
import com.github.alvarosanchez.spr.manifest.Manifest;
import com.github.alvarosanchez.spr.manifest.ManifestBuildException;
import com.github.alvarosanchez.spr.manifest.ManifestCodec;
import com.github.alvarosanchez.spr.manifest.NewProfileMetadata;
import com.github.alvarosanchez.spr.manifest.ProfileDecisionProvider;
import com.github.alvarosanchez.spr.manifest.ProfileEntry;
import com.github.alvarosanchez.spr.manifest.SignatureInvalidException;
import com.github.alvarosanchez.spr.service.ManifestService.PublishResult;
import com.github.alvarosanchez.spr.support.StubManifestSigner;
import com.github.alvarosanchez.spr.support.TestRepositories;
import io.micronaut.context.ApplicationContext;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestServiceTest {

    private static final String KEY = "ABCDEF12";

    @TempDir
    Path tempDir;

    private ApplicationContext applicationContext;
    private ManifestService manifestService;
    private Path repository;

    @BeforeEach
    void setUp() throws IOException {
        applicationContext = ApplicationContext.run(Map.of(StubManifestSigner.PROPERTY, "stub"));
        manifestService = applicationContext.getBean(ManifestService.class);
        repository = TestRepositories.filamentRepository(tempDir.resolve("profiles"));
    }

    @AfterEach
    void tearDown() {
        applicationContext.close();
    }

    @Test
    void verifyFilesReturnsTheBytesItChecked() throws IOException {
        manifestService.publish(repository, KEY, decisions("acme"));
        Manifest manifest = manifestService.verify(repository);
        byte[] original = Files.readAllBytes(repository.resolve(TestRepositories.GENERIC_PLA));

        Map<String, byte[]> verified = manifestService.verifyFiles(
            repository,
            manifest,
            List.of(TestRepositories.GENERIC_PLA, TestRepositories.COMMON)
        );
        TestRepositories.write(repository, TestRepositories.GENERIC_PLA, "{\"name\":\"Swapped\"}");

        assertEquals(List.of(TestRepositories.GENERIC_PLA, TestRepositories.COMMON), new ArrayList<>(verified.keySet()));
        assertArrayEquals(original, verified.get(TestRepositories.GENERIC_PLA));
        assertThrows(
            ChecksumMismatchException.class,
            () -> manifestService.verifyFiles(repository, manifest, List.of(TestRepositories.GENERIC_PLA))
        );
    }

    @Test
    void firstPublishWritesSignedManifestAndPublicKey() {
        PublishResult result = manifestService.publish(repository, KEY, decisions("acme"));

        assertTrue(result.written());
        assertEquals(3, result.changes().size());
        assertTrue(result.changes().stream().allMatch(change -> change.kind() == ChangeKind.NEW));
        assertTrue(Files.isRegularFile(repository.resolve(ManifestService.MANIFEST_FILE)));
        assertTrue(Files.isRegularFile(repository.resolve(ManifestService.SIGNATURE_FILE)));
        assertTrue(Files.isRegularFile(repository.resolve(ManifestService.PUBLIC_KEY_FILE)));

        Manifest manifest = manifestService.verify(repository);
        assertEquals("acme", manifest.namespace());
        assertEquals("1.0", manifest.specVersion());
        assertEquals(
            List.of(TestRepositories.COMMON, TestRepositories.PLA_BASE, TestRepositories.GENERIC_PLA),
            manifest.profiles().stream().map(ProfileEntry::path).toList()
        );
        assertTrue(manifest.profiles().stream().allMatch(profile -> "0.1.0".equals(profile.version())));
        assertTrue(manifest.pathsWithoutChecksum().isEmpty());
    }

    @Test
    void republishingUnchangedTreeWritesNothing() throws IOException {
        manifestService.publish(repository, KEY, decisions("acme"));
        byte[] before = Files.readAllBytes(repository.resolve(ManifestService.MANIFEST_FILE));

        PublishResult result = manifestService.publish(repository, KEY, decisions("ignored"));

        assertFalse(result.written());
        assertTrue(result.changes().isEmpty());
        assertEquals(new String(before, StandardCharsets.UTF_8), Files.readString(repository.resolve(ManifestService.MANIFEST_FILE)));
    }

    @Test
    void modifiedProfileIsBumpedAndKeepsItsDependencies() throws IOException {
        manifestService.publish(repository, KEY, decisions("acme"));
        Manifest published = manifestService.readManifest(repository).orElseThrow();
        ProfileEntry base = profileAt(published, TestRepositories.PLA_BASE);
        ProfileEntry leaf = profileAt(published, TestRepositories.GENERIC_PLA);
        List<ProfileEntry> withDependency = new ArrayList<>();
        for (ProfileEntry profile : published.profiles()) {
            withDependency.add(profile.uuid().equals(leaf.uuid()) ? profile.withDependencies(List.of(base.uuid())) : profile);
        }
        ManifestCodec codec = applicationContext.getBean(ManifestCodec.class);
        Files.write(
            repository.resolve(ManifestService.MANIFEST_FILE),
            codec.write(new Manifest(published.specVersion(), published.namespace(), withDependency, published.checksums(), published.extra()))
        );
        TestRepositories.write(
            repository,
            TestRepositories.GENERIC_PLA,
            "{\"config\":{\"name\":\"Generic PLA\",\"inherits\":\"fdm_filament_pla\",\"nozzle_temperature\":[215]}}"
        );

        PublishResult result = manifestService.publish(repository, KEY, decisions("acme"));

        assertTrue(result.written());
        assertEquals(List.of(ChangeKind.MODIFIED), result.changes().stream().map(FileChange::kind).toList());
        Manifest manifest = manifestService.verify(repository);
        ProfileEntry rebuilt = profileAt(manifest, TestRepositories.GENERIC_PLA);
        assertEquals(leaf.uuid(), rebuilt.uuid());
        assertEquals("0.1.1", rebuilt.version());
        assertEquals(List.of(base.uuid()), rebuilt.dependencies());
        assertEquals(base, profileAt(manifest, TestRepositories.PLA_BASE));
    }

    @Test
    void oneByteEditOfAProfileFailsVerification() throws IOException {
        manifestService.publish(repository, KEY, decisions("acme"));
        Path file = repository.resolve(TestRepositories.PLA_BASE);
        byte[] content = Files.readAllBytes(file);
        content[content.length - 2] = (byte) (content[content.length - 2] == '}' ? ' ' : '}');
        Files.write(file, content);

        ChecksumMismatchException failure = assertThrows(ChecksumMismatchException.class, () -> manifestService.verify(repository));

        assertEquals(ErrorKind.CHECKSUM_MISMATCH, failure.kind());
        assertEquals(TestRepositories.PLA_BASE, failure.path());
    }

    @Test
    void deletedProfileFailsVerification() throws IOException {
        manifestService.publish(repository, KEY, decisions("acme"));
        Files.delete(repository.resolve(TestRepositories.COMMON));

        ChecksumMismatchException failure = assertThrows(ChecksumMismatchException.class, () -> manifestService.verify(repository));

        assertEquals(TestRepositories.COMMON, failure.path());
    }

    @Test
    void editedManifestFailsSignatureCheck() throws IOException {
        manifestService.publish(repository, KEY, decisions("acme"));
        Path manifestFile = repository.resolve(ManifestService.MANIFEST_FILE);
        Files.writeString(manifestFile, Files.readString(manifestFile).replace("\"acme\"", "\"evil\""));

        SignatureInvalidException failure = assertThrows(SignatureInvalidException.class, () -> manifestService.verify(repository));

        assertEquals(ErrorKind.SIGNATURE_INVALID, failure.kind());
    }

    @Test
    void foreignKeyFailsSignatureCheck() {
        manifestService.publish(repository, KEY, decisions("acme"));

        assertThrows(
            SignatureInvalidException.class,
            () -> manifestService.verify(repository, "stub-key:OTHER".getBytes(StandardCharsets.UTF_8))
        );
    }

    @Test
    void missingSignatureFailsVerification() throws IOException {
        manifestService.publish(repository, KEY, decisions("acme"));
        Files.delete(repository.resolve(ManifestService.SIGNATURE_FILE));

        assertThrows(SignatureInvalidException.class, () -> manifestService.verify(repository));
    }

    @Test
    void signingFailureLeavesRepositoryUntouched() {
        ManifestBuildException failure = assertThrows(
            ManifestBuildException.class,
            () -> manifestService.publish(repository, "unknown-key", decisions("acme"))
        );

        assertTrue(failure.getMessage().contains("No secret key"));
        assertFalse(Files.exists(repository.resolve(ManifestService.MANIFEST_FILE)));
        assertFalse(Files.exists(repository.resolve(ManifestService.SIGNATURE_FILE)));
        assertFalse(Files.exists(repository.resolve(ManifestService.PUBLIC_KEY_FILE)));
    }

    @Test
    void missingTrackedFileAbortsPublish() throws IOException {
        manifestService.publish(repository, KEY, decisions("acme"));
        byte[] before = Files.readAllBytes(repository.resolve(ManifestService.MANIFEST_FILE));
        Files.delete(repository.resolve(TestRepositories.GENERIC_PLA));

        assertThrows(ManifestBuildException.class, () -> manifestService.publish(repository, KEY, decisions("acme")));

        assertEquals(
            new String(before, StandardCharsets.UTF_8),
            Files.readString(repository.resolve(ManifestService.MANIFEST_FILE))
        );
    }

    @Test
    void unpublishRemovesProfileAndChecksumButKeepsFile() {
        manifestService.publish(repository, KEY, decisions("acme"));
        ProfileEntry leaf = profileAt(manifestService.readManifest(repository).orElseThrow(), TestRepositories.GENERIC_PLA);

        ProfileEntry removed = manifestService.unpublish(repository, leaf.uuid(), KEY);

        assertEquals(leaf, removed);
        Manifest manifest = manifestService.verify(repository);
        assertTrue(manifest.profile(leaf.uuid()).isEmpty());
        assertFalse(manifest.checksums().containsKey(TestRepositories.GENERIC_PLA));
        assertTrue(Files.exists(repository.resolve(TestRepositories.GENERIC_PLA)));
    }

    @Test
    void unpublishRefusesProfilesOthersDependOn() throws IOException {
        manifestService.publish(repository, KEY, decisions("acme"));
        Manifest published = manifestService.readManifest(repository).orElseThrow();
        ProfileEntry base = profileAt(published, TestRepositories.PLA_BASE);
        List<ProfileEntry> profiles = new ArrayList<>();
        for (ProfileEntry profile : published.profiles()) {
            profiles.add(profile.path().equals(TestRepositories.GENERIC_PLA) ? profile.withDependencies(List.of(base.uuid())) : profile);
        }
        Files.write(
            repository.resolve(ManifestService.MANIFEST_FILE),
            applicationContext.getBean(ManifestCodec.class)
                .write(new Manifest(published.specVersion(), published.namespace(), profiles, published.checksums(), published.extra()))
        );

        IllegalStateException failure = assertThrows(
            IllegalStateException.class,
            () -> manifestService.unpublish(repository, base.uuid(), KEY)
        );

        assertTrue(failure.getMessage().contains("Generic PLA"));
    }

    private static ProfileEntry profileAt(Manifest manifest, String path) {
        return manifest.profiles().stream().filter(profile -> profile.path().equals(path)).findFirst().orElseThrow();
    }

    static ProfileDecisionProvider decisions(String namespace) {
        return new ProfileDecisionProvider() {
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
        };
    }
}
