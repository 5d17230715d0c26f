package com.github.alvarosanchez.spr.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.alvarosanchez.spr.checksum.ChecksumEngine;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestScannerTest {

    @TempDir
    Path tempDir;

    private final ChecksumEngine checksumEngine = new ChecksumEngine();
    private final ManifestScanner scanner = new ManifestScanner(checksumEngine);

    @Test
    void scanSkipsHiddenDocumentationAndSignatureFiles() throws IOException {
        write("configs/orcaslicer/filament/b.json", "{}");
        write("configs/orcaslicer/filament/a.json", "{\"a\":1}");
        write("configs/orcaslicer/README.md", "# docs");
        write("configs/orcaslicer/filament/a.json.sig", "sig");
        write("configs/.git/config.json", "{}");
        write("configs/orcaslicer/.hidden.json", "{}");

        List<ScannedFile> files = scanner.scan(tempDir, "configs");

        assertEquals(
            List.of("configs/orcaslicer/filament/a.json", "configs/orcaslicer/filament/b.json"),
            files.stream().map(ScannedFile::path).toList()
        );
        assertEquals(checksumEngine.digest(tempDir.resolve("configs/orcaslicer/filament/a.json")), files.get(0).checksum());
    }

    @Test
    void scanFailsWhenConfigDirectoryIsMissing() {
        assertThrows(ManifestBuildException.class, () -> scanner.scan(tempDir, "configs"));
    }

    @Test
    void diffClassifiesAgainstPreviousManifest() {
        Map<String, String> checksums = new TreeMap<>();
        checksums.put("configs/a.json", "sha256:aaa");
        checksums.put("configs/b.json", "sha256:bbb");
        checksums.put("configs/gone.json", "sha256:ggg");
        Manifest previous = new Manifest(
            "1.0",
            "acme",
            List.of(profile("1", "configs/a.json"), profile("2", "configs/b.json"), profile("3", "configs/gone.json")),
            new TreeMap<>(checksums),
            Map.of()
        );

        ScanResult result = scanner.diff(
            List.of(
                new ScannedFile("configs/a.json", "sha256:aaa"),
                new ScannedFile("configs/b.json", "sha256:b2b"),
                new ScannedFile("configs/c.json", "sha256:ccc")
            ),
            previous
        );

        assertEquals(ChangeKind.UNCHANGED, result.changes().get(0).kind());
        assertEquals(ChangeKind.MODIFIED, result.changes().get(1).kind());
        assertEquals("sha256:bbb", result.changes().get(1).previousChecksum());
        assertEquals(ChangeKind.NEW, result.changes().get(2).kind());
        assertNull(result.changes().get(2).previousChecksum());
        assertEquals(List.of("configs/gone.json"), result.missing());
        assertTrue(result.hasContentChanges());
    }

    @Test
    void diffWithoutPreviousManifestMarksEverythingNew() {
        ScanResult result = scanner.diff(List.of(new ScannedFile("configs/a.json", "sha256:aaa")), null);

        assertEquals(List.of(ChangeKind.NEW), result.changes().stream().map(FileChange::kind).toList());
        assertTrue(result.missing().isEmpty());
    }

    @Test
    void unchangedTreeHasNoContentChanges() {
        Manifest previous = new Manifest(
            "1.0",
            "acme",
            List.of(profile("1", "configs/a.json")),
            new TreeMap<>(Map.of("configs/a.json", "sha256:aaa")),
            Map.of()
        );

        ScanResult result = scanner.diff(List.of(new ScannedFile("configs/a.json", "sha256:aaa")), previous);

        assertFalse(result.hasContentChanges());
    }

    @Test
    void guessesMetadataFromPath() {
        NewProfileMetadata guess = NewProfileMetadata.guess("configs/orcaslicer/filament/Generic PLA.json", "configs");

        assertEquals(new NewProfileMetadata("Generic PLA", "orcaslicer", "filament"), guess);
        assertTrue(guess.isComplete());
        assertFalse(NewProfileMetadata.guess("configs/loose.json", "configs").isComplete());
    }

    private static ProfileEntry profile(String uuid, String path) {
        return new ProfileEntry(uuid, "p" + uuid, "filament", "orcaslicer", "0.1.0", path, List.of(), null, Map.of());
    }

    private Path write(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}
