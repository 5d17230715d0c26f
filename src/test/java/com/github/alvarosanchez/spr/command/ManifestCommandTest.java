package com.github.alvarosanchez.spr.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.alvarosanchez.spr.support.StubManifestSigner;
import com.github.alvarosanchez.spr.support.TestRepositories;
import io.micronaut.configuration.picocli.MicronautFactory;
import io.micronaut.context.ApplicationContext;
import io.micronaut.context.env.Environment;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ManifestCommandTest {

    @TempDir
    Path tempDir;

    private Path repository;

    @BeforeEach
    void setUp() throws IOException {
        repository = TestRepositories.filamentRepository(tempDir.resolve("profiles"));
    }

    @Test
    void nonInteractiveBuildSignsManifest() throws IOException {
        CommandResult result = execute("", "manifest", "build", repository.toString(), "-k", "ABCDEF12", "--non-interactive", "--namespace", "acme");

        assertEquals(0, result.exitCode(), result.stderr());
        assertTrue(result.stdout().contains("  + " + TestRepositories.GENERIC_PLA));
        assertTrue(result.stdout().contains("Signed manifest with 3 profile(s)."));
        assertTrue(Files.readString(repository.resolve("manifest.json")).contains("\"namespace\":\"acme\""));
    }

    @Test
    void buildWithoutNamespaceUsesDefault() throws IOException {
        execute("", "manifest", "build", repository.toString(), "-k", "ABCDEF12", "--non-interactive");

        assertTrue(Files.readString(repository.resolve("manifest.json")).contains("\"namespace\":\"default_namespace\""));
    }

    @Test
    void secondBuildReportsNoChanges() {
        execute("", "manifest", "build", repository.toString(), "-k", "ABCDEF12", "--non-interactive");

        CommandResult result = execute("", "manifest", "build", repository.toString(), "-k", "ABCDEF12", "--non-interactive");

        assertEquals(0, result.exitCode());
        assertTrue(result.stdout().contains("No profile changes. Manifest is up to date."));
    }

    @Test
    void interactiveBuildReadsDecisionsFromStandardInput() throws IOException {
        String answers = String.join("\n", "acme", "", "", "", "Custom Name", "", "", "", "", "") + "\n";

        CommandResult result = execute(answers, "manifest", "build", repository.toString(), "-k", "ABCDEF12");

        assertEquals(0, result.exitCode(), result.stderr());
        assertTrue(result.stdout().contains("Repository namespace [default_namespace]: "));
        String manifest = Files.readString(repository.resolve("manifest.json"));
        assertTrue(manifest.contains("\"namespace\":\"acme\""));
        assertTrue(manifest.contains("\"name\":\"Custom Name\""));
    }

    @Test
    void verifyReportsSuccessAndTampering() throws IOException {
        execute("", "manifest", "build", repository.toString(), "-k", "ABCDEF12", "--non-interactive", "--namespace", "acme");

        CommandResult verified = execute("", "manifest", "verify", repository.toString());
        assertEquals(0, verified.exitCode(), verified.stderr());
        assertTrue(verified.stdout().contains("Manifest of `acme` verified: 3 profile(s), 3 checksum(s)."));

        TestRepositories.write(repository, TestRepositories.COMMON, "{\"name\":\"fdm_filament_common\",\"fan_speed\":100}");
        CommandResult tampered = execute("", "manifest", "verify", repository.toString());
        assertEquals(1, tampered.exitCode());
        assertTrue(tampered.stderr().contains("Error: "));
        assertTrue(tampered.stderr().contains(TestRepositories.COMMON));
    }

    @Test
    void verifyWithUntrustedKeyFails() throws IOException {
        execute("", "manifest", "build", repository.toString(), "-k", "ABCDEF12", "--non-interactive");
        Path otherKey = Files.writeString(tempDir.resolve("other.asc"), "stub-key:OTHER");

        CommandResult result = execute("", "manifest", "verify", repository.toString(), "--public-key", otherKey.toString());

        assertEquals(1, result.exitCode());
        assertTrue(result.stderr().contains("signature does not verify"));
    }

    @Test
    void unpublishRemovesProfile() throws IOException {
        execute("", "manifest", "build", repository.toString(), "-k", "ABCDEF12", "--non-interactive");
        String manifest = Files.readString(repository.resolve("manifest.json"));
        int nameIndex = manifest.indexOf("\"name\":\"Generic PLA\"");
        String beforeName = manifest.substring(0, nameIndex);
        int uuidStart = beforeName.lastIndexOf("\"uuid\":\"") + "\"uuid\":\"".length();
        String uuid = manifest.substring(uuidStart, manifest.indexOf('"', uuidStart));

        CommandResult result = execute("", "manifest", "unpublish", repository.toString(), uuid, "-k", "ABCDEF12");

        assertEquals(0, result.exitCode(), result.stderr());
        assertTrue(result.stdout().contains("Unpublished `Generic PLA`."));
        assertEquals(0, execute("", "manifest", "verify", repository.toString()).exitCode());
    }

    @Test
    void buildFailsForMissingConfigDirectory() {
        CommandResult result = execute(
            "", "manifest", "build", tempDir.resolve("empty").toString(), "-k", "ABCDEF12", "--non-interactive"
        );

        assertEquals(1, result.exitCode());
        assertTrue(result.stderr().contains("Config directory does not exist"));
    }

    private CommandResult execute(String stdin, String... args) {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        InputStream originalIn = System.in;
        try {
            System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
            System.setIn(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));
            int exitCode;
            try (ApplicationContext context = ApplicationContext.run(Map.of(StubManifestSigner.PROPERTY, "stub"), Environment.CLI)) {
                exitCode = new CommandLine(SprCommand.class, new MicronautFactory(context)).execute(args);
            }
            return new CommandResult(exitCode, stdout.toString(StandardCharsets.UTF_8), stderr.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
            System.setIn(originalIn);
        }
    }

    private record CommandResult(int exitCode, String stdout, String stderr) {
    }
}
