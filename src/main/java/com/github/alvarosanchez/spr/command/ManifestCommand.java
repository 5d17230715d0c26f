package com.github.alvarosanchez.spr.command;

import com.github.alvarosanchez.spr.manifest.ChangeKind;
import com.github.alvarosanchez.spr.manifest.FileChange;
import com.github.alvarosanchez.spr.manifest.Manifest;
import com.github.alvarosanchez.spr.manifest.ManifestSigner;
import com.github.alvarosanchez.spr.manifest.ProfileDecisionProvider;
import com.github.alvarosanchez.spr.manifest.ProfileEntry;
import com.github.alvarosanchez.spr.service.ManifestService;
import com.github.alvarosanchez.spr.service.ManifestService.PublishResult;
import jakarta.inject.Inject;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command group for building and checking signed manifests.
 */
@Command(
    name = "manifest",
    description = "Build, verify and unpublish signed repository manifests.",
    mixinStandardHelpOptions = true,
    subcommands = {
        ManifestCommand.BuildCommand.class,
        ManifestCommand.VerifyCommand.class,
        ManifestCommand.UnpublishCommand.class
    }
)
public class ManifestCommand implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    @Command(name = "build", description = "Scan a repository, update manifest.json and sign it.")
    static class BuildCommand implements Callable<Integer> {

        private final ManifestService manifestService;
        private final ManifestSigner signer;

        @Inject
        BuildCommand(ManifestService manifestService, ManifestSigner signer) {
            this.manifestService = manifestService;
            this.signer = signer;
        }

        @Parameters(index = "0", description = "Repository root.")
        private Path repositoryRoot;

        @Option(names = {"-k", "--key"}, required = true, description = "Signing key identifier.")
        private String keyId;

        @Option(names = "--non-interactive", description = "Use guessed metadata and patch bumps without prompting.")
        private boolean nonInteractive;

        @Option(names = "--namespace", description = "Namespace for a repository without a manifest.")
        private String namespace;

        /**
         * Publishes the repository manifest.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                SystemDependencies.verifyFor(signer);
                ProfileDecisionProvider decisions = nonInteractive
                    ? new NonInteractiveDecisionProvider(namespace)
                    : new ConsoleDecisionProvider(
                        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                        System.out,
                        namespace
                    );
                PublishResult result = manifestService.publish(repositoryRoot, keyId, decisions);
                if (!result.written()) {
                    Cli.info("No profile changes. Manifest is up to date.");
                    return 0;
                }
                for (FileChange change : result.changes()) {
                    Cli.print((change.kind() == ChangeKind.NEW ? "  + " : "  ~ ") + change.path());
                }
                Cli.success("Signed manifest with " + result.manifest().profiles().size() + " profile(s).");
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "verify", description = "Verify the manifest signature and every listed checksum.")
    static class VerifyCommand implements Callable<Integer> {

        private final ManifestService manifestService;
        private final ManifestSigner signer;

        @Inject
        VerifyCommand(ManifestService manifestService, ManifestSigner signer) {
            this.manifestService = manifestService;
            this.signer = signer;
        }

        @Parameters(index = "0", description = "Repository root.")
        private Path repositoryRoot;

        @Option(names = "--public-key", description = "Trusted public key file. Defaults to the repository's public-key.asc.")
        private Path publicKey;

        /**
         * Verifies the repository snapshot.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                SystemDependencies.verifyFor(signer);
                Manifest manifest = publicKey == null
                    ? manifestService.verify(repositoryRoot)
                    : manifestService.verify(repositoryRoot, Files.readAllBytes(publicKey));
                Cli.success(
                    "Manifest of `" + manifest.namespace() + "` verified: "
                        + manifest.profiles().size() + " profile(s), "
                        + manifest.checksums().size() + " checksum(s)."
                );
                return 0;
            } catch (IOException e) {
                Cli.error("Failed to read public key " + publicKey + ": " + e.getMessage());
                return 1;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "unpublish", description = "Remove a profile from the manifest and re-sign it.")
    static class UnpublishCommand implements Callable<Integer> {

        private final ManifestService manifestService;
        private final ManifestSigner signer;

        @Inject
        UnpublishCommand(ManifestService manifestService, ManifestSigner signer) {
            this.manifestService = manifestService;
            this.signer = signer;
        }

        @Parameters(index = "0", description = "Repository root.")
        private Path repositoryRoot;

        @Parameters(index = "1", description = "Profile uuid.")
        private String uuid;

        @Option(names = {"-k", "--key"}, required = true, description = "Signing key identifier.")
        private String keyId;

        /**
         * Unpublishes a profile.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                SystemDependencies.verifyFor(signer);
                ProfileEntry removed = manifestService.unpublish(repositoryRoot, uuid, keyId);
                Cli.success("Unpublished `" + removed.name() + "`. Its file " + removed.path() + " is no longer tracked.");
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }
}
