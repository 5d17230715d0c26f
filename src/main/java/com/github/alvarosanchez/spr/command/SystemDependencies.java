package com.github.alvarosanchez.spr.command;

import com.github.alvarosanchez.spr.gpg.GpgManifestSigner;
import com.github.alvarosanchez.spr.manifest.ManifestSigner;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

final class SystemDependencies {

    private static final DependencyCheck GPG = new DependencyCheck(
        "gpg",
        List.of("--version"),
        "Install GnuPG and ensure `gpg` is available in PATH."
    );

    private SystemDependencies() {
    }

    static void verifyFor(ManifestSigner signer) {
        if (signer instanceof GpgManifestSigner) {
            verify(GPG);
        }
    }

    private static void verify(DependencyCheck dependency) {
        List<String> command = new ArrayList<>();
        command.add(dependency.executable());
        command.addAll(dependency.versionArgs());
        try {
            Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw missingDependency(dependency);
            }
        } catch (IOException e) {
            throw missingDependency(dependency);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while checking system dependencies.", e);
        }
    }

    private static IllegalStateException missingDependency(DependencyCheck dependency) {
        return new IllegalStateException(
            "Missing required dependency `"
                + dependency.executable()
                + "`. "
                + dependency.installHint()
        );
    }

    private record DependencyCheck(String executable, List<String> versionArgs, String installHint) {
    }
}
