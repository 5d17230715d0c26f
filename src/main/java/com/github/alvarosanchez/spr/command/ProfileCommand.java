package com.github.alvarosanchez.spr.command;

import com.github.alvarosanchez.spr.manifest.ProfileEntry;
import com.github.alvarosanchez.spr.service.ProfileService;
import com.github.alvarosanchez.spr.service.ProfileService.InstallResult;
import com.github.alvarosanchez.spr.service.ProfileService.ProfileListResult;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command group for profiles of registered repositories.
 */
@Command(
    name = "profile",
    description = "List and install profiles from trusted repositories.",
    mixinStandardHelpOptions = true,
    subcommands = {
        ProfileCommand.ListCommand.class,
        ProfileCommand.InstallCommand.class
    }
)
public class ProfileCommand implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    @Command(name = "list", description = "List profiles of verified repositories.")
    static class ListCommand implements Callable<Integer> {

        private final ProfileService profileService;

        @Inject
        ListCommand(ProfileService profileService) {
            this.profileService = profileService;
        }

        @Option(names = "--slicer", description = "Only list profiles for this slicer.")
        private String slicer;

        /**
         * Prints profiles of every trusted repository.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                ProfileListResult result = profileService.listProfiles(slicer);
                if (result.rows().isEmpty()) {
                    Cli.warning("No profiles available. Add a repository with `spr repository add`.");
                } else {
                    System.out.print(ProfileTableRenderer.render(result.rows()));
                }
                if (!result.untrustedRepositories().isEmpty()) {
                    Cli.warning(
                        "! Skipped repositories that failed verification: "
                            + String.join(", ", result.untrustedRepositories())
                            + "."
                    );
                }
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "install", description = "Install a profile and its dependencies.")
    static class InstallCommand implements Callable<Integer> {

        private final ProfileService profileService;

        @Inject
        InstallCommand(ProfileService profileService) {
            this.profileService = profileService;
        }

        @Parameters(index = "0", description = "Profile name or namespace/name.")
        private String reference;

        @Option(names = "--slicer", required = true, description = "Slicer the profile belongs to.")
        private String slicer;

        @Option(names = "--target", description = "Install directory. Defaults to the spr cache directory.")
        private Path target;

        /**
         * Installs a profile.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                InstallResult result = profileService.install(reference, slicer, target);
                for (ProfileEntry profile : result.profiles()) {
                    Cli.print("  " + profile.name() + " " + profile.version());
                }
                Cli.success("Installed " + result.profiles().size() + " file(s) into " + result.target());
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }
}
