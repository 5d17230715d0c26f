package com.github.alvarosanchez.spr.command;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Root Picocli command for the slicer profile repository CLI.
 */
@Command(
    name = "spr",
    description = "Signed slicer profile repositories with inheritance resolution.",
    mixinStandardHelpOptions = true,
    versionProvider = SprVersionProvider.class,
    subcommands = {
        CommandLine.HelpCommand.class,
        ManifestCommand.class,
        ResolveCommand.class,
        DependenciesCommand.class,
        ServeCommand.class,
        RepositoryCommand.class,
        ProfileCommand.class
    }
)
public class SprCommand implements Runnable {

    /**
     * Prints root command usage when no subcommand is provided.
     */
    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }
}
