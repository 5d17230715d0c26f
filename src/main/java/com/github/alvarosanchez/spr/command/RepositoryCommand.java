package com.github.alvarosanchez.spr.command;

import com.github.alvarosanchez.spr.registry.RegistryFile.RepositoryEntry;
import com.github.alvarosanchez.spr.service.RepositoryService;
import jakarta.inject.Inject;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Command group for repository-related operations.
 */
@Command(
    name = "repository",
    description = "Manage trusted profile repositories.",
    mixinStandardHelpOptions = true,
    subcommands = {
        RepositoryCommand.AddCommand.class,
        RepositoryCommand.DeleteCommand.class,
        RepositoryCommand.ListCommand.class
    }
)
public class RepositoryCommand implements Runnable {

    /**
     * Prints repository command usage when no subcommand is provided.
     */
    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    @Command(name = "add", description = "Verify a local repository and pin its public key.")
    static class AddCommand implements Callable<Integer> {

        private final RepositoryService repositoryService;

        @Inject
        AddCommand(RepositoryService repositoryService) {
            this.repositoryService = repositoryService;
        }

        @Parameters(index = "0", description = "Repository root.")
        private String repositoryPath;

        /**
         * Adds a repository to the local registry.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                RepositoryEntry added = repositoryService.add(repositoryPath);
                System.out.println("Added repository `" + added.name() + "` (namespace `" + added.namespace() + "`).");
                return 0;
            } catch (RuntimeException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "delete", description = "Delete a registered repository.")
    static class DeleteCommand implements Callable<Integer> {

        private final RepositoryService repositoryService;

        @Inject
        DeleteCommand(RepositoryService repositoryService) {
            this.repositoryService = repositoryService;
        }

        @Parameters(index = "0", description = "Repository name.")
        private String repositoryName;

        /**
         * Deletes a repository from the local registry.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                RepositoryEntry deleted = repositoryService.delete(repositoryName);
                System.out.println("Deleted repository `" + deleted.name() + "`.");
                return 0;
            } catch (RuntimeException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "list", description = "List registered repositories.")
    static class ListCommand implements Callable<Integer> {

        private final RepositoryService repositoryService;

        @Inject
        ListCommand(RepositoryService repositoryService) {
            this.repositoryService = repositoryService;
        }

        @Override
        public Integer call() {
            try {
                List<RepositoryEntry> repositories = repositoryService.load();
                if (repositories.isEmpty()) {
                    Cli.warning("No repositories registered yet. Add one with `spr repository add`.");
                    return 0;
                }
                for (RepositoryEntry repository : repositories) {
                    System.out.println(repository.name() + "\t" + repository.namespace() + "\t" + repository.localPath());
                }
                return 0;
            } catch (RuntimeException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }
}
