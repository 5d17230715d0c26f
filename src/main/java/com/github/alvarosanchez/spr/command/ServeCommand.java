package com.github.alvarosanchez.spr.command;

import io.micronaut.context.ApplicationContext;
import io.micronaut.runtime.server.EmbeddedServer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "serve", description = "Serve the read API for a repository.")
class ServeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Repository root.")
    private Path repositoryRoot;

    @Option(names = {"-p", "--port"}, defaultValue = "8080", description = "HTTP port (default: ${DEFAULT-VALUE}).")
    private int port;

    @Override
    public Integer call() {
        Path root = repositoryRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            Cli.error("Repository directory does not exist: " + root);
            return 1;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        try (ApplicationContext context = ApplicationContext
            .builder()
            .properties(Map.of("spr.repository.root", root.toString(), "micronaut.server.port", port))
            .start()) {
            EmbeddedServer server = context.getBean(EmbeddedServer.class);
            server.start();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop();
                stopped.countDown();
            }));
            Cli.info("Serving " + root + " at " + server.getURL() + "/api/v1");
            stopped.await();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Cli.error("Interrupted while serving " + root);
            return 1;
        } catch (RuntimeException e) {
            Cli.error(e.getMessage());
            return 1;
        }
    }
}
