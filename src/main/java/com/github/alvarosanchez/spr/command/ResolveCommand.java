package com.github.alvarosanchez.spr.command;

import com.github.alvarosanchez.spr.resolve.ResolutionException;
import com.github.alvarosanchez.spr.service.ResolutionService;
import io.micronaut.serde.ObjectMapper;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "resolve", description = "Print the fully resolved config of a profile file.")
class ResolveCommand implements Callable<Integer> {

    private final ResolutionService resolutionService;
    private final ObjectMapper objectMapper;

    @Inject
    ResolveCommand(ResolutionService resolutionService, ObjectMapper objectMapper) {
        this.resolutionService = resolutionService;
        this.objectMapper = objectMapper;
    }

    @Parameters(index = "0", description = "Repository root.")
    private Path repositoryRoot;

    @Parameters(index = "1", description = "Slicer directory.")
    private String slicer;

    @Parameters(index = "2", description = "Profile type directory.")
    private String type;

    @Parameters(index = "3", description = "File path within the type directory.")
    private String path;

    @Option(names = "--source-map", description = "Include the per-field source map.")
    private boolean includeSourceMap;

    @Option(names = "--validate", description = "Report structural validation errors.")
    private boolean validate;

    @Override
    public Integer call() {
        try {
            ResolutionOutput.printJson(
                objectMapper,
                resolutionService.resolved(repositoryRoot, slicer, type, path, includeSourceMap, validate)
            );
            return 0;
        } catch (ResolutionException e) {
            ResolutionOutput.printFailure(e);
            return 1;
        } catch (RuntimeException e) {
            Cli.error(e.getMessage());
            return 1;
        }
    }
}
