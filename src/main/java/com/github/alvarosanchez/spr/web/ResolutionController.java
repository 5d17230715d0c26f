package com.github.alvarosanchez.spr.web;

import com.github.alvarosanchez.spr.service.DependencyReport;
import com.github.alvarosanchez.spr.service.ResolutionService;
import com.github.alvarosanchez.spr.service.ResolvedView;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.QueryValue;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;

/**
 * Read API over the configured repository.
 */
@Controller("/api/v1")
@ExecuteOn(TaskExecutors.BLOCKING)
public class ResolutionController {

    private final ResolutionService resolutionService;

    ResolutionController(ResolutionService resolutionService) {
        this.resolutionService = resolutionService;
    }

    /**
     * Lists the inheritance dependencies of a config.
     *
     * @param slicer slicer directory
     * @param type profile type directory
     * @param path file path within the type directory
     * @param format {@code tree} to include the nested dependency tree
     * @param depth maximum inheritance depth
     * @param includeMetadata whether to include checksums and metadata sections
     * @return dependency report
     */
    @Get("/dependencies/{slicer}/{type}/{+path}")
    public DependencyReport dependencies(
        @PathVariable String slicer,
        @PathVariable String type,
        @PathVariable String path,
        @Nullable @QueryValue String format,
        @Nullable @QueryValue Integer depth,
        @QueryValue(value = "include_metadata", defaultValue = "false") boolean includeMetadata
    ) {
        return resolutionService.dependencies(
            resolutionService.defaultRepository(),
            slicer,
            type,
            path,
            "tree".equalsIgnoreCase(format),
            depth,
            includeMetadata
        );
    }

    /**
     * Returns the fully resolved config.
     *
     * @param slicer slicer directory
     * @param type profile type directory
     * @param path file path within the type directory
     * @param includeSourceMap whether to include per-field provenance
     * @param validate whether to run structural checks
     * @return resolved view
     */
    @Get("/resolved/{slicer}/{type}/{+path}")
    public ResolvedView resolved(
        @PathVariable String slicer,
        @PathVariable String type,
        @PathVariable String path,
        @QueryValue(value = "include_source_map", defaultValue = "false") boolean includeSourceMap,
        @QueryValue(defaultValue = "false") boolean validate
    ) {
        return resolutionService.resolved(
            resolutionService.defaultRepository(),
            slicer,
            type,
            path,
            includeSourceMap,
            validate
        );
    }
}
