package com.github.alvarosanchez.spr.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.alvarosanchez.spr.resolve.DepthExceededException;
import com.github.alvarosanchez.spr.service.DependencyReport.TreeNode;
import com.github.alvarosanchez.spr.support.TestRepositories;
import io.micronaut.context.ApplicationContext;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResolutionServiceTest {

    @TempDir
    Path tempDir;

    private ApplicationContext applicationContext;
    private ResolutionService resolutionService;
    private Path repository;

    @BeforeEach
    void setUp() throws IOException {
        applicationContext = ApplicationContext.run();
        resolutionService = applicationContext.getBean(ResolutionService.class);
        repository = TestRepositories.filamentRepository(tempDir.resolve("profiles"));
    }

    @AfterEach
    void tearDown() {
        applicationContext.close();
    }

    @Test
    void dependenciesListParentsRootFirstWithTree() {
        DependencyReport report = resolutionService.dependencies(
            repository, "orcaslicer", "filament", "Generic PLA.json", true, null, false
        );

        assertEquals("Generic PLA", report.target().name());
        assertEquals(TestRepositories.GENERIC_PLA, report.target().path());
        assertEquals("fdm_filament_pla", report.target().inherits());
        assertEquals("system", report.target().from());
        assertNull(report.target().checksum());
        assertEquals(
            List.of("fdm_filament_common", "fdm_filament_pla"),
            report.dependencies().stream().map(DependencyReport.ConfigNode::name).toList()
        );
        assertEquals(List.of("fdm_filament_common", "fdm_filament_pla", "Generic PLA"), report.resolutionOrder());

        TreeNode tree = report.dependencyTree();
        assertEquals("Generic PLA", tree.name());
        assertEquals("fdm_filament_pla", tree.children().get(0).name());
        assertEquals("fdm_filament_common", tree.children().get(0).children().get(0).name());
        assertTrue(tree.children().get(0).children().get(0).children().isEmpty());
    }

    @Test
    void dependenciesIncludeMetadataOnRequest() {
        DependencyReport report = resolutionService.dependencies(
            repository, "orcaslicer", "filament", "Generic PLA.json", false, null, true
        );

        assertNull(report.dependencyTree());
        assertTrue(report.target().checksum().startsWith("sha256:"));
        assertEquals(Map.of("author", "acme"), report.target().metadata());
    }

    @Test
    void resolvedViewCarriesSourceMapAndValidation() {
        ResolvedView view = resolutionService.resolved(repository, "orcaslicer", "filament", "Generic PLA.json", true, true);

        assertEquals(List.of(210), view.resolvedConfig().get("nozzle_temperature"));
        assertEquals("PLA", view.resolvedConfig().get("filament_type"));
        assertTrue(view.instantiable());
        assertEquals("fdm_filament_pla", view.sourceMap().get("nozzle_temperature"));
        assertEquals(List.of(), view.validationErrors());
    }

    @Test
    void validationFlagsNonInstantiableBases() throws IOException {
        ResolvedView view = resolutionService.resolved(repository, "orcaslicer", "base", "fdm_filament_pla.json", false, true);

        assertNull(view.sourceMap());
        assertEquals(List.of("Config `fdm_filament_pla` is not instantiable."), view.validationErrors());
    }

    @Test
    void depthLimitIsApplied() {
        assertThrows(
            DepthExceededException.class,
            () -> resolutionService.resolve(repository, "orcaslicer", "filament", "Generic PLA.json", 1)
        );
        assertThrows(
            IllegalArgumentException.class,
            () -> resolutionService.resolve(repository, "orcaslicer", "filament", "Generic PLA.json", -1)
        );
    }

    @Test
    void resolversAreKeptPerRepository() {
        assertSame(resolutionService.resolver(repository), resolutionService.resolver(repository.resolve(".")));
        assertNotNull(resolutionService.resolve(repository, "orcaslicer", "filament", "Generic PLA.json", null));

        resolutionService.invalidate(repository);

        assertEquals(0, resolutionService.resolver(repository).cache().size());
    }

    @Test
    void editedFilesArePickedUpWithoutInvalidation() throws IOException {
        resolutionService.resolve(repository, "orcaslicer", "filament", "Generic PLA.json", null);
        TestRepositories.write(
            repository,
            TestRepositories.COMMON,
            "{\"name\":\"fdm_filament_common\",\"nozzle_temperature\":[200],\"fan_speed\":80}"
        );

        ResolvedView view = resolutionService.resolved(repository, "orcaslicer", "filament", "Generic PLA.json", false, false);

        assertEquals(80, view.resolvedConfig().get("fan_speed"));
        assertNull(view.validationErrors());
    }
}
