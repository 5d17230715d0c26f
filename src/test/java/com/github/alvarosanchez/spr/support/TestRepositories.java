package com.github.alvarosanchez.spr.support;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds profile repositories on disk for tests.
 */
public final class TestRepositories {

    public static final String COMMON = "configs/orcaslicer/base/fdm_filament_common.json";
    public static final String PLA_BASE = "configs/orcaslicer/base/fdm_filament_pla.json";
    public static final String GENERIC_PLA = "configs/orcaslicer/filament/Generic PLA.json";

    private TestRepositories() {
    }

    /**
     * Writes a three-level filament chain: {@code fdm_filament_common <- fdm_filament_pla <- Generic PLA}.
     *
     * @param root repository root
     * @return the repository root
     * @throws IOException when a file cannot be written
     */
    public static Path filamentRepository(Path root) throws IOException {
        write(
            root,
            COMMON,
            "{\"name\":\"fdm_filament_common\",\"instantiation\":\"false\",\"nozzle_temperature\":[200],\"fan_speed\":40}"
        );
        write(
            root,
            PLA_BASE,
            "{\"name\":\"fdm_filament_pla\",\"inherits\":\"fdm_filament_common\",\"instantiation\":\"false\","
                + "\"nozzle_temperature\":[210],\"filament_type\":\"PLA\"}"
        );
        write(
            root,
            GENERIC_PLA,
            "{\"metadata\":{\"author\":\"acme\"},\"config\":{\"name\":\"Generic PLA\",\"inherits\":\"fdm_filament_pla\","
                + "\"from\":\"system\",\"instantiation\":\"true\"}}"
        );
        return root;
    }

    public static Path write(Path root, String relativePath, String content) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}
