package com.github.alvarosanchez.spr.command;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import picocli.CommandLine.IVersionProvider;

/**
 * Provides the CLI version from the generated version resource.
 */
public final class SprVersionProvider implements IVersionProvider {

    private static final String VERSION_RESOURCE_PATH = "/META-INF/spr/version.txt";

    @Override
    public String[] getVersion() {
        try (var inputStream = SprVersionProvider.class.getResourceAsStream(VERSION_RESOURCE_PATH)) {
            if (inputStream == null) {
                throw new IllegalStateException("Version resource not found: " + VERSION_RESOURCE_PATH);
            }

            String version = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8).trim();
            if (version.isEmpty()) {
                throw new IllegalStateException("Version resource is empty: " + VERSION_RESOURCE_PATH);
            }

            return new String[] {version};
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read version resource: " + VERSION_RESOURCE_PATH, e);
        }
    }
}
