package com.github.alvarosanchez.spr.command;

import com.github.alvarosanchez.spr.resolve.ResolutionException;
import io.micronaut.serde.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Prints read-path results as JSON and resolution failures with their chain.
 */
final class ResolutionOutput {

    private ResolutionOutput() {
    }

    static void printJson(ObjectMapper objectMapper, Object document) {
        try {
            Cli.print(objectMapper.writeValueAsString(document));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize output", e);
        }
    }

    static void printFailure(ResolutionException exception) {
        Cli.error("[" + exception.kind().name() + "] " + exception.getMessage());
        if (!exception.chain().isEmpty()) {
            System.err.println("  chain: " + String.join(" -> ", exception.chain()));
        }
    }
}
