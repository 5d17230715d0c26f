package com.github.alvarosanchez.spr.command;

import com.github.alvarosanchez.spr.manifest.BumpKind;
import com.github.alvarosanchez.spr.manifest.FileChange;
import com.github.alvarosanchez.spr.manifest.NewProfileMetadata;
import com.github.alvarosanchez.spr.manifest.ProfileDecisionProvider;
import com.github.alvarosanchez.spr.manifest.ProfileEntry;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Asks the operator for every build decision, offering guessed defaults.
 */
final class ConsoleDecisionProvider implements ProfileDecisionProvider {

    private final BufferedReader input;
    private final PrintStream output;
    private final String namespace;

    ConsoleDecisionProvider(BufferedReader input, PrintStream output, String namespace) {
        this.input = input;
        this.output = output;
        this.namespace = namespace;
    }

    @Override
    public String namespace() {
        if (namespace != null && !namespace.isBlank()) {
            return namespace.trim();
        }
        return prompt("Repository namespace", NonInteractiveDecisionProvider.DEFAULT_NAMESPACE);
    }

    @Override
    public NewProfileMetadata describe(String path, NewProfileMetadata guess) {
        output.println("New profile: " + path);
        return new NewProfileMetadata(
            prompt("  Name", guess.name()),
            prompt("  Slicer", guess.slicer()),
            prompt("  Type", guess.type())
        );
    }

    @Override
    public BumpKind bump(ProfileEntry profile, FileChange change) {
        output.println("Modified profile: " + profile.name() + " (" + profile.version() + ") at " + profile.path());
        while (true) {
            String answer = prompt("  Bump (major|minor|patch)", "patch");
            Optional<BumpKind> kind = BumpKind.parse(answer);
            if (kind.isPresent()) {
                return kind.get();
            }
            output.println("  Unknown bump kind `" + answer + "`.");
        }
    }

    private String prompt(String label, String defaultValue) {
        boolean hasDefault = defaultValue != null && !defaultValue.isBlank();
        output.print(label + (hasDefault ? " [" + defaultValue + "]" : "") + ": ");
        output.flush();
        String line;
        try {
            line = input.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read console input", e);
        }
        if (line == null) {
            throw new IllegalStateException("Console input ended before all build decisions were made.");
        }
        return line.isBlank() ? (hasDefault ? defaultValue : "") : line.trim();
    }
}
