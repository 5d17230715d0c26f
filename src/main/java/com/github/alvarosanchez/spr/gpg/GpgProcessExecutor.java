package com.github.alvarosanchez.spr.gpg;

import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.List;

/**
 * Low-level process launcher used for gpg command execution.
 */
@Singleton
public class GpgProcessExecutor {

    /**
     * Starts a process for the provided command.
     *
     * @param command command and arguments to execute
     * @return started process instance
     * @throws IOException when the process cannot be started
     */
    public Process start(List<String> command) throws IOException {
        return new ProcessBuilder(command).redirectErrorStream(true).start();
    }
}
