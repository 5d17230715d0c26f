package com.github.alvarosanchez.spr.resolve;

import com.github.alvarosanchez.spr.ErrorKind;
import java.util.List;

/**
 * Thrown when an inheritance chain returns to a config it is already resolving.
 */
public final class CircularDependencyException extends ResolutionException {

    private static final long serialVersionUID = 1L;

    CircularDependencyException(List<String> cycle) {
        super("Config inheritance cycle detected: " + String.join(" -> ", cycle), cycle);
    }

    /**
     * Returns the cycle, starting and ending with the repeated config.
     *
     * @return cycle names
     */
    public List<String> cycle() {
        return chain();
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CIRCULAR_DEPENDENCY;
    }
}
