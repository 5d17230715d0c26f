package com.github.alvarosanchez.spr.resolve;

import com.github.alvarosanchez.spr.ErrorKind;
import java.util.List;

/**
 * Thrown when an inheritance chain is deeper than the allowed maximum.
 */
public final class DepthExceededException extends ResolutionException {

    private static final long serialVersionUID = 1L;

    private final int maxDepth;

    DepthExceededException(int maxDepth, List<String> chain) {
        super("Config inheritance is deeper than " + maxDepth + ": " + String.join(" -> ", chain), chain);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DEPTH_EXCEEDED;
    }
}
