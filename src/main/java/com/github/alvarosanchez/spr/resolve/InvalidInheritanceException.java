package com.github.alvarosanchez.spr.resolve;

import com.github.alvarosanchez.spr.ErrorKind;
import java.util.List;

/**
 * Thrown when {@code inherits} or {@code from} cannot be interpreted.
 */
public final class InvalidInheritanceException extends ResolutionException {

    private static final long serialVersionUID = 1L;

    InvalidInheritanceException(String message, List<String> chain) {
        super(message, chain);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_INHERITANCE;
    }
}
