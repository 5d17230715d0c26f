package com.github.alvarosanchez.spr.resolve;

import com.github.alvarosanchez.spr.ErrorKind;
import java.util.List;

/**
 * Thrown when no config exists for a key or path.
 */
public final class ConfigNotFoundException extends ResolutionException {

    private static final long serialVersionUID = 1L;

    ConfigNotFoundException(String reference, List<String> chain) {
        super("Config `" + reference + "` was not found.", chain);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFIG_NOT_FOUND;
    }
}
