package com.github.alvarosanchez.spr.resolve;

import com.github.alvarosanchez.spr.ErrorKind;
import java.util.List;

/**
 * Thrown when a config file is not a JSON object.
 */
public final class MalformedConfigException extends ResolutionException {

    private static final long serialVersionUID = 1L;

    MalformedConfigException(String location, Throwable cause) {
        super("Config file `" + location + "` is not a valid JSON object.", List.of());
        initCause(cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MALFORMED_CONFIG;
    }
}
