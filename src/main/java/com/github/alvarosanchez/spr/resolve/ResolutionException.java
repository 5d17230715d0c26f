package com.github.alvarosanchez.spr.resolve;

import com.github.alvarosanchez.spr.ErrorKind;
import java.util.List;

/**
 * Failure to resolve a config. Carries the inheritance chain walked so far, leaf first.
 */
public abstract class ResolutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient List<String> chain;

    ResolutionException(String message, List<String> chain) {
        super(message);
        this.chain = List.copyOf(chain);
    }

    /**
     * Returns the failure kind.
     *
     * @return machine-readable kind
     */
    public abstract ErrorKind kind();

    /**
     * Returns the config names involved in the failure.
     *
     * @return offending chain
     */
    public List<String> chain() {
        return chain;
    }
}
