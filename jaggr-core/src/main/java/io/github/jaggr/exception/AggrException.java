package io.github.jaggr.exception;

import javax.annotation.Nonnull;

/**
 * Base of every error that aborts an aggregation request.
 */
public abstract class AggrException extends RuntimeException {
    protected AggrException(@Nonnull String message) {
        super(message);
    }

    protected AggrException(@Nonnull String message, Throwable cause) {
        super(message, cause);
    }
}
