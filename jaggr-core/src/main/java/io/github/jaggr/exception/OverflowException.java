package io.github.jaggr.exception;

import javax.annotation.Nonnull;

public class OverflowException extends AggrException {
    public OverflowException(@Nonnull String message) {
        super(message);
    }

    public OverflowException(@Nonnull String message, Throwable cause) {
        super(message, cause);
    }
}
