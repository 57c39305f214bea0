package io.github.jaggr.exception;

import javax.annotation.Nonnull;

public class OutOfOrderException extends AggrException {
    public OutOfOrderException(@Nonnull String message) {
        super(message);
    }
}
