package io.github.jaggr.exception;

import javax.annotation.Nonnull;

public class EncodingException extends AggrException {
    public EncodingException(@Nonnull String message) {
        super(message);
    }

    public EncodingException(@Nonnull String message, Throwable cause) {
        super(message, cause);
    }
}
