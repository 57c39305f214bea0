package io.github.jaggr.exception;

import javax.annotation.Nonnull;

public class UnsupportedFunctionException extends AggrException {
    public UnsupportedFunctionException(@Nonnull String message) {
        super(message);
    }
}
