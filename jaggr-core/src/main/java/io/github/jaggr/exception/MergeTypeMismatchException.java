package io.github.jaggr.exception;

import javax.annotation.Nonnull;

public class MergeTypeMismatchException extends AggrException {
    public MergeTypeMismatchException(@Nonnull String message) {
        super(message);
    }
}
