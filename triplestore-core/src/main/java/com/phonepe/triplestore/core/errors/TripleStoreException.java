package com.phonepe.triplestore.core.errors;

import lombok.Getter;

/**
 * Base for all errors raised by the triple store. Unchecked, surfaced synchronously from {@code add} and
 * {@code query}.
 */
@Getter
public abstract class TripleStoreException extends RuntimeException {
    private final ErrorType errorType;

    protected TripleStoreException(ErrorType errorType, String detail) {
        super(errorType.getMessage().formatted(detail));
        this.errorType = errorType;
    }

    protected TripleStoreException(ErrorType errorType, String detail, Throwable cause) {
        super(errorType.getMessage().formatted(detail), cause);
        this.errorType = errorType;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }
}
