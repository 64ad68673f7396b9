package com.phonepe.triplestore.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Kinds of failures surfaced by triple stores. None of them is retried by the store itself; {@link #isRetryable()}
 * is a hint for callers.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    VALIDATION_FAILURE("Validation failed: %s", false),
    MISSING_CAPABILITY("Missing capability: %s", false),
    STORAGE_IO_FAILURE("Storage failure: %s", true),
    EMBEDDING_FAILURE("Embedding failed: %s", true),
    ;

    private final String message;
    private final boolean retryable;
}
