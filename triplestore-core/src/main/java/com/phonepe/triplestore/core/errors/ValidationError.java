package com.phonepe.triplestore.core.errors;

/**
 * Malformed assertion or query input, e.g. a subject that is empty after canonicalization
 */
public class ValidationError extends TripleStoreException {
    public ValidationError(final String message) {
        super(ErrorType.VALIDATION_FAILURE, message);
    }

    public ValidationError(final String message, final Throwable cause) {
        super(ErrorType.VALIDATION_FAILURE, message, cause);
    }
}
