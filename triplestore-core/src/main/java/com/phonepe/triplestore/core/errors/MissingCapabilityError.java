package com.phonepe.triplestore.core.errors;

/**
 * A query asked for something the store was not configured to do. Raised for {@code query_text} on a store without
 * an embedder; there is no keyword fallback.
 */
public class MissingCapabilityError extends TripleStoreException {
    public MissingCapabilityError(final String message) {
        super(ErrorType.MISSING_CAPABILITY, message);
    }
}
