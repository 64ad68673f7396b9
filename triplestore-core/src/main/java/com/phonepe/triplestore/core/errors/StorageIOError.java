package com.phonepe.triplestore.core.errors;

/**
 * Failure opening, writing or reading persistent storage
 */
public class StorageIOError extends TripleStoreException {
    public StorageIOError(final String message) {
        super(ErrorType.STORAGE_IO_FAILURE, message);
    }

    public StorageIOError(final String message, final Throwable cause) {
        super(ErrorType.STORAGE_IO_FAILURE, message, cause);
    }
}
