package com.phonepe.triplestore.core.errors;

/**
 * The configured {@link com.phonepe.triplestore.core.embedding.TextEmbedder} could not produce a vector
 */
public class EmbeddingFailure extends TripleStoreException {
    public EmbeddingFailure(final String message) {
        super(ErrorType.EMBEDDING_FAILURE, message);
    }

    public EmbeddingFailure(final String message, final Throwable cause) {
        super(ErrorType.EMBEDDING_FAILURE, message, cause);
    }
}
