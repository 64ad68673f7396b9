package com.phonepe.triplestore.core.embedding;

import java.util.List;

/**
 * Turns text into a fixed-length vector. Stores treat implementations as pure functions supplied by the caller's
 * environment; transport, batching, caching and timeouts belong to the implementation.
 */
public interface TextEmbedder extends AutoCloseable {
    /**
     * Get the embedding for the given input
     *
     * @param text The input to get the embedding for
     * @return The embedding for the input
     */
    float[] embed(String text);

    /**
     * Embeds a batch. Implementations that can batch remote calls should override this.
     *
     * @param texts inputs
     * @return one vector per input, in input order
     */
    default List<float[]> embedAll(List<String> texts) {
        return texts.stream()
                .map(this::embed)
                .toList();
    }

    @Override
    default void close() {
        //Nothing to release by default
    }
}
