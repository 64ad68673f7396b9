package com.phonepe.triplestore.core.store;

import com.phonepe.triplestore.core.embedding.TextEmbedder;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic test embedder. Each dimension counts the occurrences of one vocabulary word in the text.
 */
public class VocabularyEmbedder implements TextEmbedder {
    private final List<String> vocabulary;
    private final AtomicInteger calls = new AtomicInteger();

    public VocabularyEmbedder(String... vocabulary) {
        this.vocabulary = List.of(vocabulary);
    }

    @Override
    public float[] embed(String text) {
        calls.incrementAndGet();
        final var vector = new float[vocabulary.size()];
        for (final var token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9_]+")) {
            final var index = vocabulary.indexOf(token);
            if (index >= 0) {
                vector[index] += 1.0f;
            }
        }
        return vector;
    }

    public int calls() {
        return calls.get();
    }

    public int dimension() {
        return vocabulary.size();
    }

    /**
     * @return a unit vector along the dimension of the given word
     */
    public float[] direction(String word) {
        final var vector = new float[vocabulary.size()];
        vector[vocabulary.indexOf(word)] = 1.0f;
        return vector;
    }
}
