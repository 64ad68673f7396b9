package com.phonepe.triplestore.core.store;

import com.phonepe.triplestore.core.embedding.TextEmbedder;
import com.phonepe.triplestore.core.errors.EmbeddingFailure;
import com.phonepe.triplestore.core.errors.MissingCapabilityError;
import com.phonepe.triplestore.core.errors.TripleStoreException;
import com.phonepe.triplestore.core.errors.ValidationError;
import com.phonepe.triplestore.core.model.CanonicalText;
import com.phonepe.triplestore.core.model.ScoredAssertion;
import com.phonepe.triplestore.core.model.TripleAssertion;
import com.phonepe.triplestore.core.query.TripleQuery;
import com.phonepe.triplestore.core.utils.VectorMath;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Embedding and ranking steps shared by all backends
 */
@UtilityClass
public class SemanticSearch {

    /**
     * A filtered row competing for a semantic query
     *
     * @param sequence  insertion sequence, used to break score ties
     * @param assertion the stored assertion
     * @param vector    stored vector, null if the row was written without an embedder
     */
    public record Candidate(long sequence, TripleAssertion assertion, float[] vector) {
    }

    /**
     * Computes one vector per assertion from its canonical embedding text
     *
     * @throws EmbeddingFailure if the embedder fails or returns unusable vectors
     */
    public static List<float[]> embedAssertions(final TextEmbedder embedder, final List<TripleAssertion> assertions) {
        final var texts = assertions.stream()
                .map(CanonicalText::embeddingText)
                .toList();
        final List<float[]> vectors;
        try {
            vectors = embedder.embedAll(texts);
        }
        catch (TripleStoreException e) {
            throw e;
        }
        catch (RuntimeException e) {
            throw new EmbeddingFailure("embedder failed for a batch of %d texts: %s".formatted(texts.size(),
                                                                                              e.getMessage()), e);
        }
        if (vectors == null || vectors.size() != texts.size()) {
            throw new EmbeddingFailure("embedder returned %s vectors for %d texts"
                                               .formatted(vectors == null ? "no" : vectors.size(), texts.size()));
        }
        var dimension = -1;
        for (final var vector : vectors) {
            requireUsable(vector);
            if (dimension >= 0 && vector.length != dimension) {
                throw new EmbeddingFailure("embedder returned vectors of different dimensions: %d and %d"
                                                   .formatted(dimension, vector.length));
            }
            dimension = vector.length;
        }
        return vectors;
    }

    /**
     * Resolves the vector a query should be ranked against
     *
     * @return the caller supplied vector, the embedded query text, or null for structured queries
     * @throws MissingCapabilityError if query text is given but there is no embedder
     */
    public static float[] resolveQueryVector(final TripleQuery query, final TextEmbedder embedder) {
        final var supplied = query.getQueryVector();
        if (supplied != null) {
            return supplied;
        }
        if (query.getQueryText() == null) {
            return null;
        }
        if (embedder == null) {
            throw new MissingCapabilityError(
                    "query_text requires a configured embedder (vector search); keyword fallback is disabled");
        }
        final float[] vector;
        try {
            vector = embedder.embed(query.getQueryText());
        }
        catch (TripleStoreException e) {
            throw e;
        }
        catch (RuntimeException e) {
            throw new EmbeddingFailure("embedder failed for query_text: " + e.getMessage(), e);
        }
        return requireUsable(vector);
    }

    /**
     * Ranks candidates by descending cosine similarity, ties in insertion order. Rows without a vector are skipped,
     * rows scoring below {@link TripleQuery#getMinScore()} are dropped, and the limit is applied last.
     */
    public static List<ScoredAssertion> rank(final List<Candidate> candidates,
                                             final float[] queryVector,
                                             final TripleQuery query) {
        record Scored(Candidate candidate, double score) {
        }

        final var scored = new ArrayList<Scored>();
        for (final var candidate : candidates) {
            if (candidate.vector() == null) {
                continue;
            }
            final var score = VectorMath.cosineSimilarity(queryVector, candidate.vector());
            if (query.getMinScore() != null && score < query.getMinScore()) {
                continue;
            }
            scored.add(new Scored(candidate, score));
        }
        scored.sort(Comparator.comparingDouble(Scored::score)
                            .reversed()
                            .thenComparingLong(s -> s.candidate().sequence()));
        return limit(scored.stream()
                             .map(s -> ScoredAssertion.of(s.candidate().assertion(), s.score()))
                             .toList(),
                     query);
    }

    /**
     * Checks a new batch against the vector dimension already recorded by a store
     *
     * @param recorded dimension of previously stored vectors, negative if none were stored yet
     * @param incoming dimension of the new batch
     * @return the dimension to record
     * @throws ValidationError if the dimensions differ
     */
    public static int requireDimension(final int recorded, final int incoming) {
        if (recorded >= 0 && recorded != incoming) {
            throw new ValidationError("vector dimension %d does not match the stored dimension %d"
                                              .formatted(incoming, recorded));
        }
        return incoming;
    }

    /**
     * Applies {@link TripleQuery#getLimit()} to an already ordered list
     */
    public static <T> List<T> limit(final List<T> ordered, final TripleQuery query) {
        if (!query.isLimited() || ordered.size() <= query.getLimit()) {
            return ordered;
        }
        return List.copyOf(ordered.subList(0, query.getLimit()));
    }

    private static float[] requireUsable(final float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new EmbeddingFailure("embedder returned an empty vector");
        }
        return vector;
    }
}
