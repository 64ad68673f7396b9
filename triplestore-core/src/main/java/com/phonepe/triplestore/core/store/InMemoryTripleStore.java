package com.phonepe.triplestore.core.store;

import com.phonepe.triplestore.core.embedding.TextEmbedder;
import com.phonepe.triplestore.core.errors.StorageIOError;
import com.phonepe.triplestore.core.model.ScoredAssertion;
import com.phonepe.triplestore.core.model.TripleAssertion;
import com.phonepe.triplestore.core.query.SortOrder;
import com.phonepe.triplestore.core.query.TripleQuery;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Process-local store. Contents are lost when the instance is discarded.
 * <p>
 * Not synchronized: callers sharing an instance between threads must serialize access themselves.
 */
@Slf4j
public class InMemoryTripleStore implements TripleStore {

    private record Row(String id, long sequence, TripleAssertion assertion, float[] vector) {
    }

    private static final Comparator<Row> BY_OBSERVED_AT = Comparator
            .comparing((Row row) -> row.assertion().getObservedAt())
            .thenComparingLong(Row::sequence);

    private final TextEmbedder embedder;
    private final List<Row> rows = new ArrayList<>();
    private long nextSequence;
    private int vectorDimension = -1;
    private boolean closed;

    public InMemoryTripleStore() {
        this(null);
    }

    /**
     * @param embedder used to vectorize assertions on add and query text on query. May be null.
     */
    public InMemoryTripleStore(TextEmbedder embedder) {
        this.embedder = embedder;
    }

    @Override
    public List<String> add(Collection<TripleAssertion> assertions) {
        ensureOpen();
        Objects.requireNonNull(assertions, "assertions");
        if (assertions.isEmpty()) {
            return List.of();
        }
        final var batch = List.copyOf(assertions);
        final var vectors = embedder == null ? null : SemanticSearch.embedAssertions(embedder, batch);
        if (vectors != null) {
            vectorDimension = SemanticSearch.requireDimension(vectorDimension, vectors.get(0).length);
        }
        final var ids = new ArrayList<String>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            final var id = UUID.randomUUID().toString();
            rows.add(new Row(id, nextSequence++, batch.get(i), vectors == null ? null : vectors.get(i)));
            ids.add(id);
        }
        log.debug("Added {} assertions, store now holds {}", batch.size(), rows.size());
        return ids;
    }

    @Override
    public List<ScoredAssertion> queryScored(TripleQuery query) {
        ensureOpen();
        Objects.requireNonNull(query, "query");
        final var queryVector = SemanticSearch.resolveQueryVector(query, embedder);
        final var matched = rows.stream()
                .filter(row -> query.matches(row.assertion()))
                .toList();
        if (queryVector != null) {
            return SemanticSearch.rank(matched.stream()
                                               .map(row -> new SemanticSearch.Candidate(row.sequence(),
                                                                                        row.assertion(),
                                                                                        row.vector()))
                                               .toList(),
                                       queryVector,
                                       query);
        }
        final var comparator = query.getOrder() == SortOrder.DESC ? BY_OBSERVED_AT.reversed() : BY_OBSERVED_AT;
        return SemanticSearch.limit(matched.stream()
                                            .sorted(comparator)
                                            .map(row -> ScoredAssertion.unscored(row.assertion()))
                                            .toList(),
                                    query);
    }

    /**
     * @return number of stored assertions
     */
    public int size() {
        return rows.size();
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageIOError("store is closed");
        }
    }
}
