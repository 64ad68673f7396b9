package com.phonepe.triplestore.core.store;

import com.phonepe.triplestore.core.model.ScoredAssertion;
import com.phonepe.triplestore.core.model.TripleAssertion;
import com.phonepe.triplestore.core.query.TripleQuery;

import java.util.Collection;
import java.util.List;

/**
 * Append-only store of {@link TripleAssertion}s.
 * <p>
 * Every implementation honours the same query contract: structured results are ordered by observed_at (ties in
 * insertion order) before the limit is applied, observed_at bounds are inclusive, valid_until is exclusive and
 * semantic results are ranked by descending cosine similarity. There is no update or delete.
 */
public interface TripleStore extends AutoCloseable {

    /**
     * Appends a batch. Either every assertion in the batch becomes visible to later queries or, on failure, none does.
     *
     * @param assertions batch to append
     * @return generated assertion ids, in batch order
     * @throws com.phonepe.triplestore.core.errors.EmbeddingFailure if vectors could not be computed
     * @throws com.phonepe.triplestore.core.errors.StorageIOError   if the batch could not be persisted
     */
    List<String> add(Collection<TripleAssertion> assertions);

    /**
     * Runs a query and returns the matching assertions together with their similarity scores
     *
     * @param query query to run
     * @return ordered hits, possibly empty
     * @throws com.phonepe.triplestore.core.errors.MissingCapabilityError if {@code query_text} is set and the store
     *                                                                    has no embedder
     */
    List<ScoredAssertion> queryScored(TripleQuery query);

    /**
     * Runs a query
     *
     * @param query query to run
     * @return ordered matching assertions, possibly empty
     * @throws com.phonepe.triplestore.core.errors.MissingCapabilityError if {@code query_text} is set and the store
     *                                                                    has no embedder
     */
    default List<TripleAssertion> query(TripleQuery query) {
        return queryScored(query).stream()
                .map(ScoredAssertion::getAssertion)
                .toList();
    }

    /**
     * Releases resources held by the store. Does not close the embedder, which is owned by the caller.
     */
    @Override
    void close();
}
