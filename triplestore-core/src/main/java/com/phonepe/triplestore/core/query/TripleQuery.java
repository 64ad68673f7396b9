package com.phonepe.triplestore.core.query;

import com.google.common.base.Strings;
import com.phonepe.triplestore.core.model.Canonicalizer;
import com.phonepe.triplestore.core.model.Scope;
import com.phonepe.triplestore.core.model.TripleAssertion;
import com.phonepe.triplestore.core.utils.Timestamps;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;

/**
 * One read request against a {@link com.phonepe.triplestore.core.store.TripleStore}. Every filter is optional; an
 * empty query returns all assertions (up to {@link #limit}).
 * <p>
 * Term filters are canonicalized with the same rule applied to assertions, so {@code "  Scrooge "} finds
 * {@code "scrooge"}. Setting {@link #queryText} or {@link #queryVector} turns the query into a semantic one ranked by
 * cosine similarity instead of by {@code observed_at}.
 */
@Value
public class TripleQuery {
    public static final int DEFAULT_LIMIT = 100;

    String subject;
    String predicate;
    String object;

    Scope scope;
    String ownerId;

    /**
     * Inclusive lower bound on observed_at
     */
    Instant since;

    /**
     * Inclusive upper bound on observed_at
     */
    Instant until;

    /**
     * Point in time that must fall inside the assertion's [valid_from, valid_until) window
     */
    Instant activeAt;

    /**
     * Text to embed with the store's embedder. Fails if the store has none.
     */
    String queryText;

    /**
     * Caller supplied query vector. Takes precedence over {@link #queryText}.
     */
    float[] queryVector;

    /**
     * Minimum cosine similarity (inclusive) for semantic hits
     */
    Double minScore;

    /**
     * Maximum number of results. Zero or negative means unbounded.
     */
    int limit;

    /**
     * Ordering of structured results by observed_at. Ignored for semantic queries.
     */
    SortOrder order;

    @Builder(toBuilder = true)
    public TripleQuery(
            String subject,
            String predicate,
            String object,
            Scope scope,
            String ownerId,
            Instant since,
            Instant until,
            Instant activeAt,
            String queryText,
            float[] queryVector,
            Double minScore,
            Integer limit,
            SortOrder order) {
        this.subject = Canonicalizer.canonicalizeFilter(subject);
        this.predicate = Canonicalizer.canonicalizeFilter(predicate);
        this.object = Canonicalizer.canonicalizeFilter(object);
        this.scope = scope;
        this.ownerId = Strings.isNullOrEmpty(ownerId) || ownerId.isBlank() ? null : ownerId.strip();
        this.since = representable(since);
        this.until = representable(until);
        this.activeAt = representable(activeAt);
        this.queryText = Strings.emptyToNull(queryText);
        this.queryVector = queryVector == null || queryVector.length == 0 ? null : queryVector.clone();
        this.minScore = minScore;
        this.limit = Objects.requireNonNullElse(limit, DEFAULT_LIMIT);
        this.order = Objects.requireNonNullElse(order, SortOrder.ASC);
    }

    /**
     * @return a copy of the query vector, or null if none was given
     */
    public float[] getQueryVector() {
        return queryVector == null ? null : queryVector.clone();
    }

    private static Instant representable(final Instant instant) {
        return instant == null ? null : Timestamps.requireRepresentable(instant);
    }

    /**
     * @return true if the query ranks by vector similarity
     */
    public boolean isSemantic() {
        return queryVector != null || queryText != null;
    }

    /**
     * @return true if {@link #limit} bounds the result size
     */
    public boolean isLimited() {
        return limit > 0;
    }

    /**
     * Structured filter evaluation. Semantic ranking, ordering and limit are not part of matching.
     *
     * @param assertion candidate
     * @return true if the assertion passes every supplied filter
     */
    public boolean matches(final TripleAssertion assertion) {
        if (subject != null && !subject.equals(assertion.getSubject())) {
            return false;
        }
        if (predicate != null && !predicate.equals(assertion.getPredicate())) {
            return false;
        }
        if (object != null && !object.equals(assertion.getObject())) {
            return false;
        }
        if (scope != null && scope != assertion.getScope()) {
            return false;
        }
        if (ownerId != null && !ownerId.equals(assertion.getOwnerId())) {
            return false;
        }
        if (since != null && assertion.getObservedAt().isBefore(since)) {
            return false;
        }
        if (until != null && assertion.getObservedAt().isAfter(until)) {
            return false;
        }
        return activeAt == null || assertion.isActiveAt(activeAt);
    }
}
