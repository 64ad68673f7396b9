package com.phonepe.triplestore.core.model;

import lombok.Value;

/**
 * A query hit together with its cosine similarity. The score is null for structured (non-semantic) queries.
 */
@Value
public class ScoredAssertion {
    TripleAssertion assertion;
    Double score;

    public static ScoredAssertion unscored(TripleAssertion assertion) {
        return new ScoredAssertion(assertion, null);
    }

    public static ScoredAssertion of(TripleAssertion assertion, double score) {
        return new ScoredAssertion(assertion, score);
    }
}
