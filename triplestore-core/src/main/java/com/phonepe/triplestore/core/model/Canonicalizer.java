package com.phonepe.triplestore.core.model;

import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Trim + lowercase normalization for triple terms. Idempotent.
 */
@UtilityClass
public class Canonicalizer {

    /**
     * @return the trimmed, lowercased term or null when the input is null
     */
    public static String canonicalize(final String term) {
        if (term == null) {
            return null;
        }
        return term.strip().toLowerCase(Locale.ROOT);
    }

    /**
     * Canonicalizes a term used as a query filter. A blank filter means "no filter".
     *
     * @return the canonical term or null when there is nothing to filter on
     */
    public static String canonicalizeFilter(final String term) {
        final var canonical = canonicalize(term);
        return canonical == null || canonical.isEmpty() ? null : canonical;
    }
}
