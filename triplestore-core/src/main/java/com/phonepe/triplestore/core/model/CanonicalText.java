package com.phonepe.triplestore.core.model;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Text renderings of an assertion. Stores embed what {@link #embeddingText(TripleAssertion)} returns.
 */
@UtilityClass
public class CanonicalText {
    public static final String SUBJECT_TYPE = "subject_type";
    public static final String OBJECT_TYPE = "object_type";
    public static final String EVIDENCE_QUOTE = "evidence_quote";
    public static final String ORIGINAL_CONTEXT = "original_context";

    private static final int MAX_CONTEXT_LENGTH = 400;

    /**
     * @return {@code "subject predicate object"}
     */
    public static String tripleText(final TripleAssertion assertion) {
        return "%s %s %s".formatted(assertion.getSubject(), assertion.getPredicate(), assertion.getObject());
    }

    /**
     * The triple text followed by one line per well known attribute that carries a non-blank string: entity types,
     * the evidence quote and the original context (capped at 400 characters).
     */
    public static String embeddingText(final TripleAssertion assertion) {
        final var lines = new ArrayList<String>();
        lines.add(tripleText(assertion));
        final var attributes = assertion.getAttributes();
        textAttribute(attributes.get(SUBJECT_TYPE)).ifPresent(v -> lines.add("subject_type: " + v));
        textAttribute(attributes.get(OBJECT_TYPE)).ifPresent(v -> lines.add("object_type: " + v));
        textAttribute(attributes.get(EVIDENCE_QUOTE)).ifPresent(v -> lines.add("evidence: " + v));
        textAttribute(attributes.get(ORIGINAL_CONTEXT))
                .map(v -> v.length() > MAX_CONTEXT_LENGTH ? v.substring(0, MAX_CONTEXT_LENGTH) + "…" : v)
                .ifPresent(v -> lines.add("context: " + v));
        return String.join("\n", lines);
    }

    private static Optional<String> textAttribute(final Object value) {
        if (value instanceof String text && !text.isBlank()) {
            return Optional.of(text.strip());
        }
        return Optional.empty();
    }
}
