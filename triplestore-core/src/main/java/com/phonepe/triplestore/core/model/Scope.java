package com.phonepe.triplestore.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.phonepe.triplestore.core.errors.ValidationError;

import java.util.Locale;

/**
 * Partition that limits where an assertion is visible
 */
public enum Scope {
    /**
     * Visible to a single run
     */
    RUN,
    /**
     * Visible across the runs of one session
     */
    SESSION,
    /**
     * Visible everywhere
     */
    GLOBAL;

    /**
     * Lowercase name used on the wire and in persisted rows
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse: surrounding whitespace and case are ignored
     *
     * @throws ValidationError for blank or unknown values
     */
    @JsonCreator
    public static Scope parse(final String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationError("scope must not be blank");
        }
        final var normalized = value.trim().toUpperCase(Locale.ROOT);
        for (final var scope : values()) {
            if (scope.name().equals(normalized)) {
                return scope;
            }
        }
        throw new ValidationError("unknown scope '%s'; expected one of run, session, global".formatted(value.trim()));
    }
}
