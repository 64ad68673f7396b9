/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.triplestore.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.phonepe.triplestore.core.errors.ValidationError;
import com.phonepe.triplestore.core.utils.JsonUtils;
import com.phonepe.triplestore.core.utils.TimestampDeserializer;
import com.phonepe.triplestore.core.utils.Timestamps;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One append-only fact: a subject-predicate-object triple plus partition, temporal and provenance metadata.
 * <p>
 * Terms are canonicalized (trimmed and lowercased) on construction, so two assertions whose terms differ only by
 * case or surrounding whitespace are identical triples. Instances are immutable; a correction is expressed by adding
 * a new assertion with a later {@link #observedAt} and its own provenance.
 */
@Value
public class TripleAssertion {
    @JsonProperty("subject")
    String subject;

    @JsonProperty("predicate")
    String predicate;

    @JsonProperty("object")
    String object;

    @JsonProperty("scope")
    Scope scope;

    /**
     * Finer partition inside {@link #scope}, e.g. a session id
     */
    @JsonProperty("owner_id")
    String ownerId;

    /**
     * When the assertion was recorded
     */
    @JsonProperty("observed_at")
    @JsonDeserialize(using = TimestampDeserializer.class)
    Instant observedAt;

    /**
     * Start of the validity window, inclusive. Null means unbounded.
     */
    @JsonProperty("valid_from")
    @JsonDeserialize(using = TimestampDeserializer.class)
    Instant validFrom;

    /**
     * End of the validity window, exclusive. Null means unbounded.
     */
    @JsonProperty("valid_until")
    @JsonDeserialize(using = TimestampDeserializer.class)
    Instant validUntil;

    /**
     * Optional confidence reported by whoever extracted the fact
     */
    @JsonProperty("confidence")
    Double confidence;

    /**
     * Where the assertion came from. Stored and returned, never interpreted.
     */
    @JsonProperty("provenance")
    Map<String, Object> provenance;

    /**
     * Caller supplied evidence and context. Stored and returned, never interpreted.
     */
    @JsonProperty("attributes")
    Map<String, Object> attributes;

    @Builder(toBuilder = true)
    @JsonCreator
    public TripleAssertion(
            @JsonProperty("subject") String subject,
            @JsonProperty("predicate") String predicate,
            @JsonProperty("object") String object,
            @JsonProperty("scope") Scope scope,
            @JsonProperty("owner_id") String ownerId,
            @JsonProperty("observed_at") @JsonDeserialize(using = TimestampDeserializer.class) Instant observedAt,
            @JsonProperty("valid_from") @JsonDeserialize(using = TimestampDeserializer.class) Instant validFrom,
            @JsonProperty("valid_until") @JsonDeserialize(using = TimestampDeserializer.class) Instant validUntil,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("provenance") Map<String, Object> provenance,
            @JsonProperty("attributes") Map<String, Object> attributes) {
        this.subject = requireTerm("subject", subject);
        this.predicate = requireTerm("predicate", predicate);
        this.object = requireTerm("object", object);
        this.scope = Objects.requireNonNullElse(scope, Scope.RUN);
        this.ownerId = ownerId == null || ownerId.isBlank() ? null : ownerId.strip();
        this.observedAt = Timestamps.requireRepresentable(Objects.requireNonNullElseGet(observedAt, Timestamps::now));
        this.validFrom = validFrom == null ? null : Timestamps.requireRepresentable(validFrom);
        this.validUntil = validUntil == null ? null : Timestamps.requireRepresentable(validUntil);
        if (this.validFrom != null && this.validUntil != null && this.validFrom.isAfter(this.validUntil)) {
            throw new ValidationError("valid_from %s is after valid_until %s".formatted(validFrom, validUntil));
        }
        if (confidence != null && !Double.isFinite(confidence)) {
            throw new ValidationError("confidence must be a finite number");
        }
        this.confidence = confidence;
        this.provenance = JsonUtils.immutableCopy(provenance);
        this.attributes = JsonUtils.immutableCopy(attributes);
    }

    /**
     * @return true if the validity window contains the given instant. {@code validUntil} is exclusive.
     */
    public boolean isActiveAt(final Instant instant) {
        return (validFrom == null || !validFrom.isAfter(instant))
                && (validUntil == null || validUntil.isAfter(instant));
    }

    private static String requireTerm(final String field, final String value) {
        final var canonical = Canonicalizer.canonicalize(value);
        if (canonical == null || canonical.isEmpty()) {
            throw new ValidationError("%s must be a non-empty string".formatted(field));
        }
        return canonical;
    }
}
