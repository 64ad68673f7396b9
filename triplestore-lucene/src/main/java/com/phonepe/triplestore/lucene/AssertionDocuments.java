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

package com.phonepe.triplestore.lucene;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.triplestore.core.errors.StorageIOError;
import com.phonepe.triplestore.core.errors.ValidationError;
import com.phonepe.triplestore.core.model.CanonicalText;
import com.phonepe.triplestore.core.model.Scope;
import com.phonepe.triplestore.core.model.TripleAssertion;
import com.phonepe.triplestore.core.utils.JsonUtils;
import com.phonepe.triplestore.core.utils.Timestamps;
import com.google.common.hash.Hashing;
import lombok.AllArgsConstructor;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.SortedDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.util.BytesRef;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

/**
 * Maps assertions to Lucene documents and back. One document is one row of the assertions table.
 */
@AllArgsConstructor
class AssertionDocuments {
    static final String ASSERTION_ID = "assertion_id";
    static final String SEQUENCE = "sequence";
    static final String SUBJECT = "subject";
    static final String PREDICATE = "predicate";
    static final String OBJECT = "object";
    static final String TEXT = "text";
    static final String SCOPE = "scope";
    static final String OWNER_ID = "owner_id";
    static final String OBSERVED_AT = "observed_at";
    static final String VALID_FROM = "valid_from";
    static final String VALID_UNTIL = "valid_until";
    static final String CONFIDENCE = "confidence";
    static final String PROVENANCE_JSON = "provenance_json";
    static final String ATTRIBUTES_JSON = "attributes_json";
    static final String VECTOR = "vector";
    static final String KEY_SUFFIX = "_key";

    /**
     * A decoded row
     */
    record StoredRow(String id, long sequence, TripleAssertion assertion, float[] vector) {
    }

    private final ObjectMapper mapper;

    Document toDocument(final String id, final long sequence, final TripleAssertion assertion, final float[] vector) {
        final var doc = new Document();
        doc.add(new StringField(ASSERTION_ID, id, Field.Store.YES));
        doc.add(new NumericDocValuesField(SEQUENCE, sequence));
        doc.add(new StoredField(SEQUENCE, sequence));
        addTerm(doc, SUBJECT, assertion.getSubject());
        addTerm(doc, PREDICATE, assertion.getPredicate());
        addTerm(doc, OBJECT, assertion.getObject());
        doc.add(new StoredField(TEXT, CanonicalText.tripleText(assertion)));
        doc.add(new StringField(SCOPE, assertion.getScope().wireName(), Field.Store.YES));
        if (assertion.getOwnerId() != null) {
            addTerm(doc, OWNER_ID, assertion.getOwnerId());
        }
        addTimestamp(doc, OBSERVED_AT, assertion.getObservedAt());
        addTimestamp(doc, VALID_FROM, assertion.getValidFrom());
        addTimestamp(doc, VALID_UNTIL, assertion.getValidUntil());
        if (assertion.getConfidence() != null) {
            doc.add(new StoredField(CONFIDENCE, assertion.getConfidence()));
        }
        doc.add(new StoredField(PROVENANCE_JSON, writeJson(assertion.getProvenance())));
        doc.add(new StoredField(ATTRIBUTES_JSON, writeJson(assertion.getAttributes())));
        if (vector != null) {
            doc.add(new StoredField(VECTOR, encodeVector(vector)));
        }
        return doc;
    }

    StoredRow fromDocument(final Document doc) {
        final var id = doc.get(ASSERTION_ID);
        final var sequence = doc.getField(SEQUENCE);
        if (id == null || sequence == null || doc.get(OBSERVED_AT) == null) {
            throw new StorageIOError("row %s is missing required columns".formatted(id));
        }
        try {
            final var assertion = TripleAssertion.builder()
                    .subject(doc.get(SUBJECT))
                    .predicate(doc.get(PREDICATE))
                    .object(doc.get(OBJECT))
                    .scope(Scope.parse(doc.get(SCOPE)))
                    .ownerId(doc.get(OWNER_ID))
                    .observedAt(readTimestamp(doc, OBSERVED_AT))
                    .validFrom(readTimestamp(doc, VALID_FROM))
                    .validUntil(readTimestamp(doc, VALID_UNTIL))
                    .confidence(doc.getField(CONFIDENCE) == null
                                ? null
                                : doc.getField(CONFIDENCE).numericValue().doubleValue())
                    .provenance(readJson(doc.get(PROVENANCE_JSON)))
                    .attributes(readJson(doc.get(ATTRIBUTES_JSON)))
                    .build();
            final var vectorBytes = doc.getBinaryValue(VECTOR);
            return new StoredRow(id,
                                 sequence.numericValue().longValue(),
                                 assertion,
                                 vectorBytes == null ? null : decodeVector(vectorBytes));
        }
        catch (ValidationError e) {
            throw new StorageIOError("row %s is corrupt: %s".formatted(id, e.getMessage()), e);
        }
    }

    /**
     * Field holding the indexed key of a free-text column
     */
    static String keyField(final String field) {
        return field + KEY_SUFFIX;
    }

    /**
     * Bounded index key for a free-text value. Lucene rejects indexed terms over 32766 bytes, so terms are matched by
     * their SHA-256 digest and the full value is only stored.
     */
    static String termKey(final String value) {
        return Hashing.sha256().hashString(value, StandardCharsets.UTF_8).toString();
    }

    private static void addTerm(final Document doc, final String field, final String value) {
        doc.add(new StringField(keyField(field), termKey(value), Field.Store.NO));
        doc.add(new StoredField(field, value));
    }

    private static void addTimestamp(final Document doc, final String field, final Instant value) {
        if (value == null) {
            return;
        }
        final var formatted = Timestamps.format(value);
        doc.add(new StringField(field, formatted, Field.Store.YES));
        doc.add(new SortedDocValuesField(field, new BytesRef(formatted)));
    }

    private static Instant readTimestamp(final Document doc, final String field) {
        final var value = doc.get(field);
        return value == null ? null : Timestamps.parse(value);
    }

    private String writeJson(final Map<String, Object> value) {
        try {
            return mapper.writeValueAsString(value);
        }
        catch (JsonProcessingException e) {
            throw new StorageIOError("could not serialize value: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> readJson(final String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, JsonUtils.OPAQUE_MAP);
        }
        catch (JsonProcessingException e) {
            throw new StorageIOError("could not parse stored json: " + e.getOriginalMessage(), e);
        }
    }

    static byte[] encodeVector(final float[] vector) {
        final var buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asFloatBuffer().put(vector);
        return buffer.array();
    }

    static float[] decodeVector(final BytesRef bytes) {
        if (bytes.length % Float.BYTES != 0) {
            throw new StorageIOError("stored vector has %d bytes, not a whole number of floats".formatted(bytes.length));
        }
        final var vector = new float[bytes.length / Float.BYTES];
        ByteBuffer.wrap(bytes.bytes, bytes.offset, bytes.length)
                .order(ByteOrder.LITTLE_ENDIAN)
                .asFloatBuffer()
                .get(vector);
        return vector;
    }
}
