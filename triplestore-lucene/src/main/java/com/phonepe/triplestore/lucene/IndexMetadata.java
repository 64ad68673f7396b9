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

import com.phonepe.triplestore.core.errors.StorageIOError;
import lombok.Value;
import lombok.With;

import java.util.HashMap;
import java.util.Map;

/**
 * Table level metadata kept in the user data of every Lucene commit
 */
@Value
@With
class IndexMetadata {
    static final int SCHEMA_VERSION = 2;

    static final String SCHEMA_VERSION_KEY = "schema_version";
    static final String VECTOR_DIMENSION_KEY = "vector_dimension";
    static final String NEXT_SEQUENCE_KEY = "next_sequence";

    /**
     * Dimension of stored vectors, negative until the first vector is written
     */
    int vectorDimension;

    /**
     * Insertion sequence handed to the next appended row
     */
    long nextSequence;

    static IndexMetadata empty() {
        return new IndexMetadata(-1, 0);
    }

    static IndexMetadata fromUserData(final Iterable<Map.Entry<String, String>> userData) {
        final var values = new HashMap<String, String>();
        if (userData != null) {
            userData.forEach(entry -> values.put(entry.getKey(), entry.getValue()));
        }
        if (values.isEmpty()) {
            return empty();
        }
        try {
            final var version = Integer.parseInt(values.getOrDefault(SCHEMA_VERSION_KEY, "0"));
            if (version != SCHEMA_VERSION) {
                throw new StorageIOError("unsupported table schema version " + version);
            }
            return new IndexMetadata(Integer.parseInt(values.getOrDefault(VECTOR_DIMENSION_KEY, "-1")),
                                     Long.parseLong(values.getOrDefault(NEXT_SEQUENCE_KEY, "0")));
        }
        catch (NumberFormatException e) {
            throw new StorageIOError("corrupt table metadata " + values, e);
        }
    }

    Map<String, String> toUserData() {
        return Map.of(SCHEMA_VERSION_KEY, Integer.toString(SCHEMA_VERSION),
                      VECTOR_DIMENSION_KEY, Integer.toString(vectorDimension),
                      NEXT_SEQUENCE_KEY, Long.toString(nextSequence));
    }
}
