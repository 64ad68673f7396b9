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

import com.phonepe.triplestore.core.query.SortOrder;
import com.phonepe.triplestore.core.query.TripleQuery;
import com.phonepe.triplestore.core.utils.Timestamps;
import lombok.experimental.UtilityClass;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.FieldExistsQuery;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TermRangeQuery;

import java.time.Instant;

import static com.phonepe.triplestore.lucene.AssertionDocuments.OBJECT;
import static com.phonepe.triplestore.lucene.AssertionDocuments.OBSERVED_AT;
import static com.phonepe.triplestore.lucene.AssertionDocuments.OWNER_ID;
import static com.phonepe.triplestore.lucene.AssertionDocuments.PREDICATE;
import static com.phonepe.triplestore.lucene.AssertionDocuments.SCOPE;
import static com.phonepe.triplestore.lucene.AssertionDocuments.SEQUENCE;
import static com.phonepe.triplestore.lucene.AssertionDocuments.SUBJECT;
import static com.phonepe.triplestore.lucene.AssertionDocuments.VALID_FROM;
import static com.phonepe.triplestore.lucene.AssertionDocuments.VALID_UNTIL;

/**
 * Translates {@link TripleQuery} filters into Lucene queries over the columns written by {@link AssertionDocuments}.
 * Timestamps compare as fixed-width strings. Free-text columns match on their digest key.
 */
@UtilityClass
class LuceneQueries {

    static Query filter(final TripleQuery query) {
        final var builder = new BooleanQuery.Builder();
        var clauses = 0;
        clauses += keyedTerm(builder, SUBJECT, query.getSubject());
        clauses += keyedTerm(builder, PREDICATE, query.getPredicate());
        clauses += keyedTerm(builder, OBJECT, query.getObject());
        clauses += term(builder, SCOPE, query.getScope() == null ? null : query.getScope().wireName());
        clauses += keyedTerm(builder, OWNER_ID, query.getOwnerId());
        if (query.getSince() != null || query.getUntil() != null) {
            builder.add(TermRangeQuery.newStringRange(OBSERVED_AT,
                                                      formatOrNull(query.getSince()),
                                                      formatOrNull(query.getUntil()),
                                                      true,
                                                      true),
                        BooleanClause.Occur.FILTER);
            clauses++;
        }
        if (query.getActiveAt() != null) {
            final var activeAt = Timestamps.format(query.getActiveAt());
            builder.add(absentOr(VALID_FROM, TermRangeQuery.newStringRange(VALID_FROM, null, activeAt, true, true)),
                        BooleanClause.Occur.FILTER);
            builder.add(absentOr(VALID_UNTIL, TermRangeQuery.newStringRange(VALID_UNTIL, activeAt, null, false, true)),
                        BooleanClause.Occur.FILTER);
            clauses += 2;
        }
        return clauses == 0 ? new MatchAllDocsQuery() : builder.build();
    }

    /**
     * observed_at then insertion sequence, both in the requested direction
     */
    static Sort chronological(final SortOrder order) {
        final var reverse = order == SortOrder.DESC;
        return new Sort(new SortField(OBSERVED_AT, SortField.Type.STRING, reverse),
                        new SortField(SEQUENCE, SortField.Type.LONG, reverse));
    }

    private static int term(final BooleanQuery.Builder builder, final String field, final String value) {
        if (value == null) {
            return 0;
        }
        builder.add(new TermQuery(new Term(field, value)), BooleanClause.Occur.FILTER);
        return 1;
    }

    private static int keyedTerm(final BooleanQuery.Builder builder, final String field, final String value) {
        return term(builder, AssertionDocuments.keyField(field), value == null ? null : AssertionDocuments.termKey(value));
    }

    private static Query absentOr(final String field, final Query bounded) {
        final var absent = new BooleanQuery.Builder()
                .add(new MatchAllDocsQuery(), BooleanClause.Occur.MUST)
                .add(new FieldExistsQuery(field), BooleanClause.Occur.MUST_NOT)
                .build();
        return new BooleanQuery.Builder()
                .add(absent, BooleanClause.Occur.SHOULD)
                .add(bounded, BooleanClause.Occur.SHOULD)
                .setMinimumNumberShouldMatch(1)
                .build();
    }

    private static String formatOrNull(final Instant instant) {
        return instant == null ? null : Timestamps.format(instant);
    }
}
