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

import com.phonepe.triplestore.core.embedding.TextEmbedder;
import com.phonepe.triplestore.core.errors.EmbeddingFailure;
import com.phonepe.triplestore.core.errors.MissingCapabilityError;
import com.phonepe.triplestore.core.errors.StorageIOError;
import com.phonepe.triplestore.core.errors.ValidationError;
import com.phonepe.triplestore.core.model.Scope;
import com.phonepe.triplestore.core.model.TripleAssertion;
import com.phonepe.triplestore.core.query.SortOrder;
import com.phonepe.triplestore.core.query.TripleQuery;
import com.phonepe.triplestore.core.store.AbstractTripleStoreContractTest;
import com.phonepe.triplestore.core.store.TripleStore;
import com.phonepe.triplestore.core.store.VocabularyEmbedder;
import com.phonepe.triplestore.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.FSDirectory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LuceneTripleStoreTest extends AbstractTripleStoreContractTest {

    @TempDir
    Path tempDir;

    private int storeCounter;

    @Override
    protected TripleStore newStore(TextEmbedder embedder) {
        return LuceneTripleStore.builder()
                .baseDir(tempDir)
                .tableName("table-" + storeCounter++)
                .embedder(embedder)
                .build();
    }

    @Test
    void testNothingCreatedBeforeFirstAdd() {
        final var store = new LuceneTripleStore(tempDir.resolve("data"), null);
        assertTrue(store.query(TripleQuery.builder().build()).isEmpty());
        assertFalse(Files.exists(store.getIndexPath()));
        assertEquals(tempDir.resolve("data").resolve(LuceneTripleStore.DEFAULT_TABLE_NAME).toAbsolutePath(),
                     store.getIndexPath());

        store.add(List.of(assertion("scrooge", "lives_in", "london", T1)));
        assertTrue(Files.isDirectory(store.getIndexPath()));
        store.close();
    }

    @Test
    void testQueryTextStillRequiresEmbedderOnEmptyTable() {
        final var store = createStore(null);
        final var query = TripleQuery.builder().queryText("ghost").build();
        assertThrows(MissingCapabilityError.class, () -> store.query(query));
    }

    @Test
    void testPersistenceRoundTrip() {
        final var embedder = new VocabularyEmbedder("london", "christmas", "ghost");
        final var queries = List.of(
                TripleQuery.builder().build(),
                TripleQuery.builder().subject("scrooge").order(SortOrder.DESC).limit(2).build(),
                TripleQuery.builder().scope(Scope.SESSION).ownerId("sess-1").build(),
                TripleQuery.builder().activeAt(T2).build(),
                TripleQuery.builder().queryText("ghost of christmas").build());

        final var first = new LuceneTripleStore(tempDir, embedder);
        first.add(List.of(assertion("scrooge", "lives_in", "london", T1),
                          TripleAssertion.builder()
                                  .subject("Scrooge")
                                  .predicate("related_to")
                                  .object("Christmas")
                                  .scope(Scope.SESSION)
                                  .ownerId("sess-1")
                                  .observedAt(T2)
                                  .validFrom(T1)
                                  .validUntil(T3)
                                  .provenance(Map.of("source", "stave-1", "line", 12))
                                  .build()));
        first.add(List.of(assertion("marley", "is", "ghost", T3)));
        final var before = queries.stream().map(first::queryScored).toList();
        first.close();

        final var reopened = new LuceneTripleStore(tempDir, embedder);
        final var after = queries.stream().map(reopened::queryScored).toList();
        reopened.close();

        assertEquals(before, after);
        assertEquals(3, before.get(0).size());
    }

    @Test
    void testSequenceContinuesAfterReopen() {
        final var first = new LuceneTripleStore(tempDir, null);
        first.add(List.of(assertion("s", "p", "a", T1)));
        first.close();

        final var reopened = new LuceneTripleStore(tempDir, null);
        reopened.add(List.of(assertion("s", "p", "b", T1)));
        assertEquals(List.of("a", "b"), objects(reopened.query(TripleQuery.builder().build())));
        assertEquals(List.of("b", "a"),
                     objects(reopened.query(TripleQuery.builder().order(SortOrder.DESC).build())));
        reopened.close();
    }

    @Test
    void testVectorDimensionSurvivesReopen() {
        final var first = new LuceneTripleStore(tempDir, new VocabularyEmbedder("london", "paris"));
        first.add(List.of(assertion("s", "p", "london", T1)));
        first.close();

        final var wider = new LuceneTripleStore(tempDir, new VocabularyEmbedder("london", "paris", "rome"));
        assertThrows(ValidationError.class, () -> wider.add(List.of(assertion("s", "p", "rome", T2))));
        assertEquals(1, wider.query(TripleQuery.builder().build()).size());
        wider.close();
    }

    @Test
    void testSecondWriterIsRejected() {
        final var owner = new LuceneTripleStore(tempDir, null);
        owner.add(List.of(assertion("s", "p", "a", T1)));

        final var intruder = new LuceneTripleStore(tempDir, null);
        assertEquals(1, intruder.query(TripleQuery.builder().build()).size());
        final var error = assertThrows(StorageIOError.class,
                                       () -> intruder.add(List.of(assertion("s", "p", "b", T2))));
        assertTrue(error.isRetryable());
        intruder.close();

        owner.add(List.of(assertion("s", "p", "c", T3)));
        assertEquals(List.of("a", "c"), objects(owner.query(TripleQuery.builder().build())));
        owner.close();
    }

    @Test
    void testReaderSeesLaterCommits() {
        final var writer = new LuceneTripleStore(tempDir, null);
        final var reader = new LuceneTripleStore(tempDir, null);
        assertTrue(reader.query(TripleQuery.builder().build()).isEmpty());

        writer.add(List.of(assertion("s", "p", "a", T1)));
        assertEquals(List.of("a"), objects(reader.query(TripleQuery.builder().build())));
        reader.close();
        writer.close();
    }

    @Test
    void testFailedEmbeddingLeavesNoTable() {
        final var embedder = mock(TextEmbedder.class);
        when(embedder.embedAll(anyList())).thenThrow(new IllegalStateException("gateway down"));
        final var store = new LuceneTripleStore(tempDir, embedder);

        assertThrows(EmbeddingFailure.class,
                     () -> store.add(List.of(assertion("s", "p", "a", T1))));
        assertFalse(Files.exists(store.getIndexPath()));
        store.close();
    }

    @Test
    void testClosedStoreRejectsCalls() {
        final var store = new LuceneTripleStore(tempDir, null);
        store.add(List.of(assertion("s", "p", "a", T1)));
        store.close();
        store.close();
        assertThrows(StorageIOError.class, () -> store.query(TripleQuery.builder().build()));
        assertThrows(StorageIOError.class, () -> store.add(List.of(assertion("s", "p", "b", T2))));
    }

    @Test
    void testTableLocationMustBeDirectory() {
        final var store = LuceneTripleStore.builder().baseDir(tempDir).tableName("flat").build();
        writeFile(store.getIndexPath());
        assertThrows(StorageIOError.class, () -> store.add(List.of(assertion("s", "p", "a", T1))));
        store.close();
    }

    @Test
    void testInvalidTableName() {
        final var builder = LuceneTripleStore.builder().baseDir(tempDir).tableName("a/b");
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void testLargeBatchSortedBeforeLimit() {
        final var store = createStore(null);
        store.add(IntStream.range(0, 50)
                          .mapToObj(i -> assertion("s", "p", "o" + i, T1.plusSeconds(100 - i)))
                          .toList());
        assertEquals(List.of("o49", "o48", "o47"), objects(store.query(TripleQuery.builder().limit(3).build())));
    }

    @Test
    @SneakyThrows
    void testCorruptJsonColumnSurfacesAsStorageError() {
        final var indexPath = tempDir.resolve(LuceneTripleStore.DEFAULT_TABLE_NAME);
        Files.createDirectories(indexPath);
        final var codec = new AssertionDocuments(JsonUtils.createMapper());
        final var doc = codec.toDocument("broken", 0, assertion("s", "p", "o", T1), null);
        doc.removeField(AssertionDocuments.ATTRIBUTES_JSON);
        doc.add(new StoredField(AssertionDocuments.ATTRIBUTES_JSON, "{not json"));
        try (var directory = FSDirectory.open(indexPath);
             var writer = new IndexWriter(directory, new IndexWriterConfig())) {
            writer.addDocument(doc);
            writer.setLiveCommitData(IndexMetadata.empty().withNextSequence(1).toUserData().entrySet());
            writer.commit();
        }

        final var store = new LuceneTripleStore(tempDir, null);
        assertThrows(StorageIOError.class, () -> store.query(TripleQuery.builder().build()));
        store.close();
    }

    @SneakyThrows
    private static void writeFile(Path path) {
        Files.createDirectories(path.getParent());
        Files.writeString(path, "not a table");
    }
}
