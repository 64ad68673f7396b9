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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.triplestore.core.embedding.TextEmbedder;
import com.phonepe.triplestore.core.errors.StorageIOError;
import com.phonepe.triplestore.core.errors.ValidationError;
import com.phonepe.triplestore.core.model.ScoredAssertion;
import com.phonepe.triplestore.core.model.TripleAssertion;
import com.phonepe.triplestore.core.query.TripleQuery;
import com.phonepe.triplestore.core.store.SemanticSearch;
import com.phonepe.triplestore.core.store.TripleStore;
import com.phonepe.triplestore.core.utils.JsonUtils;
import com.phonepe.triplestore.lucene.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.store.FSDirectory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Persistent triple store on a Lucene index under {@code <baseDir>/<tableName>}.
 * <p>
 * The index is created by the first successful {@link #add(Collection)}; until then queries return nothing and the
 * location is left untouched. Every add is one commit, so data survives a close and reopen. Only one store instance
 * may write to a location at a time; a second writer fails with {@link StorageIOError} on its first add.
 * <p>
 * Not synchronized: callers sharing an instance between threads must serialize access themselves.
 */
@Slf4j
public class LuceneTripleStore implements TripleStore {
    public static final String DEFAULT_TABLE_NAME = "triple_assertions";

    private final Path indexPath;
    private final TextEmbedder embedder;
    private final AssertionDocuments documents;

    private FSDirectory directory;
    private IndexWriter writer;
    private IndexMetadata metadata = IndexMetadata.empty();
    private boolean closed;

    /**
     * @param baseDir   directory holding the table
     * @param tableName name of the table directory, defaults to {@value #DEFAULT_TABLE_NAME}
     * @param mapper    mapper for the provenance and attribute columns, defaults to {@link JsonUtils#createMapper()}
     * @param embedder  embedder for assertions and query text, may be null
     */
    @Builder
    public LuceneTripleStore(@NonNull Path baseDir, String tableName, ObjectMapper mapper, TextEmbedder embedder) {
        final var table = Objects.requireNonNullElse(Strings.emptyToNull(tableName), DEFAULT_TABLE_NAME);
        Preconditions.checkArgument(!table.isBlank() && Path.of(table).getNameCount() == 1,
                                    "table name must be a single path segment: %s", table);
        this.indexPath = baseDir.toAbsolutePath().normalize().resolve(table);
        this.embedder = embedder;
        this.documents = new AssertionDocuments(Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper));
        if (Files.exists(indexPath)) {
            openDirectory();
            if (indexExists()) {
                metadata = readCommittedMetadata();
                log.info("Opened triple table at {} (vector dimension {}, next sequence {})",
                         indexPath, metadata.getVectorDimension(), metadata.getNextSequence());
            }
        }
    }

    public LuceneTripleStore(Path baseDir, TextEmbedder embedder) {
        this(baseDir, null, null, embedder);
    }

    @Override
    public List<String> add(Collection<TripleAssertion> assertions) {
        ensureOpen();
        Objects.requireNonNull(assertions, "assertions");
        if (assertions.isEmpty()) {
            return List.of();
        }
        final var batch = List.copyOf(assertions);
        final var vectors = embedder == null ? null : SemanticSearch.embedAssertions(embedder, batch);
        final var indexWriter = writer();
        var updated = metadata;
        if (vectors != null) {
            updated = updated.withVectorDimension(
                    SemanticSearch.requireDimension(metadata.getVectorDimension(), vectors.get(0).length));
        }
        final var ids = new ArrayList<String>(batch.size());
        final var docs = new ArrayList<Document>(batch.size());
        var sequence = metadata.getNextSequence();
        for (int i = 0; i < batch.size(); i++) {
            final var id = UUID.randomUUID().toString();
            docs.add(documents.toDocument(id, sequence++, batch.get(i), vectors == null ? null : vectors.get(i)));
            ids.add(id);
        }
        updated = updated.withNextSequence(sequence);
        try {
            indexWriter.addDocuments(docs);
            indexWriter.setLiveCommitData(updated.toUserData().entrySet());
            indexWriter.commit();
        }
        catch (IOException e) {
            rollback(e);
            throw new StorageIOError("failed to append %d assertions to %s".formatted(batch.size(), indexPath), e);
        }
        catch (IllegalArgumentException e) {
            rollback(e);
            throw new ValidationError("assertion rejected by the index: " + e.getMessage(), e);
        }
        if (metadata.getVectorDimension() < 0 && updated.getVectorDimension() >= 0) {
            log.info("Recorded vector dimension {} for {}", updated.getVectorDimension(), indexPath);
        }
        metadata = updated;
        log.debug("Committed {} assertions to {}", batch.size(), indexPath);
        return ids;
    }

    @Override
    public List<ScoredAssertion> queryScored(TripleQuery query) {
        ensureOpen();
        Objects.requireNonNull(query, "query");
        final var queryVector = SemanticSearch.resolveQueryVector(query, embedder);
        if (directory == null && Files.exists(indexPath)) {
            openDirectory();
        }
        if (directory == null || !indexExists()) {
            return List.of();
        }
        try (var reader = DirectoryReader.open(directory)) {
            if (reader.numDocs() == 0) {
                return List.of();
            }
            final var searcher = new IndexSearcher(reader);
            final var filter = LuceneQueries.filter(query);
            if (queryVector != null) {
                final var hits = searcher.search(filter, reader.numDocs());
                final var candidates = new ArrayList<SemanticSearch.Candidate>(hits.scoreDocs.length);
                for (final var row : load(searcher, hits.scoreDocs)) {
                    candidates.add(new SemanticSearch.Candidate(row.sequence(), row.assertion(), row.vector()));
                }
                return SemanticSearch.rank(candidates, queryVector, query);
            }
            final var count = query.isLimited() ? Math.min(query.getLimit(), reader.numDocs()) : reader.numDocs();
            final var hits = searcher.search(filter, count, LuceneQueries.chronological(query.getOrder()));
            return load(searcher, hits.scoreDocs).stream()
                    .map(row -> ScoredAssertion.unscored(row.assertion()))
                    .toList();
        }
        catch (IOException e) {
            throw new StorageIOError("failed to read %s".formatted(indexPath), e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (writer != null) {
                writer.close();
            }
            if (directory != null) {
                directory.close();
            }
            log.debug("Closed triple table at {}", indexPath);
        }
        catch (IOException e) {
            throw new StorageIOError("failed to close %s".formatted(indexPath), e);
        }
        finally {
            writer = null;
            directory = null;
        }
    }

    /**
     * @return location of the table on disk
     */
    public Path getIndexPath() {
        return indexPath;
    }

    private List<AssertionDocuments.StoredRow> load(final IndexSearcher searcher, final ScoreDoc[] hits)
            throws IOException {
        final var storedFields = searcher.storedFields();
        final var rows = new ArrayList<AssertionDocuments.StoredRow>(hits.length);
        for (final var hit : hits) {
            rows.add(documents.fromDocument(storedFields.document(hit.doc)));
        }
        return rows;
    }

    private IndexWriter writer() {
        if (writer != null) {
            return writer;
        }
        FileUtils.ensurePath(indexPath, true, true);
        if (directory == null) {
            openDirectory();
        }
        final var created = !indexExists();
        try {
            final var config = new IndexWriterConfig().setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            writer = new IndexWriter(directory, config);
        }
        catch (IOException e) {
            throw new StorageIOError("failed to open %s for writing".formatted(indexPath), e);
        }
        metadata = IndexMetadata.fromUserData(writer.getLiveCommitData());
        if (created) {
            log.info("Created triple table at {}", indexPath);
        }
        return writer;
    }

    private void rollback(final Exception failure) {
        try {
            writer.rollback();
        }
        catch (IOException e) {
            failure.addSuppressed(e);
        }
        finally {
            writer = null;
        }
    }

    private void openDirectory() {
        try {
            directory = FSDirectory.open(indexPath);
        }
        catch (IOException e) {
            throw new StorageIOError("failed to open %s".formatted(indexPath), e);
        }
    }

    private boolean indexExists() {
        try {
            return DirectoryReader.indexExists(directory);
        }
        catch (IOException e) {
            throw new StorageIOError("failed to inspect %s".formatted(indexPath), e);
        }
    }

    private IndexMetadata readCommittedMetadata() {
        try {
            return IndexMetadata.fromUserData(SegmentInfos.readLatestCommit(directory).getUserData().entrySet());
        }
        catch (IOException e) {
            throw new StorageIOError("failed to read table metadata from %s".formatted(indexPath), e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageIOError("store is closed");
        }
    }
}
