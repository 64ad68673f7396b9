package com.phonepe.triplestore.core.store;

import com.phonepe.triplestore.core.embedding.TextEmbedder;
import com.phonepe.triplestore.core.errors.EmbeddingFailure;
import com.phonepe.triplestore.core.errors.StorageIOError;
import com.phonepe.triplestore.core.errors.ValidationError;
import com.phonepe.triplestore.core.query.TripleQuery;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InMemoryTripleStoreTest extends AbstractTripleStoreContractTest {

    @Override
    protected TripleStore newStore(TextEmbedder embedder) {
        return new InMemoryTripleStore(embedder);
    }

    @Test
    void testSizeTracksAppends() {
        final var store = new InMemoryTripleStore();
        store.add(List.of(assertion("a", "p", "x", T1)));
        store.add(List.of(assertion("a", "p", "x", T1)));
        assertEquals(2, store.size());
    }

    @Test
    void testClosedStoreRejectsCalls() {
        final var store = new InMemoryTripleStore();
        store.close();
        assertThrows(StorageIOError.class, () -> store.add(List.of(assertion("a", "p", "x", T1))));
        assertThrows(StorageIOError.class, () -> store.query(TripleQuery.builder().build()));
    }

    @Test
    void testCloseDoesNotCloseEmbedder() {
        final var embedder = mock(TextEmbedder.class);
        new InMemoryTripleStore(embedder).close();
        verify(embedder, never()).close();
    }

    @Test
    void testVectorDimensionIsFixedByFirstBatch() {
        final var embedder = mock(TextEmbedder.class);
        when(embedder.embedAll(anyList()))
                .thenReturn(List.of(new float[]{1.0f, 0.0f}))
                .thenReturn(List.of(new float[]{1.0f, 0.0f, 0.0f}));
        final var store = createStore(embedder);
        store.add(List.of(assertion("a", "p", "x", T1)));

        assertThrows(ValidationError.class, () -> store.add(List.of(assertion("b", "p", "y", T2))));
        assertEquals(List.of("x"), objects(store.query(TripleQuery.builder().build())));
    }

    @Test
    void testMixedDimensionsInOneBatchFail() {
        final var embedder = mock(TextEmbedder.class);
        when(embedder.embedAll(anyList())).thenReturn(List.of(new float[]{1.0f}, new float[]{1.0f, 2.0f}));
        final var store = createStore(embedder);

        assertThrows(EmbeddingFailure.class,
                     () -> store.add(List.of(assertion("a", "p", "x", T1), assertion("b", "p", "y", T2))));
        assertTrue(store.query(TripleQuery.builder().build()).isEmpty());
    }
}
