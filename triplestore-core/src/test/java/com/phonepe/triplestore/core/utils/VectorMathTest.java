package com.phonepe.triplestore.core.utils;

import com.phonepe.triplestore.core.errors.ValidationError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class VectorMathTest {

    @Test
    void testCosineSimilarity() {
        assertEquals(1.0, VectorMath.cosineSimilarity(new float[]{1, 0}, new float[]{3, 0}), 1e-9);
        assertEquals(0.0, VectorMath.cosineSimilarity(new float[]{1, 0}, new float[]{0, 2}), 1e-9);
        assertEquals(-1.0, VectorMath.cosineSimilarity(new float[]{1, 1}, new float[]{-1, -1}), 1e-9);
        assertEquals(Math.sqrt(0.5), VectorMath.cosineSimilarity(new float[]{1, 1}, new float[]{1, 0}), 1e-9);
    }

    @Test
    void testZeroVectorScoresZero() {
        assertEquals(0.0, VectorMath.cosineSimilarity(new float[]{0, 0}, new float[]{1, 0}));
    }

    @Test
    void testDimensionMismatch() {
        assertThrows(ValidationError.class, () -> VectorMath.cosineSimilarity(new float[]{1}, new float[]{1, 0}));
    }
}
