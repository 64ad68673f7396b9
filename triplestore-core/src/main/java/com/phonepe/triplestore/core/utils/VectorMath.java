package com.phonepe.triplestore.core.utils;

import com.phonepe.triplestore.core.errors.ValidationError;
import lombok.experimental.UtilityClass;

/**
 * Vector helpers shared by every backend
 */
@UtilityClass
public class VectorMath {

    /**
     * Compute cosine similarity between two vectors.
     * Returns a value between -1 and 1, where 1 means identical, 0 means orthogonal, and -1 means opposite.
     * A zero-length (all zero) vector has no direction and scores 0.
     *
     * @throws ValidationError if the vectors have different dimensions
     */
    public static double cosineSimilarity(float[] lhs, float[] rhs) {
        if (lhs.length != rhs.length) {
            throw new ValidationError("vector dimension mismatch: %d vs %d".formatted(lhs.length, rhs.length));
        }
        double dotProduct = 0.0;
        double normLhs = 0.0;
        double normRhs = 0.0;
        for (int i = 0; i < lhs.length; i++) {
            dotProduct += (double) lhs[i] * rhs[i];
            normLhs += (double) lhs[i] * lhs[i];
            normRhs += (double) rhs[i] * rhs[i];
        }
        if (normLhs == 0.0 || normRhs == 0.0) {
            return 0.0;
        }
        return dotProduct / (Math.sqrt(normLhs) * Math.sqrt(normRhs));
    }
}
