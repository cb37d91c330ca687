package io.github.vishalmysore.chasm.vector;

import io.github.vishalmysore.chasm.exception.LinkerException;

/**
 * Cosine similarity: dot(A, B) / (||A|| * ||B||)
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * @return a score in [-1, 1]; 0.0 when either vector has zero norm
     * @throws LinkerException when the vectors differ in length
     */
    public static double cosine(double[] a, double[] b) {
        if (a == null || b == null) {
            throw new LinkerException("Cannot compare a missing embedding");
        }
        if (a.length != b.length) {
            throw new LinkerException("Embedding length mismatch: " + a.length + " vs " + b.length);
        }

        double dot = 0.0, normA = 0.0, normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        double denom = Math.sqrt(normA) * Math.sqrt(normB);
        if (denom == 0.0) {
            return 0.0;
        }
        // floating point can push identical vectors a hair past 1.0
        return Math.max(-1.0, Math.min(1.0, dot / denom));
    }

    /**
     * Rounds a score to four decimal places, the precision stored on edges.
     */
    public static double round4(double score) {
        return Math.round(score * 10_000d) / 10_000d;
    }
}
