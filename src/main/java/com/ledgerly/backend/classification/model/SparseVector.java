package com.ledgerly.backend.classification.model;

/**
 * Parallel arrays of ascending feature indices and their weights.
 */
public record SparseVector(int[] indices, double[] values) {
    public SparseVector {
        if (indices.length != values.length) {
            throw new IllegalArgumentException("indices and values must have the same length");
        }
    }

    public int nonZeroCount() {
        return indices.length;
    }

    public double valueAt(int featureIndex) {
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] == featureIndex) return values[i];
        }
        return 0.0;
    }
}
