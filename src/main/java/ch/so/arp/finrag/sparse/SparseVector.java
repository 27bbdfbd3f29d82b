package ch.so.arp.finrag.sparse;

import java.util.Arrays;

/**
 * Keyword-weighted vector with strictly ascending indices and positive weights.
 * Instances are immutable.
 */
public final class SparseVector {

    private final int[] indices;
    private final double[] weights;

    public SparseVector(int[] indices, double[] weights) {
        if (indices.length != weights.length) {
            throw new IllegalArgumentException("indices and weights must have the same length");
        }
        for (int i = 0; i < indices.length; i++) {
            if (i > 0 && indices[i] <= indices[i - 1]) {
                throw new IllegalArgumentException("indices must be strictly ascending");
            }
            if (!(weights[i] > 0.0d)) {
                throw new IllegalArgumentException("weights must be positive");
            }
        }
        this.indices = indices.clone();
        this.weights = weights.clone();
    }

    public int[] indices() {
        return indices.clone();
    }

    public double[] weights() {
        return weights.clone();
    }

    public int size() {
        return indices.length;
    }

    /**
     * Dot product computed as a merge over both ascending index lists.
     */
    public double dot(SparseVector other) {
        double sum = 0.0d;
        int i = 0;
        int j = 0;
        while (i < indices.length && j < other.indices.length) {
            if (indices[i] == other.indices[j]) {
                sum += weights[i] * other.weights[j];
                i++;
                j++;
            } else if (indices[i] < other.indices[j]) {
                i++;
            } else {
                j++;
            }
        }
        return sum;
    }

    public double norm() {
        double sum = 0.0d;
        for (double weight : weights) {
            sum += weight * weight;
        }
        return Math.sqrt(sum);
    }

    /**
     * Cosine similarity in [0, 1]; weights are positive so the value is never
     * negative.
     */
    public double cosine(SparseVector other) {
        double denominator = norm() * other.norm();
        return denominator == 0.0d ? 0.0d : dot(other) / denominator;
    }

    /**
     * Copy with every weight multiplied by the factor, used to weigh the sparse
     * half of a hybrid query.
     */
    public SparseVector scale(double factor) {
        if (!(factor > 0.0d)) {
            throw new IllegalArgumentException("factor must be positive");
        }
        double[] scaled = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            scaled[i] = weights[i] * factor;
        }
        return new SparseVector(indices, scaled);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SparseVector other)) {
            return false;
        }
        return Arrays.equals(indices, other.indices) && Arrays.equals(weights, other.weights);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(indices) + Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        return "SparseVector{indices=" + Arrays.toString(indices) + ", weights=" + Arrays.toString(weights) + "}";
    }
}
