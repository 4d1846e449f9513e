package com.inboxsearch.index;

final class VectorMath {
    // float storage of unit vectors leaves a self-similarity a few ulps away from 1.0
    private static final double UNIT_TOLERANCE = 1e-6;

    private VectorMath() {
    }

    /** Returns a unit-length copy, or an all-zero copy when the input has no magnitude. */
    static float[] normalized(float[] vector) {
        double norm = 0d;
        for (float value : vector) {
            norm += (double) value * value;
        }
        float[] copy = new float[vector.length];
        if (norm == 0d) {
            return copy;
        }
        double scale = 1d / Math.sqrt(norm);
        for (int i = 0; i < vector.length; i++) {
            copy[i] = (float) (vector[i] * scale);
        }
        return copy;
    }

    static double dot(float[] a, float[] b) {
        double sum = 0d;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    /** Cosine similarity of two unit vectors, clamped to [-1, 1] and snapped to 1.0 near identity. */
    static double similarity(float[] unitA, float[] unitB) {
        double dot = dot(unitA, unitB);
        if (dot >= 1d - UNIT_TOLERANCE) {
            return 1d;
        }
        return Math.max(-1d, dot);
    }
}
