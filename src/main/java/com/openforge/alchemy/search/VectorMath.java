package com.openforge.alchemy.search;

/** Float vector helpers. */
public final class VectorMath {

    private VectorMath() {}

    /**
     * Cosine similarity accumulated in double precision.
     * A zero-norm operand yields 0; vectors of different length are a caller bug.
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na  += (double) a[i] * a[i];
            nb  += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        double sim = dot / (Math.sqrt(na) * Math.sqrt(nb));
        // rounding can push parallel vectors a hair past 1
        return Math.max(-1.0, Math.min(1.0, sim));
    }

    public static boolean allFinite(float[] v) {
        for (float f : v) {
            if (!Float.isFinite(f)) return false;
        }
        return true;
    }
}
