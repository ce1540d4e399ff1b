package com.lorekeeper.memory;

final class VectorMath {

    private VectorMath() {}

    /** {@code 1 - cos(a, b)}. A zero vector is at distance 1 from everything. */
    static double cosineDistance(float[] a, float[] b) {
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 1.0;
        return 1.0 - dot / (Math.sqrt(na) * Math.sqrt(nb));
    }

    static boolean isZero(float[] v) {
        for (float x : v) {
            if (x != 0f) return false;
        }
        return true;
    }

    static boolean isFinite(float[] v) {
        for (float x : v) {
            if (!Float.isFinite(x)) return false;
        }
        return true;
    }
}
