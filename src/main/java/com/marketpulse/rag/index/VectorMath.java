package com.marketpulse.rag.index;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Returns an L2-normalized copy. A zero vector is returned as a zero copy.
     */
    public static float[] normalize(float[] vector) {
        double norm = 0.0d;
        for (float v : vector) {
            norm += (double) v * v;
        }
        norm = Math.sqrt(norm);

        float[] result = new float[vector.length];
        if (norm == 0.0d) {
            return result;
        }
        for (int i = 0; i < vector.length; i++) {
            result[i] = (float) (vector[i] / norm);
        }
        return result;
    }

    static double dot(float[] data, int offset, float[] query) {
        double sum = 0.0d;
        for (int i = 0; i < query.length; i++) {
            sum += (double) data[offset + i] * query[i];
        }
        return sum;
    }
}
