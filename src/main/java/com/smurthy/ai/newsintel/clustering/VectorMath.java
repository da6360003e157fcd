package com.smurthy.ai.newsintel.clustering;

final class VectorMath {

    private VectorMath() {
    }

    static double euclidean(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = (double) a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    static float[] l2Normalize(float[] vector) {
        double norm = 0.0;
        for (float v : vector) {
            norm += (double) v * v;
        }
        norm = Math.sqrt(norm);
        float[] normalized = new float[vector.length];
        if (norm == 0.0) {
            return normalized;
        }
        for (int i = 0; i < vector.length; i++) {
            normalized[i] = (float) (vector[i] / norm);
        }
        return normalized;
    }

    static float[] mean(Iterable<float[]> vectors, int dimension) {
        double[] sum = new double[dimension];
        int count = 0;
        for (float[] vector : vectors) {
            for (int i = 0; i < dimension; i++) {
                sum[i] += vector[i];
            }
            count++;
        }
        float[] mean = new float[dimension];
        if (count == 0) {
            return mean;
        }
        for (int i = 0; i < dimension; i++) {
            mean[i] = (float) (sum[i] / count);
        }
        return mean;
    }
}
