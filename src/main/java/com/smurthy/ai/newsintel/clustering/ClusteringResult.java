package com.smurthy.ai.newsintel.clustering;

import java.util.Arrays;

/**
 * Output of one clustering run.
 *
 * @param labels        cluster label per input point, -1 for noise
 * @param probabilities membership strength per point in [0, 1], 0 for noise
 * @param outlierScores outlier score per point in [0, 1], higher is more anomalous
 * @param backendName   backend that produced the labels
 */
public record ClusteringResult(int[] labels, double[] probabilities, double[] outlierScores, String backendName) {

    public static final int NOISE = -1;

    public ClusteringResult {
        if (labels.length != probabilities.length || labels.length != outlierScores.length) {
            throw new IllegalArgumentException("labels, probabilities and outlier scores must have the same length");
        }
    }

    /**
     * Every point in cluster 0, full membership, no outliers.
     */
    public static ClusteringResult singleCluster(int size, String backendName) {
        double[] probabilities = new double[size];
        Arrays.fill(probabilities, 1.0);
        return new ClusteringResult(new int[size], probabilities, new double[size], backendName);
    }

    public ClusteringResult copy() {
        return new ClusteringResult(labels.clone(), probabilities.clone(), outlierScores.clone(), backendName);
    }

    public int size() {
        return labels.length;
    }

    public int clusterCount() {
        return (int) Arrays.stream(labels).filter(label -> label != NOISE).distinct().count();
    }

    public int noiseCount() {
        return (int) Arrays.stream(labels).filter(label -> label == NOISE).count();
    }
}
