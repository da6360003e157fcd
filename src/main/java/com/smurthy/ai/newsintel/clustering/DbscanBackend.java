package com.smurthy.ai.newsintel.clustering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-radius DBSCAN, used when the hierarchical backend is disabled.
 * A radius of 0.25 on unit vectors corresponds to a cosine similarity of roughly 0.75.
 */
public class DbscanBackend implements ClusterBackend {

    private static final Logger log = LoggerFactory.getLogger(DbscanBackend.class);

    public static final double DEFAULT_RADIUS = 0.25;

    private final double radius;
    private final int minSamples;

    public DbscanBackend(double radius, int minSamples) {
        if (radius <= 0) {
            throw new IllegalArgumentException("radius must be > 0, got " + radius);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1, got " + minSamples);
        }
        this.radius = radius;
        this.minSamples = minSamples;
    }

    @Override
    public String name() {
        return "dbscan";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public ClusteringResult cluster(float[][] points) {
        int n = points.length;
        List<List<Integer>> neighbourhoods = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            List<Integer> neighbours = new ArrayList<>();
            for (int j = 0; j < n; j++) {
                if (VectorMath.euclidean(points[i], points[j]) <= radius) {
                    neighbours.add(j);
                }
            }
            neighbourhoods.add(neighbours);
        }

        boolean[] core = new boolean[n];
        for (int i = 0; i < n; i++) {
            core[i] = neighbourhoods.get(i).size() >= minSamples;
        }

        int[] labels = new int[n];
        Arrays.fill(labels, ClusteringResult.NOISE);
        int nextLabel = 0;
        for (int i = 0; i < n; i++) {
            if (!core[i] || labels[i] != ClusteringResult.NOISE) {
                continue;
            }
            int label = nextLabel++;
            Deque<Integer> frontier = new ArrayDeque<>();
            labels[i] = label;
            frontier.add(i);
            while (!frontier.isEmpty()) {
                int current = frontier.poll();
                if (!core[current]) {
                    continue;
                }
                for (int neighbour : neighbourhoods.get(current)) {
                    if (labels[neighbour] == ClusteringResult.NOISE) {
                        labels[neighbour] = label;
                        frontier.add(neighbour);
                    }
                }
            }
        }

        double[] probabilities = new double[n];
        double[] outlierScores = new double[n];
        for (int i = 0; i < n; i++) {
            boolean noise = labels[i] == ClusteringResult.NOISE;
            probabilities[i] = noise ? 0.0 : 1.0;
            outlierScores[i] = noise ? 1.0 : 0.0;
        }

        log.debug("DBSCAN (radius {}) found {} clusters over {} points", radius, nextLabel, n);
        return new ClusteringResult(labels, probabilities, outlierScores, name());
    }

    public double getRadius() {
        return radius;
    }
}
