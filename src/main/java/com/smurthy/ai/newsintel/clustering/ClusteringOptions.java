package com.smurthy.ai.newsintel.clustering;

import java.util.List;

/**
 * Parameters of a {@link TopicClusterer}.
 *
 * @param selectionMethod how HDBSCAN picks flat clusters, {@code EOM} when null
 * @param backendOrder backend names tried in order: {@code hdbscan}, {@code dbscan}, {@code single}
 */
public record ClusteringOptions(
        int minClusterSize,
        int minSamples,
        double clusterSelectionEpsilon,
        SelectionMethod selectionMethod,
        DistanceMetric metric,
        boolean allowSingleCluster,
        double fallbackRadius,
        List<String> backendOrder) {

    public static final List<String> DEFAULT_BACKEND_ORDER = List.of("hdbscan", "dbscan", "single");

    public ClusteringOptions {
        if (minClusterSize < 2) {
            throw new IllegalArgumentException("minClusterSize must be at least 2, got " + minClusterSize);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1, got " + minSamples);
        }
        if (selectionMethod == null) {
            selectionMethod = SelectionMethod.EOM;
        }
        if (metric == null) {
            metric = DistanceMetric.EUCLIDEAN;
        }
        backendOrder = backendOrder == null || backendOrder.isEmpty()
                ? DEFAULT_BACKEND_ORDER
                : List.copyOf(backendOrder);
    }

    public static ClusteringOptions defaults() {
        return new ClusteringOptions(5, 3, 0.0, SelectionMethod.EOM, DistanceMetric.EUCLIDEAN, true,
                DbscanBackend.DEFAULT_RADIUS, DEFAULT_BACKEND_ORDER);
    }

    public ClusteringOptions withMinClusterSize(int size) {
        return new ClusteringOptions(size, minSamples, clusterSelectionEpsilon, selectionMethod, metric,
                allowSingleCluster, fallbackRadius, backendOrder);
    }

    public ClusteringOptions withSelectionMethod(SelectionMethod method) {
        return new ClusteringOptions(minClusterSize, minSamples, clusterSelectionEpsilon, method, metric,
                allowSingleCluster, fallbackRadius, backendOrder);
    }

    public ClusteringOptions withMetric(DistanceMetric distanceMetric) {
        return new ClusteringOptions(minClusterSize, minSamples, clusterSelectionEpsilon, selectionMethod, distanceMetric,
                allowSingleCluster, fallbackRadius, backendOrder);
    }
}
