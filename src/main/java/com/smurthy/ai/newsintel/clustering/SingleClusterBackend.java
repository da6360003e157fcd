package com.smurthy.ai.newsintel.clustering;

/**
 * Last resort: every point in one cluster.
 */
public class SingleClusterBackend implements ClusterBackend {

    @Override
    public String name() {
        return "single";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public ClusteringResult cluster(float[][] points) {
        return ClusteringResult.singleCluster(points.length, name());
    }
}
