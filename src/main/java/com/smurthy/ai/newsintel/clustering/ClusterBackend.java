package com.smurthy.ai.newsintel.clustering;

/**
 * One clustering strategy. {@link TopicClusterer} holds an ordered list of these and
 * commits to the first available one when it is constructed.
 */
public interface ClusterBackend {

    String name();

    /**
     * Whether this backend can run in the current deployment.
     */
    boolean isAvailable();

    /**
     * Cluster the given points. Points are already prepared for Euclidean distance
     * (unit length when the cosine metric is configured).
     */
    ClusteringResult cluster(float[][] points);
}
