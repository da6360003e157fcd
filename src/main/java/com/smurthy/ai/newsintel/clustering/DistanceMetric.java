package com.smurthy.ai.newsintel.clustering;

/**
 * Distance used between embeddings.
 */
public enum DistanceMetric {
    /** Plain Euclidean distance on the vectors as given. */
    EUCLIDEAN,
    /** Euclidean distance on L2-normalised vectors, monotone in cosine distance. */
    COSINE
}
