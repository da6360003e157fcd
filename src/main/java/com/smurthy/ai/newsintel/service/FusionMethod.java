package com.smurthy.ai.newsintel.service;

/**
 * How keyword and semantic rankings are merged.
 */
public enum FusionMethod {
    /** Reciprocal Rank Fusion, rank positions only. */
    RRF,
    /** Min-max normalised scores, blended with the BM25 weight. */
    WEIGHTED
}
