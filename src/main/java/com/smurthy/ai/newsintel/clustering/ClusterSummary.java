package com.smurthy.ai.newsintel.clustering;

import java.util.List;

/**
 * One non-noise cluster of the last fit.
 *
 * @param coherenceScore 1 minus the mean member outlier score, capped to [0, 1]
 */
public record ClusterSummary(int clusterId, List<String> memberIds, float[] centroid, int size, double coherenceScore) {

    public ClusterSummary {
        memberIds = List.copyOf(memberIds);
    }
}
