package com.smurthy.ai.newsintel.clustering;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Topic clustering of one time window, shaped for the persistence layer.
 *
 * @param assignments article id to cluster id, -1 for noise
 */
public record TopicSnapshot(
        String window,
        Instant computedAt,
        int clusterCount,
        int noiseCount,
        String backend,
        List<TopicCluster> clusters,
        Map<String, Integer> assignments) {

    public record TopicCluster(
            int clusterId,
            String label,
            List<String> keywords,
            List<String> articleIds,
            int size,
            double coherenceScore) {}
}
