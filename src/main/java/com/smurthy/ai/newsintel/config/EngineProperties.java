package com.smurthy.ai.newsintel.config;

import com.smurthy.ai.newsintel.clustering.DistanceMetric;
import com.smurthy.ai.newsintel.clustering.SelectionMethod;
import com.smurthy.ai.newsintel.service.FusionMethod;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Configuration properties for the retrieval, deduplication and clustering engine
 */
@ConfigurationProperties(prefix = "app.engine")
public record EngineProperties(
        @DefaultValue Bm25 bm25,
        @DefaultValue Fusion fusion,
        @DefaultValue Dedup dedup,
        @DefaultValue Clustering clustering
) {

    public record Bm25(
            @DefaultValue("1.6") double k1,
            @DefaultValue("0.7") double b,
            @DefaultValue("0.25") double epsilon
    ) {
    }

    public record Fusion(
            @DefaultValue("RRF") FusionMethod method,
            @DefaultValue("60") int rrfK,
            @DefaultValue("0.5") double bm25Weight
    ) {
    }

    public record Dedup(
            @DefaultValue("128") int numHashes,
            @DefaultValue("5") int shingleSize,
            @DefaultValue("0.85") double threshold,
            @DefaultValue("8") int bands,
            @DefaultValue("42") long seed,
            @DefaultValue("100") int batchSize
    ) {
    }

    public record Clustering(
            @DefaultValue("5") int minClusterSize,
            @DefaultValue("3") int minSamples,
            @DefaultValue("0.0") double clusterSelectionEpsilon,
            @DefaultValue("EOM") SelectionMethod selectionMethod,
            @DefaultValue("EUCLIDEAN") DistanceMetric metric,
            @DefaultValue("true") boolean allowSingleCluster,
            @DefaultValue("0.25") double fallbackRadius,
            @DefaultValue({"hdbscan", "dbscan", "single"}) List<String> backends
    ) {
    }
}
