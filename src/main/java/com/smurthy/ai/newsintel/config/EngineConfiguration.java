package com.smurthy.ai.newsintel.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.newsintel.clustering.ClusterKeywordExtractor;
import com.smurthy.ai.newsintel.clustering.ClusteringOptions;
import com.smurthy.ai.newsintel.clustering.TopicClusterer;
import com.smurthy.ai.newsintel.clustering.TopicSnapshotService;
import com.smurthy.ai.newsintel.dedup.DuplicateGrouper;
import com.smurthy.ai.newsintel.dedup.MinHashDeduplicator;
import com.smurthy.ai.newsintel.dedup.MinHasher;
import com.smurthy.ai.newsintel.observability.RetrievalMetrics;
import com.smurthy.ai.newsintel.observability.RetrievalMetricsReporter;
import com.smurthy.ai.newsintel.retrieval.SemanticRanker;
import com.smurthy.ai.newsintel.retrieval.VectorStoreSemanticRanker;
import com.smurthy.ai.newsintel.service.BM25SearchService;
import com.smurthy.ai.newsintel.service.HybridRetrievalService;
import com.smurthy.ai.newsintel.service.RankFusion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Engine wiring. Every component is a plain class; this is the only place Spring sees them.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
@EnableScheduling
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public BM25SearchService bm25SearchService(EngineProperties properties) {
        EngineProperties.Bm25 bm25 = properties.bm25();
        return new BM25SearchService(bm25.k1(), bm25.b(), bm25.epsilon());
    }

    @Bean
    public RankFusion rankFusion(EngineProperties properties) {
        return new RankFusion(properties.fusion().rrfK(), properties.fusion().bm25Weight());
    }

    @Bean
    public RetrievalMetrics retrievalMetrics() {
        return new RetrievalMetrics();
    }

    @Bean
    public RetrievalMetricsReporter retrievalMetricsReporter(RetrievalMetrics retrievalMetrics) {
        return new RetrievalMetricsReporter(retrievalMetrics);
    }

    /**
     * Uses the application's vector store when one is configured; otherwise semantic
     * ranking is unavailable and searches rely on keywords alone.
     */
    @Bean
    public SemanticRanker semanticRanker(ObjectProvider<VectorStore> vectorStore,
                                         @Value("${app.retrieval.similarity-threshold:0.0}") double similarityThreshold) {
        VectorStore store = vectorStore.getIfAvailable();
        if (store == null) {
            log.warn("No VectorStore configured, semantic ranking is disabled");
            return SemanticRanker.unavailable();
        }
        return new VectorStoreSemanticRanker(store, similarityThreshold);
    }

    @Bean
    public HybridRetrievalService hybridRetrievalService(BM25SearchService bm25SearchService,
                                                         SemanticRanker semanticRanker,
                                                         RankFusion rankFusion,
                                                         RetrievalMetrics retrievalMetrics,
                                                         EngineProperties properties,
                                                         @Value("${app.retrieval.vector-limit:20}") int vectorLimit) {
        return new HybridRetrievalService(bm25SearchService, semanticRanker, rankFusion, retrievalMetrics,
                vectorLimit, properties.fusion().method());
    }

    @Bean
    public MinHashDeduplicator minHashDeduplicator(EngineProperties properties) {
        return newDeduplicator(properties.dedup());
    }

    @Bean
    public DuplicateGrouper duplicateGrouper(EngineProperties properties) {
        return new DuplicateGrouper(() -> newDeduplicator(properties.dedup()));
    }

    private static MinHashDeduplicator newDeduplicator(EngineProperties.Dedup dedup) {
        MinHasher minHasher = new MinHasher(dedup.numHashes(), dedup.shingleSize(), dedup.seed());
        return new MinHashDeduplicator(minHasher, dedup.threshold(), dedup.bands(), dedup.batchSize());
    }

    @Bean
    public TopicClusterer topicClusterer(EngineProperties properties) {
        EngineProperties.Clustering clustering = properties.clustering();
        return new TopicClusterer(new ClusteringOptions(
                clustering.minClusterSize(),
                clustering.minSamples(),
                clustering.clusterSelectionEpsilon(),
                clustering.selectionMethod(),
                clustering.metric(),
                clustering.allowSingleCluster(),
                clustering.fallbackRadius(),
                clustering.backends()));
    }

    @Bean
    public ClusterKeywordExtractor clusterKeywordExtractor() {
        return new ClusterKeywordExtractor();
    }

    @Bean
    public TopicSnapshotService topicSnapshotService(TopicClusterer topicClusterer,
                                                     ClusterKeywordExtractor clusterKeywordExtractor,
                                                     ObjectMapper objectMapper) {
        return new TopicSnapshotService(topicClusterer, clusterKeywordExtractor, objectMapper, Clock.systemUTC());
    }
}
