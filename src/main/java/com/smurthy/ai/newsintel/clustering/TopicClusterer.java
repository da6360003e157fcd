package com.smurthy.ai.newsintel.clustering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups article embeddings into topics, flagging articles that belong to no topic.
 *
 * The backend is chosen once, at construction: the first configured backend that
 * reports itself available. Results of the last {@link #fitPredict} are cached for
 * {@link #getClusterInfo}, {@link #getNoiseArticles} and {@link #getStats}.
 *
 * Not safe for concurrent fits; callers serialise writes per instance.
 */
public class TopicClusterer {

    private static final Logger log = LoggerFactory.getLogger(TopicClusterer.class);

    public static final double DEFAULT_NOISE_THRESHOLD = 0.7;

    private final ClusteringOptions options;
    private final ClusterBackend backend;

    private volatile ClusteringResult lastResult;

    public TopicClusterer() {
        this(ClusteringOptions.defaults());
    }

    public TopicClusterer(ClusteringOptions options) {
        this(options, createBackends(options));
    }

    public TopicClusterer(ClusteringOptions options, List<ClusterBackend> candidates) {
        this.options = options;
        this.backend = selectBackend(candidates);
        log.info("Topic clusterer using backend '{}' (minClusterSize={}, minSamples={}, selection={}, metric={})",
                backend.name(), options.minClusterSize(), options.minSamples(), options.selectionMethod(),
                options.metric());
    }

    private static List<ClusterBackend> createBackends(ClusteringOptions options) {
        List<ClusterBackend> backends = new ArrayList<>();
        for (String name : options.backendOrder()) {
            switch (name) {
                case "hdbscan" -> backends.add(new HdbscanBackend(options.minClusterSize(), options.minSamples(),
                        options.clusterSelectionEpsilon(), options.selectionMethod(), options.allowSingleCluster()));
                case "dbscan" -> backends.add(new DbscanBackend(options.fallbackRadius(), options.minSamples()));
                case "single" -> backends.add(new SingleClusterBackend());
                default -> throw new IllegalArgumentException("Unknown clustering backend: " + name);
            }
        }
        return backends;
    }

    private static ClusterBackend selectBackend(List<ClusterBackend> candidates) {
        for (ClusterBackend candidate : candidates) {
            if (candidate.isAvailable()) {
                return candidate;
            }
            log.warn("Clustering backend '{}' is not available, trying the next one", candidate.name());
        }
        log.error("No clustering backend available, every article will be placed in a single cluster");
        return new SingleClusterBackend();
    }

    /**
     * Cluster the embeddings and return one label per embedding, -1 for noise.
     * Fewer embeddings than the minimum cluster size all get label 0.
     */
    public int[] fitPredict(List<float[]> embeddings) {
        int n = embeddings.size();
        float[][] points = preparePoints(embeddings);

        ClusteringResult result;
        if (n < options.minClusterSize()) {
            log.warn("Too few samples ({}) for min_cluster_size ({}), assigning all to one cluster",
                    n, options.minClusterSize());
            result = ClusteringResult.singleCluster(n, backend.name());
        } else {
            long startTime = System.currentTimeMillis();
            result = backend.cluster(points);
            log.info("{} found {} clusters, {} noise points out of {} samples in {}ms",
                    backend.name(), result.clusterCount(), result.noiseCount(), n,
                    System.currentTimeMillis() - startTime);
        }

        lastResult = result;
        return result.labels().clone();
    }

    private float[][] preparePoints(List<float[]> embeddings) {
        float[][] points = new float[embeddings.size()][];
        int dimension = -1;
        for (int i = 0; i < points.length; i++) {
            float[] embedding = embeddings.get(i);
            if (embedding == null) {
                throw new IllegalArgumentException("Embedding at index " + i + " is null");
            }
            if (dimension == -1) {
                dimension = embedding.length;
            } else if (embedding.length != dimension) {
                throw new IllegalArgumentException("Embedding at index " + i + " has dimension "
                        + embedding.length + ", expected " + dimension);
            }
            points[i] = options.metric() == DistanceMetric.COSINE ? VectorMath.l2Normalize(embedding) : embedding;
        }
        return points;
    }

    /**
     * Summaries of the non-noise clusters of the last fit, in order of first appearance.
     */
    public List<ClusterSummary> getClusterInfo(List<float[]> embeddings, List<String> ids) {
        ClusteringResult result = requireResult();
        if (embeddings.size() != ids.size()) {
            throw new IllegalArgumentException("Embeddings and ids must have the same length: "
                    + embeddings.size() + " vs " + ids.size());
        }
        if (embeddings.size() != result.size()) {
            throw new IllegalArgumentException("Expected " + result.size() + " embeddings from the last fit, got "
                    + embeddings.size());
        }

        Map<Integer, List<Integer>> members = new LinkedHashMap<>();
        int[] labels = result.labels();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] != ClusteringResult.NOISE) {
                members.computeIfAbsent(labels[i], label -> new ArrayList<>()).add(i);
            }
        }

        List<ClusterSummary> summaries = new ArrayList<>(members.size());
        int dimension = embeddings.isEmpty() ? 0 : embeddings.get(0).length;
        for (Map.Entry<Integer, List<Integer>> entry : members.entrySet()) {
            List<String> memberIds = new ArrayList<>();
            List<float[]> memberVectors = new ArrayList<>();
            double outlierSum = 0.0;
            for (int index : entry.getValue()) {
                memberIds.add(ids.get(index));
                memberVectors.add(embeddings.get(index));
                outlierSum += result.outlierScores()[index];
            }
            int size = memberIds.size();
            double coherence = 1.0 - Math.min(outlierSum / size, 1.0);
            summaries.add(new ClusterSummary(entry.getKey(), memberIds,
                    VectorMath.mean(memberVectors, dimension), size, coherence));
        }
        return summaries;
    }

    public List<NoiseArticle> getNoiseArticles(List<String> ids) {
        return getNoiseArticles(ids, DEFAULT_NOISE_THRESHOLD);
    }

    /**
     * Articles labelled noise, plus clustered articles whose outlier score reaches the threshold.
     */
    public List<NoiseArticle> getNoiseArticles(List<String> ids, double threshold) {
        ClusteringResult result = requireResult();
        if (ids.size() != result.size()) {
            throw new IllegalArgumentException("Expected " + result.size() + " ids from the last fit, got " + ids.size());
        }
        List<NoiseArticle> noise = new ArrayList<>();
        for (int i = 0; i < result.size(); i++) {
            boolean isNoise = result.labels()[i] == ClusteringResult.NOISE;
            double score = result.outlierScores()[i];
            if (isNoise || score >= threshold) {
                noise.add(new NoiseArticle(ids.get(i), score, isNoise));
            }
        }
        return noise;
    }

    public ClusterStats getStats() {
        ClusteringResult result = lastResult;
        int clusters = result == null ? 0 : result.clusterCount();
        int noise = result == null ? 0 : result.noiseCount();
        double noiseRatio = result == null ? 0.0 : (double) noise / Math.max(result.size(), 1);
        return new ClusterStats(clusters, noise, noiseRatio, options.minClusterSize(), options.minSamples(),
                backend.name());
    }

    public boolean isFitted() {
        return lastResult != null;
    }

    /**
     * Copy of the result of the last fit; changing it leaves the cached result untouched.
     *
     * @throws ClustererNotFittedException before the first fit
     */
    public ClusteringResult getLastResult() {
        return requireResult().copy();
    }

    public String getBackendName() {
        return backend.name();
    }

    private ClusteringResult requireResult() {
        ClusteringResult result = lastResult;
        if (result == null) {
            throw new ClustererNotFittedException();
        }
        return result;
    }

    public record ClusterStats(
            int clusterCount,
            int noiseCount,
            double noiseRatio,
            int minClusterSize,
            int minSamples,
            String backend) {}
}
