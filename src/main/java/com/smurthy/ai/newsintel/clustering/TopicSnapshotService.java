package com.smurthy.ai.newsintel.clustering;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.newsintel.model.CorpusDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Clusters one window of articles and assembles a labelled {@link TopicSnapshot}.
 */
public class TopicSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(TopicSnapshotService.class);

    public static final Set<String> WINDOWS = Set.of("1d", "1w", "1m");

    private final TopicClusterer clusterer;
    private final ClusterKeywordExtractor keywordExtractor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TopicSnapshotService(TopicClusterer clusterer, ClusterKeywordExtractor keywordExtractor,
                                ObjectMapper objectMapper, Clock clock) {
        this.clusterer = clusterer;
        this.keywordExtractor = keywordExtractor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Fit the clusterer on the window's embeddings and describe each topic.
     *
     * @param documents  articles of the window, aligned with {@code embeddings}
     */
    public synchronized TopicSnapshot buildSnapshot(String window, List<CorpusDocument> documents, List<float[]> embeddings) {
        if (!WINDOWS.contains(window)) {
            throw new IllegalArgumentException("Unknown window '" + window + "', expected one of " + WINDOWS);
        }
        if (documents.size() != embeddings.size()) {
            throw new IllegalArgumentException("Documents and embeddings must have the same length: "
                    + documents.size() + " vs " + embeddings.size());
        }

        List<String> ids = new ArrayList<>(documents.size());
        Map<String, String> textById = new HashMap<>();
        for (CorpusDocument document : documents) {
            ids.add(document.id());
            textById.put(document.id(), document.text());
        }

        int[] labels = clusterer.fitPredict(embeddings);
        List<ClusterSummary> summaries = clusterer.getClusterInfo(embeddings, ids);

        List<TopicSnapshot.TopicCluster> clusters = new ArrayList<>(summaries.size());
        for (ClusterSummary summary : summaries) {
            List<String> texts = new ArrayList<>(summary.size());
            for (String id : summary.memberIds()) {
                texts.add(textById.get(id));
            }
            List<String> keywords = keywordExtractor.extractKeywords(texts);
            clusters.add(new TopicSnapshot.TopicCluster(summary.clusterId(), keywordExtractor.label(keywords),
                    keywords, summary.memberIds(), summary.size(), summary.coherenceScore()));
        }

        Map<String, Integer> assignments = new LinkedHashMap<>();
        int noise = 0;
        for (int i = 0; i < labels.length; i++) {
            assignments.put(ids.get(i), labels[i]);
            if (labels[i] == ClusteringResult.NOISE) {
                noise++;
            }
        }

        TopicSnapshot snapshot = new TopicSnapshot(window, clock.instant(), clusters.size(), noise,
                clusterer.getBackendName(), clusters, assignments);
        log.info("Topic snapshot for window {}: {} articles, {} clusters, {} noise",
                window, documents.size(), clusters.size(), noise);
        return snapshot;
    }

    public String toJson(TopicSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise topic snapshot for window " + snapshot.window(), e);
        }
    }
}
