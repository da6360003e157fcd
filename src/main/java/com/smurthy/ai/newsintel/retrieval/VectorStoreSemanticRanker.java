package com.smurthy.ai.newsintel.retrieval;

import com.smurthy.ai.newsintel.service.RankFusion.RankedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

import java.util.Comparator;
import java.util.List;

/**
 * Semantic ranking backed by a Spring AI {@link VectorStore}.
 *
 * The store's similarity score becomes the ranking score; hits are re-sorted by it
 * so the ranking order never depends on the store's own return order.
 */
public class VectorStoreSemanticRanker implements SemanticRanker {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreSemanticRanker.class);

    private final VectorStore vectorStore;
    private final double similarityThreshold;

    public VectorStoreSemanticRanker(VectorStore vectorStore, double similarityThreshold) {
        this.vectorStore = vectorStore;
        this.similarityThreshold = similarityThreshold;
    }

    @Override
    public List<RankedItem> rank(String query, int limit) {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }

        long startTime = System.currentTimeMillis();
        SearchRequest request = SearchRequest.builder()
                .query(query)
                .topK(limit)
                .similarityThreshold(similarityThreshold)
                .build();

        List<Document> documents = vectorStore.similaritySearch(request);
        if (documents == null || documents.isEmpty()) {
            return List.of();
        }

        List<RankedItem> ranking = documents.stream()
                .map(doc -> new RankedItem(doc.getId(), doc.getScore() != null ? doc.getScore() : 0.0))
                .sorted(Comparator.comparingDouble(RankedItem::score).reversed())
                .toList();

        log.debug("Vector search for '{}' returned {} hits in {}ms",
                query, ranking.size(), System.currentTimeMillis() - startTime);
        return ranking;
    }

    @Override
    public String getName() {
        return "vector-store";
    }
}
