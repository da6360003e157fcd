package com.smurthy.ai.newsintel.retrieval;

import com.smurthy.ai.newsintel.service.RankFusion.RankedItem;

import java.util.List;

/**
 * Source of the semantic (dense vector) ranking for a query.
 *
 * The engine never computes embeddings itself; implementations wrap whatever
 * nearest-neighbour store holds them.
 */
public interface SemanticRanker {

    /**
     * @param query free-text query
     * @param limit maximum number of hits
     * @return hits ordered by descending similarity
     */
    List<RankedItem> rank(String query, int limit);

    /**
     * Strategy name for logging/observability
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Ranker used when no vector store is configured: it never returns anything.
     */
    static SemanticRanker unavailable() {
        return new SemanticRanker() {
            @Override
            public List<RankedItem> rank(String query, int limit) {
                return List.of();
            }

            @Override
            public String getName() {
                return "unavailable";
            }
        };
    }
}
