package com.smurthy.ai.newsintel.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rank fusion of the BM25 ranking with an externally supplied semantic ranking.
 *
 * Reciprocal Rank Fusion (RRF):
 * score(doc) = Σ(1 / (k + rank_i)) for each ranking i, rank 1-based
 * - k = 60 (standard constant from Cormack et al.)
 * - a document missing from a ranking gets nothing from it
 * - only positions matter, so BM25 and cosine scales never have to be reconciled
 *
 * Weighted fusion:
 * combined(doc) = w * bm25_norm(doc) + (1 - w) * vector_norm(doc)
 * with each score list min-max normalised on its own.
 */
public class RankFusion {

    private static final Logger log = LoggerFactory.getLogger(RankFusion.class);

    public static final int DEFAULT_RRF_K = 60;
    public static final double DEFAULT_BM25_WEIGHT = 0.5;

    private final int rrfK;
    private final double bm25Weight;

    public RankFusion() {
        this(DEFAULT_RRF_K, DEFAULT_BM25_WEIGHT);
    }

    public RankFusion(int rrfK, double bm25Weight) {
        if (rrfK < 0) {
            throw new IllegalArgumentException("RRF k must be >= 0, got " + rrfK);
        }
        if (bm25Weight < 0 || bm25Weight > 1) {
            throw new IllegalArgumentException("BM25 weight must be within [0, 1], got " + bm25Weight);
        }
        this.rrfK = rrfK;
        this.bm25Weight = bm25Weight;
    }

    /**
     * Reciprocal Rank Fusion over any number of rankings.
     *
     * @param rankings each ranking ordered best first
     * @return every document of every ranking exactly once, by descending fused score;
     *         ties keep the order in which documents were first seen
     */
    public List<RankedItem> reciprocalRankFusion(List<List<RankedItem>> rankings) {
        if (rankings == null || rankings.isEmpty()) {
            return List.of();
        }

        Map<String, Double> fusedScores = new LinkedHashMap<>();
        for (List<RankedItem> ranking : rankings) {
            // A repeated id counts once per ranking, at its best position
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < ranking.size(); i++) {
                String id = ranking.get(i).id();
                if (!seen.add(id)) {
                    continue;
                }
                double rrfScore = 1.0 / (rrfK + (i + 1)); // 1-indexed rank
                fusedScores.merge(id, rrfScore, Double::sum);
            }
        }

        return sortDescending(fusedScores);
    }

    /**
     * Blend BM25 and vector scores with the configured BM25 weight.
     *
     * @param normalize min-max normalise each list first; an empty or constant list passes through as-is
     * @return document id to combined score, in first-seen order (keyword ids first)
     */
    public Map<String, Double> combineScores(Map<String, Double> bm25Scores,
                                             Map<String, Double> vectorScores,
                                             boolean normalize) {
        return combineScores(bm25Scores, vectorScores, bm25Weight, normalize);
    }

    public static Map<String, Double> combineScores(Map<String, Double> bm25Scores,
                                                    Map<String, Double> vectorScores,
                                                    double bm25Weight,
                                                    boolean normalize) {
        Map<String, Double> bm25Norm = normalize ? minMaxNormalize(bm25Scores) : bm25Scores;
        Map<String, Double> vectorNorm = normalize ? minMaxNormalize(vectorScores) : vectorScores;
        double vectorWeight = 1.0 - bm25Weight;

        Set<String> allIds = new LinkedHashSet<>(bm25Scores.keySet());
        allIds.addAll(vectorScores.keySet());

        Map<String, Double> combined = new LinkedHashMap<>();
        for (String id : allIds) {
            double bm25 = bm25Norm.getOrDefault(id, 0.0);
            double vector = vectorNorm.getOrDefault(id, 0.0);
            combined.put(id, bm25Weight * bm25 + vectorWeight * vector);
        }
        return combined;
    }

    /**
     * Min-max normalisation to [0, 1]. Skipped when the list is empty or constant,
     * where the range would be zero.
     */
    static Map<String, Double> minMaxNormalize(Map<String, Double> scores) {
        if (scores.isEmpty()) {
            return scores;
        }
        double min = scores.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double range = max - min;
        if (range == 0.0) {
            return scores;
        }

        Map<String, Double> normalized = new LinkedHashMap<>();
        scores.forEach((id, score) -> normalized.put(id, (score - min) / range));
        return normalized;
    }

    /**
     * Fuse a keyword and a semantic ranking, keeping each source's raw score for explainability.
     */
    public List<FusedResult> fuse(List<RankedItem> keywordRanking,
                                  List<RankedItem> semanticRanking,
                                  FusionMethod method) {
        Map<String, Double> bm25Scores = toScoreMap(keywordRanking);
        Map<String, Double> vectorScores = toScoreMap(semanticRanking);

        List<RankedItem> fused;
        if (method == FusionMethod.WEIGHTED) {
            fused = sortDescending(combineScores(bm25Scores, vectorScores, true));
        } else {
            fused = reciprocalRankFusion(List.of(keywordRanking, semanticRanking));
        }

        List<FusedResult> results = new ArrayList<>(fused.size());
        for (RankedItem item : fused) {
            results.add(new FusedResult(
                    item.id(),
                    item.score(),
                    bm25Scores.getOrDefault(item.id(), 0.0),
                    vectorScores.getOrDefault(item.id(), 0.0),
                    bm25Scores.containsKey(item.id()),
                    vectorScores.containsKey(item.id())));
        }

        if (log.isDebugEnabled()) {
            long both = results.stream().filter(r -> r.inKeyword() && r.inSemantic()).count();
            log.debug("{} fusion: {} results (both={}, keywordOnly={}, semanticOnly={})",
                    method, results.size(), both,
                    results.stream().filter(r -> r.inKeyword() && !r.inSemantic()).count(),
                    results.stream().filter(r -> !r.inKeyword() && r.inSemantic()).count());
        }
        return results;
    }

    public int getRrfK() {
        return rrfK;
    }

    public double getBm25Weight() {
        return bm25Weight;
    }

    public static List<RankedItem> toRanking(Map<String, Double> scores) {
        List<RankedItem> ranking = new ArrayList<>(scores.size());
        scores.forEach((id, score) -> ranking.add(new RankedItem(id, score)));
        return ranking;
    }

    private static Map<String, Double> toScoreMap(Collection<RankedItem> ranking) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (RankedItem item : ranking) {
            scores.putIfAbsent(item.id(), item.score());
        }
        return scores;
    }

    private static List<RankedItem> sortDescending(Map<String, Double> scores) {
        List<RankedItem> sorted = new ArrayList<>(toRanking(scores));
        sorted.sort((a, b) -> Double.compare(b.score(), a.score()));
        return sorted;
    }

    /**
     * One entry of a ranking: a document id and the score it was ranked by.
     */
    public record RankedItem(String id, double score) {}

    /**
     * Fused result with the per-source breakdown preserved.
     */
    public record FusedResult(
            String id,
            double fusedScore,
            double bm25Score,
            double vectorScore,
            boolean inKeyword,
            boolean inSemantic
    ) {}
}
