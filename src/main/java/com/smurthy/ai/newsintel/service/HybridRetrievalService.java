package com.smurthy.ai.newsintel.service;

import com.smurthy.ai.newsintel.model.CorpusDocument;
import com.smurthy.ai.newsintel.observability.RetrievalMetrics;
import com.smurthy.ai.newsintel.retrieval.SemanticRanker;
import com.smurthy.ai.newsintel.service.RankFusion.FusedResult;
import com.smurthy.ai.newsintel.service.RankFusion.RankedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hybrid Retrieval Service for article search
 *
 * Combines two retrieval strategies:
 * 1. Sparse Retrieval: BM25 keyword search over the indexed corpus
 * 2. Dense Retrieval: similarity ranking from the external vector store
 *
 * Why Hybrid Retrieval?
 * - BM25 search: exact matches (names, tickers, places in headlines)
 * - Vector search: synonyms and paraphrased coverage of the same story
 * - Fusion: one ranking that keeps both signals
 *
 * When the keyword index has not been built yet, the search degrades to the
 * semantic ranking alone instead of failing the query.
 */
public class HybridRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(HybridRetrievalService.class);

    private final BM25SearchService bm25SearchService;
    private final SemanticRanker semanticRanker;
    private final RankFusion rankFusion;
    private final RetrievalMetrics metrics;
    private final int defaultVectorLimit;
    private final FusionMethod defaultMethod;

    public HybridRetrievalService(
            BM25SearchService bm25SearchService,
            SemanticRanker semanticRanker,
            RankFusion rankFusion,
            RetrievalMetrics metrics,
            int defaultVectorLimit,
            FusionMethod defaultMethod) {
        this.bm25SearchService = bm25SearchService;
        this.semanticRanker = semanticRanker;
        this.rankFusion = rankFusion;
        this.metrics = metrics;
        this.defaultVectorLimit = defaultVectorLimit;
        this.defaultMethod = defaultMethod;
    }

    /**
     * Index articles for the keyword side of the search.
     * Should be called with the full corpus whenever it changes.
     */
    public int indexDocuments(List<CorpusDocument> documents) {
        return bm25SearchService.buildIndex(documents);
    }

    public HybridSearchResult search(String query, int limit) {
        return search(query, limit, defaultVectorLimit, defaultMethod);
    }

    /**
     * Hybrid search
     *
     * Pipeline:
     * 1. Sparse retrieval: top {@code limit} from BM25
     * 2. Dense retrieval: top {@code vectorLimit} from the semantic ranker
     * 3. Fusion: RRF or weighted combination
     * 4. Return: top {@code limit} fused results with per-source scores
     *
     * @param query       User query
     * @param limit       Final number of results
     * @param vectorLimit Candidates to fetch from the semantic ranker
     * @param method      Fusion method
     */
    public HybridSearchResult search(String query, int limit, int vectorLimit, FusionMethod method) {
        long startTime = System.currentTimeMillis();

        if (!bm25SearchService.isBuilt()) {
            log.warn("BM25 index not built - falling back to vector only search");
            return semanticOnly(query, limit, startTime);
        }

        // Step 1: Sparse retrieval (BM25)
        long sparseStart = System.currentTimeMillis();
        List<RankedItem> keywordRanking = bm25SearchService.search(query, limit).stream()
                .map(r -> new RankedItem(r.documentId(), r.score()))
                .toList();
        long sparseTime = System.currentTimeMillis() - sparseStart;

        // Step 2: Dense retrieval (vector store)
        long denseStart = System.currentTimeMillis();
        List<RankedItem> semanticRanking = semanticRanker.rank(query, vectorLimit);
        long denseTime = System.currentTimeMillis() - denseStart;

        // Step 3: Fusion
        long fusionStart = System.currentTimeMillis();
        List<FusedResult> fused = rankFusion.fuse(keywordRanking, semanticRanking, method);
        List<FusedResult> results = fused.subList(0, Math.min(Math.max(limit, 0), fused.size()));
        long fusionTime = System.currentTimeMillis() - fusionStart;

        long totalTime = System.currentTimeMillis() - startTime;
        log.info("Hybrid search ({}): sparse={}ms ({} docs), dense={}ms ({} docs), fusion={}ms → {} results (total: {}ms)",
                method, sparseTime, keywordRanking.size(), denseTime, semanticRanking.size(),
                fusionTime, results.size(), totalTime);

        record(query, totalTime, true, results);

        Map<String, Object> performance = new LinkedHashMap<>();
        performance.put("sparseTime", sparseTime);
        performance.put("denseTime", denseTime);
        performance.put("fusionTime", fusionTime);

        return new HybridSearchResult(
                List.copyOf(results),
                keywordRanking.size(),
                semanticRanking.size(),
                false,
                totalTime,
                performance);
    }

    /**
     * Weighted fusion restricted to a semantic candidate set the caller already filtered
     * (e.g. by source or date). BM25 only scores those candidates.
     *
     * @param semanticHits filtered semantic hits, best first
     */
    public List<FusedResult> searchWithinCandidates(String query, List<RankedItem> semanticHits, int limit) {
        if (semanticHits == null || semanticHits.isEmpty()) {
            return List.of();
        }

        Map<String, Double> vectorScores = new LinkedHashMap<>();
        semanticHits.forEach(hit -> vectorScores.putIfAbsent(hit.id(), hit.score()));

        Map<String, Double> bm25Scores = bm25SearchService.getScoresForFusion(
                query, vectorScores.keySet(), vectorScores.size());

        Map<String, Double> combined = rankFusion.combineScores(bm25Scores, vectorScores, true);

        List<FusedResult> results = new ArrayList<>(combined.size());
        combined.forEach((id, score) -> results.add(new FusedResult(
                id,
                score,
                bm25Scores.getOrDefault(id, 0.0),
                vectorScores.getOrDefault(id, 0.0),
                bm25Scores.containsKey(id),
                vectorScores.containsKey(id))));
        results.sort((a, b) -> Double.compare(b.fusedScore(), a.fusedScore()));

        return List.copyOf(results.subList(0, Math.min(Math.max(limit, 0), results.size())));
    }

    /**
     * Hybrid search statistics: index state, fusion settings and the BM25 index stats
     * (null until the index is built).
     */
    public HybridStats getStats() {
        BM25SearchService.IndexStats bm25Stats = bm25SearchService.getIndexStats();
        return new HybridStats(
                bm25Stats.built(),
                bm25Stats.documentCount(),
                defaultMethod,
                rankFusion.getRrfK(),
                rankFusion.getBm25Weight(),
                1.0 - rankFusion.getBm25Weight(),
                semanticRanker.getName(),
                bm25Stats.built() ? bm25Stats : null);
    }

    private HybridSearchResult semanticOnly(String query, int limit, long startTime) {
        log.info("Falling back to {} ranking only", semanticRanker.getName());
        List<RankedItem> semanticRanking = semanticRanker.rank(query, limit);

        List<FusedResult> results = semanticRanking.stream()
                .limit(Math.max(limit, 0))
                .map(hit -> new FusedResult(hit.id(), hit.score(), 0.0, hit.score(), false, true))
                .toList();

        long totalTime = System.currentTimeMillis() - startTime;
        record(query, totalTime, false, results);

        return new HybridSearchResult(results, 0, semanticRanking.size(), true, totalTime,
                Map.of("denseTime", totalTime));
    }

    private void record(String query, long latencyMs, boolean hybrid, List<FusedResult> results) {
        metrics.recordRetrieval(new RetrievalMetrics.RetrievalMetricData(
                query,
                latencyMs,
                hybrid,
                results.stream().map(FusedResult::id).toList()));
    }

    /**
     * Result object containing fused results and performance metrics
     */
    public record HybridSearchResult(
            List<FusedResult> results,
            int keywordResultCount,
            int semanticResultCount,
            boolean semanticOnlyFallback,
            long totalTimeMs,
            Map<String, Object> performanceMetrics
    ) {}

    public record HybridStats(
            boolean bm25Built,
            int corpusSize,
            FusionMethod fusionMethod,
            int rrfK,
            double bm25Weight,
            double vectorWeight,
            String semanticRanker,
            BM25SearchService.IndexStats bm25Stats
    ) {}
}
