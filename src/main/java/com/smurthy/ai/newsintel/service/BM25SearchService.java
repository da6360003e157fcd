package com.smurthy.ai.newsintel.service;

import com.smurthy.ai.newsintel.model.CorpusDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * BM25 Sparse Search Service for keyword based retrieval over the article corpus.
 *
 * Okapi BM25, per query token t against document d:
 * score(t,d) = IDF(t) * f(t,d)*(k1+1) / (f(t,d) + k1*(1 - b + b*|d|/avgdl))
 *
 * IDF(t) = ln(N - n(t) + 0.5) - ln(n(t) + 0.5). Terms that occur in half or more of
 * the corpus would get a zero or negative weight, so they are floored to epsilon * average IDF,
 * or to epsilon itself when the average IDF is not positive (tiny corpora).
 *
 * Defaults: k1=1.6, b=0.7, epsilon=0.25. Tuned per instance, never per query.
 *
 * The index is rebuilt from scratch on every {@link #buildIndex} call and published
 * as one immutable snapshot, so readers never see a half-built index.
 */
public class BM25SearchService {

    private static final Logger log = LoggerFactory.getLogger(BM25SearchService.class);

    public static final double DEFAULT_K1 = 1.6;
    public static final double DEFAULT_B = 0.7;
    public static final double DEFAULT_EPSILON = 0.25;

    private static final int PREVIEW_LENGTH = 200;

    private final double k1;
    private final double b;
    private final double epsilon;
    private final KeywordTokenizer tokenizer;

    private volatile IndexSnapshot snapshot;

    public BM25SearchService() {
        this(DEFAULT_K1, DEFAULT_B, DEFAULT_EPSILON);
    }

    public BM25SearchService(double k1, double b, double epsilon) {
        this(k1, b, epsilon, new KeywordTokenizer());
    }

    public BM25SearchService(double k1, double b, double epsilon, KeywordTokenizer tokenizer) {
        if (k1 < 0) {
            throw new IllegalArgumentException("k1 must be >= 0, got " + k1);
        }
        if (b < 0 || b > 1) {
            throw new IllegalArgumentException("b must be within [0, 1], got " + b);
        }
        this.k1 = k1;
        this.b = b;
        this.epsilon = epsilon;
        this.tokenizer = tokenizer;
    }

    /**
     * Build the index from map-shaped records, reading the id and text from the named fields.
     * Records without an id are skipped.
     */
    public int buildIndex(List<? extends Map<String, ?>> records, String idField, String textField) {
        return buildIndex(CorpusDocument.fromRecords(records, idField, textField));
    }

    /**
     * Build the BM25 index, replacing whatever was indexed before.
     *
     * @return number of documents indexed, 0 when there was nothing to index
     */
    public synchronized int buildIndex(List<CorpusDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            log.warn("No documents provided for BM25 indexing");
            snapshot = null;
            return 0;
        }

        long startTime = System.currentTimeMillis();

        List<String> corpusIds = new ArrayList<>(documents.size());
        List<String> texts = new ArrayList<>(documents.size());
        List<List<String>> tokenizedCorpus = new ArrayList<>(documents.size());
        List<Map<String, Integer>> termFrequencies = new ArrayList<>(documents.size());
        int[] docLengths = new int[documents.size()];
        Map<String, Integer> documentFrequencies = new HashMap<>();
        long totalTokens = 0;

        for (int i = 0; i < documents.size(); i++) {
            CorpusDocument doc = documents.get(i);
            List<String> tokens = tokenizer.tokenize(doc.text());

            Map<String, Integer> tf = new HashMap<>();
            for (String token : tokens) {
                tf.merge(token, 1, Integer::sum);
            }
            for (String term : tf.keySet()) {
                documentFrequencies.merge(term, 1, Integer::sum);
            }

            corpusIds.add(doc.id());
            texts.add(doc.text());
            tokenizedCorpus.add(List.copyOf(tokens));
            termFrequencies.add(tf);
            docLengths[i] = tokens.size();
            totalTokens += tokens.size();
        }

        if (totalTokens == 0) {
            log.warn("No valid documents after tokenization ({} documents were all blank)", documents.size());
            snapshot = null;
            return 0;
        }

        double avgDocLength = (double) totalTokens / documents.size();
        Map<String, Double> idf = computeIdf(documentFrequencies, documents.size());

        snapshot = new IndexSnapshot(
                List.copyOf(corpusIds),
                List.copyOf(texts),
                List.copyOf(tokenizedCorpus),
                List.copyOf(termFrequencies),
                docLengths,
                avgDocLength,
                Map.copyOf(idf));

        long duration = System.currentTimeMillis() - startTime;
        log.info("BM25 index built with {} documents, avg length: {} tokens ({}ms)",
                corpusIds.size(), String.format("%.1f", avgDocLength), duration);
        return corpusIds.size();
    }

    /**
     * Okapi IDF with the epsilon floor applied to non-positive weights.
     */
    private Map<String, Double> computeIdf(Map<String, Integer> documentFrequencies, int corpusSize) {
        Map<String, Double> idf = new HashMap<>();
        Set<String> nonPositiveIdfs = new HashSet<>();
        double idfSum = 0.0;

        for (Map.Entry<String, Integer> entry : documentFrequencies.entrySet()) {
            int df = entry.getValue();
            double weight = Math.log(corpusSize - df + 0.5) - Math.log(df + 0.5);
            idf.put(entry.getKey(), weight);
            idfSum += weight;
            if (weight <= 0) {
                nonPositiveIdfs.add(entry.getKey());
            }
        }

        double averageIdf = idfSum / idf.size();
        // the floor must stay positive, otherwise more occurrences would lower the score
        double floor = averageIdf > 0 ? epsilon * averageIdf : epsilon;
        for (String term : nonPositiveIdfs) {
            idf.put(term, floor);
        }
        return idf;
    }

    public List<BM25Result> search(String query, int topK) {
        return search(query, topK, 0.0);
    }

    /**
     * Search documents using BM25 scoring
     *
     * @param query          The search query
     * @param topK           Number of results to return
     * @param scoreThreshold Minimum score; 0 disables the filter
     * @return results by descending score, ties in corpus order
     */
    public List<BM25Result> search(String query, int topK, double scoreThreshold) {
        IndexSnapshot current = snapshot;
        if (current == null) {
            log.warn("BM25 index not built - call buildIndex() first");
            return List.of();
        }

        List<String> queryTokens = tokenizer.tokenize(query);
        if (queryTokens.isEmpty() || topK <= 0) {
            return List.of();
        }

        long startTime = System.currentTimeMillis();
        double[] scores = current.scores(queryTokens, k1, b);

        List<Integer> ranked = new ArrayList<>(scores.length);
        for (int i = 0; i < scores.length; i++) {
            if (scoreThreshold > 0 && scores[i] < scoreThreshold) {
                continue;
            }
            ranked.add(i);
        }
        // List.sort is stable, so equal scores keep corpus order
        ranked.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

        List<BM25Result> results = new ArrayList<>(Math.min(topK, ranked.size()));
        for (int idx : ranked.subList(0, Math.min(topK, ranked.size()))) {
            String text = current.documents().get(idx);
            results.add(new BM25Result(
                    current.corpusIds().get(idx),
                    scores[idx],
                    text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) : text,
                    current.docLengths()[idx]));
        }

        long duration = System.currentTimeMillis() - startTime;
        log.debug("BM25 search for '{}' returned {} results in {}ms", query, results.size(), duration);
        return results;
    }

    /**
     * BM25 scores for a candidate subset, used by rank fusion.
     *
     * @return candidate id to score, descending, at most topK entries
     */
    public Map<String, Double> getScoresForFusion(String query, Collection<String> candidateIds, int topK) {
        IndexSnapshot current = snapshot;
        if (current == null || candidateIds == null || candidateIds.isEmpty()) {
            return Map.of();
        }

        List<String> queryTokens = tokenizer.tokenize(query);
        if (queryTokens.isEmpty()) {
            return Map.of();
        }

        Set<String> candidates = new HashSet<>(candidateIds);
        double[] scores = current.scores(queryTokens, k1, b);

        Map<String, Double> candidateScores = new LinkedHashMap<>();
        for (int i = 0; i < scores.length; i++) {
            String id = current.corpusIds().get(i);
            if (candidates.contains(id)) {
                candidateScores.put(id, scores[i]);
            }
        }

        Map<String, Double> top = new LinkedHashMap<>();
        candidateScores.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .limit(Math.max(topK, 0))
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return top;
    }

    public boolean isBuilt() {
        return snapshot != null;
    }

    public List<String> getCorpusIds() {
        return requireSnapshot().corpusIds();
    }

    public double getAverageDocumentLength() {
        return requireSnapshot().avgDocLength();
    }

    /**
     * Drop the index; subsequent searches return nothing until the next build.
     */
    public synchronized void clearIndex() {
        snapshot = null;
        log.info("BM25 index cleared");
    }

    /**
     * Get index statistics
     */
    public IndexStats getIndexStats() {
        IndexSnapshot current = snapshot;
        return new IndexStats(
                current == null ? 0 : current.corpusIds().size(),
                current == null ? 0.0 : current.avgDocLength(),
                k1,
                b,
                epsilon,
                current != null);
    }

    private IndexSnapshot requireSnapshot() {
        IndexSnapshot current = snapshot;
        if (current == null) {
            throw new IndexNotBuiltException("BM25 index has not been built");
        }
        return current;
    }

    private record IndexSnapshot(
            List<String> corpusIds,
            List<String> documents,
            List<List<String>> tokenizedCorpus,
            List<Map<String, Integer>> termFrequencies,
            int[] docLengths,
            double avgDocLength,
            Map<String, Double> idf
    ) {

        double[] scores(List<String> queryTokens, double k1, double b) {
            double[] scores = new double[corpusIds.size()];
            for (String token : queryTokens) {
                double weight = idf.getOrDefault(token, 0.0);
                if (weight == 0.0) {
                    continue;
                }
                for (int i = 0; i < scores.length; i++) {
                    int tf = termFrequencies.get(i).getOrDefault(token, 0);
                    if (tf == 0) {
                        continue;
                    }
                    double lengthNorm = 1 - b + b * (docLengths[i] / avgDocLength);
                    scores[i] += weight * (tf * (k1 + 1)) / (tf + k1 * lengthNorm);
                }
            }
            return scores;
        }
    }

    /**
     * BM25 search result with document ID and score
     */
    public record BM25Result(String documentId, double score, String preview, int docLength) {}

    public record IndexStats(int documentCount, double averageDocLength, double k1, double b,
                             double epsilon, boolean built) {}
}
