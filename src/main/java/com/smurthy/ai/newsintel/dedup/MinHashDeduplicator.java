package com.smurthy.ai.newsintel.dedup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Near-duplicate detection using MinHash signatures and banded LSH.
 *
 * Usage:
 * <pre>
 *   MinHashDeduplicator dedup = new MinHashDeduplicator();
 *   dedup.addDocument("doc1", "article text...");
 *   dedup.addDocument("doc2", "similar article...");
 *   List&lt;DuplicatePair&gt; duplicates = dedup.findDuplicatesLsh(null);
 * </pre>
 *
 * {@link #findDuplicates} compares every pair and is exact with respect to the signatures;
 * {@link #findDuplicatesLsh} only verifies pairs that collide in some band, trading a small
 * chance of missing a pair for sub-quadratic running time. More bands means more candidates,
 * fewer misses and more verification work.
 */
public class MinHashDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(MinHashDeduplicator.class);

    public static final double DEFAULT_THRESHOLD = 0.85;
    public static final int DEFAULT_BANDS = 8;
    public static final int DEFAULT_BATCH_SIZE = 100;

    private static final Comparator<DuplicatePair> BY_SIMILARITY_DESC =
            Comparator.comparingDouble(DuplicatePair::similarity).reversed();

    private final MinHasher minHasher;
    private final double threshold;
    private final int bands;
    private final int rowsPerBand;
    private final int batchSize;

    private final Map<String, MinHashSignature> signatures = new LinkedHashMap<>();
    private LshBandTable bandTable;

    public MinHashDeduplicator() {
        this(MinHasher.DEFAULT_NUM_HASHES, DEFAULT_THRESHOLD, DEFAULT_BANDS, MinHasher.DEFAULT_SEED);
    }

    public MinHashDeduplicator(int numHashes, double threshold, int bands, long seed) {
        this(new MinHasher(numHashes, MinHasher.DEFAULT_SHINGLE_SIZE, seed), threshold, bands, DEFAULT_BATCH_SIZE);
    }

    public MinHashDeduplicator(MinHasher minHasher, double threshold, int bands, int batchSize) {
        int numHashes = minHasher.getNumHashes();
        if (bands <= 0 || bands > numHashes || numHashes % bands != 0) {
            throw new IllegalArgumentException(
                    "bands must divide numHashes evenly (numHashes=" + numHashes + ", bands=" + bands + ")");
        }
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("threshold must be within [0, 1], got " + threshold);
        }
        this.minHasher = minHasher;
        this.threshold = threshold;
        this.bands = bands;
        this.rowsPerBand = numHashes / bands;
        this.batchSize = Math.max(batchSize, 1);
    }

    /**
     * Add a document to the index, replacing any earlier signature for the same id.
     */
    public synchronized void addDocument(String docId, String text) {
        signatures.put(docId, minHasher.computeSignature(text));
        bandTable = null;
        log.debug("Added document {} with MinHash signature", docId);
    }

    /**
     * Add multiple documents
     *
     * @param documents doc id to text
     * @return number of documents added
     */
    public synchronized int addDocumentsBatch(Map<String, String> documents) {
        int count = 0;
        for (Map.Entry<String, String> entry : documents.entrySet()) {
            signatures.put(entry.getKey(), minHasher.computeSignature(entry.getValue()));
            count++;
            if (count % batchSize == 0) {
                log.debug("Processed {}/{} documents", count, documents.size());
            }
        }
        bandTable = null;

        log.info("Added {} documents to MinHash index", count);
        return count;
    }

    /**
     * Find near-duplicate pairs by comparing every pair of signatures.
     *
     * @param docIds    documents to check, or null for all
     * @param threshold similarity override, or null for the configured threshold
     * @return pairs at or above the threshold, highest similarity first
     */
    public List<DuplicatePair> findDuplicates(Collection<String> docIds, Double threshold) {
        double minSimilarity = threshold != null ? threshold : this.threshold;
        List<String> ids = new ArrayList<>(resolveIds(docIds));

        List<DuplicatePair> duplicates = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            MinHashSignature first = signatures.get(ids.get(i));
            if (first == null) {
                continue;
            }
            for (int j = i + 1; j < ids.size(); j++) {
                MinHashSignature second = signatures.get(ids.get(j));
                if (second == null) {
                    continue;
                }
                double similarity = MinHasher.estimateJaccardSimilarity(first, second);
                if (similarity >= minSimilarity) {
                    duplicates.add(new DuplicatePair(ids.get(i), ids.get(j), similarity));
                }
            }
        }

        duplicates.sort(BY_SIMILARITY_DESC);

        log.info("Found {} duplicate pairs above threshold {}", duplicates.size(), minSimilarity);
        return duplicates;
    }

    /**
     * Find near-duplicate pairs through LSH buckets, verifying every candidate pair
     * with the full-signature estimate.
     *
     * @param docIds documents to check, or null for all
     * @return pairs at or above the configured threshold, highest similarity first, then by id
     */
    public List<DuplicatePair> findDuplicatesLsh(Collection<String> docIds) {
        LshBandTable table;
        if (docIds == null) {
            table = bandTable();
        } else {
            Map<String, MinHashSignature> subset = new LinkedHashMap<>();
            for (String id : resolveIds(docIds)) {
                MinHashSignature signature = signatures.get(id);
                if (signature != null) {
                    subset.put(id, signature);
                }
            }
            table = LshBandTable.build(subset, bands, rowsPerBand);
        }

        Set<LshBandTable.CandidatePair> candidates = table.candidatePairs();

        List<DuplicatePair> duplicates = new ArrayList<>();
        for (LshBandTable.CandidatePair pair : candidates) {
            double similarity = MinHasher.estimateJaccardSimilarity(
                    signatures.get(pair.firstId()), signatures.get(pair.secondId()));
            if (similarity >= threshold) {
                duplicates.add(new DuplicatePair(pair.firstId(), pair.secondId(), similarity));
            }
        }

        duplicates.sort(BY_SIMILARITY_DESC
                .thenComparing(DuplicatePair::firstId)
                .thenComparing(DuplicatePair::secondId));

        log.info("LSH found {} duplicate pairs from {} candidates", duplicates.size(), candidates.size());
        return duplicates;
    }

    /**
     * Get MinHash signature for a document, or null if it was never added.
     */
    public synchronized MinHashSignature getSignature(String docId) {
        return signatures.get(docId);
    }

    public synchronized DedupStats getStats() {
        return new DedupStats(signatures.size(), minHasher.getNumHashes(), threshold, bands, rowsPerBand);
    }

    /**
     * Clear all documents from the index.
     */
    public synchronized void clear() {
        signatures.clear();
        bandTable = null;
    }

    public double getThreshold() {
        return threshold;
    }

    private synchronized LshBandTable bandTable() {
        if (bandTable == null) {
            bandTable = LshBandTable.build(signatures, bands, rowsPerBand);
            log.debug("Rebuilt LSH band table: {} buckets over {} documents", bandTable.bucketCount(), signatures.size());
        }
        return bandTable;
    }

    private synchronized Set<String> resolveIds(Collection<String> docIds) {
        return docIds == null ? new LinkedHashSet<>(signatures.keySet()) : new LinkedHashSet<>(docIds);
    }

    /**
     * A pair of near-duplicate documents and their estimated Jaccard similarity.
     */
    public record DuplicatePair(String firstId, String secondId, double similarity) {}

    public record DedupStats(int documentCount, int numHashes, double threshold, int bands, int rowsPerBand) {}
}
