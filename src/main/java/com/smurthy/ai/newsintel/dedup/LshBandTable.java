package com.smurthy.ai.newsintel.dedup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Banded LSH buckets over a fixed set of signatures.
 *
 * Each signature is cut into {@code bands} contiguous slices of {@code rowsPerBand} values;
 * documents whose slice is identical in at least one band share a bucket and become a
 * candidate pair. Built in one pass and never modified afterwards.
 */
public final class LshBandTable {

    private final int bands;
    private final int rowsPerBand;
    private final Map<BandKey, List<String>> buckets;

    private LshBandTable(int bands, int rowsPerBand, Map<BandKey, List<String>> buckets) {
        this.bands = bands;
        this.rowsPerBand = rowsPerBand;
        this.buckets = buckets;
    }

    /**
     * @param signatures documents to bucket, in insertion order; degenerate signatures are left out
     */
    public static LshBandTable build(Map<String, MinHashSignature> signatures, int bands, int rowsPerBand) {
        Map<BandKey, List<String>> buckets = new LinkedHashMap<>();
        for (Map.Entry<String, MinHashSignature> entry : signatures.entrySet()) {
            MinHashSignature signature = entry.getValue();
            if (signature.isDegenerate() || signature.length() < bands * rowsPerBand) {
                continue;
            }
            for (int band = 0; band < bands; band++) {
                int start = band * rowsPerBand;
                BandKey key = new BandKey(band, signature.slice(start, start + rowsPerBand));
                buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(entry.getKey());
            }
        }
        return new LshBandTable(bands, rowsPerBand, Collections.unmodifiableMap(buckets));
    }

    /**
     * Unordered, deduplicated pairs of documents that share at least one bucket.
     * Each pair is oriented so the lexicographically smaller id comes first.
     */
    public Set<CandidatePair> candidatePairs() {
        Set<CandidatePair> pairs = new LinkedHashSet<>();
        for (List<String> bucket : buckets.values()) {
            if (bucket.size() < 2) {
                continue;
            }
            for (int i = 0; i < bucket.size(); i++) {
                for (int j = i + 1; j < bucket.size(); j++) {
                    String first = bucket.get(i);
                    String second = bucket.get(j);
                    if (first.equals(second)) {
                        continue;
                    }
                    pairs.add(first.compareTo(second) < 0
                            ? new CandidatePair(first, second)
                            : new CandidatePair(second, first));
                }
            }
        }
        return pairs;
    }

    public int getBands() {
        return bands;
    }

    public int getRowsPerBand() {
        return rowsPerBand;
    }

    public int bucketCount() {
        return buckets.size();
    }

    public record CandidatePair(String firstId, String secondId) {}

    private static final class BandKey {
        private final int band;
        private final long[] slice;
        private final int hash;

        BandKey(int band, long[] slice) {
            this.band = band;
            this.slice = slice;
            this.hash = 31 * band + Arrays.hashCode(slice);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof BandKey)) {
                return false;
            }
            BandKey other = (BandKey) o;
            return band == other.band && Arrays.equals(slice, other.slice);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
