package com.smurthy.ai.newsintel.dedup;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Computes MinHash signatures over character shingles.
 *
 * Every shingle is content-hashed once (first 8 bytes of its MD5). Hash function i is the
 * affine map a_i * x + b_i (mod 2^64), with a_i and b_i derived from seed + i, followed by a
 * 64-bit finaliser so the high bits depend on the whole input. Slot i of the signature is the
 * unsigned minimum of function i over all shingles.
 */
public class MinHasher {

    public static final int DEFAULT_NUM_HASHES = 128;
    public static final int DEFAULT_SHINGLE_SIZE = 5;
    public static final long DEFAULT_SEED = 42L;

    private final int numHashes;
    private final int shingleSize;
    private final long[] multipliers;
    private final long[] increments;

    public MinHasher() {
        this(DEFAULT_NUM_HASHES, DEFAULT_SHINGLE_SIZE, DEFAULT_SEED);
    }

    public MinHasher(int numHashes, int shingleSize, long seed) {
        if (numHashes <= 0) {
            throw new IllegalArgumentException("numHashes must be positive, got " + numHashes);
        }
        if (shingleSize <= 0) {
            throw new IllegalArgumentException("shingleSize must be positive, got " + shingleSize);
        }
        this.numHashes = numHashes;
        this.shingleSize = shingleSize;
        this.multipliers = new long[numHashes];
        this.increments = new long[numHashes];

        for (int i = 0; i < numHashes; i++) {
            long hashSeed = seed + i;
            // odd multiplier keeps the affine map a bijection mod 2^64
            multipliers[i] = (hashSeed * 6364136223846793005L + 1442695040888963407L) | 1L;
            increments[i] = hashSeed * 3410719502L + 3141592653L;
        }
    }

    /**
     * Character n-gram shingles of the lowercased, stripped text.
     * Text shorter than n is a single shingle; empty text has none.
     */
    public Set<String> shingle(String text) {
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT).strip();
        if (normalized.isEmpty()) {
            return Set.of();
        }

        int[] codePoints = normalized.codePoints().toArray();
        if (codePoints.length < shingleSize) {
            return Set.of(normalized);
        }

        Set<String> shingles = new LinkedHashSet<>();
        for (int i = 0; i <= codePoints.length - shingleSize; i++) {
            shingles.add(new String(codePoints, i, shingleSize));
        }
        return shingles;
    }

    public MinHashSignature computeSignature(String text) {
        Set<String> shingles = shingle(text);
        if (shingles.isEmpty()) {
            return MinHashSignature.degenerate(numHashes);
        }

        long[] contentHashes = new long[shingles.size()];
        int n = 0;
        for (String shingle : shingles) {
            contentHashes[n++] = contentHash(shingle);
        }

        long[] signature = new long[numHashes];
        for (int i = 0; i < numHashes; i++) {
            long a = multipliers[i];
            long b = increments[i];
            long min = -1L;
            for (long x : contentHashes) {
                long h = mix(a * x + b);
                if (Long.compareUnsigned(h, min) < 0) {
                    min = h;
                }
            }
            signature[i] = min;
        }
        return MinHashSignature.of(signature);
    }

    /**
     * Fraction of signature slots that agree. The probability that two slots agree equals the
     * Jaccard similarity of the shingle sets, so this is an unbiased Monte Carlo estimate.
     *
     * @return 0.0 for signatures of different length, empty signatures, or degenerate ones
     */
    public static double estimateJaccardSimilarity(MinHashSignature first, MinHashSignature second) {
        if (first.length() != second.length() || first.length() == 0) {
            return 0.0;
        }
        if (first.isDegenerate() || second.isDegenerate()) {
            return 0.0;
        }
        return (double) first.countMatches(second) / first.length();
    }

    public int getNumHashes() {
        return numHashes;
    }

    private static long contentHash(String shingle) {
        byte[] digest = DigestUtils.md5(shingle.getBytes(StandardCharsets.UTF_8));
        return ByteBuffer.wrap(digest).getLong();
    }

    // MurmurHash3 fmix64
    private static long mix(long h) {
        h ^= h >>> 33;
        h *= 0xff51afd7ed558ccdL;
        h ^= h >>> 33;
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= h >>> 33;
        return h;
    }
}
