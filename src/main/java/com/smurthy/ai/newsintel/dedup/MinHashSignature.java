package com.smurthy.ai.newsintel.dedup;

import java.util.Arrays;

/**
 * Immutable MinHash signature: one minimum hash per hash function, compared as unsigned 64-bit values.
 *
 * A signature computed from an empty shingle set is all-maximum and marked degenerate;
 * it never matches anything, another degenerate signature included.
 */
public final class MinHashSignature {

    private final long[] values;
    private final boolean degenerate;

    private MinHashSignature(long[] values, boolean degenerate) {
        this.values = values;
        this.degenerate = degenerate;
    }

    public static MinHashSignature of(long[] values) {
        return new MinHashSignature(values.clone(), false);
    }

    static MinHashSignature degenerate(int length) {
        long[] values = new long[length];
        Arrays.fill(values, -1L); // 2^64 - 1 unsigned
        return new MinHashSignature(values, true);
    }

    public int length() {
        return values.length;
    }

    public long get(int index) {
        return values[index];
    }

    public boolean isDegenerate() {
        return degenerate;
    }

    public long[] toArray() {
        return values.clone();
    }

    long[] slice(int from, int to) {
        return Arrays.copyOfRange(values, from, to);
    }

    int countMatches(MinHashSignature other) {
        int matches = 0;
        for (int i = 0; i < values.length; i++) {
            if (values[i] == other.values[i]) {
                matches++;
            }
        }
        return matches;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MinHashSignature)) {
            return false;
        }
        MinHashSignature that = (MinHashSignature) o;
        return degenerate == that.degenerate && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Boolean.hashCode(degenerate);
    }

    @Override
    public String toString() {
        return "MinHashSignature[length=" + values.length + (degenerate ? ", degenerate" : "") + "]";
    }
}
