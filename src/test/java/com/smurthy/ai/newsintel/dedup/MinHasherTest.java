package com.smurthy.ai.newsintel.dedup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for MinHasher.
 *
 * These tests verify:
 * - Character shingling of normalised text
 * - Self-similarity and symmetry of the Jaccard estimate
 * - Degenerate signatures for empty text
 */
class MinHasherTest {

    private final MinHasher minHasher = new MinHasher();

    @Test
    @DisplayName("Should shingle lowercased, stripped text into 5-grams")
    void testShingles() {
        assertThat(minHasher.shingle("  ABCDEF ")).containsExactly("abcde", "bcdef");
        assertThat(minHasher.shingle("Hi")).containsExactly("hi");
        assertThat(minHasher.shingle("   ")).isEmpty();
        assertThat(minHasher.shingle(null)).isEmpty();
    }

    @Test
    @DisplayName("Should give a signature full similarity with itself")
    void testSelfSimilarity() {
        // Given
        MinHashSignature signature = minHasher.computeSignature(ArticleFixtures.article(1, 200));

        // When / Then
        assertThat(signature.length()).isEqualTo(MinHasher.DEFAULT_NUM_HASHES);
        assertThat(signature.isDegenerate()).isFalse();
        assertThat(MinHasher.estimateJaccardSimilarity(signature, signature)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should estimate similarity symmetrically")
    void testSymmetry() {
        // Given
        String base = ArticleFixtures.article(2, 150);
        MinHashSignature a = minHasher.computeSignature(base);
        MinHashSignature b = minHasher.computeSignature(base.substring(0, base.length() / 2)
                + ArticleFixtures.article(3, 75));

        // When
        double ab = MinHasher.estimateJaccardSimilarity(a, b);
        double ba = MinHasher.estimateJaccardSimilarity(b, a);

        // Then
        assertThat(ab).isEqualTo(ba);
        assertThat(ab).isBetween(0.05, 0.95);
    }

    @Test
    @DisplayName("Should compute identical signatures for the same seed")
    void testDeterminism() {
        String text = ArticleFixtures.article(4, 100);
        assertThat(new MinHasher(64, 5, 7).computeSignature(text))
                .isEqualTo(new MinHasher(64, 5, 7).computeSignature(text));
        assertThat(new MinHasher(64, 5, 7).computeSignature(text))
                .isNotEqualTo(new MinHasher(64, 5, 8).computeSignature(text));
    }

    @Test
    @DisplayName("Should treat empty text as dissimilar to everything, itself included")
    void testDegenerateSignature() {
        // Given
        MinHashSignature empty = minHasher.computeSignature("");
        MinHashSignature alsoEmpty = minHasher.computeSignature("   ");

        // Then
        assertThat(empty.isDegenerate()).isTrue();
        assertThat(empty.get(0)).isEqualTo(-1L);
        assertThat(MinHasher.estimateJaccardSimilarity(empty, alsoEmpty)).isZero();
        assertThat(MinHasher.estimateJaccardSimilarity(empty, minHasher.computeSignature("text"))).isZero();
    }

    @Test
    @DisplayName("Should define signatures of different lengths as dissimilar")
    void testDifferentLengths() {
        String text = ArticleFixtures.article(5, 50);
        MinHashSignature long128 = new MinHasher(128, 5, 42).computeSignature(text);
        MinHashSignature short64 = new MinHasher(64, 5, 42).computeSignature(text);

        assertThat(MinHasher.estimateJaccardSimilarity(long128, short64)).isZero();
    }

    @Test
    @DisplayName("Should treat text shorter than a shingle as one shingle")
    void testShortText() {
        MinHashSignature a = minHasher.computeSignature("Fed");
        MinHashSignature b = minHasher.computeSignature(" fed ");
        assertThat(MinHasher.estimateJaccardSimilarity(a, b)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject invalid parameters")
    void testInvalidParameters() {
        assertThatThrownBy(() -> new MinHasher(0, 5, 42)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MinHasher(128, 0, 42)).isInstanceOf(IllegalArgumentException.class);
    }
}
