package com.smurthy.ai.newsintel.service;

import com.smurthy.ai.newsintel.model.CorpusDocument;
import com.smurthy.ai.newsintel.service.BM25SearchService.BM25Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for BM25SearchService.
 *
 * These tests verify:
 * - Ranking of documents by keyword relevance
 * - Soft failures for empty corpora and empty queries
 * - Candidate scoring used by rank fusion
 */
class BM25SearchServiceTest {

    private BM25SearchService bm25;

    @BeforeEach
    void setUp() {
        bm25 = new BM25SearchService();
    }

    private static List<CorpusDocument> docs(String... texts) {
        return java.util.stream.IntStream.range(0, texts.length)
                .mapToObj(i -> new CorpusDocument("doc" + (i + 1), texts[i]))
                .toList();
    }

    @Test
    @DisplayName("Should rank the document without the query term lowest")
    void testSmallCorpusRanking() {
        // Given
        bm25.buildIndex(docs("the cat sat", "the dog sat", "the cat sat on the mat"));

        // When
        List<BM25Result> results = bm25.search("cat sat", 10);

        // Then
        assertThat(results).hasSize(3);
        assertThat(results.get(2).documentId()).isEqualTo("doc2");
        assertThat(results).allSatisfy(r -> assertThat(r.score()).isPositive());
        assertThat(results.get(0).score()).isGreaterThan(results.get(2).score());
    }

    @Test
    @DisplayName("Should return no results for a query without tokens")
    void testEmptyQuery() {
        // Given
        bm25.buildIndex(docs("the cat sat", "the dog sat"));

        // When / Then
        assertThat(bm25.search("", 10)).isEmpty();
        assertThat(bm25.search("   ", 10)).isEmpty();
    }

    @Test
    @DisplayName("Should never lower the score when a query term occurs more often")
    void testTermFrequencyMonotonicity() {
        // Given: two documents of equal length, one repeating the query term
        bm25.buildIndex(docs(
                "apple banana cherry",
                "apple apple cherry",
                "kiwi lemon mango",
                "peach pear plum"));

        // When
        Map<String, Double> scores = bm25.getScoresForFusion("apple", List.of("doc1", "doc2"), 10);

        // Then
        assertThat(scores.get("doc2")).isGreaterThan(scores.get("doc1"));
    }

    @Test
    @DisplayName("Should count a repeated query token again")
    void testRepeatedQueryToken() {
        // Given
        bm25.buildIndex(docs("apple banana", "kiwi lemon", "peach pear"));

        // When
        double single = bm25.search("apple", 1).get(0).score();
        double repeated = bm25.search("apple apple", 1).get(0).score();

        // Then
        assertThat(repeated).isCloseTo(2 * single, within(1e-12));
    }

    @Test
    @DisplayName("Should lowercase documents and queries alike")
    void testCaseInsensitiveMatching() {
        // Given
        bm25.buildIndex(docs("Federal Reserve raises RATES", "Local team wins final", "Storm hits coast"));

        // When
        List<BM25Result> results = bm25.search("rates", 5);

        // Then
        assertThat(results.get(0).documentId()).isEqualTo("doc1");
    }

    @Test
    @DisplayName("Should keep corpus order for equal scores")
    void testStableTies() {
        // Given
        bm25.buildIndex(docs("solar eclipse tonight", "unrelated story", "solar eclipse tonight", "another story"));

        // When
        List<BM25Result> results = bm25.search("eclipse", 2);

        // Then
        assertThat(results).extracting(BM25Result::documentId).containsExactly("doc1", "doc3");
        assertThat(results.get(0).score()).isEqualTo(results.get(1).score());
    }

    @Test
    @DisplayName("Should drop results below a positive score threshold")
    void testScoreThreshold() {
        // Given
        bm25.buildIndex(docs("election results tonight", "election", "weather report", "sports roundup"));
        List<BM25Result> all = bm25.search("election results", 10);
        double cutoff = all.get(0).score();

        // When
        List<BM25Result> filtered = bm25.search("election results", 10, cutoff);

        // Then
        assertThat(filtered).extracting(BM25Result::documentId).containsExactly("doc1");
    }

    @Test
    @DisplayName("Should leave the index unbuilt for an empty or blank corpus")
    void testEmptyCorpus() {
        // When / Then
        assertThat(bm25.buildIndex(List.<CorpusDocument>of())).isZero();
        assertThat(bm25.isBuilt()).isFalse();

        assertThat(bm25.buildIndex(docs("", "   "))).isZero();
        assertThat(bm25.isBuilt()).isFalse();
        assertThat(bm25.search("anything", 5)).isEmpty();
    }

    @Test
    @DisplayName("Should drop the previous index when rebuilt with nothing")
    void testRebuildWithEmptyCorpusDropsIndex() {
        // Given
        bm25.buildIndex(docs("markets rally", "markets fall"));
        assertThat(bm25.isBuilt()).isTrue();

        // When
        bm25.buildIndex(List.<CorpusDocument>of());

        // Then
        assertThat(bm25.isBuilt()).isFalse();
        assertThat(bm25.getIndexStats().documentCount()).isZero();
    }

    @Test
    @DisplayName("Should throw when reading internals of an unbuilt index")
    void testUnbuiltInternals() {
        assertThatThrownBy(() -> bm25.getCorpusIds()).isInstanceOf(IndexNotBuiltException.class);
        assertThatThrownBy(() -> bm25.getAverageDocumentLength()).isInstanceOf(IndexNotBuiltException.class);
        assertThat(bm25.search("query", 5)).isEmpty();
        assertThat(bm25.getScoresForFusion("query", List.of("doc1"), 5)).isEmpty();
    }

    @Test
    @DisplayName("Should produce identical results when rebuilt with the same corpus")
    void testIdempotentRebuild() {
        // Given
        List<CorpusDocument> corpus = docs("rates rise again", "rates steady", "tech stocks slide");
        bm25.buildIndex(corpus);
        List<BM25Result> first = bm25.search("rates rise", 3);

        // When
        bm25.buildIndex(corpus);
        List<BM25Result> second = bm25.search("rates rise", 3);

        // Then
        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should score only the requested candidates, best first")
    void testScoresForFusion() {
        // Given
        bm25.buildIndex(docs("oil prices climb", "oil oil prices", "football final", "gold prices slip"));

        // When
        Map<String, Double> scores = bm25.getScoresForFusion("oil prices", List.of("doc1", "doc2", "doc3"), 2);

        // Then
        assertThat(scores).hasSize(2).containsOnlyKeys("doc1", "doc2");
        assertThat(scores.keySet()).containsExactly("doc2", "doc1");
    }

    @Test
    @DisplayName("Should build from map records and skip records without an id")
    void testBuildFromRecords() {
        // Given
        Map<String, Object> noId = new HashMap<>();
        noId.put("content", "orphan text");
        List<Map<String, Object>> records = List.of(
                Map.of("id", "a", "content", "central bank decision"),
                noId,
                Map.of("id", "b", "content", "bank holiday weekend"));

        // When
        int count = bm25.buildIndex(records, "id", "content");

        // Then
        assertThat(count).isEqualTo(2);
        assertThat(bm25.getCorpusIds()).containsExactly("a", "b");
        assertThat(bm25.getAverageDocumentLength()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should report index statistics and clear the index")
    void testStatsAndClear() {
        // Given
        bm25.buildIndex(docs("one two", "three four five six"));

        // Then
        BM25SearchService.IndexStats stats = bm25.getIndexStats();
        assertThat(stats.built()).isTrue();
        assertThat(stats.documentCount()).isEqualTo(2);
        assertThat(stats.averageDocLength()).isEqualTo(3.0);
        assertThat(stats.k1()).isEqualTo(BM25SearchService.DEFAULT_K1);

        // When
        bm25.clearIndex();

        // Then
        assertThat(bm25.isBuilt()).isFalse();
    }

    @Test
    @DisplayName("Should truncate previews to 200 characters")
    void testPreviewLength() {
        // Given
        String longText = "headline " + "word ".repeat(100);
        bm25.buildIndex(docs(longText, "short other"));

        // When
        BM25Result result = bm25.search("headline", 1).get(0);

        // Then
        assertThat(result.preview()).hasSize(200);
        assertThat(result.docLength()).isEqualTo(101);
    }

    @Test
    @DisplayName("Should reject invalid parameters")
    void testInvalidParameters() {
        assertThatThrownBy(() -> new BM25SearchService(-1, 0.7, 0.25)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BM25SearchService(1.6, 1.5, 0.25)).isInstanceOf(IllegalArgumentException.class);
    }
}
