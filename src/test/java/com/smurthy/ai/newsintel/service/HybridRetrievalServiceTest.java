package com.smurthy.ai.newsintel.service;

import com.smurthy.ai.newsintel.model.CorpusDocument;
import com.smurthy.ai.newsintel.observability.RetrievalMetrics;
import com.smurthy.ai.newsintel.retrieval.SemanticRanker;
import com.smurthy.ai.newsintel.service.HybridRetrievalService.HybridSearchResult;
import com.smurthy.ai.newsintel.service.HybridRetrievalService.HybridStats;
import com.smurthy.ai.newsintel.service.RankFusion.FusedResult;
import com.smurthy.ai.newsintel.service.RankFusion.RankedItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for HybridRetrievalService.
 *
 * These tests verify:
 * - Fusion of BM25 and semantic rankings
 * - Semantic-only fallback while the keyword index is unbuilt
 * - Metrics recording for both paths
 * - Statistics before and after indexing
 */
@ExtendWith(MockitoExtension.class)
class HybridRetrievalServiceTest {

    @Mock
    private SemanticRanker semanticRanker;

    private BM25SearchService bm25;
    private RetrievalMetrics metrics;
    private HybridRetrievalService service;

    @BeforeEach
    void setUp() {
        bm25 = new BM25SearchService();
        metrics = new RetrievalMetrics();
        service = new HybridRetrievalService(bm25, semanticRanker, new RankFusion(), metrics, 20, FusionMethod.RRF);
        lenient().when(semanticRanker.getName()).thenReturn("mock");
    }

    private void indexCorpus() {
        service.indexDocuments(List.of(
                new CorpusDocument("a1", "central bank raises interest rates"),
                new CorpusDocument("a2", "local football club wins cup"),
                new CorpusDocument("a3", "interest rates expected to fall next year"),
                new CorpusDocument("a4", "storm warning for the coast")));
    }

    @Test
    @DisplayName("Should fuse keyword and semantic rankings")
    void testHybridSearch() {
        // Given
        indexCorpus();
        when(semanticRanker.rank(eq("interest rates"), eq(20))).thenReturn(List.of(
                new RankedItem("a3", 0.91),
                new RankedItem("a5", 0.80)));

        // When
        HybridSearchResult result = service.search("interest rates", 3);

        // Then
        assertThat(result.semanticOnlyFallback()).isFalse();
        assertThat(result.results()).hasSize(3);
        assertThat(result.results().get(0).id()).isEqualTo("a3");
        assertThat(result.results().get(0).inKeyword()).isTrue();
        assertThat(result.results().get(0).inSemantic()).isTrue();
        assertThat(result.semanticResultCount()).isEqualTo(2);
        assertThat(result.performanceMetrics()).containsKeys("sparseTime", "denseTime", "fusionTime");
        assertThat(metrics.getMetricsSummary().hybridRetrievals()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fall back to semantic ranking when the index is not built")
    void testSemanticOnlyFallback() {
        // Given
        when(semanticRanker.rank(anyString(), anyInt())).thenReturn(List.of(
                new RankedItem("a9", 0.7),
                new RankedItem("a8", 0.6)));

        // When
        HybridSearchResult result = service.search("anything", 5);

        // Then
        assertThat(result.semanticOnlyFallback()).isTrue();
        assertThat(result.keywordResultCount()).isZero();
        assertThat(result.results()).extracting(FusedResult::id).containsExactly("a9", "a8");
        assertThat(result.results().get(0).fusedScore()).isEqualTo(0.7);
        assertThat(result.results().get(0).bm25Score()).isZero();
        verify(semanticRanker).rank("anything", 5);
        assertThat(metrics.getMetricsSummary().semanticOnlyRetrievals()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should rank keyword hits when semantic ranking is unavailable")
    void testUnavailableSemanticRanker() {
        // Given
        service = new HybridRetrievalService(bm25, SemanticRanker.unavailable(), new RankFusion(), metrics, 20,
                FusionMethod.WEIGHTED);
        indexCorpus();

        // When
        HybridSearchResult result = service.search("storm coast", 2);

        // Then
        assertThat(result.results()).isNotEmpty();
        assertThat(result.results().get(0).id()).isEqualTo("a4");
        assertThat(result.semanticResultCount()).isZero();
    }

    @Test
    @DisplayName("Should combine scores within a filtered candidate set")
    void testSearchWithinCandidates() {
        // Given
        indexCorpus();
        List<RankedItem> hits = List.of(
                new RankedItem("a2", 0.9),
                new RankedItem("a1", 0.5),
                new RankedItem("a3", 0.1));

        // When
        List<FusedResult> results = service.searchWithinCandidates("interest rates", hits, 2);

        // Then
        assertThat(results).hasSize(2);
        assertThat(results).extracting(FusedResult::id).doesNotContain("a4");
        assertThat(results.get(0).fusedScore()).isGreaterThanOrEqualTo(results.get(1).fusedScore());
        assertThat(service.searchWithinCandidates("interest rates", List.of(), 5)).isEmpty();
    }

    @Test
    @DisplayName("Should report index state and fusion settings")
    void testStats() {
        // Given
        HybridStats before = service.getStats();
        indexCorpus();

        // When
        HybridStats after = service.getStats();

        // Then
        assertThat(before.bm25Built()).isFalse();
        assertThat(before.corpusSize()).isZero();
        assertThat(before.bm25Stats()).isNull();

        assertThat(after.bm25Built()).isTrue();
        assertThat(after.corpusSize()).isEqualTo(4);
        assertThat(after.fusionMethod()).isEqualTo(FusionMethod.RRF);
        assertThat(after.rrfK()).isEqualTo(60);
        assertThat(after.bm25Weight()).isEqualTo(0.5);
        assertThat(after.vectorWeight()).isEqualTo(0.5);
        assertThat(after.semanticRanker()).isEqualTo("mock");
        assertThat(after.bm25Stats().documentCount()).isEqualTo(4);
        assertThat(after.bm25Stats().averageDocLength()).isEqualTo(bm25.getAverageDocumentLength());
    }
}
