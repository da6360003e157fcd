package com.smurthy.ai.newsintel.clustering;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClusterKeywordExtractorTest {

    private final ClusterKeywordExtractor extractor = new ClusterKeywordExtractor();

    @Test
    @DisplayName("Should pick the most frequent content words, ties in first-seen order")
    void testExtractKeywords() {
        // Given
        List<String> texts = List.of(
                "Fed raises interest rates",
                "Interest rates climb as Fed acts",
                "Markets react to Fed rates");

        // When
        List<String> keywords = extractor.extractKeywords(texts);

        // Then
        assertThat(keywords).containsExactly("fed", "rates", "interest");
        assertThat(extractor.label(keywords)).isEqualTo("Fed Rates Interest");
    }

    @Test
    @DisplayName("Should strip edge punctuation and skip stop words, numbers and short words")
    void testFiltering() {
        // Given
        List<String> texts = List.of(
                "(Breaking) The storm's path: 2024 forecast, says the NEWS desk!",
                "Breaking: storm warning issued... by officials");

        // When
        List<String> keywords = extractor.extractKeywords(texts);

        // Then
        assertThat(keywords).containsExactly("breaking", "path", "forecast");
    }

    @Test
    @DisplayName("Should return no label when nothing qualifies")
    void testNoKeywords() {
        List<String> keywords = extractor.extractKeywords(List.of("the and of", "2024"));

        assertThat(keywords).isEmpty();
        assertThat(extractor.label(keywords)).isNull();
    }
}
