package com.smurthy.ai.newsintel.clustering;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.smurthy.ai.newsintel.model.CorpusDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for TopicSnapshotService.
 */
class TopicSnapshotServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private TopicSnapshotService service;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
        TopicClusterer clusterer = new TopicClusterer(ClusteringOptions.defaults().withMinClusterSize(2));
        service = new TopicSnapshotService(clusterer, new ClusterKeywordExtractor(), objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static List<CorpusDocument> documents() {
        return List.of(
                new CorpusDocument("a", "Wildfire spreads near coastal town"),
                new CorpusDocument("b", "Coastal wildfire forces evacuations"),
                new CorpusDocument("c", "Firefighters battle coastal wildfire"),
                new CorpusDocument("d", "Chess champion retains title"));
    }

    private static List<float[]> embeddings() {
        return List.of(new float[]{0f, 0f}, new float[]{0.1f, 0f}, new float[]{0f, 0.1f}, new float[]{10f, 10f});
    }

    @Test
    @DisplayName("Should build a labelled snapshot for a window")
    void testBuildSnapshot() {
        // When
        TopicSnapshot snapshot = service.buildSnapshot("1d", documents(), embeddings());

        // Then
        assertThat(snapshot.window()).isEqualTo("1d");
        assertThat(snapshot.computedAt()).isEqualTo(NOW);
        assertThat(snapshot.clusterCount()).isEqualTo(1);
        assertThat(snapshot.noiseCount()).isEqualTo(1);
        assertThat(snapshot.backend()).isEqualTo("hdbscan");
        assertThat(snapshot.assignments()).containsEntry("a", 0).containsEntry("d", -1);

        TopicSnapshot.TopicCluster cluster = snapshot.clusters().get(0);
        assertThat(cluster.articleIds()).containsExactly("a", "b", "c");
        assertThat(cluster.keywords()).containsExactly("wildfire", "coastal", "spreads");
        assertThat(cluster.label()).isEqualTo("Wildfire Coastal Spreads");
    }

    @Test
    @DisplayName("Should serialise a snapshot to JSON")
    void testToJson() {
        // Given
        TopicSnapshot snapshot = service.buildSnapshot("1w", documents(), embeddings());

        // When
        String json = service.toJson(snapshot);

        // Then
        assertThat(json)
                .contains("\"window\":\"1w\"")
                .contains("\"computedAt\":\"2026-01-15T10:00:00Z\"")
                .contains("\"label\":\"Wildfire Coastal Spreads\"");
    }

    @Test
    @DisplayName("Should reject unknown windows and misaligned inputs")
    void testValidation() {
        assertThatThrownBy(() -> service.buildSnapshot("2h", documents(), embeddings()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.buildSnapshot("1m", documents(), embeddings().subList(0, 2)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
