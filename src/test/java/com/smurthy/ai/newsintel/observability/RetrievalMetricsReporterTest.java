package com.smurthy.ai.newsintel.observability;

import com.smurthy.ai.newsintel.observability.RetrievalMetrics.RetrievalMetricData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;

/**
 * Unit tests for RetrievalMetricsReporter: each run logs the window that just
 * ended and then starts a new one.
 */
@ExtendWith(MockitoExtension.class)
class RetrievalMetricsReporterTest {

    @Mock
    private RetrievalMetrics metrics;

    @Test
    @DisplayName("Should log the summary before resetting the counters")
    void testReportThenReset() {
        // Given
        RetrievalMetricsReporter reporter = new RetrievalMetricsReporter(metrics);

        // When
        reporter.reportAndReset();

        // Then
        InOrder order = inOrder(metrics);
        order.verify(metrics).logMetricsSummary();
        order.verify(metrics).resetMetrics();
    }

    @Test
    @DisplayName("Should start the next window from zero")
    void testWindowStartsEmpty() {
        // Given
        RetrievalMetrics realMetrics = new RetrievalMetrics();
        realMetrics.recordRetrieval(new RetrievalMetricData("rates", 25, true, List.of("a")));

        // When
        new RetrievalMetricsReporter(realMetrics).reportAndReset();

        // Then
        assertThat(realMetrics.getMetricsSummary().totalRetrievals()).isZero();
        assertThat(realMetrics.getMetricsSummary().topRetrievedDocuments()).isEmpty();
    }
}
