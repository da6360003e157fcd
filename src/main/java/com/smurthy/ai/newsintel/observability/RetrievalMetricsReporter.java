package com.smurthy.ai.newsintel.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Logs the hybrid search metrics summary on a fixed interval and starts a fresh window.
 * The interval is {@code app.metrics.summary-interval} (ISO-8601 duration, hourly by default).
 */
public class RetrievalMetricsReporter {

    private static final Logger log = LoggerFactory.getLogger(RetrievalMetricsReporter.class);

    private final RetrievalMetrics metrics;

    public RetrievalMetricsReporter(RetrievalMetrics metrics) {
        this.metrics = metrics;
    }

    @Scheduled(fixedRateString = "${app.metrics.summary-interval:PT1H}",
            initialDelayString = "${app.metrics.summary-interval:PT1H}")
    public void reportAndReset() {
        log.debug("Publishing scheduled retrieval metrics summary");
        metrics.logMetricsSummary();
        metrics.resetMetrics();
    }
}
