package com.smurthy.ai.newsintel.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Retrieval Observability Metrics
 *
 * Tracks hybrid search health:
 * - how often fusion ran versus the semantic-only fallback
 * - search latency
 * - which articles come back most often
 *
 * Usage:
 * 1. Call recordRetrieval() after each search
 * 2. Call getMetricsSummary() to get current statistics
 * 3. RetrievalMetricsReporter logs the summary and calls resetMetrics() every interval
 */
public class RetrievalMetrics {

    private static final Logger log = LoggerFactory.getLogger(RetrievalMetrics.class);

    private static final long SLOW_RETRIEVAL_MS = 500;

    // Counters
    private final LongAdder totalRetrievals = new LongAdder();
    private final LongAdder totalDocumentsRetrieved = new LongAdder();
    private final LongAdder totalHybridRetrievals = new LongAdder();
    private final LongAdder totalSemanticOnlyRetrievals = new LongAdder();
    private final LongAdder emptyRetrievals = new LongAdder();

    // Timing metrics (in milliseconds)
    private final LongAdder totalLatencyMs = new LongAdder();
    private final AtomicLong maxLatencyMs = new AtomicLong(0);
    private final AtomicLong minLatencyMs = new AtomicLong(Long.MAX_VALUE);

    // Document usage tracking (which articles get retrieved most?)
    private final Map<String, LongAdder> documentRetrievalCounts = new ConcurrentHashMap<>();

    /**
     * Record a retrieval operation
     */
    public void recordRetrieval(RetrievalMetricData data) {
        totalRetrievals.increment();
        totalDocumentsRetrieved.add(data.resultIds().size());

        if (data.hybrid()) {
            totalHybridRetrievals.increment();
        } else {
            totalSemanticOnlyRetrievals.increment();
        }
        if (data.resultIds().isEmpty()) {
            emptyRetrievals.increment();
        }

        totalLatencyMs.add(data.latencyMs());
        maxLatencyMs.updateAndGet(current -> Math.max(current, data.latencyMs()));
        minLatencyMs.updateAndGet(current -> Math.min(current, data.latencyMs()));

        for (String id : data.resultIds()) {
            documentRetrievalCounts.computeIfAbsent(id, k -> new LongAdder()).increment();
        }

        if (data.latencyMs() > SLOW_RETRIEVAL_MS) {
            log.warn("Slow retrieval detected: {}ms for query: {}", data.latencyMs(), data.query());
        }
    }

    /**
     * Get current metrics summary
     */
    public MetricsSummary getMetricsSummary() {
        long retrievals = totalRetrievals.sum();
        long latency = totalLatencyMs.sum();

        return new MetricsSummary(
                retrievals,
                totalDocumentsRetrieved.sum(),
                totalHybridRetrievals.sum(),
                totalSemanticOnlyRetrievals.sum(),
                emptyRetrievals.sum(),
                retrievals > 0 ? latency / retrievals : 0,
                maxLatencyMs.get(),
                minLatencyMs.get() == Long.MAX_VALUE ? 0 : minLatencyMs.get(),
                retrievals > 0 ? (double) totalDocumentsRetrieved.sum() / retrievals : 0,
                getMostRetrievedDocuments(5)
        );
    }

    /**
     * Reset all metrics (useful for hourly/daily resets)
     */
    public void resetMetrics() {
        totalRetrievals.reset();
        totalDocumentsRetrieved.reset();
        totalHybridRetrievals.reset();
        totalSemanticOnlyRetrievals.reset();
        emptyRetrievals.reset();
        totalLatencyMs.reset();
        maxLatencyMs.set(0);
        minLatencyMs.set(Long.MAX_VALUE);
        documentRetrievalCounts.clear();
        log.info("Retrieval metrics reset");
    }

    /**
     * Log current metrics summary
     */
    public void logMetricsSummary() {
        MetricsSummary summary = getMetricsSummary();
        log.info("""

                ╔═══════════════════════════════════════════════════════════════╗
                ║              HYBRID SEARCH METRICS SUMMARY                    ║
                ╠═══════════════════════════════════════════════════════════════╣
                ║ Total Searches:         {}
                ║ Articles Returned:      {}
                ║ Hybrid (fused):         {} ({} %)
                ║ Semantic-only fallback: {}
                ║ Empty Results:          {}
                ║ Avg Latency:            {} ms
                ║ Max Latency:            {} ms
                ║ Min Latency:            {} ms
                ║ Avg Results/Query:      {}
                ╚═══════════════════════════════════════════════════════════════╝
                """,
                summary.totalRetrievals(),
                summary.totalDocumentsRetrieved(),
                summary.hybridRetrievals(),
                summary.totalRetrievals() > 0 ? (summary.hybridRetrievals() * 100 / summary.totalRetrievals()) : 0,
                summary.semanticOnlyRetrievals(),
                summary.emptyRetrievals(),
                summary.averageLatencyMs(),
                summary.maxLatencyMs(),
                summary.minLatencyMs(),
                String.format("%.2f", summary.averageDocsPerQuery())
        );
    }

    private List<String> getMostRetrievedDocuments(int limit) {
        return documentRetrievalCounts.entrySet().stream()
                .sorted((e1, e2) -> Long.compare(e2.getValue().sum(), e1.getValue().sum()))
                .limit(limit)
                .map(e -> e.getKey() + " (" + e.getValue().sum() + " times)")
                .toList();
    }

    // Data classes

    public record RetrievalMetricData(
            String query,
            long latencyMs,
            boolean hybrid,
            List<String> resultIds
    ) {}

    public record MetricsSummary(
            long totalRetrievals,
            long totalDocumentsRetrieved,
            long hybridRetrievals,
            long semanticOnlyRetrievals,
            long emptyRetrievals,
            long averageLatencyMs,
            long maxLatencyMs,
            long minLatencyMs,
            double averageDocsPerQuery,
            List<String> topRetrievedDocuments
    ) {}
}
