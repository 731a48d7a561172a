package io.rerankbench.api.metrics;

import java.time.Instant;

/**
 * Point-in-time view of live metrics for one scenario.
 */
public record MetricsSnapshot(
        String scenario,
        int activeWorkers,
        long successCount,
        long failureCount,
        double averageLatencyMs,
        double maxLatencyMs,
        Instant timestamp
) {}
