package io.rerankbench.api.metrics;

import java.util.Optional;

/**
 * Summary statistics for one benchmarked scenario.
 * <p>
 * Latency fields are in milliseconds and cover successful calls only. When no call succeeded
 * they are {@link Double#NaN}; see {@link #hasLatencyStats()}.
 */
public record ScenarioSummary(
        String label,
        int total,
        int succeeded,
        int failed,
        double successRate,
        double throughput,
        double meanLatencyMs,
        double p50LatencyMs,
        double p95LatencyMs,
        double p99LatencyMs,
        double maxLatencyMs,
        String sampleError
) {

    public ScenarioSummary {
        if (succeeded + failed != total) {
            throw new IllegalArgumentException(
                    "succeeded (%d) + failed (%d) != total (%d)".formatted(succeeded, failed, total));
        }
        if ((failed > 0) != (sampleError != null)) {
            throw new IllegalArgumentException("sampleError must be present exactly when calls failed");
        }
    }

    public boolean hasLatencyStats() {
        return succeeded > 0;
    }

    public Optional<String> sampleErrorMessage() {
        return Optional.ofNullable(sampleError);
    }
}
