package io.rerankbench.api.runtime;

import io.rerankbench.api.metrics.ScenarioSummary;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Complete result of a benchmark: one summary per (operation, concurrency level) scenario,
 * in execution order.
 */
public record BenchmarkResult(
        Instant startTime,
        Instant endTime,
        Duration totalDuration,
        List<ScenarioSummary> summaries
) {

    public BenchmarkResult {
        summaries = List.copyOf(summaries);
    }
}
