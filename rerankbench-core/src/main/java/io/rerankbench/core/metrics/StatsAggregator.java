package io.rerankbench.core.metrics;

import io.rerankbench.api.metrics.ScenarioSummary;
import io.rerankbench.api.runtime.CallOutcome;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Turns the outcomes of one run into a {@link ScenarioSummary}.
 * <p>
 * Latency statistics use successful calls only; failed calls count towards total, failed and success
 * rate. The computation is a pure function of its arguments.
 */
public class StatsAggregator {

    public static final int DEFAULT_MAX_SAMPLE_ERROR_LENGTH = 200;

    private final int maxSampleErrorLength;

    public StatsAggregator() {
        this(DEFAULT_MAX_SAMPLE_ERROR_LENGTH);
    }

    public StatsAggregator(int maxSampleErrorLength) {
        if (maxSampleErrorLength <= 0) {
            throw new IllegalArgumentException("Sample error length must be positive");
        }
        this.maxSampleErrorLength = maxSampleErrorLength;
    }

    public ScenarioSummary summarize(String label, List<CallOutcome> outcomes, Duration wallTime) {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(outcomes, "outcomes");
        Objects.requireNonNull(wallTime, "wallTime");

        int total = outcomes.size();
        double[] latencies = outcomes.stream()
                .filter(CallOutcome::success)
                .mapToDouble(CallOutcome::latencyMillis)
                .sorted()
                .toArray();
        int succeeded = latencies.length;
        int failed = total - succeeded;

        double successRate = total > 0 ? (double) succeeded / total : 0.0;
        double wallSeconds = wallTime.toNanos() / 1_000_000_000.0;
        double throughput = wallSeconds > 0 ? total / wallSeconds : 0.0;

        double mean = succeeded > 0 ? Arrays.stream(latencies).sum() / succeeded : Double.NaN;
        double max = succeeded > 0 ? latencies[succeeded - 1] : Double.NaN;

        return new ScenarioSummary(
                label,
                total,
                succeeded,
                failed,
                successRate,
                throughput,
                mean,
                Percentiles.nearestRank(latencies, 50),
                Percentiles.nearestRank(latencies, 95),
                Percentiles.nearestRank(latencies, 99),
                max,
                failed > 0 ? sampleError(outcomes) : null
        );
    }

    private String sampleError(List<CallOutcome> outcomes) {
        String error = outcomes.stream()
                .filter(o -> !o.success())
                .findFirst()
                .flatMap(CallOutcome::errorMessage)
                .orElse("");
        if (error.length() <= maxSampleErrorLength) {
            return error;
        }
        int end = maxSampleErrorLength;
        if (Character.isHighSurrogate(error.charAt(end - 1))) {
            end--;
        }
        return error.substring(0, end);
    }
}
