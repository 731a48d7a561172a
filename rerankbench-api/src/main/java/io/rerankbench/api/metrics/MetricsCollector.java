package io.rerankbench.api.metrics;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Abstraction for live metrics collection during a run.
 * Observational only: summaries are computed from the recorded outcomes, not from these metrics.
 */
public interface MetricsCollector {

    /**
     * Record a successful call.
     *
     * @param scenario scenario label
     * @param latency  time taken by the call
     */
    void recordSuccess(String scenario, Duration latency);

    /**
     * Record a failed call.
     *
     * @param scenario scenario label
     * @param latency  time taken before the failure
     * @param error    textual description of the failure
     */
    void recordFailure(String scenario, Duration latency, String error);

    /**
     * Record how many workers of a scenario are currently running.
     */
    void recordActiveWorkers(String scenario, int count);

    /**
     * @return one snapshot per scenario seen so far
     */
    List<MetricsSnapshot> snapshot();

    /**
     * Register a listener that receives snapshots at the configured interval.
     */
    void onSnapshot(Consumer<List<MetricsSnapshot>> listener);

    /**
     * Start periodic snapshot publication.
     */
    void start(Duration interval);

    /**
     * Stop periodic snapshot publication.
     */
    void stop();
}
