package io.rerankbench.api.environment;

import io.rerankbench.api.client.ClientConfig;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * Configuration for a benchmark run.
 * Controls concurrency levels, calls per worker, warm-up, client settings and output files.
 */
public final class BenchmarkConfig {

    private int[] concurrencyLevels = {50, 100, 150};
    private int callsPerWorker = 5;
    private int warmupCalls = 2;
    private ClientConfig clientConfig = ClientConfig.defaults();
    private String logFilePath = null; // null = no JSON result file
    private String reportPath = null; // null = no CSV report
    private Duration metricsInterval = Duration.ofSeconds(1);
    private ThreadFactory threadFactory = null;

    private BenchmarkConfig() {}

    public static BenchmarkConfig create() {
        return new BenchmarkConfig();
    }

    /**
     * Concurrency levels to benchmark, in order. Each level is one scenario per operation.
     */
    public BenchmarkConfig concurrencyLevels(int... levels) {
        Objects.requireNonNull(levels, "levels");
        if (levels.length == 0) {
            throw new IllegalArgumentException("At least one concurrency level is required");
        }
        for (int level : levels) {
            if (level <= 0) {
                throw new IllegalArgumentException("Concurrency levels must be positive, got " + level);
            }
        }
        this.concurrencyLevels = levels.clone();
        return this;
    }

    public BenchmarkConfig callsPerWorker(int callsPerWorker) {
        if (callsPerWorker <= 0) {
            throw new IllegalArgumentException("Calls per worker must be positive");
        }
        this.callsPerWorker = callsPerWorker;
        return this;
    }

    /**
     * Number of serial warm-up rounds before the timed runs. Zero disables warm-up.
     */
    public BenchmarkConfig warmupCalls(int warmupCalls) {
        if (warmupCalls < 0) {
            throw new IllegalArgumentException("Warm-up calls must not be negative");
        }
        this.warmupCalls = warmupCalls;
        return this;
    }

    public BenchmarkConfig clientConfig(ClientConfig clientConfig) {
        this.clientConfig = Objects.requireNonNull(clientConfig, "clientConfig");
        return this;
    }

    public BenchmarkConfig endpoint(String endpoint) {
        this.clientConfig = clientConfig.withEndpoint(endpoint);
        return this;
    }

    public BenchmarkConfig timeout(Duration timeout) {
        this.clientConfig = clientConfig.withTimeout(timeout);
        return this;
    }

    public BenchmarkConfig logFilePath(String logFilePath) {
        this.logFilePath = logFilePath;
        return this;
    }

    /**
     * Set the path for a CSV summary report written after the benchmark.
     * If not set, no report is generated.
     */
    public BenchmarkConfig reportPath(String reportPath) {
        this.reportPath = reportPath;
        return this;
    }

    public BenchmarkConfig metricsInterval(Duration metricsInterval) {
        Objects.requireNonNull(metricsInterval, "metricsInterval");
        if (metricsInterval.isZero() || metricsInterval.isNegative()) {
            throw new IllegalArgumentException("Metrics interval must be positive");
        }
        this.metricsInterval = metricsInterval;
        return this;
    }

    /**
     * Provide a custom thread factory for worker threads.
     */
    public BenchmarkConfig threadFactory(ThreadFactory threadFactory) {
        this.threadFactory = threadFactory;
        return this;
    }

    public int[] concurrencyLevels() { return concurrencyLevels.clone(); }
    public int callsPerWorker() { return callsPerWorker; }
    public int warmupCalls() { return warmupCalls; }
    public ClientConfig clientConfig() { return clientConfig; }
    public String logFilePath() { return logFilePath; }
    public String reportPath() { return reportPath; }
    public Duration metricsInterval() { return metricsInterval; }
    public ThreadFactory threadFactory() { return threadFactory; }

    @Override
    public String toString() {
        return "BenchmarkConfig{levels=" + Arrays.toString(concurrencyLevels)
                + ", callsPerWorker=" + callsPerWorker
                + ", warmupCalls=" + warmupCalls
                + ", client=" + clientConfig + "}";
    }
}
