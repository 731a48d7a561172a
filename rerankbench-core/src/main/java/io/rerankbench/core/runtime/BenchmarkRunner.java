package io.rerankbench.core.runtime;

import io.micrometer.core.instrument.Clock;
import io.rerankbench.api.client.ClientFactory;
import io.rerankbench.api.client.ClientHandle;
import io.rerankbench.api.client.HandleCreationException;
import io.rerankbench.api.environment.BenchmarkConfig;
import io.rerankbench.api.log.LogWriter;
import io.rerankbench.api.metrics.MetricsCollector;
import io.rerankbench.api.metrics.ScenarioSummary;
import io.rerankbench.api.operation.OperationDefinition;
import io.rerankbench.api.runtime.BenchmarkResult;
import io.rerankbench.api.runtime.LoadResult;
import io.rerankbench.core.log.JsonLogWriter;
import io.rerankbench.core.metrics.MicrometerMetricsCollector;
import io.rerankbench.core.metrics.StatsAggregator;
import io.rerankbench.core.pool.ClientPool;
import io.rerankbench.core.report.CsvReportGenerator;
import io.rerankbench.core.report.TextReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs every operation at every configured concurrency level and reports one summary per scenario.
 * <p>
 * Usage:
 * <pre>{@code
 * var config = BenchmarkConfig.create()
 *     .concurrencyLevels(50, 100, 150)
 *     .callsPerWorker(5)
 *     .warmupCalls(2)
 *     .endpoint("http://127.0.0.1:11438/v1");
 *
 * var operations = new ScoringOperations(new ScoringClient(), ScoringOperations.DEFAULT_QUERY,
 *         ScoringOperations.sampleDocuments(16));
 *
 * try (var runner = new BenchmarkRunner<>(config, new HttpClientFactory())) {
 *     BenchmarkResult result = runner.run(operations.standard(10, ScoringOperations.DEFAULT_MODEL));
 * }
 * }</pre>
 *
 * @param <H> the handle type the operations use
 */
public class BenchmarkRunner<H extends ClientHandle> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkRunner.class);

    private final BenchmarkConfig config;
    private final ClientPool<H> pool;
    private final MetricsCollector metricsCollector;
    private final TextReporter reporter;
    private final StatsAggregator aggregator = new StatsAggregator();
    private final LoadGenerator<H> loadGenerator;

    public BenchmarkRunner(BenchmarkConfig config, ClientFactory<? extends H> factory) {
        this(config, new ClientPool<>(factory), new MicrometerMetricsCollector(), new TextReporter(), Clock.SYSTEM);
    }

    public BenchmarkRunner(BenchmarkConfig config, ClientPool<H> pool, MetricsCollector metricsCollector,
                           TextReporter reporter, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.metricsCollector = Objects.requireNonNull(metricsCollector, "metricsCollector");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.loadGenerator = new LoadGenerator<>(pool, config.clientConfig(), metricsCollector, clock,
                config.threadFactory());
        metricsCollector.onSnapshot(snapshots -> snapshots.forEach(s -> log.debug("Live metrics: {}", s)));
    }

    public BenchmarkResult run(List<OperationDefinition<H>> operations) {
        if (operations.isEmpty()) {
            throw new IllegalArgumentException("At least one operation is required");
        }

        Instant startTime = Instant.now();
        log.info("Starting benchmark: {} against {}", config, operations.stream().map(OperationDefinition::name).toList());

        metricsCollector.start(config.metricsInterval());

        LogWriter logWriter = config.logFilePath() != null ? new JsonLogWriter(config.logFilePath()) : null;
        List<ScenarioSummary> summaries = new ArrayList<>();
        try {
            warmUp(operations);

            int nameWidth = operations.stream().mapToInt(op -> op.name().length()).max().orElse(0);
            for (int concurrency : config.concurrencyLevels()) {
                long total = (long) concurrency * config.callsPerWorker();
                List<ScenarioSummary> levelSummaries = new ArrayList<>();

                for (OperationDefinition<H> op : operations) {
                    String label = ("%-" + nameWidth + "s | conc=%d | total=%d")
                            .formatted(op.name(), concurrency, total);

                    LoadResult load = loadGenerator.run(label, concurrency, config.callsPerWorker(), op.operation());
                    ScenarioSummary summary = aggregator.summarize(label, load.outcomes(), load.wallTime());
                    levelSummaries.add(summary);
                    if (logWriter != null) {
                        logWriter.append(summary);
                    }
                }

                levelSummaries.forEach(reporter::print);
                reporter.separator();
                summaries.addAll(levelSummaries);
            }
        } finally {
            metricsCollector.stop();
            if (logWriter != null) {
                logWriter.close();
            }
        }

        Instant endTime = Instant.now();
        BenchmarkResult result = new BenchmarkResult(startTime, endTime, Duration.between(startTime, endTime), summaries);

        if (logWriter != null) {
            logWriter.write(result);
        }
        generateReport(result);

        log.info("Benchmark completed: {} scenarios in {}s", summaries.size(), result.totalDuration().toSeconds());
        return result;
    }

    private void warmUp(List<OperationDefinition<H>> operations) {
        int rounds = config.warmupCalls();
        if (rounds == 0) {
            return;
        }
        log.info("Warming up: {} serial rounds", rounds);
        try {
            int failures = 0;
            for (int i = 0; i < rounds; i++) {
                for (OperationDefinition<H> op : operations) {
                    failures += loadGenerator.warmUp(1, op.operation());
                }
            }
            if (failures > 0) {
                log.warn("{} of {} warm-up calls failed", failures, rounds * operations.size());
            }
        } catch (HandleCreationException e) {
            log.warn("Skipping warm-up, no client handle available for {}", config.clientConfig().endpoint(), e);
        }
    }

    private void generateReport(BenchmarkResult result) {
        String reportPath = config.reportPath();
        if (reportPath == null || reportPath.isBlank()) {
            return;
        }
        try {
            new CsvReportGenerator().generate(result, Path.of(reportPath));
        } catch (Exception e) {
            log.error("Failed to generate report", e);
        }
    }

    public ClientPool<H> pool() {
        return pool;
    }

    public MetricsCollector metricsCollector() {
        return metricsCollector;
    }

    @Override
    public void close() {
        metricsCollector.stop();
        pool.releaseAll();
        log.info("Benchmark runner closed");
    }
}
