package io.rerankbench.core.runtime;

import io.micrometer.core.instrument.Clock;
import io.rerankbench.api.client.ClientConfig;
import io.rerankbench.api.client.ClientHandle;
import io.rerankbench.api.client.HandleCreationException;
import io.rerankbench.api.metrics.MetricsCollector;
import io.rerankbench.api.operation.Operation;
import io.rerankbench.api.runtime.CallOutcome;
import io.rerankbench.api.runtime.LoadResult;
import io.rerankbench.core.metrics.MicrometerMetricsCollector;
import io.rerankbench.core.pool.ClientPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives an operation with a fixed number of parallel workers.
 * <p>
 * Each worker performs its calls sequentially through a <b>worker-private</b> client handle: the worker
 * opens its own {@link ClientPool} over the shared pool's factory, acquires one handle for the configured
 * {@link ClientConfig}, reuses it for all of its calls and releases it when done. Handles are never shared
 * between workers. The shared pool is used only by the serial warm-up.
 * <p>
 * A worker whose handle cannot be created aborts without recording outcomes. Every other failure is
 * recorded as a failed {@link CallOutcome}.
 *
 * @param <H> the handle type
 */
public class LoadGenerator<H extends ClientHandle> {

    private static final Logger log = LoggerFactory.getLogger(LoadGenerator.class);

    private final ClientPool<H> sharedPool;
    private final ClientConfig config;
    private final CallExecutor callExecutor;
    private final MetricsCollector metricsCollector;
    private final Clock clock;
    private final ThreadFactory threadFactory;

    public LoadGenerator(ClientPool<H> sharedPool, ClientConfig config) {
        this(sharedPool, config, new MicrometerMetricsCollector(), Clock.SYSTEM, null);
    }

    public LoadGenerator(ClientPool<H> sharedPool, ClientConfig config, MetricsCollector metricsCollector,
                         Clock clock, ThreadFactory threadFactory) {
        this.sharedPool = Objects.requireNonNull(sharedPool, "sharedPool");
        this.config = Objects.requireNonNull(config, "config");
        this.metricsCollector = Objects.requireNonNull(metricsCollector, "metricsCollector");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.callExecutor = new CallExecutor(clock);
        this.threadFactory = threadFactory != null ? threadFactory : new WorkerThreadFactory();
    }

    /**
     * Run serial warm-up calls through the shared pool's handle. Outcomes are discarded; failures are
     * logged and never abort the caller.
     *
     * @return number of warm-up calls that failed
     */
    public int warmUp(int calls, Operation<? super H> operation) {
        if (calls <= 0) {
            return 0;
        }
        H handle = sharedPool.acquire(config);
        int failures = 0;
        for (int i = 0; i < calls; i++) {
            CallOutcome outcome = callExecutor.execute(handle, operation);
            if (!outcome.success()) {
                failures++;
                log.warn("Warm-up call {}/{} failed after {}ms: {}",
                        i + 1, calls, outcome.latency().toMillis(), outcome.error());
            }
        }
        return failures;
    }

    public LoadResult run(int concurrency, int callsPerWorker, Operation<? super H> operation) {
        return run("load", concurrency, callsPerWorker, operation);
    }

    /**
     * Run {@code concurrency} workers, each issuing {@code callsPerWorker} sequential calls, and wait for all
     * of them. Outcomes are collected in worker completion order; within a worker they keep issuance order.
     * Wall time runs from dispatching the first worker until the last worker's outcomes are collected.
     *
     * @param label scenario label used for metrics and logs
     */
    public LoadResult run(String label, int concurrency, int callsPerWorker, Operation<? super H> operation) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("Concurrency must be positive");
        }
        if (callsPerWorker <= 0) {
            throw new IllegalArgumentException("Calls per worker must be positive");
        }
        Objects.requireNonNull(operation, "operation");
        int expectedCalls;
        try {
            expectedCalls = Math.multiplyExact(concurrency, callsPerWorker);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    "Too many calls: " + concurrency + " workers x " + callsPerWorker + " calls overflows int", e);
        }

        log.info("Starting [{}]: {} workers x {} calls", label, concurrency, callsPerWorker);

        AtomicInteger activeWorkers = new AtomicInteger(0);
        List<CallOutcome> outcomes = new ArrayList<>(expectedCalls);
        int aborted = 0;

        ExecutorService executor = Executors.newFixedThreadPool(concurrency, threadFactory);
        CompletionService<WorkerResult> completion = new ExecutorCompletionService<>(executor);
        try {
            long start = clock.monotonicTime();
            for (int workerId = 0; workerId < concurrency; workerId++) {
                final int id = workerId;
                completion.submit(() -> runWorker(id, label, callsPerWorker, operation, activeWorkers));
            }

            for (int i = 0; i < concurrency; i++) {
                WorkerResult result = awaitNext(completion);
                if (result.aborted()) {
                    aborted++;
                } else {
                    outcomes.addAll(result.outcomes());
                }
            }
            Duration wallTime = Duration.ofNanos(clock.monotonicTime() - start);

            log.info("Finished [{}]: {} outcomes in {}ms ({} workers aborted)",
                    label, outcomes.size(), wallTime.toMillis(), aborted);
            return new LoadResult(outcomes, wallTime, aborted);
        } finally {
            shutdown(executor);
        }
    }

    private WorkerResult runWorker(int workerId, String label, int calls, Operation<? super H> operation,
                                   AtomicInteger activeWorkers) {
        ClientPool<H> workerPool = new ClientPool<>(sharedPool.factory());
        metricsCollector.recordActiveWorkers(label, activeWorkers.incrementAndGet());
        try {
            H handle;
            try {
                handle = workerPool.acquire(config);
            } catch (HandleCreationException e) {
                log.error("Worker {} of [{}] could not create a client handle, skipping its {} calls",
                        workerId, label, calls, e);
                return WorkerResult.ABORTED;
            }

            List<CallOutcome> outcomes = new ArrayList<>(calls);
            try {
                for (int i = 0; i < calls; i++) {
                    CallOutcome outcome = callExecutor.execute(handle, operation);
                    outcomes.add(outcome);
                    if (outcome.success()) {
                        metricsCollector.recordSuccess(label, outcome.latency());
                    } else {
                        metricsCollector.recordFailure(label, outcome.latency(), outcome.error());
                    }
                }
                log.debug("Worker {} of [{}] completed {} calls", workerId, label, calls);
            } catch (RuntimeException e) {
                // keep what was recorded so far
                log.error("Worker {} of [{}] stopped after {} of {} calls", workerId, label, outcomes.size(), calls, e);
            }
            return new WorkerResult(outcomes, false);
        } finally {
            workerPool.releaseAll();
            metricsCollector.recordActiveWorkers(label, activeWorkers.decrementAndGet());
        }
    }

    private static WorkerResult awaitNext(CompletionService<WorkerResult> completion) {
        try {
            return completion.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for workers", e);
        } catch (ExecutionException e) {
            log.error("Worker terminated unexpectedly", e.getCause());
            return WorkerResult.ABORTED;
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record WorkerResult(List<CallOutcome> outcomes, boolean aborted) {
        static final WorkerResult ABORTED = new WorkerResult(Collections.emptyList(), true);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);
        private final int run = RUN_COUNTER.incrementAndGet();
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "rerankbench-worker-" + run + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
