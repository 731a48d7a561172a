package io.rerankbench.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.rerankbench.api.metrics.MetricsCollector;
import io.rerankbench.api.metrics.MetricsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Default metrics collector using Micrometer.
 * Collects call latency, success/failure counts and active workers per scenario.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsCollector.class);

    static final String LATENCY = "rerankbench.call.latency";
    static final String SUCCESS = "rerankbench.calls.success";
    static final String FAILURE = "rerankbench.calls.failure";
    static final String ACTIVE_WORKERS = "rerankbench.active.workers";

    private final MeterRegistry registry;
    private final Map<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final Map<String, Counter> successCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> failureCounters = new ConcurrentHashMap<>();
    private final Map<String, GaugeHolder> activeWorkers = new ConcurrentHashMap<>();
    private final List<Consumer<List<MetricsSnapshot>>> listeners = new CopyOnWriteArrayList<>();
    private ScheduledExecutorService scheduler;

    public MicrometerMetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    public MicrometerMetricsCollector(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordSuccess(String scenario, Duration latency) {
        timer(scenario).record(latency);
        successCounter(scenario).increment();
    }

    @Override
    public void recordFailure(String scenario, Duration latency, String error) {
        timer(scenario).record(latency);
        failureCounter(scenario).increment();
    }

    @Override
    public void recordActiveWorkers(String scenario, int count) {
        activeWorkers.computeIfAbsent(scenario, name -> {
            var holder = new GaugeHolder();
            Gauge.builder(ACTIVE_WORKERS, holder, GaugeHolder::get)
                    .tag("scenario", name)
                    .register(registry);
            return holder;
        }).set(count);
    }

    @Override
    public List<MetricsSnapshot> snapshot() {
        List<MetricsSnapshot> snapshots = new ArrayList<>();
        Instant now = Instant.now();

        for (var entry : latencyTimers.entrySet()) {
            String scenario = entry.getKey();
            Timer timer = entry.getValue();
            var holder = activeWorkers.get(scenario);

            snapshots.add(new MetricsSnapshot(
                    scenario,
                    holder != null ? (int) holder.get() : 0,
                    (long) successCounter(scenario).count(),
                    (long) failureCounter(scenario).count(),
                    timer.mean(TimeUnit.MILLISECONDS),
                    timer.max(TimeUnit.MILLISECONDS),
                    now
            ));
        }
        return snapshots;
    }

    @Override
    public void onSnapshot(Consumer<List<MetricsSnapshot>> listener) {
        listeners.add(listener);
    }

    @Override
    public synchronized void start(Duration interval) {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rerankbench-metrics");
            t.setDaemon(true);
            return t;
        });

        scheduler.scheduleAtFixedRate(() -> {
            try {
                List<MetricsSnapshot> snap = snapshot();
                listeners.forEach(l -> l.accept(snap));
            } catch (Exception e) {
                log.error("Error collecting metrics snapshot", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);

        log.info("Metrics collection started with interval: {}ms", interval.toMillis());
    }

    @Override
    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
            log.info("Metrics collection stopped");
        }
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Timer timer(String scenario) {
        return latencyTimers.computeIfAbsent(scenario, name ->
                Timer.builder(LATENCY)
                        .tag("scenario", name)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry));
    }

    private Counter successCounter(String scenario) {
        return successCounters.computeIfAbsent(scenario, name ->
                Counter.builder(SUCCESS)
                        .tag("scenario", name)
                        .register(registry));
    }

    private Counter failureCounter(String scenario) {
        return failureCounters.computeIfAbsent(scenario, name ->
                Counter.builder(FAILURE)
                        .tag("scenario", name)
                        .register(registry));
    }

    /**
     * Mutable holder for gauge values.
     */
    private static class GaugeHolder {
        private volatile long value;

        void set(long value) { this.value = value; }
        double get() { return value; }
    }
}
