package io.rerankbench.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.rerankbench.api.metrics.MetricsSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;

class MicrometerMetricsCollectorTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsCollector collector;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        collector = new MicrometerMetricsCollector(registry);
    }

    @AfterEach
    void tearDown() {
        collector.stop();
        registry.close();
    }

    @Test
    void shouldCreateWithDefaultRegistry() {
        var defaultCollector = new MicrometerMetricsCollector();
        assertThat(defaultCollector.registry()).isNotNull();
        defaultCollector.stop();
    }

    @Test
    void shouldRecordSuccessfulCall() {
        collector.recordSuccess("rerank", Duration.ofMillis(150));

        Counter counter = registry.find(MicrometerMetricsCollector.SUCCESS)
                .tag("scenario", "rerank")
                .counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);

        Timer timer = registry.find(MicrometerMetricsCollector.LATENCY)
                .tag("scenario", "rerank")
                .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isCloseTo(150.0, within(5.0));
    }

    @Test
    void shouldTrackSuccessAndFailureSeparately() {
        collector.recordSuccess("score", Duration.ofMillis(100));
        collector.recordSuccess("score", Duration.ofMillis(120));
        collector.recordFailure("score", Duration.ofMillis(3000), "HTTP 500");

        Counter success = registry.find(MicrometerMetricsCollector.SUCCESS).tag("scenario", "score").counter();
        Counter failure = registry.find(MicrometerMetricsCollector.FAILURE).tag("scenario", "score").counter();

        assertThat(success.count()).isEqualTo(2.0);
        assertThat(failure.count()).isEqualTo(1.0);

        // the latency timer sees every call, failed ones included
        Timer timer = registry.find(MicrometerMetricsCollector.LATENCY).tag("scenario", "score").timer();
        assertThat(timer.count()).isEqualTo(3);
    }

    @Test
    void shouldRecordActiveWorkers() {
        collector.recordActiveWorkers("rerank", 42);

        Gauge gauge = registry.find(MicrometerMetricsCollector.ACTIVE_WORKERS)
                .tag("scenario", "rerank")
                .gauge();
        assertThat(gauge).isNotNull();
        assertThat(gauge.value()).isEqualTo(42.0);

        collector.recordActiveWorkers("rerank", 7);
        assertThat(gauge.value()).isEqualTo(7.0);
    }

    @Test
    void shouldSnapshotEachScenario() {
        collector.recordSuccess("rerank", Duration.ofMillis(10));
        collector.recordSuccess("rerank", Duration.ofMillis(30));
        collector.recordFailure("score", Duration.ofMillis(5), "boom");
        collector.recordActiveWorkers("rerank", 3);

        List<MetricsSnapshot> snapshots = collector.snapshot();

        assertThat(snapshots).hasSize(2);
        MetricsSnapshot rerank = snapshots.stream().filter(s -> s.scenario().equals("rerank")).findFirst().orElseThrow();
        assertThat(rerank.successCount()).isEqualTo(2);
        assertThat(rerank.failureCount()).isZero();
        assertThat(rerank.activeWorkers()).isEqualTo(3);
        assertThat(rerank.averageLatencyMs()).isCloseTo(20.0, within(1.0));
        assertThat(rerank.maxLatencyMs()).isCloseTo(30.0, within(1.0));

        MetricsSnapshot score = snapshots.stream().filter(s -> s.scenario().equals("score")).findFirst().orElseThrow();
        assertThat(score.failureCount()).isEqualTo(1);
    }

    @Test
    void shouldPublishSnapshotsPeriodically() {
        List<List<MetricsSnapshot>> received = new CopyOnWriteArrayList<>();
        collector.onSnapshot(received::add);
        collector.recordSuccess("rerank", Duration.ofMillis(10));

        collector.start(Duration.ofMillis(50));

        await().atMost(2, TimeUnit.SECONDS).until(() -> received.size() >= 2);
        assertThat(received.get(0)).extracting(MetricsSnapshot::scenario).containsExactly("rerank");
    }

    @Test
    void stopShouldHaltPublication() throws InterruptedException {
        List<List<MetricsSnapshot>> received = new CopyOnWriteArrayList<>();
        collector.onSnapshot(received::add);
        collector.start(Duration.ofMillis(20));
        await().atMost(2, TimeUnit.SECONDS).until(() -> !received.isEmpty());

        collector.stop();
        Thread.sleep(50);
        int afterStop = received.size();
        Thread.sleep(150);

        assertThat(received).hasSize(afterStop);
    }
}
