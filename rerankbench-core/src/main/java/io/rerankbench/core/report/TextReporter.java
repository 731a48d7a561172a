package io.rerankbench.core.report;

import io.rerankbench.api.metrics.ScenarioSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders scenario summaries as human-readable lines:
 * <pre>
 * [rerank | conc=50 | total=250] ok=250/250 succ=100.0% rps=812.35 avg=58.2ms p50=55.0ms p95=90.1ms p99=101.7ms max=120.4ms
 * </pre>
 * followed by an {@code err_sample} line when calls failed.
 */
public class TextReporter {

    private static final Logger log = LoggerFactory.getLogger(TextReporter.class);
    private static final String UNDEFINED = "n/a";

    private final PrintStream out;

    public TextReporter() {
        this(System.out);
    }

    public TextReporter(PrintStream out) {
        this.out = out;
    }

    public List<String> format(ScenarioSummary s) {
        List<String> lines = new ArrayList<>(2);
        lines.add(String.format(Locale.ROOT,
                "[%s] ok=%d/%d succ=%.1f%% rps=%.2f avg=%s p50=%s p95=%s p99=%s max=%s",
                s.label(),
                s.succeeded(),
                s.total(),
                s.successRate() * 100,
                s.throughput(),
                millis(s.meanLatencyMs()),
                millis(s.p50LatencyMs()),
                millis(s.p95LatencyMs()),
                millis(s.p99LatencyMs()),
                millis(s.maxLatencyMs())));
        s.sampleErrorMessage().ifPresent(err -> lines.add("  err_sample: " + err));
        return lines;
    }

    public void print(ScenarioSummary summary) {
        for (String line : format(summary)) {
            out.println(line);
            log.info(line);
        }
    }

    public void separator() {
        out.println("-".repeat(110));
    }

    private static String millis(double value) {
        return Double.isNaN(value) ? UNDEFINED : String.format(Locale.ROOT, "%.1fms", value);
    }
}
