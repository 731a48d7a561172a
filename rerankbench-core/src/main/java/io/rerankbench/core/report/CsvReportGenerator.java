package io.rerankbench.core.report;

import io.rerankbench.api.metrics.ScenarioSummary;
import io.rerankbench.api.report.ReportGenerator;
import io.rerankbench.api.runtime.BenchmarkResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes one CSV row per scenario summary. Undefined latency values are left blank.
 */
public class CsvReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(CsvReportGenerator.class);

    static final String HEADER =
            "scenario,total,ok,failed,success_rate,rps,avg_ms,p50_ms,p95_ms,p99_ms,max_ms,err_sample";

    @Override
    public Path generate(BenchmarkResult result, Path outputPath) {
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            List<String> lines = new ArrayList<>();
            lines.add(HEADER);
            for (ScenarioSummary s : result.summaries()) {
                lines.add(String.join(",",
                        escapeCsv(s.label()),
                        Integer.toString(s.total()),
                        Integer.toString(s.succeeded()),
                        Integer.toString(s.failed()),
                        decimal(s.successRate(), 4),
                        decimal(s.throughput(), 2),
                        decimal(s.meanLatencyMs(), 2),
                        decimal(s.p50LatencyMs(), 2),
                        decimal(s.p95LatencyMs(), 2),
                        decimal(s.p99LatencyMs(), 2),
                        decimal(s.maxLatencyMs(), 2),
                        escapeCsv(s.sampleErrorMessage().orElse(""))));
            }

            Files.write(outputPath, lines);
            log.info("CSV report generated: {}", outputPath);
            return outputPath;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV report to " + outputPath, e);
        }
    }

    @Override
    public String format() {
        return "CSV";
    }

    private static String decimal(double value, int scale) {
        return Double.isNaN(value) ? "" : String.format(Locale.ROOT, "%." + scale + "f", value);
    }

    private static String escapeCsv(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
