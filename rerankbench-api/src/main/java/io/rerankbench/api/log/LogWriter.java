package io.rerankbench.api.log;

import io.rerankbench.api.metrics.ScenarioSummary;
import io.rerankbench.api.runtime.BenchmarkResult;

/**
 * Writes benchmark results to a log file.
 */
public interface LogWriter {

    /**
     * Write the complete benchmark result.
     */
    void write(BenchmarkResult result);

    /**
     * Append one scenario summary as soon as it is available (streaming mode).
     */
    void append(ScenarioSummary summary);

    /**
     * Flush and close the writer.
     */
    void close();
}
