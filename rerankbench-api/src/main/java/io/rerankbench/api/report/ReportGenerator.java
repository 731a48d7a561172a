package io.rerankbench.api.report;

import io.rerankbench.api.runtime.BenchmarkResult;

import java.nio.file.Path;

/**
 * Writes a summary file for a completed benchmark, one entry per scenario.
 */
public interface ReportGenerator {

    /**
     * @param result     the finished benchmark
     * @param outputPath target file; missing parent directories are created
     * @return the written file
     */
    Path generate(BenchmarkResult result, Path outputPath);

    /**
     * @return short format name, e.g. {@code "CSV"}
     */
    String format();
}
