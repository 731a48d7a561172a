package io.rerankbench.core.log;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.rerankbench.api.log.LogWriter;
import io.rerankbench.api.metrics.ScenarioSummary;
import io.rerankbench.api.runtime.BenchmarkResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the benchmark result to a JSON file and streams scenario summaries to a sibling
 * {@code -stream.jsonl} file as they complete.
 */
public class JsonLogWriter implements LogWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonLogWriter.class);

    private final Path logFilePath;
    private final ObjectMapper objectMapper;
    private BufferedWriter streamWriter;

    public JsonLogWriter(String logFilePath) {
        this.logFilePath = Path.of(logFilePath);
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void write(BenchmarkResult result) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(logFilePath.toFile(), result);
            log.info("Benchmark results written to: {}", logFilePath.toAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to write benchmark results to {}", logFilePath, e);
        }
    }

    @Override
    public synchronized void append(ScenarioSummary summary) {
        try {
            if (streamWriter == null) {
                streamWriter = Files.newBufferedWriter(streamPath());
            }
            streamWriter.write(objectMapper.writeValueAsString(summary));
            streamWriter.newLine();
            streamWriter.flush();
        } catch (IOException e) {
            log.error("Failed to append scenario summary", e);
        }
    }

    @Override
    public synchronized void close() {
        if (streamWriter != null) {
            try {
                streamWriter.close();
            } catch (IOException e) {
                log.error("Failed to close stream writer", e);
            } finally {
                streamWriter = null;
            }
        }
    }

    Path streamPath() {
        String name = logFilePath.getFileName().toString();
        String base = name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
        return logFilePath.resolveSibling(base + "-stream.jsonl");
    }
}
