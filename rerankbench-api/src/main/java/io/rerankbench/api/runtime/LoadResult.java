package io.rerankbench.api.runtime;

import java.time.Duration;
import java.util.List;

/**
 * Everything one load run produced.
 *
 * @param outcomes       all recorded outcomes, in completion order across workers and issuance order within a worker
 * @param wallTime       from dispatching the first worker until the last outcome was collected
 * @param abortedWorkers workers that could not obtain a client handle and recorded nothing
 */
public record LoadResult(List<CallOutcome> outcomes, Duration wallTime, int abortedWorkers) {

    public LoadResult {
        outcomes = List.copyOf(outcomes);
    }
}
