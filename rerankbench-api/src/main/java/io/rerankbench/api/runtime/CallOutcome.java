package io.rerankbench.api.runtime;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one attempted call. Latency is measured for failed calls too.
 *
 * @param success whether the operation completed without failure
 * @param latency time between invoking the operation and its return or failure
 * @param error   textual description of the failure, {@code null} on success
 */
public record CallOutcome(boolean success, Duration latency, String error) {

    public CallOutcome {
        Objects.requireNonNull(latency, "latency");
        if (success && error != null) {
            throw new IllegalArgumentException("A successful call carries no error");
        }
    }

    public static CallOutcome success(Duration latency) {
        return new CallOutcome(true, latency, null);
    }

    public static CallOutcome failure(Duration latency, String error) {
        return new CallOutcome(false, latency, error != null ? error : "");
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    public double latencyMillis() {
        return latency.toNanos() / 1_000_000.0;
    }
}
