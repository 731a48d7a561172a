package io.rerankbench.api.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable connection settings for the remote scoring service.
 * <p>
 * Equality is structural, so a config is safe to use as a cache key.
 *
 * @param endpoint base URL including the path prefix, e.g. {@code http://127.0.0.1:11438/v1}
 * @param timeout  per-request timeout
 */
public record ClientConfig(String endpoint, Duration timeout) {

    public static final String DEFAULT_ENDPOINT = "http://127.0.0.1:11438/v1";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public ClientConfig {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(timeout, "timeout");
        endpoint = stripTrailingSlashes(endpoint.trim());
        if (endpoint.isEmpty()) {
            throw new IllegalArgumentException("Endpoint must not be blank");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
    }

    public static ClientConfig defaults() {
        return new ClientConfig(DEFAULT_ENDPOINT, DEFAULT_TIMEOUT);
    }

    /**
     * Build a config, falling back to the defaults for any {@code null} argument.
     */
    public static ClientConfig of(String endpoint, Duration timeout) {
        return new ClientConfig(
                endpoint != null ? endpoint : DEFAULT_ENDPOINT,
                timeout != null ? timeout : DEFAULT_TIMEOUT);
    }

    public ClientConfig withEndpoint(String endpoint) {
        return new ClientConfig(endpoint, timeout);
    }

    public ClientConfig withTimeout(Duration timeout) {
        return new ClientConfig(endpoint, timeout);
    }

    /**
     * Resolve a path relative to the endpoint, e.g. {@code resolve("rerank")}.
     */
    public String resolve(String path) {
        String p = path.startsWith("/") ? path.substring(1) : path;
        return endpoint + "/" + p;
    }

    private static String stripTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }
}
