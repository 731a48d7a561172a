package io.rerankbench.api.client;

/**
 * Factory for client handles.
 * Implement this interface to benchmark a different transport without touching the harness.
 *
 * @param <H> the handle type produced
 */
@FunctionalInterface
public interface ClientFactory<H extends ClientHandle> {

    /**
     * Create a new handle bound to the given configuration.
     *
     * @param config the connection settings
     * @return a live handle
     * @throws HandleCreationException if the handle cannot be constructed
     */
    H create(ClientConfig config);
}
