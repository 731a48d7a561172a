package io.rerankbench.api.client;

/**
 * A reusable, stateful connection resource to the scoring service
 * (for example a connection-pooled HTTP client).
 * <p>
 * A handle is bound to exactly one {@link ClientConfig}. Handles cached by a pool are owned by
 * that pool; callers borrow them for the duration of a call and must not keep them across
 * configuration changes.
 */
public interface ClientHandle {

    /**
     * @return the configuration this handle was created for
     */
    ClientConfig config();

    /**
     * Release the underlying resources. Calling it more than once has no further effect.
     *
     * @throws HandleReleaseException if the resources could not be released cleanly
     */
    void release() throws HandleReleaseException;
}
