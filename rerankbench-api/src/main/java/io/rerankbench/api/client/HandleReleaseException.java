package io.rerankbench.api.client;

/**
 * Thrown when a client handle fails to release its resources.
 * Pools log and discard it.
 */
public class HandleReleaseException extends Exception {

    public HandleReleaseException(String message) {
        super(message);
    }

    public HandleReleaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
