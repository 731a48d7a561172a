package io.rerankbench.api.client;

/**
 * Thrown when a client handle cannot be constructed.
 * Fatal to the acquire call that triggered it; a worker that hits it aborts its remaining calls.
 */
public class HandleCreationException extends RuntimeException {

    public HandleCreationException(String message) {
        super(message);
    }

    public HandleCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
