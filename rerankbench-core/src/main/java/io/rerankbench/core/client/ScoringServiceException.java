package io.rerankbench.core.client;

/**
 * The scoring service answered with an error status or a response that does not have the expected shape.
 */
public class ScoringServiceException extends RuntimeException {

    public ScoringServiceException(String message) {
        super(message);
    }

    public ScoringServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
