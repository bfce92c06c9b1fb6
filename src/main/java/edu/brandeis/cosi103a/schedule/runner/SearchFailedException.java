package edu.brandeis.cosi103a.schedule.runner;

/**
 * Thrown when a worker dies. The result file has already been checkpointed as partial.
 */
public class SearchFailedException extends RuntimeException {
    public SearchFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
