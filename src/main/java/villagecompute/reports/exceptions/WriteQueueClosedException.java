package villagecompute.reports.exceptions;

/**
 * Raised to a write submitter when the single-writer queue no longer accepts operations (shutdown began, or the caller
 * was interrupted while waiting).
 */
public class WriteQueueClosedException extends RuntimeException {

    public WriteQueueClosedException(String message) {
        super(message);
    }

    public WriteQueueClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
