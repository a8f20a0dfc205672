package villagecompute.reports.exceptions;

/**
 * Thrown when the dispatcher refuses a manual run.
 */
public class DispatchRejectedException extends RuntimeException {

    public enum Reason {
        /** The schedule already has an execution in flight. */
        ALREADY_RUNNING,
        /** Dispatched-but-unfinished jobs reached the backlog limit. */
        BACKLOG_FULL,
        /** The dispatcher is shutting down. */
        SHUTTING_DOWN
    }

    private final Reason reason;

    public DispatchRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
