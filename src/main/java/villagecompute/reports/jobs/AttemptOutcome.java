package villagecompute.reports.jobs;

/**
 * Result of a single render-and-deliver attempt.
 *
 * <p>
 * The retry loop looks only at {@link Kind}: transient failures are retried with backoff, permanent failures
 * (configuration problems such as missing credentials or settings) end the run immediately.
 */
public record AttemptOutcome(Kind kind, String error, Throwable cause) {

    public enum Kind {
        SUCCESS, TRANSIENT_FAILURE, PERMANENT_FAILURE
    }

    private static final AttemptOutcome SUCCESS = new AttemptOutcome(Kind.SUCCESS, null, null);

    public static AttemptOutcome success() {
        return SUCCESS;
    }

    public static AttemptOutcome transientFailure(String error, Throwable cause) {
        return new AttemptOutcome(Kind.TRANSIENT_FAILURE, error, cause);
    }

    public static AttemptOutcome permanentFailure(String error, Throwable cause) {
        return new AttemptOutcome(Kind.PERMANENT_FAILURE, error, cause);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isRetryable() {
        return kind == Kind.TRANSIENT_FAILURE;
    }
}
