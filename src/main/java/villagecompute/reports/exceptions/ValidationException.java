package villagecompute.reports.exceptions;

/**
 * Thrown when a schedule or settings payload is rejected (recipient outside the domain whitelist, unparseable cron
 * expression, too many recipients, missing SMTP fields).
 *
 * <p>
 * Mapped to HTTP 400 Bad Request by the REST resources.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
