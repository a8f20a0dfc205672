package villagecompute.reports.integration.render;

/**
 * No credential strategy produced a token for the tenant. This is a configuration problem and is never retried.
 */
public class MissingCredentialsException extends RuntimeException {

    public MissingCredentialsException(String message) {
        super(message);
    }
}
