package villagecompute.reports.integration.render;

/**
 * The dashboard host served its login page, usually because the bearer token expired or lacks access to the
 * dashboard. Retried like other render failures since captured tokens can be refreshed between attempts.
 */
public class LoginPageDetectedException extends RenderException {

    public LoginPageDetectedException(String message) {
        super(message);
    }
}
