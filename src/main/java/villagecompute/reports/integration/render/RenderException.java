package villagecompute.reports.integration.render;

/**
 * A render attempt failed in a way that may succeed when retried (timeouts, navigation errors, browser crashes).
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
