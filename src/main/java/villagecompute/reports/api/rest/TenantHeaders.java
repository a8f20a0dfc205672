package villagecompute.reports.api.rest;

/**
 * Request headers identifying the calling tenant and user. The hosting platform sets them on every proxied request.
 */
public final class TenantHeaders {

    public static final String ORG_ID = "X-Org-Id";

    public static final String USER_ID = "X-User-Id";

    public static final long DEFAULT_ORG_ID = 1L;

    private TenantHeaders() {
    }
}
