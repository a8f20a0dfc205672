package villagecompute.reports.api.filters;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import villagecompute.reports.api.rest.TenantHeaders;
import villagecompute.reports.integration.render.RequestCredentialProvider;
import villagecompute.reports.observability.LoggingConfig;

/**
 * Captures bearer tokens from API requests for later unattended renders and tags request logs with tenant and path.
 *
 * <p>
 * The token is remembered per tenant ({@code X-Org-Id}) by {@link RequestCredentialProvider}. Requests without a
 * bearer token or with a malformed tenant header are passed through untouched.
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class BearerTokenCaptureFilter implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger LOG = Logger.getLogger(BearerTokenCaptureFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    RequestCredentialProvider requestCredentials;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin("/" + requestContext.getUriInfo().getPath());

        String authorization = requestContext.getHeaderString(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return;
        }
        String orgHeader = requestContext.getHeaderString(TenantHeaders.ORG_ID);
        long orgId;
        try {
            orgId = orgHeader == null || orgHeader.isBlank()
                    ? TenantHeaders.DEFAULT_ORG_ID
                    : Long.parseLong(orgHeader.trim());
        } catch (NumberFormatException e) {
            LOG.debugf("Ignoring bearer token with malformed %s header '%s'", TenantHeaders.ORG_ID, orgHeader);
            return;
        }
        LoggingConfig.setScheduleContext(orgId, null);
        requestCredentials.capture(orgId, authorization.substring(BEARER_PREFIX.length()).trim());
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        LoggingConfig.clearMDC();
    }
}
