package villagecompute.reports.api.filters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.jboss.logging.MDC;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.UriInfo;
import villagecompute.reports.api.rest.TenantHeaders;
import villagecompute.reports.integration.render.RequestCredentialProvider;
import villagecompute.reports.observability.LoggingConfig;

/**
 * Unit tests for {@link BearerTokenCaptureFilter}.
 */
class BearerTokenCaptureFilterTest {

    private BearerTokenCaptureFilter filter;
    private RequestCredentialProvider credentials;

    @BeforeEach
    void setUp() {
        credentials = new RequestCredentialProvider();
        filter = new BearerTokenCaptureFilter();
        filter.requestCredentials = credentials;
    }

    @AfterEach
    void tearDown() {
        LoggingConfig.clearMDC();
    }

    private static ContainerRequestContext request(String authorization, String orgHeader) {
        ContainerRequestContext context = mock(ContainerRequestContext.class);
        UriInfo uriInfo = mock(UriInfo.class);
        when(uriInfo.getPath()).thenReturn("api/schedules");
        when(context.getUriInfo()).thenReturn(uriInfo);
        when(context.getHeaderString(HttpHeaders.AUTHORIZATION)).thenReturn(authorization);
        when(context.getHeaderString(TenantHeaders.ORG_ID)).thenReturn(orgHeader);
        return context;
    }

    @Test
    void testCapturesTokenForTenant() {
        filter.filter(request("Bearer glsa_abc", "4"));

        assertEquals(Optional.of("glsa_abc"), credentials.resolveToken(4L));
        assertEquals("/api/schedules", MDC.get(LoggingConfig.MDC_REQUEST_ORIGIN));
    }

    @Test
    void testMissingTenantHeaderUsesDefaultOrg() {
        filter.filter(request("Bearer glsa_abc", null));

        assertEquals(Optional.of("glsa_abc"), credentials.resolveToken(TenantHeaders.DEFAULT_ORG_ID));
    }

    @Test
    void testNonBearerOrMalformedTenantIgnored() {
        filter.filter(request("Basic dXNlcjpwYXNz", "4"));
        filter.filter(request("Bearer glsa_abc", "four"));

        assertTrue(credentials.resolveToken(4L).isEmpty());
        assertTrue(credentials.resolveToken(TenantHeaders.DEFAULT_ORG_ID).isEmpty());
    }

    @Test
    void testResponseClearsMdc() {
        filter.filter(request(null, null));

        filter.filter(request(null, null), mock(ContainerResponseContext.class));

        assertNull(MDC.get(LoggingConfig.MDC_REQUEST_ORIGIN));
    }
}
