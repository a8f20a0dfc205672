package villagecompute.reports.integration.render;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.ruiyun.jvppeteer.api.core.Page;
import com.ruiyun.jvppeteer.cdp.entities.Viewport;

import villagecompute.reports.api.types.RendererConfigType;
import villagecompute.reports.data.models.ReportSchedule;

/**
 * Unit tests for the browser-independent parts of {@link ChromiumRenderBackend}.
 */
class ChromiumRenderBackendTest {

    @Test
    void testPageSizeFollowsContent() {
        assertArrayEquals(new double[]{20.0, 15.0}, ChromiumRenderBackend.pageSizeInches(1920, 1440), 0.0001);
    }

    @Test
    void testPageSizeClampedToMinimumAndMaximum() {
        assertArrayEquals(new double[]{8.0, 6.0}, ChromiumRenderBackend.pageSizeInches(100, 100), 0.0001);
        assertArrayEquals(new double[]{8.0, 200.0}, ChromiumRenderBackend.pageSizeInches(0, 96 * 500), 0.0001);
    }

    @Test
    void testLoginPageDetection() {
        assertThrows(LoginPageDetectedException.class,
                () -> ChromiumRenderBackend.detectLoginPage("http://grafana:3000/login", "Grafana"));
        assertThrows(LoginPageDetectedException.class,
                () -> ChromiumRenderBackend.detectLoginPage("http://grafana:3000/d/x", "Login - Grafana"));
        assertDoesNotThrow(() -> ChromiumRenderBackend.detectLoginPage("http://grafana:3000/d/x", "Ops - Grafana"));
    }

    @Test
    void testPdfMagic() {
        assertTrue(ChromiumRenderBackend.isPdf("%PDF-1.7\n...".getBytes(StandardCharsets.US_ASCII)));
        assertFalse(ChromiumRenderBackend.isPdf("<html>".getBytes(StandardCharsets.US_ASCII)));
        assertFalse(ChromiumRenderBackend.isPdf(new byte[0]));
    }

    @Test
    void testBrowserArgsFollowOptions() {
        RendererConfigType config = new RendererConfigType("http://grafana:3000", null, null, null, null, null, false,
                null, null, false, null);
        ChromiumRenderBackend backend = new ChromiumRenderBackend(RendererOptions.from(config, null));

        List<String> args = backend.browserArgs(Path.of("/tmp/profile"));

        assertFalse(args.contains("--no-sandbox"));
        assertTrue(args.contains("--disable-gpu"));
        assertFalse(args.contains("--ignore-certificate-errors"));
        assertTrue(args.contains("--user-data-dir=/tmp/profile"));
    }

    @Test
    void testPageTimeoutsFollowTenantTimeout() throws Exception {
        RendererConfigType config = new RendererConfigType("http://grafana:3000", 120000, null, 1280, 720, 1.0, null,
                null, null, null, null);
        ChromiumRenderBackend backend = new ChromiumRenderBackend(RendererOptions.from(config, null));
        Page page = mock(Page.class);

        backend.preparePage(page, "token-1");

        verify(page).setDefaultNavigationTimeout(120000);
        verify(page).setDefaultTimeout(120000);
        verify(page).setExtraHTTPHeaders(Map.of("Authorization", "Bearer token-1"));
        ArgumentCaptor<Viewport> viewport = ArgumentCaptor.forClass(Viewport.class);
        verify(page).setViewport(viewport.capture());
        assertEquals(1280, (int) viewport.getValue().getWidth());
        assertEquals(720, (int) viewport.getValue().getHeight());
    }

    @Test
    void testPageTimeoutDefaultsWhenUnset() throws Exception {
        ChromiumRenderBackend backend = new ChromiumRenderBackend(RendererOptions.from(null, "http://grafana:3000"));
        Page page = mock(Page.class);

        backend.preparePage(page, "token-1");

        verify(page).setDefaultNavigationTimeout(RendererOptions.DEFAULT_TIMEOUT_MS);
        verify(page).setDefaultTimeout(RendererOptions.DEFAULT_TIMEOUT_MS);
    }

    @Test
    void testRendererOptionsDefaults() {
        RendererOptions options = RendererOptions.from(null, "http://fallback:3000");

        assertEquals("http://fallback:3000", options.baseUrl());
        assertEquals(1920, options.viewportWidth());
        assertEquals(1080, options.viewportHeight());
        assertTrue(options.headless());
        assertTrue(options.noSandbox());
    }

    @Test
    void testMissingTokenFailsBeforeLaunchingBrowser() {
        ChromiumRenderBackend backend = new ChromiumRenderBackend(RendererOptions.from(null, "http://grafana:3000"));
        ReportSchedule schedule = new ReportSchedule();
        schedule.orgId = 1L;
        schedule.dashboardUid = "abc";
        CredentialProvider none = new CredentialProvider() {
            @Override
            public Optional<String> resolveToken(long orgId) {
                return Optional.empty();
            }

            @Override
            public String name() {
                return "none";
            }
        };

        assertThrows(MissingCredentialsException.class, () -> backend.renderDashboard(schedule, none));
        backend.close();
        backend.close();
    }
}
