/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.integration.render;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruiyun.jvppeteer.api.core.Browser;
import com.ruiyun.jvppeteer.api.core.Page;
import com.ruiyun.jvppeteer.cdp.core.Puppeteer;
import com.ruiyun.jvppeteer.cdp.entities.LaunchOptions;
import com.ruiyun.jvppeteer.cdp.entities.PDFOptions;
import com.ruiyun.jvppeteer.cdp.entities.Viewport;
import com.ruiyun.jvppeteer.cdp.entities.WaitForOptions;

import villagecompute.reports.data.models.ReportSchedule;

/**
 * Headless Chromium renderer driven over the DevTools protocol.
 *
 * <p>
 * <b>Browser lifecycle:</b>
 * <ul>
 * <li>one browser per instance (that is, per tenant), launched on first render</li>
 * <li>each instance owns a unique temporary profile directory, deleted on {@link #close()}</li>
 * <li>every render opens and closes its own page, so concurrent renders share the browser</li>
 * </ul>
 *
 * <p>
 * <b>Render steps:</b>
 * <ol>
 * <li>resolve a bearer token (fails fast with {@link MissingCredentialsException})</li>
 * <li>set the {@code Authorization} header, the viewport and the tenant's {@code timeout_ms} as the page's
 * navigation and operation timeout</li>
 * <li>navigate to the kiosk URL, wait for load, then the configured settle delay</li>
 * <li>reject login pages</li>
 * <li>measure the content and print a single PDF page sized to it (96 px per inch, at least 8x6 in, at most 200 in
 * per side)</li>
 * <li>reject output that is not a PDF</li>
 * </ol>
 */
public class ChromiumRenderBackend implements RenderBackend {

    private static final Logger LOG = Logger.getLogger(ChromiumRenderBackend.class);

    static final double PIXELS_PER_INCH = 96.0;
    static final double MIN_WIDTH_INCHES = 8.0;
    static final double MIN_HEIGHT_INCHES = 6.0;
    static final double MAX_INCHES = 200.0;

    private static final String MEASURE_SCRIPT = "() => JSON.stringify({"
            + "width: Math.max(document.documentElement.scrollWidth, document.body ? document.body.scrollWidth : 0),"
            + "height: Math.max(document.documentElement.scrollHeight, document.body ? document.body.scrollHeight : 0)"
            + "})";

    private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);

    private final RendererOptions options;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private Browser browser;
    private Path profileDir;
    private boolean closed;

    public ChromiumRenderBackend(RendererOptions options) {
        this.options = options;
    }

    @Override
    public String name() {
        return "chromium";
    }

    @Override
    public byte[] renderDashboard(ReportSchedule schedule, CredentialProvider credentials) {
        String token = credentials.requireToken(schedule.orgId);
        String url = DashboardUrlBuilder.build(options.baseUrl(), schedule);

        Browser activeBrowser = ensureBrowser();
        Page page = null;
        long started = System.currentTimeMillis();
        try {
            page = activeBrowser.newPage();
            preparePage(page, token);

            LOG.infof("Rendering dashboard %s for schedule %d (viewport=%dx%d)", schedule.dashboardUid, schedule.id,
                    options.viewportWidth(), options.viewportHeight());
            page.goTo(url);

            // Best effort: late client-side redirects (login) land here.
            try {
                WaitForOptions waitOptions = new WaitForOptions();
                waitOptions.setTimeout(Math.min(options.timeoutMs(), 5000));
                page.waitForNavigation(waitOptions);
            } catch (Exception e) {
                LOG.debugf("No further navigation for %s", schedule.dashboardUid);
            }

            if (options.delayMs() > 0) {
                Thread.sleep(options.delayMs());
            }

            detectLoginPage(page.url(), page.title());

            double[] size = measure(page);
            PDFOptions pdfOptions = new PDFOptions();
            pdfOptions.setPrintBackground(true);
            pdfOptions.setWidth(String.format(Locale.ROOT, "%.2fin", size[0]));
            pdfOptions.setHeight(String.format(Locale.ROOT, "%.2fin", size[1]));

            byte[] pdf = page.pdf(pdfOptions);
            if (!isPdf(pdf)) {
                throw new RenderException("renderer output is not a PDF document");
            }

            LOG.infof("Rendered dashboard %s: %d bytes in %d ms", schedule.dashboardUid, pdf.length,
                    System.currentTimeMillis() - started);
            return pdf;

        } catch (RenderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderException("Interrupted while rendering " + schedule.dashboardUid, e);
        } catch (Exception e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            if (message.toLowerCase(Locale.ROOT).contains("timeout")) {
                throw new RenderException("Dashboard load timeout: " + schedule.dashboardUid, e);
            }
            throw new RenderException("Dashboard render failed: " + message, e);
        } finally {
            if (page != null) {
                try {
                    page.close();
                } catch (Exception e) {
                    LOG.warnf(e, "Failed to close page for dashboard %s", schedule.dashboardUid);
                }
            }
        }
    }

    /**
     * Applies the auth header, the viewport and the tenant's timeout to a fresh page. The timeout bounds navigation
     * and every later wait, evaluation and print on the page.
     */
    void preparePage(Page page, String token) throws Exception {
        page.setDefaultNavigationTimeout(options.timeoutMs());
        page.setDefaultTimeout(options.timeoutMs());
        page.setExtraHTTPHeaders(Map.of("Authorization", "Bearer " + token));

        Viewport viewport = new Viewport();
        viewport.setWidth(options.viewportWidth());
        viewport.setHeight(options.viewportHeight());
        viewport.setDeviceScaleFactor(options.deviceScaleFactor());
        page.setViewport(viewport);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (browser != null) {
            try {
                browser.close();
            } catch (Exception e) {
                LOG.errorf(e, "Failed to close browser");
            } finally {
                browser = null;
            }
        }
        deleteProfileDir();
    }

    /**
     * Chromium command line flags for the configured options.
     */
    List<String> browserArgs(Path userDataDir) {
        List<String> args = new ArrayList<>();
        if (options.noSandbox()) {
            args.add("--no-sandbox");
            args.add("--disable-setuid-sandbox");
        }
        args.add("--disable-dev-shm-usage");
        if (options.disableGpu()) {
            args.add("--disable-gpu");
        }
        args.add("--no-first-run");
        args.add("--no-default-browser-check");
        if (options.skipTlsVerify()) {
            args.add("--ignore-certificate-errors");
        }
        if (userDataDir != null) {
            args.add("--user-data-dir=" + userDataDir.toAbsolutePath());
        }
        return args;
    }

    static double[] pageSizeInches(double widthPx, double heightPx) {
        double width = clamp(widthPx / PIXELS_PER_INCH, MIN_WIDTH_INCHES);
        double height = clamp(heightPx / PIXELS_PER_INCH, MIN_HEIGHT_INCHES);
        return new double[]{width, height};
    }

    static void detectLoginPage(String url, String title) {
        String lowerUrl = url == null ? "" : url.toLowerCase(Locale.ROOT);
        String lowerTitle = title == null ? "" : title.toLowerCase(Locale.ROOT);
        if (lowerUrl.contains("/login") || lowerTitle.startsWith("login") || lowerTitle.contains("log in")) {
            throw new LoginPageDetectedException("dashboard host returned a login page (" + url
                    + "); check the service account token");
        }
    }

    static boolean isPdf(byte[] data) {
        if (data == null || data.length < PDF_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (data[i] != PDF_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    private synchronized Browser ensureBrowser() {
        if (closed) {
            throw new RenderException("renderer is closed");
        }
        if (browser != null) {
            return browser;
        }
        try {
            profileDir = Files.createTempDirectory("reports-chromium-");
            String executable = options.browserPath() == null || options.browserPath().isBlank()
                    ? null
                    : options.browserPath();
            LaunchOptions launchOptions = LaunchOptions.builder().headless(options.headless())
                    .timeout(options.timeoutMs()).executablePath(executable).args(browserArgs(profileDir)).build();
            LOG.infof("Launching browser (headless=%s, profile=%s)", options.headless(), profileDir);
            browser = Puppeteer.launch(launchOptions);
            return browser;
        } catch (Exception e) {
            deleteProfileDir();
            throw new RenderException("Failed to launch browser: " + e.getMessage(), e);
        }
    }

    private double[] measure(Page page) throws IOException {
        Object raw = page.evaluate(MEASURE_SCRIPT);
        if (raw == null) {
            return pageSizeInches(options.viewportWidth(), options.viewportHeight());
        }
        JsonNode size = objectMapper.readTree(raw.toString());
        return pageSizeInches(size.path("width").asDouble(options.viewportWidth()),
                size.path("height").asDouble(options.viewportHeight()));
    }

    private void deleteProfileDir() {
        if (profileDir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(profileDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            LOG.warnf(e, "Failed to delete browser profile %s", profileDir);
        } finally {
            profileDir = null;
        }
    }

    private static double clamp(double inches, double min) {
        return Math.min(MAX_INCHES, Math.max(min, inches));
    }
}
