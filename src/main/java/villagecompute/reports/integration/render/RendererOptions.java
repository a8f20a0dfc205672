package villagecompute.reports.integration.render;

import villagecompute.reports.api.types.RendererConfigType;

/**
 * Fully resolved renderer settings: tenant values where given, renderer defaults otherwise.
 */
public record RendererOptions(String baseUrl, int timeoutMs, int delayMs, int viewportWidth, int viewportHeight,
        double deviceScaleFactor, boolean skipTlsVerify, String browserPath, boolean headless, boolean noSandbox,
        boolean disableGpu) {

    public static final int DEFAULT_WIDTH = 1920;
    public static final int DEFAULT_HEIGHT = 1080;
    public static final int DEFAULT_TIMEOUT_MS = 30000;
    public static final double DEFAULT_SCALE = 2.0;

    public static RendererOptions from(RendererConfigType config, String fallbackBaseUrl) {
        RendererConfigType c = config == null ? RendererConfigType.defaults() : config;
        String baseUrl = c.baseUrl() == null || c.baseUrl().isBlank() ? fallbackBaseUrl : c.baseUrl().trim();
        return new RendererOptions(baseUrl, positive(c.timeoutMs(), DEFAULT_TIMEOUT_MS),
                c.delayMs() == null || c.delayMs() < 0 ? 0 : c.delayMs(), positive(c.viewportWidth(), DEFAULT_WIDTH),
                positive(c.viewportHeight(), DEFAULT_HEIGHT),
                c.deviceScaleFactor() == null || c.deviceScaleFactor() <= 0 ? DEFAULT_SCALE : c.deviceScaleFactor(),
                Boolean.TRUE.equals(c.skipTlsVerify()), c.browserPath(), !Boolean.FALSE.equals(c.headless()),
                !Boolean.FALSE.equals(c.noSandbox()), !Boolean.FALSE.equals(c.disableGpu()));
    }

    private static int positive(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }
}
