package villagecompute.reports.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-tenant headless browser settings. Null fields fall back to renderer defaults.
 */
public record RendererConfigType(@JsonProperty("base_url") String baseUrl,
        @JsonProperty("timeout_ms") Integer timeoutMs, @JsonProperty("delay_ms") Integer delayMs,
        @JsonProperty("viewport_width") Integer viewportWidth, @JsonProperty("viewport_height") Integer viewportHeight,
        @JsonProperty("device_scale_factor") Double deviceScaleFactor,
        @JsonProperty("skip_tls_verify") Boolean skipTlsVerify, @JsonProperty("browser_path") String browserPath,
        @JsonProperty("headless") Boolean headless, @JsonProperty("no_sandbox") Boolean noSandbox,
        @JsonProperty("disable_gpu") Boolean disableGpu) {

    /**
     * Values returned to tenants that have not saved settings yet.
     */
    public static RendererConfigType defaults() {
        return new RendererConfigType(null, 60000, 5000, 1920, 1080, 2.0, true, null, true, true, true);
    }
}
