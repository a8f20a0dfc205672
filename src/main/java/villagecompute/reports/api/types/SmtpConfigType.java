package villagecompute.reports.api.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-tenant outbound SMTP settings.
 *
 * <p>
 * A tenant without SMTP settings still gets rendered artifacts; the run records that email was not attempted.
 */
public record SmtpConfigType(@JsonProperty("host") String host, @JsonProperty("port") Integer port,
        @JsonProperty("username") String username, @JsonProperty("password") String password,
        @JsonProperty("from") String from, @JsonProperty("use_tls") Boolean useTls,
        @JsonProperty("skip_tls_verify") Boolean skipTlsVerify) {

    public static final int DEFAULT_PORT = 587;

    @JsonIgnore
    public boolean isConfigured() {
        return host != null && !host.isBlank();
    }

    @JsonIgnore
    public int effectivePort() {
        return port == null || port <= 0 ? DEFAULT_PORT : port;
    }

    @JsonIgnore
    public boolean tlsEnabled() {
        return useTls == null || useTls;
    }

    @JsonIgnore
    public boolean tlsVerificationSkipped() {
        return Boolean.TRUE.equals(skipTlsVerify);
    }
}
