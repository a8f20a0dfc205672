package villagecompute.reports.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-tenant limits applied to schedules and deliveries.
 *
 * <p>
 * {@code allowed_domains} entries are either exact domains ({@code example.com}) or wildcards
 * ({@code *.example.com}); an empty list allows every recipient domain.
 */
public record UsageLimitsType(@JsonProperty("max_recipients") Integer maxRecipients,
        @JsonProperty("max_attachment_size_mb") Integer maxAttachmentSizeMb,
        @JsonProperty("max_concurrent_renders") Integer maxConcurrentRenders,
        @JsonProperty("retention_days") Integer retentionDays,
        @JsonProperty("allowed_domains") List<String> allowedDomains) {

    public UsageLimitsType {
        allowedDomains = allowedDomains == null ? List.of() : List.copyOf(allowedDomains);
    }

    public static UsageLimitsType defaults() {
        return new UsageLimitsType(50, 25, 5, 30, List.of());
    }
}
