package villagecompute.reports.api.types;

import java.time.Instant;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.reports.data.models.TenantSettings;

/**
 * Tenant settings as read and written over the API. {@code org_id} and {@code updated_at} are ignored on write.
 */
@Schema(
        description = "Per-tenant SMTP, renderer and limit settings")
public record SettingsType(@JsonProperty("org_id") Long orgId, @JsonProperty("smtp_config") SmtpConfigType smtpConfig,
        @JsonProperty("renderer_config") RendererConfigType rendererConfig,
        @JsonProperty("limits") UsageLimitsType limits, @JsonProperty("updated_at") Instant updatedAt) {

    public static SettingsType fromEntity(TenantSettings settings) {
        return new SettingsType(settings.orgId, settings.smtpConfig, settings.effectiveRendererConfig(),
                settings.effectiveLimits(), settings.updatedAt);
    }
}
