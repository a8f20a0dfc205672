package villagecompute.reports.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Create/overwrite payload for a report schedule.
 *
 * <p>
 * Example:
 *
 * <pre>{@code
 * {
 *   "name": "Weekly ops",
 *   "dashboard_uid": "abc123",
 *   "dashboard_title": "Operations",
 *   "range_from": "now-7d",
 *   "range_to": "now",
 *   "interval_type": "weekly",
 *   "timezone": "Europe/London",
 *   "variables": [{"name": "env", "value": "prod"}, {"name": "env", "value": "staging"}],
 *   "recipients": {"to": ["ops@example.com"]},
 *   "email_subject": "{{schedule.name}} for {{timerange}}",
 *   "enabled": true
 * }
 * }</pre>
 */
public record ScheduleRequestType(@JsonProperty("name") @NotBlank(
        message = "Name is required") @Size(
                max = 200,
                message = "Name must not exceed 200 characters") String name,

        @JsonProperty("dashboard_uid") @NotBlank(
                message = "Dashboard UID is required") String dashboardUid,

        @JsonProperty("dashboard_title") String dashboardTitle,

        @JsonProperty("panel_ids") List<Long> panelIds,

        @JsonProperty("range_from") String rangeFrom,

        @JsonProperty("range_to") String rangeTo,

        @JsonProperty("interval_type") String intervalType,

        @JsonProperty("cron_expr") String cronExpr,

        @JsonProperty("timezone") String timezone,

        @JsonProperty("variables") List<@Valid DashboardVariableType> variables,

        @JsonProperty("recipients") @NotNull(
                message = "Recipients are required") RecipientsType recipients,

        @JsonProperty("email_subject") String emailSubject,

        @JsonProperty("email_body") String emailBody,

        @JsonProperty("enabled") Boolean enabled) {
}
