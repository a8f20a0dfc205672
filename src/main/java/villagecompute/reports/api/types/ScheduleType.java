package villagecompute.reports.api.types;

import java.time.Instant;
import java.util.List;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.reports.data.models.ReportSchedule;

/**
 * API representation of a schedule.
 */
@Schema(
        description = "Recurring dashboard report")
public record ScheduleType(@JsonProperty("id") Long id, @JsonProperty("org_id") Long orgId,
        @JsonProperty("name") String name, @JsonProperty("dashboard_uid") String dashboardUid,
        @JsonProperty("dashboard_title") String dashboardTitle, @JsonProperty("panel_ids") List<Long> panelIds,
        @JsonProperty("range_from") String rangeFrom, @JsonProperty("range_to") String rangeTo,
        @JsonProperty("interval_type") String intervalType, @JsonProperty("cron_expr") String cronExpr,
        @JsonProperty("timezone") String timezone, @JsonProperty("variables") List<DashboardVariableType> variables,
        @JsonProperty("recipients") RecipientsType recipients, @JsonProperty("email_subject") String emailSubject,
        @JsonProperty("email_body") String emailBody, @JsonProperty("enabled") boolean enabled,
        @JsonProperty("last_run_at") Instant lastRunAt, @JsonProperty("next_run_at") Instant nextRunAt,
        @JsonProperty("owner_user_id") Long ownerUserId, @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    public static ScheduleType fromEntity(ReportSchedule s) {
        return new ScheduleType(s.id, s.orgId, s.name, s.dashboardUid, s.dashboardTitle, s.panelIds, s.rangeFrom,
                s.rangeTo, s.intervalType, s.cronExpr, s.timezone, s.variables, s.recipients, s.emailSubject,
                s.emailBody, s.enabled, s.lastRunAt, s.nextRunAt, s.ownerUserId, s.createdAt, s.updatedAt);
    }
}
