package villagecompute.reports.api.types;

import java.time.Instant;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.reports.data.models.ReportRun;

/**
 * API representation of a run. Artifact bytes are served separately.
 */
@Schema(
        description = "One execution of a schedule")
public record RunType(@JsonProperty("id") Long id, @JsonProperty("schedule_id") Long scheduleId,
        @JsonProperty("org_id") Long orgId, @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt, @JsonProperty("status") String status,
        @JsonProperty("rendered_pages") int renderedPages, @JsonProperty("bytes") long bytes,
        @JsonProperty("checksum") String checksum, @JsonProperty("email_sent") boolean emailSent,
        @JsonProperty("email_error") String emailError, @JsonProperty("error_text") String errorText,
        @JsonProperty("created_at") Instant createdAt) {

    public static RunType fromEntity(ReportRun r) {
        return new RunType(r.id, r.scheduleId, r.orgId, r.startedAt, r.finishedAt, r.status, r.renderedPages, r.bytes,
                r.checksum, r.emailSent, r.emailError, r.errorText, r.createdAt);
    }
}
