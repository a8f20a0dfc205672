/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.data.models;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import villagecompute.reports.api.types.DashboardVariableType;
import villagecompute.reports.api.types.RecipientsType;
import villagecompute.reports.util.UtcTimestampConverter;

/**
 * A tenant's recurring instruction to render a dashboard to PDF and email it.
 *
 * <h2>Timing</h2>
 * <ul>
 * <li>{@code cronExpr} is a 5-field UNIX expression evaluated in {@code timezone}; when blank it is derived from
 * {@code intervalType} (daily {@code 0 0 * * *}, weekly {@code 0 0 * * 1}, monthly {@code 0 0 1 * *})</li>
 * <li>{@code nextRunAt} is non-null while enabled and null while disabled</li>
 * <li>{@code lastRunAt} is the start time of the most recent run, whatever its outcome</li>
 * </ul>
 *
 * <p>
 * All instants are stored as UTC text with second precision (see {@link UtcTimestampConverter}).
 *
 * <h2>Usage</h2>
 *
 * <pre>
 * {@code
 * Optional<ReportSchedule> schedule = ReportSchedule.findByOrgAndId(orgId, scheduleId);
 * List<ReportSchedule> all = ReportSchedule.findByOrg(orgId);
 * }
 * </pre>
 *
 * <p>
 * Instances handed out by the store are detached snapshots; changes are persisted only through the write queue.
 */
@Entity
@Table(
        name = "report_schedules",
        indexes = {@Index(
                name = "idx_report_schedules_org",
                columnList = "org_id"),
                @Index(
                        name = "idx_report_schedules_next_run",
                        columnList = "enabled, next_run_at")})
public class ReportSchedule extends PanacheEntityBase {

    public static final String INTERVAL_DAILY = "daily";
    public static final String INTERVAL_WEEKLY = "weekly";
    public static final String INTERVAL_MONTHLY = "monthly";
    public static final String INTERVAL_CRON = "cron";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    public Long id;

    @Column(
            name = "org_id",
            nullable = false)
    public Long orgId;

    @Column(
            nullable = false)
    public String name;

    @Column(
            name = "dashboard_uid",
            nullable = false)
    public String dashboardUid;

    @Column(
            name = "dashboard_title")
    public String dashboardTitle;

    /**
     * Optional panel subset. Kept for API compatibility; the renderer prints the whole dashboard.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(
            name = "panel_ids")
    public List<Long> panelIds = new ArrayList<>();

    @Column(
            name = "range_from",
            nullable = false)
    public String rangeFrom = "now-7d";

    @Column(
            name = "range_to",
            nullable = false)
    public String rangeTo = "now";

    @Column(
            name = "interval_type",
            nullable = false)
    public String intervalType = INTERVAL_DAILY;

    @Column(
            name = "cron_expr")
    public String cronExpr;

    /**
     * IANA zone name; unknown zones are evaluated as UTC.
     */
    @Column(
            nullable = false)
    public String timezone = "UTC";

    /**
     * Ordered dashboard variables; the same name may repeat.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(
            name = "variables")
    public List<DashboardVariableType> variables = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(
            name = "recipients",
            nullable = false)
    public RecipientsType recipients = new RecipientsType(List.of(), List.of(), List.of());

    @Column(
            name = "email_subject",
            length = 1000)
    public String emailSubject;

    @Column(
            name = "email_body",
            length = 10000)
    public String emailBody;

    @Column(
            nullable = false)
    public boolean enabled = true;

    @Convert(
            converter = UtcTimestampConverter.class)
    @Column(
            name = "last_run_at",
            length = 64)
    public Instant lastRunAt;

    @Convert(
            converter = UtcTimestampConverter.class)
    @Column(
            name = "next_run_at",
            length = 64)
    public Instant nextRunAt;

    @Column(
            name = "owner_user_id")
    public Long ownerUserId;

    @Convert(
            converter = UtcTimestampConverter.class)
    @Column(
            name = "created_at",
            nullable = false,
            length = 64)
    public Instant createdAt;

    @Convert(
            converter = UtcTimestampConverter.class)
    @Column(
            name = "updated_at",
            nullable = false,
            length = 64)
    public Instant updatedAt;

    public static Optional<ReportSchedule> findByOrgAndId(long orgId, long id) {
        return find("orgId = ?1 and id = ?2", orgId, id).firstResultOptional();
    }

    public static List<ReportSchedule> findByOrg(long orgId) {
        return list("orgId = ?1 order by createdAt desc, id desc", orgId);
    }

    public static List<ReportSchedule> findEnabled() {
        return list("enabled", true);
    }

    /**
     * Copies every user-editable and timing field from {@code source}. Identity and {@code createdAt} stay untouched.
     */
    public void copyFrom(ReportSchedule source) {
        this.name = source.name;
        this.dashboardUid = source.dashboardUid;
        this.dashboardTitle = source.dashboardTitle;
        this.panelIds = source.panelIds == null ? new ArrayList<>() : new ArrayList<>(source.panelIds);
        this.rangeFrom = source.rangeFrom;
        this.rangeTo = source.rangeTo;
        this.intervalType = source.intervalType;
        this.cronExpr = source.cronExpr;
        this.timezone = source.timezone;
        this.variables = source.variables == null ? new ArrayList<>() : new ArrayList<>(source.variables);
        this.recipients = source.recipients;
        this.emailSubject = source.emailSubject;
        this.emailBody = source.emailBody;
        this.enabled = source.enabled;
        this.lastRunAt = source.lastRunAt;
        this.nextRunAt = source.nextRunAt;
        this.ownerUserId = source.ownerUserId;
    }
}
