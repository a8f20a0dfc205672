/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.data.models;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import villagecompute.reports.util.UtcTimestampConverter;

/**
 * One execution of a {@link ReportSchedule}.
 *
 * <p>
 * Status moves {@code running} to {@code completed} or {@code failed} and never back. The rendered PDF is stored with
 * the run as soon as rendering succeeds, before email delivery is attempted, so it survives delivery failures.
 *
 * <p>
 * {@code emailSent}/{@code emailError} describe delivery independently of the run status: a run can be
 * {@code completed} with {@code emailSent=false}.
 */
@Entity
@Table(
        name = "report_runs",
        indexes = {@Index(
                name = "idx_report_runs_schedule",
                columnList = "org_id, schedule_id")})
public class ReportRun extends PanacheEntityBase {

    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    /** Recorded in {@code emailError} when the tenant has no SMTP settings. */
    public static final String SMTP_NOT_CONFIGURED = "SMTP not configured";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    public Long id;

    @Column(
            name = "schedule_id",
            nullable = false)
    public Long scheduleId;

    @Column(
            name = "org_id",
            nullable = false)
    public Long orgId;

    @Convert(
            converter = UtcTimestampConverter.class)
    @Column(
            name = "started_at",
            nullable = false,
            length = 64)
    public Instant startedAt;

    @Convert(
            converter = UtcTimestampConverter.class)
    @Column(
            name = "finished_at",
            length = 64)
    public Instant finishedAt;

    @Column(
            nullable = false,
            length = 16)
    public String status = STATUS_RUNNING;

    @Column(
            name = "rendered_pages")
    public int renderedPages;

    @Column(
            name = "bytes")
    public long bytes;

    /** Lowercase hex SHA-256 of {@link #artifactData}. */
    @Column(
            name = "checksum",
            length = 64)
    public String checksum;

    @Lob
    @Column(
            name = "artifact_data")
    public byte[] artifactData;

    @Column(
            name = "email_sent",
            nullable = false)
    public boolean emailSent;

    @Column(
            name = "email_error",
            length = 2000)
    public String emailError;

    @Column(
            name = "error_text",
            length = 4000)
    public String errorText;

    @Convert(
            converter = UtcTimestampConverter.class)
    @Column(
            name = "created_at",
            nullable = false,
            length = 64)
    public Instant createdAt;

    public boolean isTerminal() {
        return STATUS_COMPLETED.equals(status) || STATUS_FAILED.equals(status);
    }

    public static Optional<ReportRun> findByOrgAndId(long orgId, long id) {
        return find("orgId = ?1 and id = ?2", orgId, id).firstResultOptional();
    }

    /**
     * Newest-first run history of a schedule.
     */
    public static List<ReportRun> findRecent(long orgId, long scheduleId, int limit) {
        return find("orgId = ?1 and scheduleId = ?2 order by startedAt desc, id desc", orgId, scheduleId).page(0, limit)
                .list();
    }

    /**
     * Id and start time of every non-running run of a tenant, without loading artifacts.
     *
     * @return rows of {@code [Long id, Instant startedAt]}
     */
    public static List<Object[]> findFinishedStartTimes(long orgId) {
        return getEntityManager()
                .createQuery("select r.id, r.startedAt from ReportRun r where r.orgId = ?1 and r.status <> ?2",
                        Object[].class)
                .setParameter(1, orgId).setParameter(2, STATUS_RUNNING).getResultList();
    }

    public static long deleteByOrgAndIds(long orgId, List<Long> ids) {
        return delete("orgId = ?1 and id in ?2", orgId, ids);
    }

    public static long deleteBySchedule(long orgId, long scheduleId) {
        return delete("orgId = ?1 and scheduleId = ?2", orgId, scheduleId);
    }
}
