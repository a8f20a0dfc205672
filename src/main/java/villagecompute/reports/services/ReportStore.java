/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.services;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.jboss.logging.Logger;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import jakarta.inject.Inject;
import villagecompute.reports.config.ReportsConfig;
import villagecompute.reports.data.models.ReportRun;
import villagecompute.reports.data.models.ReportSchedule;
import villagecompute.reports.data.models.TenantSettings;
import villagecompute.reports.exceptions.ResourceNotFoundException;

/**
 * Persistence engine for schedules, runs and tenant settings.
 *
 * <p>
 * <b>Writes</b> go through a single {@link WriteQueue}; each one runs in its own transaction on the queue's worker
 * thread and its result or exception is handed back to the caller synchronously. <b>Reads</b> bypass the queue and
 * run concurrently.
 *
 * <p>
 * <b>Write operations:</b>
 * <ul>
 * <li>{@link #createSchedule}, {@link #updateSchedule}, {@link #deleteSchedule} (cascades to runs)</li>
 * <li>{@link #updateScheduleTiming} for the dispatcher's next/last run bookkeeping</li>
 * <li>{@link #createRun}, {@link #updateRun}</li>
 * <li>{@link #upsertSettings}</li>
 * <li>{@link #deleteRunsStartedBefore} for history retention</li>
 * </ul>
 *
 * <p>
 * Entities returned by this store are detached snapshots; mutating them has no effect until passed back to a write
 * operation.
 */
@ApplicationScoped
public class ReportStore {

    private static final Logger LOG = Logger.getLogger(ReportStore.class);

    /** Run history page size. */
    public static final int RUN_HISTORY_LIMIT = 50;

    private static final Comparator<ReportSchedule> DUE_ORDER = Comparator
            .comparing((ReportSchedule s) -> s.nextRunAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(s -> s.id);

    @Inject
    ReportsConfig config;

    Clock clock = Clock.systemUTC();

    private WriteQueue writeQueue;

    @PostConstruct
    void start() {
        writeQueue = new WriteQueue("report-store-writer", config.writeQueueCapacity());
        writeQueue.start();
    }

    @PreDestroy
    void stop() {
        writeQueue.shutdown(config.shutdownGrace());
    }

    // ---------------------------------------------------------------- schedules

    /**
     * Inserts a schedule, assigning its id and creation timestamps.
     *
     * @return the same instance, now carrying its id
     */
    public ReportSchedule createSchedule(ReportSchedule schedule) {
        return writeQueue.submit("createSchedule", () -> QuarkusTransaction.requiringNew().call(() -> {
            Instant now = now();
            schedule.id = null;
            schedule.createdAt = now;
            schedule.updatedAt = now;
            schedule.persist();
            LOG.debugf("Created schedule %d for org %d", schedule.id, schedule.orgId);
            return schedule;
        }));
    }

    /**
     * Overwrites every mutable field of the schedule identified by (org, id).
     *
     * @throws ResourceNotFoundException
     *             if the schedule no longer exists
     */
    public void updateSchedule(ReportSchedule schedule) {
        writeQueue.execute("updateSchedule", () -> QuarkusTransaction.requiringNew().run(() -> {
            ReportSchedule managed = ReportSchedule.findByOrgAndId(schedule.orgId, schedule.id)
                    .orElseThrow(() -> ResourceNotFoundException.schedule(schedule.orgId, schedule.id));
            managed.copyFrom(schedule);
            managed.updatedAt = now();
            schedule.updatedAt = managed.updatedAt;
        }));
    }

    /**
     * Sets only {@code nextRunAt} and {@code lastRunAt} on the current row, leaving every user-editable field as
     * stored. A {@code null} argument leaves that field unchanged. A schedule that is disabled by now keeps a
     * {@code null} next run.
     *
     * @return the updated schedule, or empty if it no longer exists
     */
    public Optional<ReportSchedule> updateScheduleTiming(long orgId, long scheduleId, Instant nextRunAt,
            Instant lastRunAt) {
        return writeQueue.submit("updateScheduleTiming", () -> QuarkusTransaction.requiringNew().call(() -> {
            Optional<ReportSchedule> existing = ReportSchedule.findByOrgAndId(orgId, scheduleId);
            if (existing.isEmpty()) {
                return Optional.<ReportSchedule>empty();
            }
            ReportSchedule managed = existing.get();
            if (!managed.enabled) {
                managed.nextRunAt = null;
            } else if (nextRunAt != null) {
                managed.nextRunAt = nextRunAt;
            }
            if (lastRunAt != null) {
                managed.lastRunAt = lastRunAt;
            }
            managed.updatedAt = now();
            return Optional.of(managed);
        }));
    }

    /**
     * Deletes a schedule and all of its runs in one transaction.
     *
     * @return {@code false} if no such schedule existed
     */
    public boolean deleteSchedule(long orgId, long scheduleId) {
        return writeQueue.submit("deleteSchedule", () -> QuarkusTransaction.requiringNew().call(() -> {
            Optional<ReportSchedule> existing = ReportSchedule.findByOrgAndId(orgId, scheduleId);
            if (existing.isEmpty()) {
                return false;
            }
            long runs = ReportRun.deleteBySchedule(orgId, scheduleId);
            existing.get().delete();
            LOG.infof("Deleted schedule %d for org %d with %d runs", scheduleId, orgId, runs);
            return true;
        }));
    }

    // ---------------------------------------------------------------- runs

    /**
     * Inserts a run. A run without a status starts as {@code running}.
     */
    public ReportRun createRun(ReportRun run) {
        return writeQueue.submit("createRun", () -> QuarkusTransaction.requiringNew().call(() -> {
            run.id = null;
            if (run.status == null) {
                run.status = ReportRun.STATUS_RUNNING;
            }
            if (run.startedAt == null) {
                run.startedAt = now();
            }
            run.createdAt = now();
            run.persist();
            return run;
        }));
    }

    /**
     * Overwrites status, timing, artifact and delivery fields of an existing run.
     *
     * @throws ResourceNotFoundException
     *             if the run no longer exists (its schedule was deleted)
     * @throws IllegalStateException
     *             if the update would move a finished run back to {@code running}
     */
    public void updateRun(ReportRun run) {
        writeQueue.execute("updateRun", () -> QuarkusTransaction.requiringNew().run(() -> {
            ReportRun managed = ReportRun.findByOrgAndId(run.orgId, run.id)
                    .orElseThrow(() -> ResourceNotFoundException.run(run.orgId, run.id));
            if (managed.isTerminal() && ReportRun.STATUS_RUNNING.equals(run.status)) {
                throw new IllegalStateException("Run " + run.id + " is already " + managed.status);
            }
            managed.status = run.status;
            managed.finishedAt = run.finishedAt;
            managed.errorText = run.errorText;
            managed.renderedPages = run.renderedPages;
            managed.bytes = run.bytes;
            managed.checksum = run.checksum;
            managed.artifactData = run.artifactData;
            managed.emailSent = run.emailSent;
            managed.emailError = run.emailError;
        }));
    }

    /**
     * Deletes finished runs of {@code orgId} that started before {@code cutoff}. Runs still in progress are kept.
     *
     * <p>
     * Start times are compared as parsed instants so rows written with older timestamp layouts are aged correctly;
     * rows whose start time cannot be parsed are kept.
     *
     * @return number of deleted runs
     */
    public long deleteRunsStartedBefore(long orgId, Instant cutoff) {
        return writeQueue.submit("deleteRunsStartedBefore", () -> QuarkusTransaction.requiringNew().call(() -> {
            List<Long> expired = new ArrayList<>();
            for (Object[] row : ReportRun.findFinishedStartTimes(orgId)) {
                Instant startedAt = (Instant) row[1];
                if (startedAt != null && startedAt.isBefore(cutoff)) {
                    expired.add((Long) row[0]);
                }
            }
            if (expired.isEmpty()) {
                return 0L;
            }
            return ReportRun.deleteByOrgAndIds(orgId, expired);
        }));
    }

    // ---------------------------------------------------------------- settings

    /**
     * Inserts the tenant's settings, or replaces SMTP, renderer and limit settings if a row exists.
     *
     * @return the stored settings
     */
    public TenantSettings upsertSettings(TenantSettings settings) {
        return writeQueue.submit("upsertSettings", () -> QuarkusTransaction.requiringNew().call(() -> {
            Instant now = now();
            Optional<TenantSettings> existing = TenantSettings.findByOrg(settings.orgId);
            if (existing.isPresent()) {
                TenantSettings managed = existing.get();
                managed.smtpConfig = settings.smtpConfig;
                managed.rendererConfig = settings.rendererConfig;
                managed.limits = settings.limits;
                managed.updatedAt = now;
                return managed;
            }
            settings.id = null;
            settings.createdAt = now;
            settings.updatedAt = now;
            settings.persist();
            return settings;
        }));
    }

    // ---------------------------------------------------------------- reads

    @ActivateRequestContext
    public Optional<ReportSchedule> getSchedule(long orgId, long scheduleId) {
        return ReportSchedule.findByOrgAndId(orgId, scheduleId);
    }

    @ActivateRequestContext
    public List<ReportSchedule> listSchedules(long orgId) {
        return ReportSchedule.findByOrg(orgId);
    }

    /**
     * Enabled schedules whose next run is unset or not after {@code now}, oldest first.
     *
     * <p>
     * Filtering happens on parsed instants so rows written with older timestamp layouts compare correctly.
     */
    @ActivateRequestContext
    public List<ReportSchedule> getDueSchedules(Instant now) {
        List<ReportSchedule> due = new ArrayList<>();
        for (ReportSchedule schedule : ReportSchedule.findEnabled()) {
            if (schedule.nextRunAt == null || !schedule.nextRunAt.isAfter(now)) {
                due.add(schedule);
            }
        }
        due.sort(DUE_ORDER);
        return due;
    }

    @ActivateRequestContext
    public Optional<ReportRun> getRun(long orgId, long runId) {
        return ReportRun.findByOrgAndId(orgId, runId);
    }

    /**
     * Newest-first run history without artifact bytes.
     */
    @ActivateRequestContext
    public List<ReportRun> listRuns(long orgId, long scheduleId) {
        List<ReportRun> runs = ReportRun.findRecent(orgId, scheduleId, RUN_HISTORY_LIMIT);
        List<ReportRun> summaries = new ArrayList<>(runs.size());
        for (ReportRun run : runs) {
            summaries.add(summaryOf(run));
        }
        return summaries;
    }

    @ActivateRequestContext
    public Optional<TenantSettings> getSettings(long orgId) {
        return TenantSettings.findByOrg(orgId);
    }

    @ActivateRequestContext
    public List<TenantSettings> listTenantSettings() {
        return TenantSettings.listAllTenants();
    }

    public int pendingWrites() {
        return writeQueue.pending();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static ReportRun summaryOf(ReportRun run) {
        ReportRun summary = new ReportRun();
        summary.id = run.id;
        summary.scheduleId = run.scheduleId;
        summary.orgId = run.orgId;
        summary.startedAt = run.startedAt;
        summary.finishedAt = run.finishedAt;
        summary.status = run.status;
        summary.renderedPages = run.renderedPages;
        summary.bytes = run.bytes;
        summary.checksum = run.checksum;
        summary.emailSent = run.emailSent;
        summary.emailError = run.emailError;
        summary.errorText = run.errorText;
        summary.createdAt = run.createdAt;
        return summary;
    }
}
