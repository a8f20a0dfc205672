/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reports.api.types.RecipientsType;
import villagecompute.reports.api.types.ScheduleRequestType;
import villagecompute.reports.api.types.UsageLimitsType;
import villagecompute.reports.data.models.ReportRun;
import villagecompute.reports.data.models.ReportSchedule;
import villagecompute.reports.data.models.TenantSettings;
import villagecompute.reports.exceptions.ResourceNotFoundException;
import villagecompute.reports.exceptions.ValidationException;
import villagecompute.reports.jobs.ReportDispatcher;
import villagecompute.reports.util.RecipientDomainValidator;

/**
 * Schedule lifecycle: validated create/overwrite/delete, run history, manual runs and next-run recalculation.
 *
 * <p>
 * <b>Validation on write:</b>
 * <ul>
 * <li>recipients must be inside the tenant's domain whitelist and within its recipient limit (when the tenant has
 * settings)</li>
 * <li>an explicit cron expression, or interval type {@code cron}, must parse</li>
 * </ul>
 *
 * <p>
 * <b>Timing on write:</b> the effective cron expression is stored; enabled schedules get {@code nextRunAt} computed
 * from now, disabled ones get {@code null}.
 */
@ApplicationScoped
public class ScheduleService {

    private static final Logger LOG = Logger.getLogger(ScheduleService.class);

    @Inject
    ReportStore store;

    @Inject
    TenantCache tenantCache;

    @Inject
    NextRunCalculator nextRunCalculator;

    @Inject
    ReportDispatcher dispatcher;

    public List<ReportSchedule> listSchedules(long orgId) {
        return store.listSchedules(orgId);
    }

    public ReportSchedule getSchedule(long orgId, long scheduleId) {
        return store.getSchedule(orgId, scheduleId)
                .orElseThrow(() -> ResourceNotFoundException.schedule(orgId, scheduleId));
    }

    public ReportSchedule createSchedule(long orgId, Long userId, ScheduleRequestType request) {
        ReportSchedule schedule = new ReportSchedule();
        schedule.orgId = orgId;
        schedule.ownerUserId = userId;
        apply(schedule, request);
        validate(schedule);
        applyTiming(schedule);

        ReportSchedule created = store.createSchedule(schedule);
        LOG.infof("Created schedule %d '%s' for org %d (next run %s)", created.id, created.name, orgId,
                created.nextRunAt);
        return created;
    }

    /**
     * Overwrites a schedule's editable fields. Owner, creation time and last run are preserved.
     */
    public ReportSchedule updateSchedule(long orgId, long scheduleId, ScheduleRequestType request) {
        ReportSchedule schedule = getSchedule(orgId, scheduleId);
        apply(schedule, request);
        validate(schedule);
        applyTiming(schedule);

        store.updateSchedule(schedule);
        LOG.infof("Updated schedule %d for org %d (enabled=%s, next run %s)", scheduleId, orgId, schedule.enabled,
                schedule.nextRunAt);
        return schedule;
    }

    public void deleteSchedule(long orgId, long scheduleId) {
        if (!store.deleteSchedule(orgId, scheduleId)) {
            throw ResourceNotFoundException.schedule(orgId, scheduleId);
        }
    }

    /**
     * Starts an immediate run without touching {@code nextRunAt}.
     *
     * @throws villagecompute.reports.exceptions.DispatchRejectedException
     *             if the schedule is already running or the dispatcher is saturated
     */
    public void runNow(long orgId, long scheduleId) {
        dispatcher.runNow(getSchedule(orgId, scheduleId));
    }

    /**
     * Recomputes {@code nextRunAt} from now, e.g. after a timezone database update.
     */
    public ReportSchedule recalculateNextRun(long orgId, long scheduleId) {
        ReportSchedule schedule = getSchedule(orgId, scheduleId);
        applyTiming(schedule);
        store.updateSchedule(schedule);
        LOG.infof("Recalculated next run of schedule %d: %s", scheduleId, schedule.nextRunAt);
        return schedule;
    }

    public List<ReportRun> listRuns(long orgId, long scheduleId) {
        getSchedule(orgId, scheduleId);
        return store.listRuns(orgId, scheduleId);
    }

    public ReportRun getRun(long orgId, long runId) {
        return store.getRun(orgId, runId).orElseThrow(() -> ResourceNotFoundException.run(orgId, runId));
    }

    void validate(ReportSchedule schedule) {
        if (schedule.recipients == null || schedule.recipients.isEmpty()) {
            throw new ValidationException("at least one recipient is required");
        }

        TenantSettings settings = tenantCache.getSettings(schedule.orgId);
        if (settings != null) {
            UsageLimitsType limits = settings.effectiveLimits();
            RecipientDomainValidator.validate(schedule.recipients, limits.allowedDomains());
            RecipientDomainValidator.validateCount(schedule.recipients, limits.maxRecipients());
        }

        boolean cronInterval = ReportSchedule.INTERVAL_CRON.equals(schedule.intervalType);
        boolean hasExpression = schedule.cronExpr != null && !schedule.cronExpr.isBlank();
        if (cronInterval || hasExpression) {
            NextRunCalculator.validateCronExpression(schedule.cronExpr);
        }
    }

    private void applyTiming(ReportSchedule schedule) {
        schedule.cronExpr = NextRunCalculator.effectiveCronExpression(schedule.cronExpr, schedule.intervalType);
        schedule.nextRunAt = schedule.enabled ? nextRunCalculator.calculateNextRun(schedule) : null;
    }

    private static void apply(ReportSchedule schedule, ScheduleRequestType request) {
        schedule.name = request.name().trim();
        schedule.dashboardUid = request.dashboardUid().trim();
        schedule.dashboardTitle = request.dashboardTitle();
        schedule.panelIds = request.panelIds() == null ? new ArrayList<>() : new ArrayList<>(request.panelIds());
        schedule.rangeFrom = blankToDefault(request.rangeFrom(), "now-7d");
        schedule.rangeTo = blankToDefault(request.rangeTo(), "now");
        schedule.intervalType = blankToDefault(request.intervalType(), ReportSchedule.INTERVAL_DAILY)
                .toLowerCase(Locale.ROOT);
        schedule.cronExpr = request.cronExpr() == null ? null : request.cronExpr().trim();
        schedule.timezone = blankToDefault(request.timezone(), "UTC");
        schedule.variables = request.variables() == null ? new ArrayList<>() : new ArrayList<>(request.variables());
        schedule.recipients = request.recipients() == null
                ? new RecipientsType(List.of(), List.of(), List.of())
                : request.recipients();
        schedule.emailSubject = request.emailSubject();
        schedule.emailBody = request.emailBody();
        schedule.enabled = request.enabled() == null || request.enabled();
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
