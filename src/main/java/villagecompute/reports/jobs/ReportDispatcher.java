/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.jobs;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.mail.MessagingException;
import villagecompute.reports.api.types.SmtpConfigType;
import villagecompute.reports.api.types.UsageLimitsType;
import villagecompute.reports.config.ReportsConfig;
import villagecompute.reports.data.models.ReportRun;
import villagecompute.reports.data.models.ReportSchedule;
import villagecompute.reports.data.models.TenantSettings;
import villagecompute.reports.exceptions.DispatchRejectedException;
import villagecompute.reports.integration.render.CredentialChain;
import villagecompute.reports.integration.render.MissingCredentialsException;
import villagecompute.reports.integration.render.RenderBackend;
import villagecompute.reports.observability.LoggingConfig;
import villagecompute.reports.services.NextRunCalculator;
import villagecompute.reports.services.ReportMailer;
import villagecompute.reports.services.ReportStore;
import villagecompute.reports.services.TenantCache;
import villagecompute.reports.util.ReportFilenames;
import villagecompute.reports.util.TemplateInterpolator;

/**
 * Minute-tick dispatcher and executor for scheduled reports.
 *
 * <p>
 * <b>Tick (every minute at second 0):</b>
 * <ol>
 * <li>load due schedules (enabled, next run unset or not in the future), oldest first</li>
 * <li>for each: compute and persist the next run <em>before</em> dispatching, so a schedule is never dispatched twice
 * for one occurrence; if that write fails the schedule is skipped this tick</li>
 * <li>hand the schedule to the job executor; the job waits for one of {@code max-concurrent} execution slots</li>
 * </ol>
 *
 * <p>
 * <b>Execution:</b> create a {@code running} run, make up to {@code max-attempts} attempts with {@code attempt²}
 * seconds of backoff between them, record the terminal status, then record {@code lastRunAt}. Each attempt renders,
 * persists the artifact, and only then tries email; delivery problems never fail a run.
 *
 * <p>
 * <b>Backpressure:</b> when dispatched-but-unfinished jobs reach {@code backlog-limit} the tick stops and leaves the
 * remaining schedules due (not advanced) for a later tick. Manual runs are rejected in that state.
 *
 * <p>
 * <b>Overlap:</b> a schedule has at most one execution in flight. A manual run for an in-flight schedule is rejected;
 * a scheduled occurrence that finds it in flight is coalesced (next run advanced, no second run).
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li>{@code reports.runs.total{status}}</li>
 * <li>{@code reports.email.total{result}}</li>
 * <li>{@code reports.render.duration}</li>
 * <li>{@code reports.dispatch.deferred.total}, {@code reports.dispatch.coalesced.total}</li>
 * </ul>
 */
@ApplicationScoped
public class ReportDispatcher {

    private static final Logger LOG = Logger.getLogger(ReportDispatcher.class);

    public static final String ORIGIN_SCHEDULED = "scheduled";
    public static final String ORIGIN_MANUAL = "manual";

    /** Sleeps between attempts; replaced in tests. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    @Inject
    ReportStore store;

    @Inject
    TenantCache tenantCache;

    @Inject
    NextRunCalculator nextRunCalculator;

    @Inject
    ReportMailer mailer;

    @Inject
    CredentialChain credentials;

    @Inject
    ReportsConfig config;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    Executor executor;

    Sleeper sleeper = duration -> Thread.sleep(duration.toMillis());

    Clock clock = Clock.systemUTC();

    private Semaphore slots;
    private final AtomicInteger backlog = new AtomicInteger();
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean stopped;

    @PostConstruct
    void init() {
        slots = new Semaphore(config.maxConcurrent(), true);
        if (executor == null) {
            executor = Executors.newCachedThreadPool(new ReportThreadFactory());
        }
        LOG.infof("Report dispatcher ready (slots=%d, attempts=%d, backlog limit=%d)", config.maxConcurrent(),
                config.maxAttempts(), config.backlogLimit());
    }

    @Scheduled(
            cron = "0 * * * * ?",
            identity = "report-dispatch-tick",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void tick() {
        try {
            dispatchDue();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Report dispatch tick failed");
        }
    }

    /**
     * Dispatches every due schedule, advancing each one's next run first.
     *
     * @return number of schedules handed to the executor
     */
    public int dispatchDue() {
        if (stopped) {
            return 0;
        }
        Instant now = clock.instant();
        List<ReportSchedule> due = store.getDueSchedules(now);
        if (due.isEmpty()) {
            LOG.debug("No schedules due");
            return 0;
        }
        LOG.infof("Found %d due schedules", due.size());

        int dispatched = 0;
        for (int i = 0; i < due.size(); i++) {
            ReportSchedule candidate = due.get(i);
            if (config.backlogLimit() > 0 && backlog.get() >= config.backlogLimit()) {
                int deferred = due.size() - i;
                LOG.warnf("Dispatch backlog at limit %d, deferring %d due schedules to a later tick",
                        config.backlogLimit(), deferred);
                Counter.builder("reports.dispatch.deferred.total").register(meterRegistry).increment(deferred);
                break;
            }

            ReportSchedule schedule;
            try {
                Optional<ReportSchedule> advanced = store.updateScheduleTiming(candidate.orgId, candidate.id,
                        nextRunCalculator.calculateNextRun(candidate), null);
                if (advanced.isEmpty()) {
                    LOG.warnf("Schedule %d was deleted before dispatch, skipping", candidate.id);
                    continue;
                }
                schedule = advanced.get();
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to advance next run of schedule %d, skipping this tick", candidate.id);
                continue;
            }
            if (!schedule.enabled) {
                LOG.infof("Schedule %d was disabled before dispatch, skipping", schedule.id);
                continue;
            }

            if (!inFlight.add(schedule.id)) {
                LOG.warnf("Schedule %d is still running, coalescing this occurrence (next run %s)", schedule.id,
                        schedule.nextRunAt);
                Counter.builder("reports.dispatch.coalesced.total").register(meterRegistry).increment();
                continue;
            }
            if (submit(schedule, ORIGIN_SCHEDULED)) {
                dispatched++;
            }
        }
        return dispatched;
    }

    /**
     * Runs a schedule now, outside its cadence, through the same slots and execution path. Does not change
     * {@code nextRunAt}.
     *
     * @throws DispatchRejectedException
     *             if the schedule is already running, the backlog is full, or the dispatcher is stopping
     */
    public void runNow(ReportSchedule schedule) {
        if (stopped) {
            throw new DispatchRejectedException(DispatchRejectedException.Reason.SHUTTING_DOWN,
                    "report dispatcher is shutting down");
        }
        if (config.backlogLimit() > 0 && backlog.get() >= config.backlogLimit()) {
            throw new DispatchRejectedException(DispatchRejectedException.Reason.BACKLOG_FULL,
                    "too many reports are queued, try again later");
        }
        if (!inFlight.add(schedule.id)) {
            throw new DispatchRejectedException(DispatchRejectedException.Reason.ALREADY_RUNNING,
                    "schedule " + schedule.id + " is already running");
        }
        if (!submit(schedule, ORIGIN_MANUAL)) {
            throw new DispatchRejectedException(DispatchRejectedException.Reason.SHUTTING_DOWN,
                    "report dispatcher is not accepting work");
        }
        LOG.infof("Manual run of schedule %d dispatched", schedule.id);
    }

    void onShutdown(@Observes ShutdownEvent event) {
        shutdown();
    }

    /**
     * Stops dispatching, waits up to the configured grace period for in-flight jobs, then closes every cached
     * renderer.
     */
    public void shutdown() {
        if (stopped) {
            return;
        }
        stopped = true;
        LOG.infof("Stopping report dispatcher (%d jobs in flight)", backlog.get());
        if (executor instanceof ExecutorService service) {
            service.shutdown();
            try {
                if (!service.awaitTermination(config.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                    LOG.warnf("%d report jobs still running after %s", backlog.get(), config.shutdownGrace());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        tenantCache.closeAll();
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    public int backlog() {
        return backlog.get();
    }

    public boolean isRunning(long scheduleId) {
        return inFlight.contains(scheduleId);
    }

    private boolean submit(ReportSchedule schedule, String origin) {
        backlog.incrementAndGet();
        try {
            executor.execute(() -> {
                try {
                    executeSchedule(schedule, origin);
                } finally {
                    backlog.decrementAndGet();
                    inFlight.remove(schedule.id);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            backlog.decrementAndGet();
            inFlight.remove(schedule.id);
            LOG.errorf(e, "Executor rejected schedule %d", schedule.id);
            return false;
        }
    }

    /**
     * Runs one execution of {@code schedule} to a terminal run status.
     */
    void executeSchedule(ReportSchedule schedule, String origin) {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Interrupted waiting for an execution slot, schedule %d not run", schedule.id);
            return;
        }

        Span span = tracer.spanBuilder("report.execute").setAttribute("org.id", String.valueOf(schedule.orgId))
                .setAttribute("schedule.id", String.valueOf(schedule.id)).setAttribute("origin", origin).startSpan();
        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setScheduleContext(schedule.orgId, schedule.id);
            LoggingConfig.setRequestOrigin(origin);

            ReportRun run = new ReportRun();
            run.scheduleId = schedule.id;
            run.orgId = schedule.orgId;
            run.status = ReportRun.STATUS_RUNNING;
            run.startedAt = now();
            try {
                run = store.createRun(run);
            } catch (RuntimeException e) {
                span.recordException(e);
                LOG.errorf(e, "Failed to create run for schedule %d", schedule.id);
                return;
            }
            LoggingConfig.setRunId(run.id);
            span.setAttribute("run.id", String.valueOf(run.id));
            LOG.infof("Executing schedule %d '%s' as run %d", schedule.id, schedule.name, run.id);

            AttemptOutcome outcome = executeWithRetry(schedule, run);

            run.finishedAt = now();
            if (outcome.isSuccess()) {
                run.status = ReportRun.STATUS_COMPLETED;
                run.errorText = null;
                LOG.infof("Run %d completed (%d bytes, email sent=%s)", run.id, run.bytes, run.emailSent);
            } else {
                run.status = ReportRun.STATUS_FAILED;
                run.errorText = outcome.error();
                span.setAttribute("error", outcome.error());
                LOG.errorf(outcome.cause(), "Run %d failed: %s", run.id, outcome.error());
            }
            span.setAttribute("status", run.status);
            try {
                store.updateRun(run);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to persist final status %s of run %d", run.status, run.id);
            }
            Counter.builder("reports.runs.total").tag("status", run.status).register(meterRegistry).increment();

            recordLastRun(schedule, run.startedAt);
        } finally {
            span.end();
            slots.release();
            LoggingConfig.clearMDC();
        }
    }

    AttemptOutcome executeWithRetry(ReportSchedule schedule, ReportRun run) {
        int maxAttempts = config.maxAttempts();
        AttemptOutcome outcome = null;
        int attempt = 1;
        for (; attempt <= maxAttempts; attempt++) {
            outcome = executeOnce(schedule, run);
            if (outcome.isSuccess()) {
                return outcome;
            }
            if (!outcome.isRetryable()) {
                break;
            }
            LOG.warnf("Attempt %d/%d for schedule %d failed: %s", attempt, maxAttempts, schedule.id, outcome.error());
            if (attempt < maxAttempts) {
                Duration backoff = Duration.ofSeconds((long) attempt * attempt);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        int reported = Math.min(attempt, maxAttempts);
        return new AttemptOutcome(outcome.kind(),
                String.format("attempt %d/%d for schedule %d: %s", reported, maxAttempts, schedule.id, outcome.error()),
                outcome.cause());
    }

    /**
     * One render-and-deliver attempt. Never throws.
     */
    AttemptOutcome executeOnce(ReportSchedule schedule, ReportRun run) {
        TenantSettings settings;
        try {
            settings = tenantCache.getSettings(schedule.orgId);
        } catch (RuntimeException e) {
            return AttemptOutcome.transientFailure("failed to load settings: " + e.getMessage(), e);
        }
        if (settings == null) {
            return AttemptOutcome.permanentFailure("no settings configured for org " + schedule.orgId, null);
        }

        RenderBackend renderer;
        try {
            renderer = tenantCache.getRenderer(schedule.orgId);
        } catch (RuntimeException e) {
            return AttemptOutcome.permanentFailure("failed to create renderer: " + e.getMessage(), e);
        }

        byte[] pdf;
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            pdf = renderer.renderDashboard(schedule, credentials);
        } catch (MissingCredentialsException e) {
            return AttemptOutcome.permanentFailure(e.getMessage(), e);
        } catch (RuntimeException e) {
            return AttemptOutcome.transientFailure("render failed: " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("reports.render.duration", "renderer", renderer.name()));
        }

        run.renderedPages = 1;
        run.bytes = pdf.length;
        run.checksum = sha256Hex(pdf);
        run.artifactData = pdf;
        try {
            store.updateRun(run);
        } catch (RuntimeException e) {
            return AttemptOutcome.transientFailure("failed to store artifact: " + e.getMessage(), e);
        }

        deliver(schedule, run, settings, pdf);
        return AttemptOutcome.success();
    }

    private void deliver(ReportSchedule schedule, ReportRun run, TenantSettings settings, byte[] pdf) {
        SmtpConfigType smtp = settings.smtpConfig;
        UsageLimitsType limits = settings.effectiveLimits();

        if (smtp == null || !smtp.isConfigured()) {
            run.emailSent = false;
            run.emailError = ReportRun.SMTP_NOT_CONFIGURED;
            recordEmail("skipped");
        } else if (exceedsAttachmentLimit(pdf.length, limits)) {
            run.emailSent = false;
            run.emailError = String.format("attachment of %d bytes exceeds the %d MB limit", pdf.length,
                    limits.maxAttachmentSizeMb());
            LOG.warnf("Not emailing run %d: %s", run.id, run.emailError);
            recordEmail("skipped");
        } else {
            Map<String, String> vars = TemplateInterpolator.variablesFor(schedule, run.startedAt);
            String filename = ReportFilenames.pdfFilename(schedule.name, clock.instant());
            try {
                mailer.sendReport(smtp, schedule.recipients, TemplateInterpolator.subject(schedule, vars),
                        TemplateInterpolator.body(schedule, vars), pdf, filename);
                run.emailSent = true;
                run.emailError = "";
                recordEmail("sent");
            } catch (MessagingException | RuntimeException e) {
                run.emailSent = false;
                run.emailError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                LOG.warnf(e, "Email delivery failed for run %d", run.id);
                recordEmail("failed");
            }
        }

        try {
            store.updateRun(run);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record email outcome of run %d", run.id);
        }
    }

    /**
     * Persists {@code lastRunAt} alone so edits made during the run survive.
     */
    private void recordLastRun(ReportSchedule dispatched, Instant startedAt) {
        try {
            if (store.updateScheduleTiming(dispatched.orgId, dispatched.id, null, startedAt).isEmpty()) {
                LOG.warnf("Schedule %d was deleted during its run, not recording last run", dispatched.id);
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record last run of schedule %d", dispatched.id);
        }
    }

    private void recordEmail(String result) {
        Counter.builder("reports.email.total").tag("result", result).register(meterRegistry).increment();
    }

    private static boolean exceedsAttachmentLimit(long bytes, UsageLimitsType limits) {
        Integer maxMb = limits.maxAttachmentSizeMb();
        return maxMb != null && maxMb > 0 && bytes > maxMb * 1024L * 1024L;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    static String sha256Hex(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final class ReportThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "report-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
