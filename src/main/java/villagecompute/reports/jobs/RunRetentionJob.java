/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.jobs;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reports.config.ReportsConfig;
import villagecompute.reports.data.models.TenantSettings;
import villagecompute.reports.services.ReportStore;

/**
 * Deletes finished runs (and their artifacts) older than each tenant's {@code retention_days}.
 *
 * <p>
 * Runs daily at 03:15 UTC. Tenants with a non-positive retention keep their history forever; tenants without stored
 * settings keep it as well. One tenant's failure does not stop the others.
 */
@ApplicationScoped
public class RunRetentionJob {

    private static final Logger LOG = Logger.getLogger(RunRetentionJob.class);

    @Inject
    ReportStore store;

    @Inject
    ReportsConfig config;

    @Inject
    MeterRegistry meterRegistry;

    Clock clock = Clock.systemUTC();

    @Scheduled(
            cron = "0 15 3 * * ?",
            identity = "report-run-retention")
    void scheduledCleanup() {
        if (!config.retentionEnabled()) {
            LOG.debug("Run retention disabled");
            return;
        }
        purgeExpiredRuns();
    }

    /**
     * @return total runs deleted across tenants
     */
    public long purgeExpiredRuns() {
        Instant now = clock.instant();
        long total = 0;
        for (TenantSettings settings : store.listTenantSettings()) {
            Integer days = settings.effectiveLimits().retentionDays();
            if (days == null || days <= 0) {
                continue;
            }
            Instant cutoff = now.minus(Duration.ofDays(days));
            try {
                long deleted = store.deleteRunsStartedBefore(settings.orgId, cutoff);
                if (deleted > 0) {
                    LOG.infof("Deleted %d runs older than %d days for org %d", deleted, days, settings.orgId);
                }
                total += deleted;
            } catch (RuntimeException e) {
                LOG.errorf(e, "Run retention failed for org %d", settings.orgId);
            }
        }
        Counter.builder("reports.retention.deleted.total").register(meterRegistry).increment(total);
        return total;
    }
}
