package villagecompute.reports.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.reports.jobs.ReportDispatcher;
import villagecompute.reports.services.ReportStore;
import villagecompute.reports.services.TenantCache;

/**
 * Registers gauges describing scheduler capacity and cache state.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li>{@code reports_slots_available} - free execution slots</li>
 * <li>{@code reports_dispatch_backlog} - dispatched jobs not yet finished (waiting or running)</li>
 * <li>{@code reports_cached_renderers} - live per-tenant render backends</li>
 * <li>{@code reports_write_queue_pending} - buffered store writes</li>
 * </ul>
 *
 * <p>
 * Counters and timers for runs, email and render duration are recorded by {@link ReportDispatcher}. Everything is
 * exported in Prometheus format at {@code /q/metrics}.
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    ReportDispatcher dispatcher;

    @Inject
    TenantCache tenantCache;

    @Inject
    ReportStore store;

    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        LOG.info("Registering report scheduler metrics");

        Gauge.builder("reports_slots_available", dispatcher, ReportDispatcher::availableSlots)
                .description("Free report execution slots").strongReference(true)
                .register(registry);

        Gauge.builder("reports_dispatch_backlog", dispatcher, ReportDispatcher::backlog)
                .description("Report jobs dispatched but not yet finished").strongReference(true)
                .register(registry);

        Gauge.builder("reports_cached_renderers", tenantCache, TenantCache::cachedRendererCount)
                .description("Per-tenant render backends currently cached").strongReference(true)
                .register(registry);

        Gauge.builder("reports_write_queue_pending", store, ReportStore::pendingWrites)
                .description("Store writes waiting for the single writer").strongReference(true)
                .register(registry);

        LOG.debug("Report scheduler metrics registered");
    }
}
