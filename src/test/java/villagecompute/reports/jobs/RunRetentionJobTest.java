package villagecompute.reports.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.reports.api.types.UsageLimitsType;
import villagecompute.reports.config.ReportsConfig;
import villagecompute.reports.data.models.TenantSettings;
import villagecompute.reports.services.ReportStore;

/**
 * Unit tests for {@link RunRetentionJob}.
 */
class RunRetentionJobTest {

    private static final Instant NOW = Instant.parse("2025-03-01T03:15:00Z");

    @Mock
    ReportStore store;

    @Mock
    ReportsConfig config;

    @InjectMocks
    RunRetentionJob job;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        job.meterRegistry = new SimpleMeterRegistry();
        job.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    private static TenantSettings tenant(long orgId, Integer retentionDays) {
        TenantSettings settings = TenantSettings.defaults(orgId);
        settings.limits = new UsageLimitsType(50, 25, 5, retentionDays, List.of());
        return settings;
    }

    @Test
    void testDeletesRunsOlderThanEachTenantsRetention() {
        when(store.listTenantSettings()).thenReturn(List.of(tenant(1L, 30), tenant(2L, 7)));
        when(store.deleteRunsStartedBefore(1L, Instant.parse("2025-01-30T03:15:00Z"))).thenReturn(4L);
        when(store.deleteRunsStartedBefore(2L, Instant.parse("2025-02-22T03:15:00Z"))).thenReturn(1L);

        assertEquals(5L, job.purgeExpiredRuns());
    }

    @Test
    void testNonPositiveRetentionKeepsHistory() {
        when(store.listTenantSettings()).thenReturn(List.of(tenant(1L, 0)));

        assertEquals(0L, job.purgeExpiredRuns());
        verify(store, never()).deleteRunsStartedBefore(anyLong(), any());
    }

    @Test
    void testOneTenantFailureDoesNotStopOthers() {
        when(store.listTenantSettings()).thenReturn(List.of(tenant(1L, 30), tenant(2L, 30)));
        when(store.deleteRunsStartedBefore(eq(1L), any())).thenThrow(new IllegalStateException("locked"));
        when(store.deleteRunsStartedBefore(eq(2L), any())).thenReturn(3L);

        assertEquals(3L, job.purgeExpiredRuns());
    }

    @Test
    void testDisabledRetentionSkipsCleanup() {
        when(config.retentionEnabled()).thenReturn(false);

        job.scheduledCleanup();

        verify(store, never()).listTenantSettings();
    }
}
