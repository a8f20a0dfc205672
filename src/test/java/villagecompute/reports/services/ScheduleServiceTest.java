/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.reports.api.types.RecipientsType;
import villagecompute.reports.api.types.ScheduleRequestType;
import villagecompute.reports.api.types.UsageLimitsType;
import villagecompute.reports.data.models.ReportSchedule;
import villagecompute.reports.data.models.TenantSettings;
import villagecompute.reports.exceptions.ResourceNotFoundException;
import villagecompute.reports.exceptions.ValidationException;
import villagecompute.reports.jobs.ReportDispatcher;

/**
 * Unit tests for {@link ScheduleService}.
 */
class ScheduleServiceTest {

    private static final Instant NEXT = Instant.parse("2025-01-16T00:00:00Z");

    @Mock
    ReportStore store;

    @Mock
    TenantCache tenantCache;

    @Mock
    NextRunCalculator nextRunCalculator;

    @Mock
    ReportDispatcher dispatcher;

    @InjectMocks
    ScheduleService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(nextRunCalculator.calculateNextRun(any(ReportSchedule.class))).thenReturn(NEXT);
        when(store.createSchedule(any())).thenAnswer(invocation -> {
            ReportSchedule schedule = invocation.getArgument(0);
            schedule.id = 5L;
            return schedule;
        });
    }

    private static ScheduleRequestType request(String interval, String cron, Boolean enabled, String... to) {
        return new ScheduleRequestType(" Weekly Ops ", "abc123", "Operations", null, null, null, interval, cron,
                "Europe/London", null, new RecipientsType(List.of(to), null, null), null, null, enabled);
    }

    @Test
    void testCreateAppliesDefaultsAndComputesNextRun() {
        ReportSchedule created = service.createSchedule(1L, 42L, request(null, null, null, "ops@example.com"));

        assertEquals(5L, created.id);
        assertEquals("Weekly Ops", created.name);
        assertEquals("now-7d", created.rangeFrom);
        assertEquals("now", created.rangeTo);
        assertEquals(ReportSchedule.INTERVAL_DAILY, created.intervalType);
        assertEquals(NextRunCalculator.DAILY_CRON, created.cronExpr);
        assertEquals(NEXT, created.nextRunAt);
        assertEquals(42L, created.ownerUserId);
        assertTrue(created.enabled);
    }

    @Test
    void testDisabledScheduleHasNoNextRun() {
        ReportSchedule created = service.createSchedule(1L, null, request("weekly", null, false, "ops@example.com"));

        assertEquals(NextRunCalculator.WEEKLY_CRON, created.cronExpr);
        assertNull(created.nextRunAt);
    }

    @Test
    void testRecipientOutsideWhitelistRejected() {
        TenantSettings settings = TenantSettings.defaults(1L);
        settings.limits = new UsageLimitsType(50, 25, 5, 30, List.of("*.example.com"));
        when(tenantCache.getSettings(1L)).thenReturn(settings);

        ValidationException e = assertThrows(ValidationException.class,
                () -> service.createSchedule(1L, null, request(null, null, null, "me@gmail.com")));

        assertEquals("email domain 'gmail.com' is not in the allowed domains list", e.getMessage());
        verify(store, never()).createSchedule(any());
    }

    @Test
    void testNoRecipientsRejected() {
        assertThrows(ValidationException.class, () -> service.createSchedule(1L, null, request(null, null, null)));
    }

    @Test
    void testInvalidCronRejected() {
        assertThrows(ValidationException.class,
                () -> service.createSchedule(1L, null, request("cron", "every tuesday", null, "ops@example.com")));
        assertThrows(ValidationException.class,
                () -> service.createSchedule(1L, null, request("cron", null, null, "ops@example.com")));
        verify(store, never()).createSchedule(any());
    }

    @Test
    void testUpdatePreservesOwnerAndCreation() {
        ReportSchedule existing = new ReportSchedule();
        existing.id = 5L;
        existing.orgId = 1L;
        existing.ownerUserId = 7L;
        existing.createdAt = Instant.parse("2024-12-01T00:00:00Z");
        when(store.getSchedule(1L, 5L)).thenReturn(Optional.of(existing));

        ReportSchedule updated = service.updateSchedule(1L, 5L, request("monthly", null, true, "ops@example.com"));

        assertSame(existing, updated);
        assertEquals(7L, updated.ownerUserId);
        assertEquals(Instant.parse("2024-12-01T00:00:00Z"), updated.createdAt);
        assertEquals(NextRunCalculator.MONTHLY_CRON, updated.cronExpr);
        verify(store).updateSchedule(existing);
    }

    @Test
    void testMissingScheduleIsNotFound() {
        when(store.getSchedule(1L, 99L)).thenReturn(Optional.empty());
        when(store.deleteSchedule(1L, 99L)).thenReturn(false);

        assertThrows(ResourceNotFoundException.class,
                () -> service.updateSchedule(1L, 99L, request(null, null, null, "ops@example.com")));
        assertThrows(ResourceNotFoundException.class, () -> service.deleteSchedule(1L, 99L));
        assertThrows(ResourceNotFoundException.class, () -> service.runNow(1L, 99L));
        assertThrows(ResourceNotFoundException.class, () -> service.listRuns(1L, 99L));
    }

    @Test
    void testRunNowDelegatesToDispatcher() {
        ReportSchedule existing = new ReportSchedule();
        existing.id = 5L;
        existing.orgId = 1L;
        when(store.getSchedule(1L, 5L)).thenReturn(Optional.of(existing));

        service.runNow(1L, 5L);

        verify(dispatcher).runNow(existing);
    }

    @Test
    void testRecalculateStoresFreshNextRun() {
        ReportSchedule existing = new ReportSchedule();
        existing.id = 5L;
        existing.orgId = 1L;
        existing.nextRunAt = Instant.parse("2020-01-01T00:00:00Z");
        when(store.getSchedule(1L, 5L)).thenReturn(Optional.of(existing));

        ReportSchedule result = service.recalculateNextRun(1L, 5L);

        assertEquals(NEXT, result.nextRunAt);
        verify(store).updateSchedule(existing);
    }
}
