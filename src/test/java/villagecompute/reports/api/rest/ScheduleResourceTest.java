/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.api.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import jakarta.ws.rs.core.Response;
import villagecompute.reports.api.types.RecipientsType;
import villagecompute.reports.api.types.ScheduleRequestType;
import villagecompute.reports.api.types.ScheduleType;
import villagecompute.reports.data.models.ReportSchedule;
import villagecompute.reports.exceptions.DispatchRejectedException;
import villagecompute.reports.exceptions.ResourceNotFoundException;
import villagecompute.reports.exceptions.ValidationException;
import villagecompute.reports.services.ScheduleService;

/**
 * Unit tests for {@link ScheduleResource}.
 */
class ScheduleResourceTest {

    @Mock
    ScheduleService scheduleService;

    @InjectMocks
    ScheduleResource resource;

    private ScheduleRequestType request;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        request = new ScheduleRequestType("Ops", "abc", null, null, null, null, "daily", null, "UTC", null,
                new RecipientsType(List.of("ops@example.com"), null, null), null, null, true);
    }

    @Test
    void testCreateReturns201() {
        ReportSchedule created = new ReportSchedule();
        created.id = 9L;
        created.orgId = 1L;
        created.name = "Ops";
        when(scheduleService.createSchedule(eq(1L), eq(3L), any())).thenReturn(created);

        Response response = resource.create(1L, 3L, request);

        assertEquals(201, response.getStatus());
        assertEquals(9L, ((ScheduleType) response.getEntity()).id());
    }

    @Test
    void testCreateValidationErrorReturns400() {
        when(scheduleService.createSchedule(eq(1L), any(), any()))
                .thenThrow(new ValidationException("invalid cron expression: bad"));

        Response response = resource.create(1L, null, request);

        assertEquals(400, response.getStatus());
        assertEquals("invalid cron expression: bad",
                ((ScheduleResource.ErrorResponse) response.getEntity()).error());
    }

    @Test
    void testGetMissingReturns404() {
        when(scheduleService.getSchedule(1L, 5L)).thenThrow(ResourceNotFoundException.schedule(1L, 5L));

        assertEquals(404, resource.get(1L, 5L).getStatus());
    }

    @Test
    void testRunNowAccepted() {
        Response response = resource.runNow(1L, 5L);

        assertEquals(202, response.getStatus());
        assertEquals("started", ((ScheduleResource.StatusResponse) response.getEntity()).status());
    }

    @Test
    void testRunNowAlreadyRunningReturns409() {
        doThrow(new DispatchRejectedException(DispatchRejectedException.Reason.ALREADY_RUNNING, "busy"))
                .when(scheduleService).runNow(1L, 5L);

        assertEquals(409, resource.runNow(1L, 5L).getStatus());
    }

    @Test
    void testRunNowSaturatedReturns503() {
        doThrow(new DispatchRejectedException(DispatchRejectedException.Reason.BACKLOG_FULL, "queued"))
                .when(scheduleService).runNow(1L, 5L);

        Response response = resource.runNow(1L, 5L);

        assertEquals(503, response.getStatus());
        assertInstanceOf(ScheduleResource.ErrorResponse.class, response.getEntity());
    }

    @Test
    void testDeleteReturns204() {
        assertEquals(204, resource.delete(1L, 5L).getStatus());
    }
}
