/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.api.rest;

import java.util.List;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.reports.api.types.RunType;
import villagecompute.reports.api.types.ScheduleRequestType;
import villagecompute.reports.api.types.ScheduleType;
import villagecompute.reports.data.models.ReportSchedule;
import villagecompute.reports.exceptions.DispatchRejectedException;
import villagecompute.reports.exceptions.ResourceNotFoundException;
import villagecompute.reports.exceptions.ValidationException;
import villagecompute.reports.services.ScheduleService;

/**
 * REST endpoints for report schedules.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/schedules} – list the tenant's schedules</li>
 * <li>{@code POST /api/schedules} – create a schedule</li>
 * <li>{@code GET /api/schedules/{id}} – read one schedule</li>
 * <li>{@code PUT /api/schedules/{id}} – overwrite a schedule</li>
 * <li>{@code DELETE /api/schedules/{id}} – delete a schedule and its runs</li>
 * <li>{@code POST /api/schedules/{id}/run} – run immediately</li>
 * <li>{@code POST /api/schedules/{id}/recalculate} – recompute the next run</li>
 * <li>{@code GET /api/schedules/{id}/runs} – newest 50 runs</li>
 * </ul>
 *
 * <p>
 * The tenant is taken from {@code X-Org-Id} and the acting user from {@code X-User-Id}.
 */
@Path("/api/schedules")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Schedules",
        description = "Scheduled dashboard report operations")
public class ScheduleResource {

    private static final Logger LOG = Logger.getLogger(ScheduleResource.class);

    @Inject
    ScheduleService scheduleService;

    @GET
    @Operation(
            summary = "List schedules")
    public List<ScheduleType> list(@HeaderParam(TenantHeaders.ORG_ID) @DefaultValue("1") long orgId) {
        return scheduleService.listSchedules(orgId).stream().map(ScheduleType::fromEntity).toList();
    }

    @POST
    @Operation(
            summary = "Create schedule")
    public Response create(@HeaderParam(TenantHeaders.ORG_ID) @DefaultValue("1") long orgId,
            @HeaderParam(TenantHeaders.USER_ID) Long userId, @Valid ScheduleRequestType request) {
        try {
            ReportSchedule created = scheduleService.createSchedule(orgId, userId, request);
            return Response.status(Response.Status.CREATED).entity(ScheduleType.fromEntity(created)).build();
        } catch (ValidationException e) {
            return badRequest(e);
        }
    }

    @GET
    @Path("/{id}")
    @Operation(
            summary = "Get schedule")
    public Response get(@HeaderParam(TenantHeaders.ORG_ID) @DefaultValue("1") long orgId, @PathParam("id") long id) {
        try {
            return Response.ok(ScheduleType.fromEntity(scheduleService.getSchedule(orgId, id))).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        }
    }

    @PUT
    @Path("/{id}")
    @Operation(
            summary = "Overwrite schedule")
    public Response update(@HeaderParam(TenantHeaders.ORG_ID) @DefaultValue("1") long orgId, @PathParam("id") long id,
            @Valid ScheduleRequestType request) {
        try {
            return Response.ok(ScheduleType.fromEntity(scheduleService.updateSchedule(orgId, id, request))).build();
        } catch (ValidationException e) {
            return badRequest(e);
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        }
    }

    @DELETE
    @Path("/{id}")
    @Operation(
            summary = "Delete schedule and its runs")
    public Response delete(@HeaderParam(TenantHeaders.ORG_ID) @DefaultValue("1") long orgId,
            @PathParam("id") long id) {
        try {
            scheduleService.deleteSchedule(orgId, id);
            return Response.noContent().build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        }
    }

    @POST
    @Path("/{id}/run")
    @Operation(
            summary = "Run schedule now")
    public Response runNow(@HeaderParam(TenantHeaders.ORG_ID) @DefaultValue("1") long orgId,
            @PathParam("id") long id) {
        try {
            scheduleService.runNow(orgId, id);
            return Response.accepted(new StatusResponse("started")).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        } catch (DispatchRejectedException e) {
            Response.Status status = e.getReason() == DispatchRejectedException.Reason.ALREADY_RUNNING
                    ? Response.Status.CONFLICT
                    : Response.Status.SERVICE_UNAVAILABLE;
            LOG.warnf("Manual run of schedule %d rejected: %s", id, e.getMessage());
            return Response.status(status).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @POST
    @Path("/{id}/recalculate")
    @Operation(
            summary = "Recalculate next run")
    public Response recalculate(@HeaderParam(TenantHeaders.ORG_ID) @DefaultValue("1") long orgId,
            @PathParam("id") long id) {
        try {
            return Response.ok(ScheduleType.fromEntity(scheduleService.recalculateNextRun(orgId, id))).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        }
    }

    @GET
    @Path("/{id}/runs")
    @Operation(
            summary = "List recent runs")
    public Response runs(@HeaderParam(TenantHeaders.ORG_ID) @DefaultValue("1") long orgId, @PathParam("id") long id) {
        try {
            List<RunType> runs = scheduleService.listRuns(orgId, id).stream().map(RunType::fromEntity).toList();
            return Response.ok(runs).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        }
    }

    private static Response badRequest(RuntimeException e) {
        return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
    }

    private static Response notFound(RuntimeException e) {
        return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
    }

    public record StatusResponse(String status) {
    }

    public record ErrorResponse(String error) {
    }
}
