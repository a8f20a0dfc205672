package villagecompute.reports.api.rest;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.reports.api.types.RunType;
import villagecompute.reports.data.models.ReportRun;
import villagecompute.reports.data.models.ReportSchedule;
import villagecompute.reports.exceptions.ResourceNotFoundException;
import villagecompute.reports.services.ScheduleService;
import villagecompute.reports.util.ReportFilenames;

/**
 * Run details and PDF download.
 */
@Path("/api/runs")
@Tag(
        name = "Runs",
        description = "Report run history")
public class RunResource {

    @Inject
    ScheduleService scheduleService;

    @GET
    @Path("/{id}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Get run")
    public Response get(@HeaderParam(TenantHeaders.ORG_ID) @DefaultValue("1") long orgId, @PathParam("id") long id) {
        try {
            return Response.ok(RunType.fromEntity(scheduleService.getRun(orgId, id))).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).type(MediaType.APPLICATION_JSON)
                    .entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @GET
    @Path("/{id}/artifact")
    @Produces({"application/pdf", MediaType.APPLICATION_JSON})
    @Operation(
            summary = "Download the rendered PDF")
    @APIResponses({@APIResponse(
            responseCode = "200",
            description = "PDF document"),
            @APIResponse(
                    responseCode = "404",
                    description = "Run not found or produced no artifact")})
    public Response artifact(@HeaderParam(TenantHeaders.ORG_ID) @DefaultValue("1") long orgId,
            @PathParam("id") long id) {
        try {
            ReportRun run = scheduleService.getRun(orgId, id);
            if (run.artifactData == null || run.artifactData.length == 0) {
                return Response.status(Response.Status.NOT_FOUND).type(MediaType.APPLICATION_JSON)
                        .entity(new ErrorResponse("run " + id + " has no artifact")).build();
            }
            ReportSchedule schedule = scheduleService.getSchedule(orgId, run.scheduleId);
            String filename = ReportFilenames.pdfFilename(schedule.name, run.startedAt);
            return Response.ok(run.artifactData, "application/pdf")
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"").build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).type(MediaType.APPLICATION_JSON)
                    .entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    public record ErrorResponse(String error) {
    }
}
