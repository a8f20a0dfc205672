/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.api.rest;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.mail.MessagingException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.reports.api.types.SettingsType;
import villagecompute.reports.api.types.SmtpConfigType;
import villagecompute.reports.exceptions.ValidationException;
import villagecompute.reports.services.SettingsService;

/**
 * Tenant settings endpoints. Saving settings drops the tenant's cached renderer.
 */
@Path("/api/settings")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Settings",
        description = "Per-tenant SMTP, renderer and limit settings")
public class SettingsResource {

    private static final Logger LOG = Logger.getLogger(SettingsResource.class);

    @Inject
    SettingsService settingsService;

    @GET
    @Operation(
            summary = "Get settings, or defaults when none are saved")
    public SettingsType get(@HeaderParam(TenantHeaders.ORG_ID) @DefaultValue("1") long orgId) {
        return SettingsType.fromEntity(settingsService.getSettings(orgId));
    }

    @POST
    @Operation(
            summary = "Save settings")
    public Response save(@HeaderParam(TenantHeaders.ORG_ID) @DefaultValue("1") long orgId, SettingsType request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("request body is required"))
                    .build();
        }
        try {
            return Response.ok(SettingsType.fromEntity(settingsService.updateSettings(orgId, request))).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @POST
    @Path("/cache/clear")
    @Operation(
            summary = "Drop cached settings and renderer")
    public Response clearCache(@HeaderParam(TenantHeaders.ORG_ID) @DefaultValue("1") long orgId) {
        settingsService.clearCache(orgId);
        return Response.ok(new StatusResponse("cleared")).build();
    }

    @POST
    @Path("/smtp/test")
    @Operation(
            summary = "Test an SMTP configuration")
    public Response testSmtp(SmtpConfigType smtp) {
        try {
            settingsService.testSmtp(smtp);
            return Response.ok(new SmtpTestResponse(true, "SMTP connection successful")).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (MessagingException e) {
            LOG.warnf("SMTP test against %s failed: %s", smtp.host(), e.getMessage());
            return Response.ok(new SmtpTestResponse(false, "SMTP test failed: " + e.getMessage())).build();
        }
    }

    public record SmtpTestResponse(boolean success, String message) {
    }

    public record StatusResponse(String status) {
    }

    public record ErrorResponse(String error) {
    }
}
