/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.services;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.mail.MessagingException;
import villagecompute.reports.api.types.SettingsType;
import villagecompute.reports.api.types.SmtpConfigType;
import villagecompute.reports.data.models.TenantSettings;
import villagecompute.reports.exceptions.ValidationException;

/**
 * Reads and writes tenant settings and keeps the tenant cache coherent with them.
 *
 * <p>
 * Every successful write invalidates the tenant's cached settings and renderer, so the next run builds a renderer
 * from the new values.
 */
@ApplicationScoped
public class SettingsService {

    private static final Logger LOG = Logger.getLogger(SettingsService.class);

    @Inject
    ReportStore store;

    @Inject
    TenantCache tenantCache;

    @Inject
    ReportMailer mailer;

    /**
     * Stored settings, or defaults (not persisted) for a tenant that has saved none.
     */
    public TenantSettings getSettings(long orgId) {
        return store.getSettings(orgId).orElseGet(() -> TenantSettings.defaults(orgId));
    }

    public TenantSettings updateSettings(long orgId, SettingsType request) {
        SmtpConfigType smtp = request.smtpConfig();
        if (smtp != null && !smtp.isConfigured()) {
            smtp = null;
        }
        if (smtp != null && (smtp.from() == null || smtp.from().isBlank())) {
            throw new ValidationException("SMTP from address is required");
        }

        TenantSettings settings = new TenantSettings();
        settings.orgId = orgId;
        settings.smtpConfig = smtp;
        settings.rendererConfig = request.rendererConfig();
        settings.limits = request.limits();

        TenantSettings stored = store.upsertSettings(settings);
        tenantCache.invalidate(orgId);
        LOG.infof("Updated settings for org %d (smtp configured=%s)", orgId, smtp != null);
        return stored;
    }

    public void clearCache(long orgId) {
        tenantCache.invalidate(orgId);
    }

    /**
     * Verifies that an SMTP server accepts a connection with the given settings.
     *
     * @throws ValidationException
     *             if host, port or from address is missing
     * @throws MessagingException
     *             if the connection or authentication fails
     */
    public void testSmtp(SmtpConfigType smtp) throws MessagingException {
        if (smtp == null || !smtp.isConfigured() || smtp.port() == null || smtp.port() <= 0 || smtp.from() == null
                || smtp.from().isBlank()) {
            throw new ValidationException("SMTP host, port, and from address are required");
        }
        mailer.testConnection(smtp);
    }
}
