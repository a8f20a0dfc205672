/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.integration.render;

import villagecompute.reports.data.models.ReportSchedule;

/**
 * Produces a PDF of a dashboard.
 *
 * <p>
 * One backend instance is cached per tenant and may be asked to render several schedules concurrently. Implementations
 * must be safe to {@link #close()} more than once.
 */
public interface RenderBackend extends AutoCloseable {

    /**
     * Renders the schedule's dashboard, including its time range and variables.
     *
     * @param schedule
     *            what to render
     * @param credentials
     *            source of the bearer token sent to the dashboard host
     * @return PDF bytes, always starting with {@code %PDF-}
     * @throws MissingCredentialsException
     *             if no token is available; raised before any browser work
     * @throws LoginPageDetectedException
     *             if the host answered with a login page instead of the dashboard
     * @throws RenderException
     *             on navigation, timeout or print failures
     */
    byte[] renderDashboard(ReportSchedule schedule, CredentialProvider credentials);

    /**
     * Releases the browser process and any temporary files.
     */
    @Override
    void close();

    String name();
}
