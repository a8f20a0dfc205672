package villagecompute.reports.integration.render;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reports.config.ReportsConfig;
import villagecompute.reports.data.models.TenantSettings;

/**
 * Creates the render backend for a tenant from its renderer settings.
 */
@ApplicationScoped
public class RenderBackendFactory {

    private static final Logger LOG = Logger.getLogger(RenderBackendFactory.class);

    @Inject
    ReportsConfig config;

    /**
     * @throws IllegalArgumentException
     *             if the effective base URL is not an absolute URL
     */
    public RenderBackend create(TenantSettings settings) {
        RendererOptions options = RendererOptions.from(settings.effectiveRendererConfig(), config.defaultBaseUrl());
        DashboardUrlBuilder.validateBaseUrl(options.baseUrl());
        LOG.infof("Creating chromium renderer for org %d (base=%s)", settings.orgId, options.baseUrl());
        return new ChromiumRenderBackend(options);
    }
}
