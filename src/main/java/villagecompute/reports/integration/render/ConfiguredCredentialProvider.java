package villagecompute.reports.integration.render;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reports.config.ReportsConfig;

/**
 * Background service-account token from {@code reports.renderer.service-account-token} (bound to
 * {@code GF_PLUGIN_APP_CLIENT_SECRET} by default), shared by all tenants.
 */
@ApplicationScoped
public class ConfiguredCredentialProvider implements CredentialProvider {

    @Inject
    ReportsConfig config;

    @Override
    public Optional<String> resolveToken(long orgId) {
        return config.serviceAccountToken();
    }

    @Override
    public String name() {
        return "service-account";
    }
}
