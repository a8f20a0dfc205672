package villagecompute.reports.integration.render;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Remembers the most recent bearer token seen on API requests per tenant.
 *
 * <p>
 * Populated by {@link villagecompute.reports.api.filters.BearerTokenCaptureFilter}; lets renders triggered shortly
 * after user activity reuse that user's access.
 */
@ApplicationScoped
public class RequestCredentialProvider implements CredentialProvider {

    private static final Logger LOG = Logger.getLogger(RequestCredentialProvider.class);

    private final Map<Long, String> tokens = new ConcurrentHashMap<>();

    public void capture(long orgId, String token) {
        if (token == null || token.isBlank()) {
            return;
        }
        if (!token.equals(tokens.put(orgId, token))) {
            LOG.debugf("Captured request token for org %d", orgId);
        }
    }

    public void forget(long orgId) {
        tokens.remove(orgId);
    }

    @Override
    public Optional<String> resolveToken(long orgId) {
        return Optional.ofNullable(tokens.get(orgId));
    }

    @Override
    public String name() {
        return "request";
    }
}
