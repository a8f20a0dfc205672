package villagecompute.reports.integration.render;

import java.util.Optional;

/**
 * Supplies the bearer token the renderer presents to the dashboard host on behalf of a tenant.
 */
public interface CredentialProvider {

    /**
     * @return a token for {@code orgId}, or empty when this strategy has none
     */
    Optional<String> resolveToken(long orgId);

    String name();

    /**
     * Resolves a token or fails.
     *
     * @throws MissingCredentialsException
     *             when no token is available
     */
    default String requireToken(long orgId) {
        return resolveToken(orgId).filter(token -> !token.isBlank())
                .orElseThrow(() -> new MissingCredentialsException("no service account token available"));
    }
}
