/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.integration.render;

import java.util.List;
import java.util.Optional;

import org.jboss.logging.Logger;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Tries credential strategies in order: the latest token captured from live requests, then the configured service
 * account token.
 */
@ApplicationScoped
public class CredentialChain implements CredentialProvider {

    private static final Logger LOG = Logger.getLogger(CredentialChain.class);

    @Inject
    RequestCredentialProvider requestCredentials;

    @Inject
    ConfiguredCredentialProvider configuredCredentials;

    private List<CredentialProvider> providers;

    @PostConstruct
    void init() {
        providers = List.of(requestCredentials, configuredCredentials);
    }

    CredentialChain withProviders(List<CredentialProvider> ordered) {
        this.providers = List.copyOf(ordered);
        return this;
    }

    @Override
    public Optional<String> resolveToken(long orgId) {
        for (CredentialProvider provider : providers) {
            Optional<String> token = provider.resolveToken(orgId).filter(t -> !t.isBlank());
            if (token.isPresent()) {
                LOG.debugf("Using %s credentials for org %d", provider.name(), orgId);
                return token;
            }
        }
        return Optional.empty();
    }

    @Override
    public String name() {
        return "chain";
    }
}
