/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.services;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reports.data.models.TenantSettings;
import villagecompute.reports.integration.render.RenderBackend;
import villagecompute.reports.integration.render.RenderBackendFactory;

/**
 * Per-tenant cache of settings and render backends.
 *
 * <p>
 * <b>Consistency:</b> a single read/write lock guards both maps. Lookups take the read lock; misses, population and
 * invalidation take the write lock, so a tenant's settings and renderer are always dropped together and concurrent
 * misses for one tenant read the store once. There is no TTL: entries live until {@link #invalidate(long)} (called
 * after every settings write) or {@link #closeAll()}.
 *
 * <p>
 * Tenants without stored settings are not cached; each lookup for them goes to the store again.
 */
@ApplicationScoped
public class TenantCache {

    private static final Logger LOG = Logger.getLogger(TenantCache.class);

    @Inject
    ReportStore store;

    @Inject
    RenderBackendFactory rendererFactory;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Long, TenantSettings> settingsByOrg = new HashMap<>();
    private final Map<Long, RenderBackend> renderersByOrg = new HashMap<>();

    /**
     * Returns the tenant's settings, reading the store on a miss.
     *
     * @return settings, or {@code null} if the tenant has none stored
     * @throws RuntimeException
     *             whatever the store raised; nothing is cached in that case
     */
    public TenantSettings getSettings(long orgId) {
        lock.readLock().lock();
        try {
            TenantSettings cached = settingsByOrg.get(orgId);
            if (cached != null) {
                return cached;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            return currentSettings(orgId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the tenant's renderer, creating it on first use from the settings current at that moment.
     *
     * <p>
     * The settings are resolved under the write lock, so a renderer is never built from settings that an
     * {@link #invalidate(long)} has already dropped.
     *
     * @throws IllegalStateException
     *             if the tenant has no stored settings
     * @throws RuntimeException
     *             if the store or the factory fails; nothing is cached in that case
     */
    public RenderBackend getRenderer(long orgId) {
        lock.readLock().lock();
        try {
            RenderBackend cached = renderersByOrg.get(orgId);
            if (cached != null) {
                return cached;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            RenderBackend cached = renderersByOrg.get(orgId);
            if (cached != null) {
                return cached;
            }
            TenantSettings settings = currentSettings(orgId);
            if (settings == null) {
                throw new IllegalStateException("no settings configured for org " + orgId);
            }
            RenderBackend created = rendererFactory.create(settings);
            renderersByOrg.put(orgId, created);
            return created;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops the tenant's settings and closes its renderer, if any. Close failures are logged.
     */
    public void invalidate(long orgId) {
        lock.writeLock().lock();
        try {
            settingsByOrg.remove(orgId);
            RenderBackend renderer = renderersByOrg.remove(orgId);
            if (renderer != null) {
                closeQuietly(orgId, renderer);
            }
            LOG.infof("Cleared renderer and settings cache for org %d", orgId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Closes every cached renderer and empties both maps.
     */
    public void closeAll() {
        lock.writeLock().lock();
        try {
            List<Long> orgs = new ArrayList<>(renderersByOrg.keySet());
            for (Long orgId : orgs) {
                closeQuietly(orgId, renderersByOrg.get(orgId));
            }
            renderersByOrg.clear();
            settingsByOrg.clear();
            LOG.infof("Closed %d cached renderers", orgs.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int cachedRendererCount() {
        lock.readLock().lock();
        try {
            return renderersByOrg.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // caller holds the write lock
    private TenantSettings currentSettings(long orgId) {
        TenantSettings cached = settingsByOrg.get(orgId);
        if (cached != null) {
            return cached;
        }
        Optional<TenantSettings> loaded = store.getSettings(orgId);
        loaded.ifPresent(settings -> settingsByOrg.put(orgId, settings));
        return loaded.orElse(null);
    }

    private static void closeQuietly(long orgId, RenderBackend renderer) {
        try {
            renderer.close();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to close %s renderer for org %d", renderer.name(), orgId);
        }
    }
}
