/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.config;

import java.time.Duration;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Runtime tuning for the report scheduler, write queue and renderer.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code reports.scheduler.max-concurrent} - execution slots shared by scheduled and manual runs</li>
 * <li>{@code reports.scheduler.max-attempts} - render attempts per run before it is marked failed</li>
 * <li>{@code reports.scheduler.backlog-limit} - dispatched-but-unfinished jobs before due schedules are deferred</li>
 * <li>{@code reports.scheduler.shutdown-grace} - how long shutdown waits for in-flight jobs</li>
 * <li>{@code reports.write-queue.capacity} - buffered write operations before submitters block</li>
 * <li>{@code reports.renderer.default-base-url} - dashboard host used when tenant settings carry none</li>
 * <li>{@code reports.renderer.service-account-token} - background credential for unattended renders</li>
 * <li>{@code reports.retention.enabled} - toggles the daily run history cleanup</li>
 * </ul>
 */
@ApplicationScoped
public class ReportsConfig {

    @ConfigProperty(
            name = "reports.scheduler.max-concurrent",
            defaultValue = "5")
    int maxConcurrent;

    @ConfigProperty(
            name = "reports.scheduler.max-attempts",
            defaultValue = "3")
    int maxAttempts;

    @ConfigProperty(
            name = "reports.scheduler.backlog-limit",
            defaultValue = "100")
    int backlogLimit;

    @ConfigProperty(
            name = "reports.scheduler.shutdown-grace",
            defaultValue = "30s")
    Duration shutdownGrace;

    @ConfigProperty(
            name = "reports.write-queue.capacity",
            defaultValue = "100")
    int writeQueueCapacity;

    @ConfigProperty(
            name = "reports.renderer.default-base-url",
            defaultValue = "http://localhost:3000")
    String defaultBaseUrl;

    @ConfigProperty(
            name = "reports.renderer.service-account-token")
    Optional<String> serviceAccountToken;

    @ConfigProperty(
            name = "reports.retention.enabled",
            defaultValue = "true")
    boolean retentionEnabled;

    public int maxConcurrent() {
        return Math.max(1, maxConcurrent);
    }

    public int maxAttempts() {
        return Math.max(1, maxAttempts);
    }

    public int backlogLimit() {
        return backlogLimit;
    }

    public Duration shutdownGrace() {
        return shutdownGrace;
    }

    public int writeQueueCapacity() {
        return Math.max(1, writeQueueCapacity);
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    public Optional<String> serviceAccountToken() {
        return serviceAccountToken.filter(token -> !token.isBlank());
    }

    public boolean retentionEnabled() {
        return retentionEnabled;
    }
}
