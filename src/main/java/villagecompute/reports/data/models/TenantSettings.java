/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.data.models;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import villagecompute.reports.api.types.RendererConfigType;
import villagecompute.reports.api.types.SmtpConfigType;
import villagecompute.reports.api.types.UsageLimitsType;
import villagecompute.reports.util.UtcTimestampConverter;

/**
 * Per-tenant SMTP, renderer and limit settings. At most one row per org.
 */
@Entity
@Table(
        name = "tenant_settings")
public class TenantSettings extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    public Long id;

    @Column(
            name = "org_id",
            nullable = false,
            unique = true)
    public Long orgId;

    /** Null when the tenant has not configured email delivery. */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(
            name = "smtp_config")
    public SmtpConfigType smtpConfig;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(
            name = "renderer_config")
    public RendererConfigType rendererConfig;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(
            name = "limits")
    public UsageLimitsType limits;

    @Convert(
            converter = UtcTimestampConverter.class)
    @Column(
            name = "created_at",
            nullable = false,
            length = 64)
    public Instant createdAt;

    @Convert(
            converter = UtcTimestampConverter.class)
    @Column(
            name = "updated_at",
            nullable = false,
            length = 64)
    public Instant updatedAt;

    public static Optional<TenantSettings> findByOrg(long orgId) {
        return find("orgId", orgId).firstResultOptional();
    }

    public static List<TenantSettings> listAllTenants() {
        return list("order by orgId");
    }

    /**
     * Settings shown to tenants that have not saved any: no SMTP, default renderer and limits.
     */
    public static TenantSettings defaults(long orgId) {
        TenantSettings settings = new TenantSettings();
        settings.orgId = orgId;
        settings.rendererConfig = RendererConfigType.defaults();
        settings.limits = UsageLimitsType.defaults();
        return settings;
    }

    public UsageLimitsType effectiveLimits() {
        return limits == null ? UsageLimitsType.defaults() : limits;
    }

    public RendererConfigType effectiveRendererConfig() {
        return rendererConfig == null ? RendererConfigType.defaults() : rendererConfig;
    }
}
