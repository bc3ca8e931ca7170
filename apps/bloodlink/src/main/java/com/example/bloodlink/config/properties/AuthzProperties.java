package com.example.bloodlink.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.authz")
public record AuthzProperties(
        AuditProperties audit,
        MetricsProperties metrics
) {
    public AuthzProperties {
        if (audit == null) {
            audit = new AuditProperties(true, true);
        }
        if (metrics == null) {
            metrics = new MetricsProperties(true);
        }
    }

    /**
     * @param enabled    write one AUTHZ_AUDIT line per decision
     * @param logAllowed include ALLOW decisions; denials are always written when enabled
     */
    public record AuditProperties(
            boolean enabled,
            boolean logAllowed
    ) {}

    public record MetricsProperties(
            boolean enabled
    ) {}
}
