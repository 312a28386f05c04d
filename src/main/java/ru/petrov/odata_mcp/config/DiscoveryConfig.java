package ru.petrov.odata_mcp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.discovery")
public record DiscoveryConfig(
        @DefaultValue("10") int defaultLimit,
        @DefaultValue("20") int maxLimit
) {}
