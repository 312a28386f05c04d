package ru.petrov.odata_mcp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Список сервисов, метаданные которых читаются при старте, и черные списки сущностей и полей.
 */
@ConfigurationProperties(prefix = "app.catalog")
public record CatalogConfig(
        List<ServiceEntry> services,
        List<String> excludeEntities,
        List<String> excludeFields
) {
    public CatalogConfig {
        services = services == null ? List.of() : List.copyOf(services);
        excludeEntities = excludeEntities == null ? List.of() : List.copyOf(excludeEntities);
        excludeFields = excludeFields == null ? List.of() : List.copyOf(excludeFields);
    }

    /**
     * @param url путь сервиса относительно destination (напр. /sap/opu/odata/sap/API_BUSINESS_PARTNER)
     */
    public record ServiceEntry(
            String id,
            String title,
            String description,
            String url,
            String version
    ) {}
}
