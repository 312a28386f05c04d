package ru.petrov.odata_mcp.model.discovery;

import java.util.List;

/**
 * Полная схема сущности (режим serviceId + entityName).
 */
public record EntitySchema(
        String serviceId,
        String serviceTitle,
        String name,
        String entitySet,
        String namespace,
        Capabilities capabilities,
        List<String> keyProperties,
        List<PropertySchema> properties,
        String guidanceText
) {
    public record PropertySchema(String name, String type, boolean nullable, Integer maxLength, boolean isKey) {}
}
