package ru.petrov.odata_mcp.model.discovery;

/**
 * Строка плоской таблицы соответствий: одна строка на пару (сущность, свойство).
 */
public record MappingRow(
        String serviceId,
        String serviceName,
        String entityName,
        String entitySet,
        String propertyName,
        String propertyType,
        boolean isKey,
        boolean nullable,
        Integer maxLength,
        String capabilitiesSummary
) {}
