package ru.petrov.odata_mcp.model.discovery;

/**
 * Тело запроса на поиск. serviceId и entityName включают режим прямого доступа.
 */
public record DiscoveryRequest(
        String query,
        String category,
        Integer limit,
        String serviceId,
        String entityName
) {}
