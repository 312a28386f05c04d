package ru.petrov.odata_mcp.model.discovery;

import ru.petrov.odata_mcp.model.catalog.EntityDefinition;
import ru.petrov.odata_mcp.model.catalog.ServiceDefinition;

import java.util.List;

/**
 * Одно совпадение поиска. Для совпадения уровня сервиса {@code entity} равен null.
 *
 * @param matchedProperties имена свойств, совпавших с запросом (для сущностей)
 */
public record MatchRecord(
        MatchKind kind,
        double score,
        ServiceDefinition service,
        EntityDefinition entity,
        List<String> matchedProperties,
        String reason
) {
    public MatchRecord {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score out of range [0,1]: " + score);
        }
        matchedProperties = matchedProperties == null ? List.of() : List.copyOf(matchedProperties);
    }

    public static MatchRecord service(double score, ServiceDefinition service, String reason) {
        return new MatchRecord(MatchKind.SERVICE, score, service, null, List.of(), reason);
    }
}
