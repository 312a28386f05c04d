package ru.petrov.odata_mcp.model.catalog;

import java.util.List;
import java.util.Optional;

/**
 * OData-сервис из каталога. Ищется только по {@code id}, {@code title} показывается людям.
 */
public record ServiceDefinition(
        String id,
        String title,
        String description,
        String url,
        String version,
        String odataVersion,
        List<EntityDefinition> entityTypes
) {
    public ServiceDefinition {
        title = title == null ? id : title;
        description = description == null ? "" : description;
        entityTypes = entityTypes == null ? List.of() : List.copyOf(entityTypes);
    }

    public Optional<EntityDefinition> findEntity(String entityName) {
        return entityTypes.stream().filter(e -> e.name().equals(entityName)).findFirst();
    }

    public List<String> entityNames() {
        return entityTypes.stream().map(EntityDefinition::name).toList();
    }
}
