package ru.petrov.odata_mcp.model.discovery;

import ru.petrov.odata_mcp.model.catalog.CategoryTag;

import java.util.List;
import java.util.Set;

/**
 * Сервис и краткое описание его сущностей (режим serviceId без entityName).
 */
public record ServiceSummary(
        String id,
        String title,
        String description,
        String odataVersion,
        Set<CategoryTag> categories,
        List<EntitySummary> entities,
        String guidanceText
) {
    public record EntitySummary(
            String name,
            String entitySet,
            List<String> keyProperties,
            int propertyCount,
            Capabilities capabilities
    ) {}
}
