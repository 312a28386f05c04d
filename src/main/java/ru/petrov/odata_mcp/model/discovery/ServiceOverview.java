package ru.petrov.odata_mcp.model.discovery;

import ru.petrov.odata_mcp.model.catalog.CategoryTag;

import java.util.Set;

public record ServiceOverview(
        String id,
        String title,
        String description,
        int entityCount,
        Set<CategoryTag> categories
) {}
