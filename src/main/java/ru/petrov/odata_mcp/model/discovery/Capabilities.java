package ru.petrov.odata_mcp.model.discovery;

import ru.petrov.odata_mcp.model.catalog.EntityDefinition;

public record Capabilities(boolean readable, boolean creatable, boolean updatable, boolean deletable) {

    public static Capabilities of(EntityDefinition entity) {
        return new Capabilities(true, entity.creatable(), entity.updatable(), entity.deletable());
    }
}
