package ru.petrov.odata_mcp.client;

import ru.petrov.odata_mcp.model.destination.EntityKey;
import ru.petrov.odata_mcp.model.destination.EntityTarget;

import java.util.Map;

/**
 * Сетевые операции с набором сущностей OData. Ошибки удаленного сервиса пробрасываются как есть.
 */
public interface EntityClient {

    Object read(EntityTarget target, Map<String, Object> queryOptions);

    Object readOne(EntityTarget target, EntityKey key, Map<String, Object> queryOptions);

    Object create(EntityTarget target, Map<String, Object> payload);

    Object update(EntityTarget target, EntityKey key, Map<String, Object> payload);

    void delete(EntityTarget target, EntityKey key);
}
