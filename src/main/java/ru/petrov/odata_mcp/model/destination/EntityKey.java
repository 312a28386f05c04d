package ru.petrov.odata_mcp.model.destination;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Значения ключевых свойств сущности в порядке объявления ключа.
 */
public record EntityKey(Map<String, String> values) {

    public EntityKey {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Entity key has no properties");
        }
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static EntityKey single(String property, String value) {
        return new EntityKey(Map.of(property, value));
    }

    public boolean isComposite() {
        return values.size() > 1;
    }

    /**
     * Ключ в виде для сообщений: одиночный как есть, составной как k1='v1',k2='v2'.
     */
    public String value() {
        if (!isComposite()) {
            return values.values().iterator().next();
        }
        return values.entrySet().stream()
                .map(e -> e.getKey() + "='" + e.getValue() + "'")
                .collect(Collectors.joining(","));
    }

    @Override
    public String toString() {
        return value();
    }
}
