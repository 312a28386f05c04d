package ru.petrov.odata_mcp.model.catalog;

import ru.petrov.odata_mcp.model.operation.Operation;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Тип сущности OData вместе с возможностями записи.
 * Чтение разрешено всегда, поэтому флага readable нет.
 *
 * @param name       Имя типа сущности (используется как entityName в инструментах)
 * @param entitySet  Имя набора сущностей, по которому идут HTTP-запросы
 * @param namespace  Пространство имен схемы
 * @param keys       Ключевые свойства в порядке объявления, не пустой список
 * @param properties Все свойства сущности
 */
public record EntityDefinition(
        String name,
        String entitySet,
        String namespace,
        List<String> keys,
        List<PropertyDefinition> properties,
        boolean creatable,
        boolean updatable,
        boolean deletable
) {
    public EntityDefinition {
        keys = List.copyOf(keys);
        properties = List.copyOf(properties);
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("Entity '" + name + "' declares no key properties");
        }
        Set<String> names = properties.stream().map(PropertyDefinition::name).collect(Collectors.toSet());
        Set<String> unknown = new HashSet<>(keys);
        unknown.removeAll(names);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Entity '" + name + "' has key properties missing from its property list: " + unknown);
        }
    }

    public boolean isKey(String propertyName) {
        return keys.contains(propertyName);
    }

    /**
     * Разрешена ли операция по метаданным сущности.
     */
    public boolean allows(Operation operation) {
        return switch (operation) {
            case READ, READ_SINGLE -> true;
            case CREATE -> creatable;
            case UPDATE -> updatable;
            case DELETE -> deletable;
        };
    }

    /**
     * Краткая сводка возможностей: read=yes, create=yes, update=no, delete=no.
     */
    public String capabilitiesSummary() {
        return "read=yes, create=" + yesNo(creatable)
                + ", update=" + yesNo(updatable)
                + ", delete=" + yesNo(deletable);
    }

    private static String yesNo(boolean flag) {
        return flag ? "yes" : "no";
    }
}
