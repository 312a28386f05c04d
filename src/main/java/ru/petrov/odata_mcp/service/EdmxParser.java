package ru.petrov.odata_mcp.service;

import org.springframework.stereotype.Component;
import ru.petrov.odata_mcp.config.CatalogConfig;
import ru.petrov.odata_mcp.model.catalog.EntityDefinition;
import ru.petrov.odata_mcp.model.catalog.PropertyDefinition;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Разбор документа $metadata (EDMX) для OData V2 и V4.
 * <p>
 * Из V2 читаются атрибуты sap:creatable / sap:updatable / sap:deletable набора сущностей,
 * из V4 аннотации Capabilities.V1 внутри EntitySet. Если ограничений нет, запись разрешена.
 */
@Component
public class EdmxParser {
    static final String SAP_NAMESPACE = "http://www.sap.com/Protocols/SAPData";

    private final CatalogConfig config;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(EdmxParser.class);

    public EdmxParser(CatalogConfig config) {
        this.config = config;
    }

    /**
     * @param odataVersion "V2" для EDMX 1.0, "V4" для EDMX 4.0
     */
    public record EdmxDocument(String odataVersion, List<EntityDefinition> entityTypes) {}

    public EdmxDocument parse(InputStream is) throws XMLStreamException {
        XMLInputFactory factory = XMLInputFactory.newInstance();
        // Отключаем внешние сущности для безопасности
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        XMLStreamReader reader = factory.createXMLStreamReader(is);

        String odataVersion = "V2";
        Map<String, TypeBuilder> types = new LinkedHashMap<>();
        Map<String, SetInfo> setsByType = new LinkedHashMap<>();

        String namespace = null;
        String alias = null;
        TypeBuilder currentType = null;
        SetInfo currentSet = null;
        String currentTerm = null;
        boolean inKey = false;

        try {
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.START_ELEMENT) {
                    switch (reader.getLocalName()) {
                        case "Edmx" -> odataVersion = "4.0".equals(reader.getAttributeValue(null, "Version")) ? "V4" : "V2";
                        case "Schema" -> {
                            namespace = reader.getAttributeValue(null, "Namespace");
                            alias = reader.getAttributeValue(null, "Alias");
                        }
                        case "EntityType" -> {
                            // Нашли начало описания типа сущности
                            currentType = new TypeBuilder(reader.getAttributeValue(null, "Name"), namespace, alias);
                            types.put(namespace + "." + currentType.name, currentType);
                        }
                        case "Key" -> inKey = currentType != null;
                        case "PropertyRef" -> {
                            if (inKey) currentType.keys.add(reader.getAttributeValue(null, "Name"));
                        }
                        case "Property" -> {
                            if (currentType != null) currentType.properties.add(readProperty(reader));
                        }
                        case "EntitySet" -> {
                            currentSet = new SetInfo(reader.getAttributeValue(null, "Name"));
                            currentSet.creatable = sapFlag(reader, "creatable");
                            currentSet.updatable = sapFlag(reader, "updatable");
                            currentSet.deletable = sapFlag(reader, "deletable");
                            setsByType.putIfAbsent(reader.getAttributeValue(null, "EntityType"), currentSet);
                        }
                        case "Annotation" -> currentTerm = reader.getAttributeValue(null, "Term");
                        case "PropertyValue" -> {
                            if (currentSet != null && currentTerm != null) applyCapability(reader, currentTerm, currentSet);
                        }
                        default -> {
                        }
                    }
                } else if (event == XMLStreamConstants.END_ELEMENT) {
                    switch (reader.getLocalName()) {
                        case "EntityType" -> currentType = null;
                        case "Key" -> inKey = false;
                        case "EntitySet" -> currentSet = null;
                        case "Annotation" -> currentTerm = null;
                        default -> {
                        }
                    }
                }
            }
        } finally {
            reader.close();
        }

        List<EntityDefinition> entities = new ArrayList<>();
        for (Map.Entry<String, TypeBuilder> entry : types.entrySet()) {
            TypeBuilder type = entry.getValue();
            SetInfo set = setsByType.get(entry.getKey());
            if (set == null && type.alias != null) {
                set = setsByType.get(type.alias + "." + type.name);
            }
            EntityDefinition entity = toEntity(type, set);
            if (entity != null) {
                entities.add(entity);
            }
        }
        log.info("Парсинг завершен. Версия OData: {}, найдено сущностей: {}", odataVersion, entities.size());
        return new EdmxDocument(odataVersion, entities);
    }

    private EntityDefinition toEntity(TypeBuilder type, SetInfo set) {
        if (set == null) {
            log.debug("Тип {} пропущен: нет набора сущностей", type.name);
            return null;
        }
        if (type.keys.isEmpty()) {
            log.debug("Тип {} пропущен: нет ключа", type.name);
            return null;
        }
        List<String> undeclared = type.keys.stream()
                .filter(key -> type.properties.stream().noneMatch(p -> p.name().equals(key)))
                .toList();
        if (!undeclared.isEmpty()) {
            log.warn("Тип {} пропущен: ключ {} не объявлен среди свойств", type.name, undeclared);
            return null;
        }
        // Фильтрация сущностей (черный список по вхождению подстроки)
        if (config.excludeEntities().stream().anyMatch(type.name::contains)) {
            return null;
        }
        // Фильтрация полей, ключевые поля не исключаются
        List<PropertyDefinition> properties = type.properties.stream()
                .filter(p -> type.keys.contains(p.name()) || !config.excludeFields().contains(p.name()))
                .toList();
        return new EntityDefinition(type.name, set.name, type.namespace, type.keys, properties,
                set.creatable, set.updatable, set.deletable);
    }

    private static PropertyDefinition readProperty(XMLStreamReader reader) {
        String nullable = reader.getAttributeValue(null, "Nullable");
        String maxLength = reader.getAttributeValue(null, "MaxLength");
        Integer length = null;
        if (maxLength != null && !maxLength.isEmpty() && maxLength.chars().allMatch(Character::isDigit)) {
            length = Integer.valueOf(maxLength);
        }
        return new PropertyDefinition(
                reader.getAttributeValue(null, "Name"),
                reader.getAttributeValue(null, "Type"),
                !"false".equalsIgnoreCase(nullable),
                length);
    }

    private static boolean sapFlag(XMLStreamReader reader, String name) {
        return !"false".equalsIgnoreCase(reader.getAttributeValue(SAP_NAMESPACE, name));
    }

    private static void applyCapability(XMLStreamReader reader, String term, SetInfo set) {
        String property = reader.getAttributeValue(null, "Property");
        boolean allowed = !"false".equalsIgnoreCase(reader.getAttributeValue(null, "Bool"));
        if (term.endsWith("InsertRestrictions") && "Insertable".equals(property)) {
            set.creatable = allowed;
        } else if (term.endsWith("UpdateRestrictions") && "Updatable".equals(property)) {
            set.updatable = allowed;
        } else if (term.endsWith("DeleteRestrictions") && "Deletable".equals(property)) {
            set.deletable = allowed;
        }
    }

    private static final class TypeBuilder {
        final String name;
        final String namespace;
        final String alias;
        final List<String> keys = new ArrayList<>();
        final List<PropertyDefinition> properties = new ArrayList<>();

        TypeBuilder(String name, String namespace, String alias) {
            this.name = name;
            this.namespace = namespace;
            this.alias = alias;
        }
    }

    private static final class SetInfo {
        final String name;
        boolean creatable = true;
        boolean updatable = true;
        boolean deletable = true;

        SetInfo(String name) {
            this.name = name;
        }
    }
}
