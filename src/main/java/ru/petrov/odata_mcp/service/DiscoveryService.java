package ru.petrov.odata_mcp.service;

import org.springframework.stereotype.Service;
import ru.petrov.odata_mcp.config.DiscoveryConfig;
import ru.petrov.odata_mcp.exception.ValidationException;
import ru.petrov.odata_mcp.model.catalog.CategoryTag;
import ru.petrov.odata_mcp.model.catalog.EntityDefinition;
import ru.petrov.odata_mcp.model.catalog.PropertyDefinition;
import ru.petrov.odata_mcp.model.catalog.ServiceCatalog;
import ru.petrov.odata_mcp.model.catalog.ServiceDefinition;
import ru.petrov.odata_mcp.model.discovery.Capabilities;
import ru.petrov.odata_mcp.model.discovery.DiscoveryResult;
import ru.petrov.odata_mcp.model.discovery.EntitySchema;
import ru.petrov.odata_mcp.model.discovery.MappingRow;
import ru.petrov.odata_mcp.model.discovery.MatchKind;
import ru.petrov.odata_mcp.model.discovery.MatchRecord;
import ru.petrov.odata_mcp.model.discovery.ServiceOverview;
import ru.petrov.odata_mcp.model.discovery.ServiceSummary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Поиск по каталогу: сервисы → сущности → свойства.
 * <p>
 * Поиск идет по уровням и останавливается на первом, который дал хоть одно совпадение:
 * 1. весь запрос как одна подстрока в запрошенной категории;
 * 2. запрос из нескольких слов: поле должно содержать каждое слово;
 * 3. категория не all: шаги 1 и 2 по всем категориям;
 * 4. запрос не пустой: все сервисы категории без учета запроса.
 * Найденное сортируется по релевантности и разворачивается в плоскую таблицу свойств.
 */
@Service
public class DiscoveryService {
    static final double SERVICE_ID_SCORE = 0.90;
    static final double SERVICE_TITLE_SCORE = 0.85;
    static final double SERVICE_DESCRIPTION_SCORE = 0.70;
    static final double CATEGORY_LISTING_SCORE = 0.50;
    static final double ENTITY_NAME_SCORE = 0.95;
    static final double PROPERTY_NAME_SCORE = 0.75;

    private final ServiceCatalog catalog;
    private final CategoryService categoryService;
    private final DiscoveryConfig config;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(DiscoveryService.class);

    public DiscoveryService(ServiceCatalog catalog, CategoryService categoryService, DiscoveryConfig config) {
        this.catalog = catalog;
        this.categoryService = categoryService;
        this.config = config;
    }

    /**
     * Поиск с постепенным ослаблением условий. "Ничего не найдено" не является ошибкой.
     *
     * @param query    Строка поиска, может быть пустой.
     * @param category Категория сервисов, пустое значение означает all.
     * @param limit    Сколько совпадений оставить (1..20), по умолчанию 10.
     * @return Таблица соответствий по всем свойствам оставшихся сущностей.
     */
    public DiscoveryResult discover(String query, String category, Integer limit) {
        CategoryTag requested = CategoryTag.fromValue(category);
        int effectiveLimit = resolveLimit(limit);
        String normalized = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        List<String> words = normalized.isEmpty() ? List.of() : Arrays.asList(normalized.split("\\s+"));

        CategoryTag actual = requested;
        boolean categoryFallback = false;
        boolean returnedAll = false;

        List<MatchRecord> matches = searchCategory(normalized, words, requested);

        if (matches.isEmpty() && requested != CategoryTag.ALL) {
            matches = searchCategory(normalized, words, CategoryTag.ALL);
            if (!matches.isEmpty()) {
                log.info("В категории '{}' ничего не найдено по '{}', поиск расширен до all", requested.value(), normalized);
                actual = CategoryTag.ALL;
                categoryFallback = true;
            }
        }

        if (matches.isEmpty() && !normalized.isEmpty()) {
            matches = listCategory(requested, "No matches for '" + normalized + "', showing every service in category '" + requested.value() + "'");
            if (matches.isEmpty() && requested != CategoryTag.ALL) {
                matches = listCategory(CategoryTag.ALL, "No matches for '" + normalized + "', showing every service");
                actual = CategoryTag.ALL;
                categoryFallback = true;
            }
            returnedAll = true;
            log.info("По запросу '{}' совпадений нет, возвращены все сервисы категории '{}': {}",
                    normalized, actual.value(), matches.size());
        }

        matches.sort(Comparator.comparingDouble(MatchRecord::score).reversed());
        int totalFound = matches.size();
        List<MatchRecord> retained = new ArrayList<>(matches.subList(0, Math.min(effectiveLimit, totalFound)));
        List<MappingRow> mappingTable = flatten(retained);

        log.info("Поиск '{}' [{}]: найдено {}, оставлено {}, строк в таблице {}",
                normalized, actual.value(), totalFound, retained.size(), mappingTable.size());

        String guidance = guidance(normalized, actual, totalFound, retained.size(), categoryFallback, returnedAll);
        return new DiscoveryResult(normalized.isEmpty() ? "all" : normalized, totalFound, actual,
                categoryFallback, returnedAll, retained, mappingTable, guidance);
    }

    /**
     * Уровни 1 и 2 внутри одной категории.
     */
    private List<MatchRecord> searchCategory(String query, List<String> words, CategoryTag category) {
        List<MatchRecord> combined = collect(query, field -> field.contains(query), category);
        if (!combined.isEmpty() || words.size() < 2) {
            return combined;
        }
        return collect(query, field -> words.stream().allMatch(field::contains), category);
    }

    private List<MatchRecord> collect(String query, Predicate<String> matcher, CategoryTag category) {
        List<MatchRecord> matches = new ArrayList<>();
        boolean hasQuery = !query.isEmpty();

        for (ServiceDefinition service : catalog.services()) {
            if (!categoryService.belongsTo(service, category)) {
                continue;
            }

            if (!hasQuery) {
                matches.add(MatchRecord.service(CATEGORY_LISTING_SCORE, service,
                        "Service in category '" + category.value() + "'"));
                continue;
            }

            double serviceScore = scoreService(service, matcher);
            if (serviceScore > 0) {
                matches.add(MatchRecord.service(serviceScore, service, "Service matches '" + query + "'"));
            }

            for (EntityDefinition entity : service.entityTypes()) {
                MatchRecord entityMatch = matchEntity(service, entity, matcher, query);
                if (entityMatch != null) {
                    matches.add(entityMatch);
                }
            }
        }
        return matches;
    }

    private double scoreService(ServiceDefinition service, Predicate<String> matcher) {
        if (matcher.test(lower(service.id()))) return SERVICE_ID_SCORE;
        if (matcher.test(lower(service.title()))) return SERVICE_TITLE_SCORE;
        if (matcher.test(lower(service.description()))) return SERVICE_DESCRIPTION_SCORE;
        return 0;
    }

    private MatchRecord matchEntity(ServiceDefinition service, EntityDefinition entity,
                                    Predicate<String> matcher, String query) {
        double score = matcher.test(lower(entity.name())) ? ENTITY_NAME_SCORE : 0;

        List<String> matchedProperties = new ArrayList<>();
        for (PropertyDefinition property : entity.properties()) {
            if (matcher.test(lower(property.name()))) {
                matchedProperties.add(property.name());
                if (score == 0) score = PROPERTY_NAME_SCORE;
            }
        }
        if (score == 0) {
            return null;
        }

        boolean byName = score >= ENTITY_NAME_SCORE;
        String reason = byName
                ? "Entity '" + entity.name() + "' matches '" + query + "'"
                : "Properties [" + String.join(", ", matchedProperties) + "] match '" + query + "'";
        return new MatchRecord(byName ? MatchKind.ENTITY : MatchKind.PROPERTY, score, service, entity, matchedProperties, reason);
    }

    private List<MatchRecord> listCategory(CategoryTag category, String reason) {
        List<MatchRecord> matches = new ArrayList<>();
        for (ServiceDefinition service : catalog.services()) {
            if (categoryService.belongsTo(service, category)) {
                matches.add(MatchRecord.service(CATEGORY_LISTING_SCORE, service, reason));
            }
        }
        return matches;
    }

    /**
     * Совпадение по сервису дает все его сущности, совпадение по сущности или свойству дает саму сущность.
     * Каждая сущность попадает в таблицу один раз и всегда со всеми свойствами.
     */
    private List<MappingRow> flatten(List<MatchRecord> matches) {
        List<MappingRow> rows = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (MatchRecord match : matches) {
            ServiceDefinition service = match.service();
            List<EntityDefinition> entities = match.entity() != null ? List.of(match.entity()) : service.entityTypes();
            for (EntityDefinition entity : entities) {
                if (!seen.add(service.id() + '\u0000' + entity.name())) {
                    continue;
                }
                String capabilities = entity.capabilitiesSummary();
                for (PropertyDefinition property : entity.properties()) {
                    rows.add(new MappingRow(service.id(), service.title(), entity.name(), entity.entitySet(),
                            property.name(), property.type(), entity.isKey(property.name()),
                            property.nullable(), property.maxLength(), capabilities));
                }
            }
        }
        return rows;
    }

    private int resolveLimit(Integer limit) {
        if (limit == null) {
            return config.defaultLimit();
        }
        if (limit < 0) {
            throw new ValidationException("Invalid limit: " + limit + ". Limit must be between 1 and " + config.maxLimit());
        }
        return Math.max(1, Math.min(limit, config.maxLimit()));
    }

    private String guidance(String query, CategoryTag category, int totalFound, int showing,
                            boolean categoryFallback, boolean returnedAll) {
        StringBuilder text = new StringBuilder();
        text.append("Found ").append(totalFound).append(" matches");
        if (!query.isEmpty()) text.append(" for \"").append(query).append('"');
        if (category != CategoryTag.ALL) text.append(" in category \"").append(category.value()).append('"');
        text.append(", showing ").append(showing).append('.');

        if (categoryFallback) {
            text.append("\nNothing matched in the requested category, results come from all categories.");
        }
        if (returnedAll) {
            text.append("\nNothing matched the query, every service is listed instead. Try different search terms or categories: ")
                    .append(CategoryTag.allowedValues()).append('.');
        }
        if (showing > 0) {
            text.append("\n\n== NEXT STEPS ==")
                    .append("\n1. The mapping table already lists every property of every returned entity.")
                    .append("\n2. To execute operations: call the execute tool with serviceId, entityName and operation.")
                    .append("\n3. Use 'serviceId' (NOT the service name) and 'entityName' (NOT the entity set) from the table.")
                    .append("\n4. Check capabilitiesSummary before create, update or delete.");
        } else {
            text.append("\n\n== SUGGESTION ==\nThe catalog is empty or the category holds no services.");
        }
        return text.toString();
    }

    /**
     * Сервис и краткое описание его сущностей.
     */
    public ServiceSummary describeService(String serviceId) {
        ServiceDefinition service = catalog.requireService(serviceId);
        List<ServiceSummary.EntitySummary> entities = service.entityTypes().stream()
                .map(e -> new ServiceSummary.EntitySummary(e.name(), e.entitySet(), e.keys(),
                        e.properties().size(), Capabilities.of(e)))
                .toList();
        String guidance = "Found " + entities.size() + " entities.\n\n== NEXT STEPS ==\n"
                + "1. Call discover with serviceId and entityName to get the full entity schema.\n"
                + "2. Use the 'name' field as entityName, never the 'entitySet' field.";
        return new ServiceSummary(service.id(), service.title(), service.description(), service.odataVersion(),
                categoryService.categoriesOf(service.id()), entities, guidance);
    }

    /**
     * Полная схема сущности со всеми свойствами.
     */
    public EntitySchema describeEntity(String serviceId, String entityName) {
        ServiceDefinition service = catalog.requireService(serviceId);
        EntityDefinition entity = catalog.requireEntity(service, entityName);
        List<EntitySchema.PropertySchema> properties = entity.properties().stream()
                .map(p -> new EntitySchema.PropertySchema(p.name(), p.type(), p.nullable(), p.maxLength(), entity.isKey(p.name())))
                .toList();
        String guidance = "== NEXT STEPS ==\n"
                + "1. Use the execute tool to perform operations on this entity.\n"
                + "2. Pass keyProperties in 'parameters' for read-single, update and delete.\n"
                + "3. Check capabilities to see which operations are allowed.";
        return new EntitySchema(service.id(), service.title(), entity.name(), entity.entitySet(), entity.namespace(),
                Capabilities.of(entity), entity.keys(), properties, guidance);
    }

    /**
     * Обзор всех сервисов каталога.
     */
    public List<ServiceOverview> listServices() {
        return catalog.services().stream()
                .map(s -> new ServiceOverview(s.id(), s.title(), s.description(), s.entityTypes().size(),
                        categoryService.categoriesOf(s.id())))
                .toList();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
