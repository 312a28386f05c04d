package ru.petrov.odata_mcp.service;

import org.springframework.stereotype.Service;
import ru.petrov.odata_mcp.model.catalog.CategoryTag;
import ru.petrov.odata_mcp.model.catalog.ServiceCatalog;
import ru.petrov.odata_mcp.model.catalog.ServiceDefinition;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Распределение сервисов по тематическим категориям.
 * Категории считаются один раз при создании бина и дальше не меняются.
 */
@Service
public class CategoryService {
    private final Map<String, Set<CategoryTag>> categoriesByService;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(CategoryService.class);

    public CategoryService(ServiceCatalog catalog) {
        Map<String, Set<CategoryTag>> categories = new LinkedHashMap<>();
        for (ServiceDefinition service : catalog.services()) {
            categories.put(service.id(), categorize(service));
        }
        this.categoriesByService = Collections.unmodifiableMap(categories);
        log.info("Распределено по категориям сервисов: {}", categoriesByService.size());
    }

    /**
     * Ищет ключевые слова категорий в id, title и description сервиса.
     *
     * @return непустой набор; {ALL}, если ни одно ключевое слово не найдено
     */
    public static Set<CategoryTag> categorize(ServiceDefinition service) {
        String id = lower(service.id());
        String title = lower(service.title());
        String description = lower(service.description());

        EnumSet<CategoryTag> tags = EnumSet.noneOf(CategoryTag.class);
        for (CategoryTag tag : CategoryTag.values()) {
            for (String keyword : tag.keywords()) {
                if (id.contains(keyword) || title.contains(keyword) || description.contains(keyword)) {
                    tags.add(tag);
                    break;
                }
            }
        }
        if (tags.isEmpty()) {
            tags.add(CategoryTag.ALL);
        }
        return Collections.unmodifiableSet(tags);
    }

    public Set<CategoryTag> categoriesOf(String serviceId) {
        Set<CategoryTag> tags = categoriesByService.get(serviceId);
        return tags != null ? tags : Set.of(CategoryTag.ALL);
    }

    /**
     * Входит ли сервис в категорию. В категорию ALL входят все сервисы.
     */
    public boolean belongsTo(ServiceDefinition service, CategoryTag category) {
        return category == CategoryTag.ALL || categoriesOf(service.id()).contains(category);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
