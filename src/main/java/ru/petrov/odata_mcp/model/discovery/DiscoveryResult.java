package ru.petrov.odata_mcp.model.discovery;

import com.fasterxml.jackson.annotation.JsonIgnore;
import ru.petrov.odata_mcp.model.catalog.CategoryTag;

import java.util.List;

/**
 * Результат поиска. Клиенту отдается {@code mappingTable}, список совпадений нужен только внутри.
 *
 * @param totalFound           число совпадений до обрезки по limit
 * @param actualCategory       категория, в которой реально найдены результаты
 * @param usedCategoryFallback поиск пришлось расширить до категории all
 * @param returnedAllServices  ничего не найдено, возвращены все сервисы категории
 */
public record DiscoveryResult(
        String query,
        int totalFound,
        CategoryTag actualCategory,
        boolean usedCategoryFallback,
        boolean returnedAllServices,
        @JsonIgnore List<MatchRecord> matches,
        List<MappingRow> mappingTable,
        String guidanceText
) {}
