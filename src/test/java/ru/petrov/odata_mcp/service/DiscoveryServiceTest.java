package ru.petrov.odata_mcp.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.petrov.odata_mcp.CatalogFixtures;
import ru.petrov.odata_mcp.config.DiscoveryConfig;
import ru.petrov.odata_mcp.exception.ErrorCode;
import ru.petrov.odata_mcp.exception.NotFoundException;
import ru.petrov.odata_mcp.exception.ValidationException;
import ru.petrov.odata_mcp.model.catalog.CategoryTag;
import ru.petrov.odata_mcp.model.catalog.ServiceCatalog;
import ru.petrov.odata_mcp.model.discovery.DiscoveryResult;
import ru.petrov.odata_mcp.model.discovery.EntitySchema;
import ru.petrov.odata_mcp.model.discovery.MappingRow;
import ru.petrov.odata_mcp.model.discovery.MatchKind;
import ru.petrov.odata_mcp.model.discovery.MatchRecord;
import ru.petrov.odata_mcp.model.discovery.ServiceOverview;
import ru.petrov.odata_mcp.model.discovery.ServiceSummary;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DiscoveryServiceTest {

    private DiscoveryService discoveryService;

    @BeforeEach
    void setUp() {
        ServiceCatalog catalog = CatalogFixtures.catalog();
        discoveryService = new DiscoveryService(catalog, new CategoryService(catalog), new DiscoveryConfig(10, 20));
    }

    @Test
    @DisplayName("Совпадение по свойству возвращает все свойства сущности")
    void propertyMatchExpandsToAllEntityProperties() {
        DiscoveryResult result = discoveryService.discover("email", null, null);

        assertEquals(1, result.totalFound());
        assertFalse(result.returnedAllServices());
        assertFalse(result.usedCategoryFallback());
        assertEquals(CategoryTag.ALL, result.actualCategory());

        MatchRecord match = result.matches().get(0);
        assertEquals(MatchKind.PROPERTY, match.kind());
        assertEquals(List.of("Email"), match.matchedProperties());

        List<MappingRow> rows = result.mappingTable();
        assertEquals(List.of("ID", "Name", "Email"), rows.stream().map(MappingRow::propertyName).toList());
        assertTrue(rows.stream().allMatch(r -> r.serviceId().equals("API_BP") && r.entityName().equals("Customer")));
        assertTrue(rows.get(0).isKey());
        assertFalse(rows.get(2).isKey());
        assertEquals("read=yes, create=yes, update=yes, delete=no", rows.get(0).capabilitiesSummary());
    }

    @Test
    void multiWordQueryFallsBackToSeparatedTerms() {
        DiscoveryResult result = discoveryService.discover("net total", null, null);

        assertEquals(1, result.totalFound());
        assertEquals("SalesOrder", result.matches().get(0).entity().name());
        assertEquals(List.of("TotalNetAmount"), result.matches().get(0).matchedProperties());
        assertFalse(result.returnedAllServices());
    }

    @Test
    @DisplayName("Пустая категория расширяется до all")
    void emptyCategoryFallsBackToAll() {
        DiscoveryResult result = discoveryService.discover("customer", "finance", null);

        assertTrue(result.usedCategoryFallback());
        assertFalse(result.returnedAllServices());
        assertEquals(CategoryTag.ALL, result.actualCategory());
        assertEquals(1, result.totalFound());
        assertEquals("Customer", result.matches().get(0).entity().name());
        assertTrue(result.guidanceText().contains("results come from all categories"));
    }

    @Test
    @DisplayName("После расширения до all срабатывает поиск по отдельным словам")
    void categoryFallbackUsesSeparatedTerms() {
        DiscoveryResult result = discoveryService.discover("net total", "finance", null);

        assertTrue(result.usedCategoryFallback());
        assertFalse(result.returnedAllServices());
        assertEquals(CategoryTag.ALL, result.actualCategory());
        assertEquals(1, result.totalFound());
        MatchRecord match = result.matches().get(0);
        assertEquals("SalesOrder", match.entity().name());
        assertEquals(MatchKind.PROPERTY, match.kind());
        assertEquals(List.of("TotalNetAmount"), match.matchedProperties());
    }

    @Test
    void singleWordIsNotSplitAfterCategoryFallback() {
        DiscoveryResult result = discoveryService.discover("nettotal", "finance", null);

        assertTrue(result.usedCategoryFallback());
        assertTrue(result.returnedAllServices());
        assertEquals(CategoryTag.ALL, result.actualCategory());
        assertEquals(3, result.totalFound());
    }

    @Test
    void unmatchedQueryListsEveryService() {
        DiscoveryResult result = discoveryService.discover("zzzznomatch", null, null);

        assertTrue(result.returnedAllServices());
        assertEquals(3, result.totalFound());
        assertEquals(Set.of("API_BP", "API_SALES_ORDER_SRV", "ZZ_MISC"),
                result.mappingTable().stream().map(MappingRow::serviceId).collect(Collectors.toSet()));
        assertEquals(16, result.mappingTable().size());
        assertTrue(result.guidanceText().contains("Try different search terms"));
    }

    @Test
    void unmatchedQueryKeepsRequestedCategory() {
        DiscoveryResult result = discoveryService.discover("zzz", "sales", null);

        assertTrue(result.returnedAllServices());
        assertFalse(result.usedCategoryFallback());
        assertEquals(CategoryTag.SALES, result.actualCategory());
        assertEquals(1, result.totalFound());
        assertEquals(8, result.mappingTable().size());
    }

    @Test
    @DisplayName("Равные оценки сохраняют порядок каталога")
    void sortIsStableAndEntitiesAreNotDuplicated() {
        DiscoveryResult result = discoveryService.discover("order", null, null);

        List<MatchRecord> matches = result.matches();
        assertEquals(3, matches.size());
        assertEquals("SalesOrder", matches.get(0).entity().name());
        assertEquals("SalesOrderItem", matches.get(1).entity().name());
        assertEquals(MatchKind.SERVICE, matches.get(2).kind());
        assertEquals(0.90, matches.get(2).score());

        // сервис совпал тоже, но его сущности уже в таблице
        assertEquals(8, result.mappingTable().size());
    }

    @Test
    void emptyQueryListsServicesWithoutMarkingReturnedAll() {
        DiscoveryResult result = discoveryService.discover("  ", null, 2);

        assertEquals("all", result.query());
        assertEquals(3, result.totalFound());
        assertEquals(2, result.matches().size());
        assertFalse(result.returnedAllServices());
        assertTrue(result.matches().stream().allMatch(m -> m.score() == 0.5));
        assertEquals(14, result.mappingTable().size());
    }

    @Test
    void limitIsClampedAndNegativeLimitRejected() {
        assertEquals(1, discoveryService.discover("", null, 0).matches().size());
        assertEquals(3, discoveryService.discover("", null, 100).matches().size());

        ValidationException e = assertThrows(ValidationException.class, () -> discoveryService.discover("order", null, -1));
        assertEquals(ErrorCode.INVALID_ARGUMENT, e.getCode());
    }

    @Test
    void unknownCategoryIsRejected() {
        ValidationException e = assertThrows(ValidationException.class, () -> discoveryService.discover("order", "marketing", null));
        assertTrue(e.getMessage().contains("marketing"));
        assertTrue(e.getMessage().contains("business-partner"));
    }

    @Test
    void categoryValueIsCaseInsensitive() {
        DiscoveryResult result = discoveryService.discover("order", "SALES", null);

        assertEquals(CategoryTag.SALES, result.actualCategory());
        assertEquals(3, result.totalFound());
    }

    @Test
    void describeServiceListsEntitiesWithCapabilities() {
        ServiceSummary summary = discoveryService.describeService("API_BP");

        assertEquals(2, summary.entities().size());
        ServiceSummary.EntitySummary supplier = summary.entities().get(1);
        assertEquals("Supplier", supplier.name());
        assertEquals(List.of("SupplierID"), supplier.keyProperties());
        assertTrue(supplier.capabilities().readable());
        assertFalse(supplier.capabilities().creatable());
        assertEquals(Set.of(CategoryTag.BUSINESS_PARTNER), summary.categories());
    }

    @Test
    @DisplayName("Title вместо id: ошибка с подсказкой правильного id")
    void describeServiceByTitleSuggestsId() {
        NotFoundException e = assertThrows(NotFoundException.class, () -> discoveryService.describeService("Business Partner"));

        assertTrue(e.getMessage().contains("'title' field was used"));
        assertEquals("Use serviceId 'API_BP' instead.", e.getSuggestion());
    }

    @Test
    void describeEntityReturnsFullSchema() {
        EntitySchema schema = discoveryService.describeEntity("API_SALES_ORDER_SRV", "SalesOrderItem");

        assertEquals("A_SalesOrderItem", schema.entitySet());
        assertEquals(List.of("SalesOrder", "SalesOrderItem"), schema.keyProperties());
        assertEquals(4, schema.properties().size());
        assertTrue(schema.properties().get(1).isKey());
        assertFalse(schema.properties().get(2).isKey());
    }

    @Test
    void describeEntityByEntitySetSuggestsName() {
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> discoveryService.describeEntity("API_SALES_ORDER_SRV", "A_SalesOrder"));

        assertTrue(e.getMessage().contains("Available entities: SalesOrder, SalesOrderItem"));
        assertTrue(e.getSuggestion().contains("entityName 'SalesOrder'"));
    }

    @Test
    void listServicesReportsEntityCountsAndCategories() {
        List<ServiceOverview> services = discoveryService.listServices();

        assertEquals(3, services.size());
        assertEquals(2, services.get(0).entityCount());
        assertEquals(Set.of(CategoryTag.ALL), services.get(2).categories());
    }
}
