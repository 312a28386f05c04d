package ru.petrov.odata_mcp.tools;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;
import ru.petrov.odata_mcp.exception.ErrorDetails;
import ru.petrov.odata_mcp.exception.ODataMcpException;
import ru.petrov.odata_mcp.model.discovery.ServiceOverview;
import ru.petrov.odata_mcp.model.operation.ExecuteRequest;
import ru.petrov.odata_mcp.model.operation.OperationResult;
import ru.petrov.odata_mcp.service.DiscoveryService;
import ru.petrov.odata_mcp.service.InstructionsService;
import ru.petrov.odata_mcp.service.OperationService;

import java.util.List;
import java.util.Map;

/**
 * Инструменты MCP. Вместо отдельного инструмента на каждую пару сущность/операция
 * клиенту доступны поиск по каталогу и универсальное выполнение операций.
 */
@Service
public class ODataTools {
    private final DiscoveryService discoveryService;
    private final OperationService operationService;
    private final InstructionsService instructionsService;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ODataTools.class);

    public ODataTools(DiscoveryService discoveryService, OperationService operationService,
                      InstructionsService instructionsService) {
        this.discoveryService = discoveryService;
        this.operationService = operationService;
        this.instructionsService = instructionsService;
    }

    @Tool(
            name = "discover-odata-data",
            description = "Universal discovery for OData services, entities and properties. "
                    + "Search mode (query/category) returns a mapping table with every property of every matched entity. "
                    + "With serviceId returns the entities of that service; with serviceId and entityName returns the full entity schema. "
                    + "Discovery uses the technical user.")
    public Object discoverData(
            @ToolParam(required = false, description = "Search term matched against service ids, titles, descriptions, entity names and property names. Examples: 'customer', 'email', 'sales order'") String query,
            @ToolParam(required = false, description = "Service category: business-partner, sales, finance, procurement, hr, logistics, all. Default: all") String category,
            @ToolParam(required = false, description = "Maximum number of matches (1-20). Default: 10") Integer limit,
            @ToolParam(required = false, description = "Direct access to a service. Use the 'id' field from previous results, NOT the 'title'") String serviceId,
            @ToolParam(required = false, description = "Direct access to an entity schema, requires serviceId. Use the 'name' field, NOT the 'entitySet'") String entityName
    ) {
        log.info("[AI TOOL CALL] discover | Запрос: {} | Категория: {} | Лимит: {} | Сервис: {} | Сущность: {}",
                query, category, limit, serviceId, entityName);
        try {
            if (isPresent(serviceId) && isPresent(entityName)) {
                return discoveryService.describeEntity(serviceId, entityName);
            }
            if (isPresent(serviceId)) {
                return discoveryService.describeService(serviceId);
            }
            return discoveryService.discover(query, category, limit);
        } catch (ODataMcpException e) {
            log.warn("Поиск не выполнен: {}", e.getMessage());
            return ErrorDetails.of(e);
        }
    }

    @Tool(
            name = "execute-odata-operation",
            description = "Perform a CRUD operation on an OData entity under the authenticated user's identity. "
                    + "Use discover-odata-data first to find serviceId and entityName and check the entity capabilities.")
    public OperationResult executeOperation(
            @ToolParam(description = "Service id from discover-odata-data. Use the 'id' field, NOT the 'title'") String serviceId,
            @ToolParam(description = "Entity name from discover-odata-data. Use the 'name' field, NOT the 'entitySet'") String entityName,
            @ToolParam(description = "Operation: read, read-single, create, update, delete") String operation,
            @ToolParam(required = false, description = "Key properties for read-single/update/delete and data fields for create/update") Map<String, Object> parameters,
            @ToolParam(required = false, description = "OData $filter value without the prefix, e.g. \"Status eq 'Active'\"") String filterString,
            @ToolParam(required = false, description = "OData $select value: comma-separated property names") String selectString,
            @ToolParam(required = false, description = "OData $expand value: comma-separated navigation properties") String expandString,
            @ToolParam(required = false, description = "OData $orderby value, e.g. \"Name desc\"") String orderbyString,
            @ToolParam(required = false, description = "OData $top value: number of records to return") Integer topNumber,
            @ToolParam(required = false, description = "OData $skip value: number of records to skip") Integer skipNumber,
            @ToolParam(required = false, description = "Legacy query options object, e.g. {\"$top\": 5}. Overrides the discrete fields above") Map<String, Object> queryOptions,
            @ToolParam(required = false, description = "Use the authenticated user's token. Default: true") Boolean useUserToken
    ) {
        ExecuteRequest request = ExecuteRequest.builder()
                .serviceId(serviceId)
                .entityName(entityName)
                .operation(operation)
                .parameters(parameters)
                .filterString(filterString)
                .selectString(selectString)
                .expandString(expandString)
                .orderbyString(orderbyString)
                .topNumber(topNumber)
                .skipNumber(skipNumber)
                .queryOptions(queryOptions)
                .useUserToken(useUserToken)
                .build();
        return operationService.execute(request, UserTokens.fromCurrentRequest());
    }

    @Tool(name = "list-odata-services", description = "List every available OData service with its id, title, categories and entity count")
    public List<ServiceOverview> listServices() {
        return discoveryService.listServices();
    }

    @Tool(name = "odata-instructions", description = "Usage instructions for the OData tools: workflow, id vs title, authentication model")
    public String instructions() {
        return instructionsService.instructions();
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
