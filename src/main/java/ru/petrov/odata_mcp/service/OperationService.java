package ru.petrov.odata_mcp.service;

import org.springframework.stereotype.Service;
import ru.petrov.odata_mcp.client.EntityClient;
import ru.petrov.odata_mcp.exception.CapabilityException;
import ru.petrov.odata_mcp.exception.MissingKeyPropertyException;
import ru.petrov.odata_mcp.exception.ODataMcpException;
import ru.petrov.odata_mcp.exception.UpstreamException;
import ru.petrov.odata_mcp.model.catalog.EntityDefinition;
import ru.petrov.odata_mcp.model.catalog.PropertyDefinition;
import ru.petrov.odata_mcp.model.catalog.ServiceCatalog;
import ru.petrov.odata_mcp.model.catalog.ServiceDefinition;
import ru.petrov.odata_mcp.model.destination.Destination;
import ru.petrov.odata_mcp.model.destination.EntityKey;
import ru.petrov.odata_mcp.model.destination.EntityTarget;
import ru.petrov.odata_mcp.model.operation.ExecuteRequest;
import ru.petrov.odata_mcp.model.operation.Operation;
import ru.petrov.odata_mcp.model.operation.OperationResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Выполнение одной CRUD-операции над сущностью каталога.
 * <p>
 * Проверки идут до любого сетевого вызова: операция, сервис, сущность, разрешения, ключ.
 * Ошибки не пробрасываются наружу, а возвращаются в {@link OperationResult}.
 */
@Service
public class OperationService {
    private final ServiceCatalog catalog;
    private final DestinationService destinationService;
    private final EntityClient entityClient;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(OperationService.class);

    public OperationService(ServiceCatalog catalog, DestinationService destinationService, EntityClient entityClient) {
        this.catalog = catalog;
        this.destinationService = destinationService;
        this.entityClient = entityClient;
    }

    /**
     * @param request   Параметры операции.
     * @param userToken Токен пользователя из текущего запроса, null если пользователь не аутентифицирован.
     * @return Успешный результат с данными или описание ошибки с подсказкой.
     */
    public OperationResult execute(ExecuteRequest request, String userToken) {
        log.info("[TOOL CALL] execute | Сервис: {} | Сущность: {} | Операция: {}",
                request.getServiceId(), request.getEntityName(), request.getOperation());
        try {
            return doExecute(request, userToken);
        } catch (ODataMcpException e) {
            log.warn("Операция {} над {} не выполнена: {}", request.getOperation(), request.getEntityName(), e.getMessage());
            return OperationResult.failure(request.getOperation(), e);
        }
    }

    private OperationResult doExecute(ExecuteRequest request, String userToken) {
        Operation operation = Operation.fromValue(request.getOperation());
        Map<String, Object> queryOptions = buildQueryOptions(request);
        Map<String, Object> parameters = request.getParameters() == null ? Map.of() : request.getParameters();

        ServiceDefinition service = catalog.requireService(request.getServiceId());
        EntityDefinition entity = catalog.requireEntity(service, request.getEntityName());
        checkCapability(entity, operation);

        EntityKey key = operation == Operation.READ || operation == Operation.CREATE
                ? null
                : buildKey(entity, parameters);

        Destination destination = destinationService.getExecutionDestination(userToken, request.isUserTokenRequested());
        EntityTarget target = new EntityTarget(destination, service.url(), entity.entitySet(), singleKeyType(entity));
        String name = entity.name();

        switch (operation) {
            case READ -> {
                String description = "Reading " + name + " entities"
                        + (queryOptions.containsKey("$top") ? " (top " + queryOptions.get("$top") + ")" : "")
                        + (queryOptions.containsKey("$filter") ? " with filter: " + queryOptions.get("$filter") : "");
                Object data = callUpstream(() -> entityClient.read(target, queryOptions));
                return OperationResult.success(operation, description, data);
            }
            case READ_SINGLE -> {
                Object data = callUpstream(() -> entityClient.readOne(target, key, queryOptions));
                return OperationResult.success(operation, "Reading single " + name + " with key: " + key.value(), data);
            }
            case CREATE -> {
                Object data = callUpstream(() -> entityClient.create(target, parameters));
                return OperationResult.success(operation, "Creating new " + name, data);
            }
            case UPDATE -> {
                Map<String, Object> payload = withoutKeys(entity, parameters);
                Object data = callUpstream(() -> entityClient.update(target, key, payload));
                return OperationResult.success(operation, "Updating " + name + " with key: " + key.value(), data);
            }
            case DELETE -> {
                callUpstream(() -> {
                    entityClient.delete(target, key);
                    return null;
                });
                String message = "Successfully deleted " + name + " with key: " + key.value();
                Map<String, Object> ack = new LinkedHashMap<>();
                ack.put("message", message);
                ack.put("success", true);
                return OperationResult.success(operation, message, ack);
            }
            default -> throw new IllegalStateException("Unsupported operation: " + operation);
        }
    }

    /**
     * Плоские поля переносятся в параметры OData, затем накладывается старый объект queryOptions.
     * Его значения перезаписывают одноименные плоские поля.
     */
    static Map<String, Object> buildQueryOptions(ExecuteRequest request) {
        Map<String, Object> options = new LinkedHashMap<>();
        putIfPresent(options, "$filter", request.getFilterString());
        putIfPresent(options, "$select", request.getSelectString());
        putIfPresent(options, "$expand", request.getExpandString());
        putIfPresent(options, "$orderby", request.getOrderbyString());
        if (request.getTopNumber() != null) options.put("$top", request.getTopNumber());
        if (request.getSkipNumber() != null) options.put("$skip", request.getSkipNumber());

        if (request.getQueryOptions() != null) {
            options.putAll(request.getQueryOptions());
        }
        return options;
    }

    private static void putIfPresent(Map<String, Object> options, String name, String value) {
        if (value != null && !value.isBlank()) {
            options.put(name, value);
        }
    }

    private static void checkCapability(EntityDefinition entity, Operation operation) {
        if (!entity.allows(operation)) {
            throw new CapabilityException("Entity '" + entity.name() + "' does not support " + operation.value() + " operations");
        }
    }

    /**
     * Значения ключевых свойств в порядке объявления. Отсутствующее свойство ключа считается ошибкой.
     */
    static EntityKey buildKey(EntityDefinition entity, Map<String, Object> parameters) {
        List<String> keys = entity.keys();
        Map<String, String> values = new LinkedHashMap<>();
        for (String key : keys) {
            if (!parameters.containsKey(key)) {
                throw new MissingKeyPropertyException(key, keys);
            }
            values.put(key, String.valueOf(parameters.get(key)));
        }
        return new EntityKey(values);
    }

    private static Map<String, Object> withoutKeys(EntityDefinition entity, Map<String, Object> parameters) {
        Map<String, Object> payload = new LinkedHashMap<>(parameters);
        entity.keys().forEach(payload::remove);
        return payload;
    }

    private static String singleKeyType(EntityDefinition entity) {
        if (entity.keys().size() != 1) {
            return null;
        }
        String key = entity.keys().get(0);
        return entity.properties().stream()
                .filter(p -> p.name().equals(key))
                .map(PropertyDefinition::type)
                .findFirst()
                .orElse(null);
    }

    private static Object callUpstream(Supplier<Object> call) {
        try {
            return call.get();
        } catch (ODataMcpException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Ошибка удаленного сервиса: {}", e.getMessage());
            throw new UpstreamException(e.getMessage(), e);
        }
    }
}
