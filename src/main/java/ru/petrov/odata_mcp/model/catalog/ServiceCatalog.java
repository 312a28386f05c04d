package ru.petrov.odata_mcp.model.catalog;

import ru.petrov.odata_mcp.exception.NotFoundException;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Неизменяемый каталог сервисов, собранный один раз при старте.
 * Сервисы хранятся в порядке появления в метаданных, на этом порядке держится стабильность сортировки.
 */
public final class ServiceCatalog {
    private final List<ServiceDefinition> services;

    public ServiceCatalog(List<ServiceDefinition> services) {
        this.services = List.copyOf(services);
    }

    public static ServiceCatalog empty() {
        return new ServiceCatalog(List.of());
    }

    public List<ServiceDefinition> services() {
        return services;
    }

    public int size() {
        return services.size();
    }

    public Optional<ServiceDefinition> findService(String serviceId) {
        return services.stream().filter(s -> s.id().equals(serviceId)).findFirst();
    }

    /**
     * Поиск сервиса строго по id. Если вместо id передан title, в ошибке будет правильный id,
     * но сам title как идентификатор не принимается.
     */
    public ServiceDefinition requireService(String serviceId) {
        if (serviceId == null || serviceId.isBlank()) {
            throw new NotFoundException("Service not found: serviceId is empty",
                    "Use 'discover' to find available services and pass the 'id' field as serviceId.");
        }
        Optional<ServiceDefinition> byId = findService(serviceId);
        if (byId.isPresent()) {
            return byId.get();
        }
        String lowered = serviceId.toLowerCase(Locale.ROOT);
        Optional<ServiceDefinition> byTitle = services.stream()
                .filter(s -> s.title().toLowerCase(Locale.ROOT).equals(lowered))
                .findFirst();
        if (byTitle.isPresent()) {
            throw new NotFoundException("Service not found: " + serviceId
                    + ". It looks like the 'title' field was used instead of the 'id' field.",
                    "Use serviceId '" + byTitle.get().id() + "' instead.");
        }
        throw new NotFoundException("Service not found: " + serviceId,
                "Use 'discover' to find available services. Make sure you pass the 'id' field from the results, NOT the 'title' field.");
    }

    /**
     * Поиск сущности строго по имени типа. В ошибке перечисляются допустимые имена.
     */
    public EntityDefinition requireEntity(ServiceDefinition service, String entityName) {
        if (entityName != null) {
            Optional<EntityDefinition> exact = service.findEntity(entityName);
            if (exact.isPresent()) {
                return exact.get();
            }
        }
        String available = service.entityTypes().isEmpty() ? "none" : String.join(", ", service.entityNames());
        String message = "Entity '" + entityName + "' not found in service '" + service.id() + "'. Available entities: " + available;
        if (entityName != null) {
            String lowered = entityName.toLowerCase(Locale.ROOT);
            Optional<EntityDefinition> similar = service.entityTypes().stream()
                    .filter(e -> e.name().toLowerCase(Locale.ROOT).equals(lowered)
                            || (e.entitySet() != null && e.entitySet().toLowerCase(Locale.ROOT).equals(lowered)))
                    .findFirst();
            if (similar.isPresent()) {
                throw new NotFoundException(message,
                        "Use entityName '" + similar.get().name() + "' (the 'name' field, NOT the 'entitySet' field).");
            }
        }
        throw new NotFoundException(message, "Use one of the entity names listed above.");
    }
}
