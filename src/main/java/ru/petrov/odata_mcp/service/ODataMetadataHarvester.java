package ru.petrov.odata_mcp.service;

import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import ru.petrov.odata_mcp.client.ODataWebClientFactory;
import ru.petrov.odata_mcp.config.CatalogConfig;
import ru.petrov.odata_mcp.exception.DestinationException;
import ru.petrov.odata_mcp.model.catalog.ServiceCatalog;
import ru.petrov.odata_mcp.model.catalog.ServiceDefinition;
import ru.petrov.odata_mcp.model.destination.Destination;
import ru.petrov.odata_mcp.model.destination.EntityTarget;

import javax.xml.stream.XMLStreamException;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Собирает каталог из $metadata сервисов, перечисленных в app.catalog.services.
 * Метаданные читаются от технического пользователя. Сервис, который не удалось прочитать,
 * пропускается с записью в лог, остальные попадают в каталог.
 */
@Service
public class ODataMetadataHarvester implements MetadataHarvester {
    private final CatalogConfig config;
    private final DestinationService destinationService;
    private final ODataWebClientFactory webClientFactory;
    private final EdmxParser edmxParser;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ODataMetadataHarvester.class);

    public ODataMetadataHarvester(CatalogConfig config, DestinationService destinationService,
                                  ODataWebClientFactory webClientFactory, EdmxParser edmxParser) {
        this.config = config;
        this.destinationService = destinationService;
        this.webClientFactory = webClientFactory;
        this.edmxParser = edmxParser;
    }

    @Override
    public ServiceCatalog loadCatalog() {
        if (config.services().isEmpty()) {
            log.warn("В app.catalog.services не указано ни одного сервиса, каталог пуст");
            return ServiceCatalog.empty();
        }

        Destination destination;
        try {
            destination = destinationService.getDiscoveryDestination();
        } catch (DestinationException e) {
            log.error("Каталог не загружен, destination для поиска недоступен: {}", e.getMessage());
            return ServiceCatalog.empty();
        }

        List<ServiceDefinition> services = new ArrayList<>();
        for (CatalogConfig.ServiceEntry entry : config.services()) {
            log.info("Запуск парсинга XML метаданных сервиса {} ...", entry.id());
            try {
                services.add(load(entry, destination));
            } catch (XMLStreamException | RuntimeException e) {
                log.error("Ошибка загрузки метаданных сервиса {}: {}", entry.id(), e.getMessage());
            }
        }
        log.info("Каталог загружен: сервисов {} из {}", services.size(), config.services().size());
        return new ServiceCatalog(services);
    }

    private ServiceDefinition load(CatalogConfig.ServiceEntry entry, Destination destination) throws XMLStreamException {
        EntityTarget root = new EntityTarget(destination, entry.url(), null, null);
        byte[] metadata = webClientFactory.create(root.serviceRoot(), destination).get()
                .uri("/$metadata")
                .accept(MediaType.APPLICATION_XML) // Явно просим XML
                .retrieve()
                .bodyToMono(byte[].class)
                .block();
        if (metadata == null) {
            throw new IllegalStateException("Empty $metadata response");
        }
        EdmxParser.EdmxDocument document = edmxParser.parse(new ByteArrayInputStream(metadata));
        return new ServiceDefinition(entry.id(), entry.title(), entry.description(), entry.url(),
                entry.version(), document.odataVersion(), document.entityTypes());
    }
}
