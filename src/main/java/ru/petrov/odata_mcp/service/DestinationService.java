package ru.petrov.odata_mcp.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import ru.petrov.odata_mcp.client.DestinationLookup;
import ru.petrov.odata_mcp.config.ODataConfig;
import ru.petrov.odata_mcp.exception.DestinationException;
import ru.petrov.odata_mcp.model.destination.Destination;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Определяет destination для вызова.
 * <p>
 * Поиск метаданных всегда идет от технического пользователя. Операции с данными идут от имени
 * пользователя, если его токен передан и вызывающий не отказался от него. Токен передается
 * аргументом в каждый вызов, в полях сервиса он не хранится.
 */
@Service
public class DestinationService {
    static final String ENV_DESTINATIONS = "destinations";

    private final ODataConfig config;
    private final Environment environment;
    private final DestinationLookup destinationLookup;
    private final ObjectMapper objectMapper;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(DestinationService.class);

    public DestinationService(ODataConfig config, Environment environment,
                              DestinationLookup destinationLookup, ObjectMapper objectMapper) {
        this.config = config;
        this.environment = environment;
        this.destinationLookup = destinationLookup;
        this.objectMapper = objectMapper;
    }

    /**
     * Destination для чтения метаданных, всегда с технической учетной записью.
     */
    public Destination getDiscoveryDestination() {
        String name = config.discoveryDestination();
        log.debug("Получение destination для поиска: {}", name);
        return resolve(name, null);
    }

    /**
     * Destination для операций с данными.
     *
     * @param userToken    Токен пользователя из текущего запроса, может быть null.
     * @param useUserToken false: принудительно использовать техническую учетную запись.
     */
    public Destination getExecutionDestination(String userToken, boolean useUserToken) {
        String name = config.executionDestination();
        String token = useUserToken && userToken != null && !userToken.isBlank() ? userToken : null;
        log.debug("Получение destination для выполнения: {} {}", name, token != null ? "с токеном пользователя" : "без токена");
        return resolve(name, token);
    }

    private Destination resolve(String name, String userToken) {
        Optional<Destination> fromEnvironment = fromEnvironment(name);
        if (fromEnvironment.isPresent()) {
            return fromEnvironment.get();
        }

        Optional<Destination> fromService;
        try {
            fromService = destinationLookup.find(name, userToken);
        } catch (DestinationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Ошибка обращения к сервису destination для '{}': {}", name, e.getMessage());
            throw new DestinationException("Failed to resolve destination '" + name + "': " + e.getMessage(), e);
        }
        return fromService
                .map(d -> {
                    log.info("Destination '{}' получен из сервиса destination ({})", name, d.credentialMode());
                    return d;
                })
                .orElseThrow(() -> new DestinationException(
                        "Destination '" + name + "' not found in environment variables or destination service"));
    }

    /**
     * Destination из переменной окружения destinations (JSON-массив).
     * Сначала ищется точное совпадение имени, если destination один, берется он.
     */
    Optional<Destination> fromEnvironment(String name) {
        String json = environment.getProperty(ENV_DESTINATIONS);
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }

        List<EnvDestination> parsed;
        try {
            parsed = objectMapper.readValue(json, new TypeReference<List<EnvDestination>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Переменная окружения destinations не разобрана, используется сервис destination: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (parsed == null) {
            log.warn("Переменная окружения destinations равна null, используется сервис destination");
            return Optional.empty();
        }
        // элементы null в массиве пропускаются
        List<EnvDestination> destinations = parsed.stream().filter(Objects::nonNull).toList();

        for (EnvDestination d : destinations) {
            if (name.equals(d.name())) {
                log.info("Destination '{}' получен из переменной окружения", name);
                return Optional.of(d.toDestination());
            }
        }
        if (destinations.size() == 1) {
            EnvDestination single = destinations.get(0);
            log.info("Используется единственный destination из окружения '{}' вместо '{}'", single.name(), name);
            return Optional.of(single.toDestination());
        }
        return Optional.empty();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EnvDestination(String name, String url, String username, String password) {
        Destination toDestination() {
            return Destination.basic(name, url, username, password);
        }
    }
}
