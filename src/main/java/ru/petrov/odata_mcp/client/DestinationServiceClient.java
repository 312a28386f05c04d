package ru.petrov.odata_mcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import ru.petrov.odata_mcp.config.DestinationServiceConfig;
import ru.petrov.odata_mcp.exception.DestinationException;
import ru.petrov.odata_mcp.model.destination.CredentialMode;
import ru.petrov.odata_mcp.model.destination.Destination;

import java.util.Optional;

/**
 * Клиент REST API сервиса destination (destination-configuration/v1).
 * Технический токен идет в Authorization, токен пользователя в X-user-token.
 */
@Component
public class DestinationServiceClient implements DestinationLookup {
    static final String USER_TOKEN_HEADER = "X-user-token";

    private final DestinationServiceConfig config;
    private final WebClient webClient;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(DestinationServiceClient.class);

    public DestinationServiceClient(DestinationServiceConfig config, WebClient.Builder webClientBuilder) {
        this.config = config;
        WebClient.Builder builder = webClientBuilder.clone();
        if (config.isEnabled()) {
            builder.baseUrl(config.uri());
        }
        if (config.clientToken() != null && !config.clientToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.clientToken());
        }
        this.webClient = builder.build();
    }

    @Override
    public Optional<Destination> find(String name, String userToken) {
        if (!config.isEnabled()) {
            log.debug("Сервис destination не настроен, '{}' не ищется", name);
            return Optional.empty();
        }

        JsonNode body;
        try {
            body = webClient.get()
                    .uri("/destination-configuration/v1/destinations/{name}", name)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (userToken != null) {
                            headers.set(USER_TOKEN_HEADER, userToken);
                        }
                    })
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw new DestinationException("Destination service returned " + e.getStatusCode().value()
                    + " for '" + name + "': " + e.getResponseBodyAsString(), e);
        }

        if (body == null || !body.hasNonNull("destinationConfiguration")) {
            return Optional.empty();
        }
        Destination destination = toDestination(name, body, userToken != null);
        if (destination.url() == null) {
            throw new DestinationException("Destination '" + name + "' has no URL configured");
        }
        return Optional.of(destination);
    }

    static Destination toDestination(String name, JsonNode body, boolean endUser) {
        JsonNode configuration = body.get("destinationConfiguration");
        String authToken = null;
        JsonNode tokens = body.path("authTokens");
        if (tokens.isArray() && !tokens.isEmpty()) {
            authToken = textOrNull(tokens.get(0), "value");
        }
        return new Destination(
                configuration.path("Name").asText(name),
                textOrNull(configuration, "URL"),
                textOrNull(configuration, "User"),
                textOrNull(configuration, "Password"),
                authToken,
                endUser ? CredentialMode.END_USER : CredentialMode.TECHNICAL);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
