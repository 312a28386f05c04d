package ru.petrov.odata_mcp.client;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import ru.petrov.odata_mcp.config.ODataConfig;
import ru.petrov.odata_mcp.model.destination.Destination;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Создает WebClient для конкретного destination: адрес, авторизация, лимит буфера, логирование.
 */
@Component
public class ODataWebClientFactory {
    private final WebClient.Builder webClientBuilder;
    private final ODataConfig config;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ODataWebClientFactory.class);

    public ODataWebClientFactory(WebClient.Builder webClientBuilder, ODataConfig config) {
        this.webClientBuilder = webClientBuilder;
        this.config = config;
    }

    public WebClient create(String baseUrl, Destination destination) {
        // Ответы $metadata больших сервисов не влезают в буфер по умолчанию
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(config.maxInMemorySizeMb() * 1024 * 1024))
                .build();
        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(baseUrl)
                .exchangeStrategies(strategies)
                .filter(logRequest());
        String authorization = authorization(destination);
        if (authorization != null) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, authorization);
        }
        return builder.build();
    }

    static String authorization(Destination destination) {
        if (destination.hasBearerToken()) {
            return "Bearer " + destination.authToken();
        }
        if (destination.username() != null) {
            String auth = destination.username() + ":" + (destination.password() == null ? "" : destination.password());
            return "Basic " + Base64.getEncoder().encodeToString(auth.getBytes(StandardCharsets.UTF_8));
        }
        return null;
    }

    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.info(">>>> ЗАПРОС К ODATA: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
