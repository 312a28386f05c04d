package ru.petrov.odata_mcp.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;
import ru.petrov.odata_mcp.model.destination.EntityKey;
import ru.petrov.odata_mcp.model.destination.EntityTarget;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Выполняет CRUD-запросы к OData-сервису через WebClient.
 * Перед записью запрашивает CSRF-токен, ответы V2 (d / d.results) и V4 (value) разворачиваются.
 */
@Component
public class ODataClient implements EntityClient {
    static final String CSRF_HEADER = "x-csrf-token";

    private static final Set<String> UNQUOTED_KEY_TYPES = Set.of(
            "Edm.Byte", "Edm.SByte", "Edm.Int16", "Edm.Int32", "Edm.Int64",
            "Edm.Decimal", "Edm.Double", "Edm.Single", "Edm.Boolean");

    private final ODataWebClientFactory webClientFactory;
    private final ObjectMapper objectMapper;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ODataClient.class);

    public ODataClient(ODataWebClientFactory webClientFactory, ObjectMapper objectMapper) {
        this.webClientFactory = webClientFactory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Object read(EntityTarget target, Map<String, Object> queryOptions) {
        WebClient client = client(target);
        String body = client.get()
                .uri(uriBuilder -> buildUri(uriBuilder, target, null, queryOptions))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, ODataClient::toException)
                .bodyToMono(String.class)
                .block();
        return unwrap(parse(body));
    }

    @Override
    public Object readOne(EntityTarget target, EntityKey key, Map<String, Object> queryOptions) {
        WebClient client = client(target);
        String body = client.get()
                .uri(uriBuilder -> buildUri(uriBuilder, target, key, queryOptions))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, ODataClient::toException)
                .bodyToMono(String.class)
                .block();
        return unwrap(parse(body));
    }

    @Override
    public Object create(EntityTarget target, Map<String, Object> payload) {
        return write(target, HttpMethod.POST, null, payload);
    }

    @Override
    public Object update(EntityTarget target, EntityKey key, Map<String, Object> payload) {
        return write(target, HttpMethod.PATCH, key, payload);
    }

    @Override
    public void delete(EntityTarget target, EntityKey key) {
        write(target, HttpMethod.DELETE, key, null);
    }

    private Object write(EntityTarget target, HttpMethod method, EntityKey key, Map<String, Object> payload) {
        WebClient client = client(target);
        CsrfSession csrf = fetchCsrfToken(client);

        WebClient.RequestBodySpec request = client.method(method)
                .uri(uriBuilder -> buildUri(uriBuilder, target, key, null))
                .accept(MediaType.APPLICATION_JSON)
                .headers(csrf::apply);
        WebClient.RequestHeadersSpec<?> spec = payload == null
                ? request
                : request.contentType(MediaType.APPLICATION_JSON).bodyValue(payload);

        String body = spec.retrieve()
                .onStatus(HttpStatusCode::isError, ODataClient::toException)
                .bodyToMono(String.class)
                .block();
        return unwrap(parse(body));
    }

    private WebClient client(EntityTarget target) {
        return webClientFactory.create(target.serviceRoot(), target.destination());
    }

    /**
     * Путь и параметры запроса. Предикат ключа входит в шаблон пути, поэтому '=', ',' и кавычки
     * остаются как есть, а значения ключей и параметров подставляются переменными и кодируются.
     */
    private static URI buildUri(UriBuilder uriBuilder, EntityTarget target, EntityKey key, Map<String, Object> queryOptions) {
        Map<String, Object> variables = new HashMap<>();
        String path = "/" + target.entitySet();
        if (key != null) {
            path += "(" + keyPredicate(target, key, variables) + ")";
        }
        uriBuilder.path(path);
        boolean hasFormat = false;
        if (queryOptions != null) {
            int i = 0;
            for (Map.Entry<String, Object> option : queryOptions.entrySet()) {
                if (option.getValue() == null) {
                    continue;
                }
                String variable = "q" + i++;
                uriBuilder.queryParam(option.getKey(), "{" + variable + "}");
                variables.put(variable, String.valueOf(option.getValue()));
                hasFormat |= "$format".equals(option.getKey());
            }
        }
        if (!hasFormat) {
            uriBuilder.queryParam("$format", "json");
        }
        return uriBuilder.build(variables);
    }

    /**
     * Шаблон предиката ключа: ('{k0}') или ({k0}) для одиночного ключа,
     * Name1='{k0}',Name2='{k1}' для составного. Значения складываются в variables.
     * Одиночный ключ не берется в кавычки для числовых и логических типов.
     */
    static String keyPredicate(EntityTarget target, EntityKey key, Map<String, Object> variables) {
        if (!key.isComposite()) {
            String value = key.values().values().iterator().next();
            if (target.keyType() != null && UNQUOTED_KEY_TYPES.contains(target.keyType())) {
                variables.put("k0", value);
                return "{k0}";
            }
            variables.put("k0", quoteEscape(value));
            return "'{k0}'";
        }
        StringBuilder predicate = new StringBuilder();
        int i = 0;
        for (Map.Entry<String, String> part : key.values().entrySet()) {
            String variable = "k" + i++;
            if (predicate.length() > 0) {
                predicate.append(',');
            }
            predicate.append(part.getKey()).append("='{").append(variable).append("}'");
            variables.put(variable, quoteEscape(part.getValue()));
        }
        return predicate.toString();
    }

    private static String quoteEscape(String value) {
        return value.replace("'", "''");
    }

    private CsrfSession fetchCsrfToken(WebClient client) {
        try {
            CsrfSession session = client.get()
                    .uri("/")
                    .header(CSRF_HEADER, "Fetch")
                    .exchangeToMono(response -> {
                        String token = response.headers().asHttpHeaders().getFirst(CSRF_HEADER);
                        List<String> cookies = response.headers().header(HttpHeaders.SET_COOKIE);
                        return response.releaseBody().thenReturn(new CsrfSession(token, cookies));
                    })
                    .block();
            return session != null ? session : CsrfSession.NONE;
        } catch (WebClientException e) {
            log.warn("Не удалось получить CSRF-токен, запрос отправляется без него: {}", e.getMessage());
            return CsrfSession.NONE;
        }
    }

    private static Mono<? extends Throwable> toException(ClientResponse response) {
        String method = response.request().getMethod().name();
        String url = response.request().getURI().toString();
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> {
                    log.error("OData ответил {} на {} {}", status, method, url);
                    return new ODataClientException(status, method, url, body);
                });
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Ответ OData не является JSON, возвращается как текст: {}", e.getOriginalMessage());
            return objectMapper.getNodeFactory().textNode(body);
        }
    }

    static JsonNode unwrap(JsonNode root) {
        if (root == null) {
            return null;
        }
        if (root.has("d")) {
            JsonNode d = root.get("d");
            JsonNode results = d.get("results");
            return results != null && results.isArray() ? results : d;
        }
        JsonNode value = root.get("value");
        if (value != null && value.isArray()) {
            return value;
        }
        return root;
    }

    record CsrfSession(String token, List<String> cookies) {
        static final CsrfSession NONE = new CsrfSession(null, List.of());

        void apply(HttpHeaders headers) {
            if (token != null) {
                headers.set(CSRF_HEADER, token);
            }
            if (cookies != null && !cookies.isEmpty()) {
                headers.set(HttpHeaders.COOKIE, cookies.stream()
                        .map(cookie -> cookie.split(";", 2)[0])
                        .collect(Collectors.joining("; ")));
            }
        }
    }
}
