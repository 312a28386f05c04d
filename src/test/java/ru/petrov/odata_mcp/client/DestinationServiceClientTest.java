package ru.petrov.odata_mcp.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import ru.petrov.odata_mcp.config.DestinationServiceConfig;
import ru.petrov.odata_mcp.exception.DestinationException;
import ru.petrov.odata_mcp.model.destination.CredentialMode;
import ru.petrov.odata_mcp.model.destination.Destination;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DestinationServiceClientTest {
    private static final DestinationServiceConfig CONFIG = new DestinationServiceConfig("http://destinations.local", "client-token");

    private final List<ClientRequest> requests = new ArrayList<>();

    private DestinationServiceClient client(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, "application/json")
                    .body(body)
                    .build());
        });
        return new DestinationServiceClient(CONFIG, builder);
    }

    @Test
    void readsDestinationWithUserToken() {
        DestinationServiceClient client = client(HttpStatus.OK, """
                {"destinationConfiguration":{"Name":"ERP_SYSTEM","URL":"https://erp.example.com"},
                 "authTokens":[{"type":"Bearer","value":"exchanged-jwt"}]}
                """);

        Destination destination = client.find("ERP_SYSTEM", "user-jwt").orElseThrow();

        assertEquals("https://erp.example.com", destination.url());
        assertEquals("exchanged-jwt", destination.authToken());
        assertEquals(CredentialMode.END_USER, destination.credentialMode());

        ClientRequest request = requests.get(0);
        assertEquals("/destination-configuration/v1/destinations/ERP_SYSTEM", request.url().getPath());
        assertEquals("Bearer client-token", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("user-jwt", request.headers().getFirst(DestinationServiceClient.USER_TOKEN_HEADER));
    }

    @Test
    void technicalLookupSendsNoUserToken() {
        DestinationServiceClient client = client(HttpStatus.OK,
                "{\"destinationConfiguration\":{\"URL\":\"https://erp\",\"User\":\"tech\",\"Password\":\"pw\"}}");

        Destination destination = client.find("ERP_SYSTEM", null).orElseThrow();

        assertEquals("ERP_SYSTEM", destination.name());
        assertEquals("tech", destination.username());
        assertEquals(CredentialMode.TECHNICAL, destination.credentialMode());
        assertNull(requests.get(0).headers().getFirst(DestinationServiceClient.USER_TOKEN_HEADER));
    }

    @Test
    void notFoundMeansEmpty() {
        assertEquals(Optional.empty(), client(HttpStatus.NOT_FOUND, "{}").find("MISSING", null));
    }

    @Test
    void serverErrorIsDestinationError() {
        DestinationException e = assertThrows(DestinationException.class,
                () -> client(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"boom\"}").find("ERP_SYSTEM", null));

        assertTrue(e.getMessage().contains("500"));
    }

    @Test
    void destinationWithoutUrlIsRejected() {
        assertThrows(DestinationException.class,
                () -> client(HttpStatus.OK, "{\"destinationConfiguration\":{\"Name\":\"ERP\"}}").find("ERP", null));
    }

    @Test
    void disabledClientFindsNothing() {
        DestinationServiceClient client = new DestinationServiceClient(new DestinationServiceConfig(null, null), WebClient.builder());

        assertTrue(client.find("ERP_SYSTEM", "jwt").isEmpty());
    }

    @Test
    void toDestinationIgnoresEmptyTokenList() throws Exception {
        Destination destination = DestinationServiceClient.toDestination("ERP",
                new ObjectMapper().readTree("{\"destinationConfiguration\":{\"URL\":\"http://x\"},\"authTokens\":[]}"), false);

        assertNull(destination.authToken());
        assertFalse(destination.hasBearerToken());
    }
}
