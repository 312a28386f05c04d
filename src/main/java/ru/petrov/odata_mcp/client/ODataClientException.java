package ru.petrov.odata_mcp.client;

/**
 * HTTP-ошибка OData-сервиса: код статуса и тело ответа.
 */
public class ODataClientException extends RuntimeException {
    private final int status;
    private final String responseBody;

    public ODataClientException(int status, String method, String url, String responseBody) {
        super("OData request " + method + " " + url + " failed with status " + status
                + (responseBody == null || responseBody.isBlank() ? "" : ": " + responseBody));
        this.status = status;
        this.responseBody = responseBody;
    }

    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
