package ru.petrov.odata_mcp.exception;

import org.springframework.http.HttpStatus;

/**
 * Стабильные коды ошибок шлюза. Код уходит клиенту вместе с текстом ошибки.
 */
public enum ErrorCode {
    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    OPERATION_NOT_ALLOWED(HttpStatus.CONFLICT),
    MISSING_KEY_PROPERTY(HttpStatus.BAD_REQUEST),
    DESTINATION_ERROR(HttpStatus.SERVICE_UNAVAILABLE),
    UPSTREAM_ERROR(HttpStatus.BAD_GATEWAY);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
