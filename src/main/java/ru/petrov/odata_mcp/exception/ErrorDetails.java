package ru.petrov.odata_mcp.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Ошибка в виде, пригодном для ответа клиенту.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorDetails(boolean success, String error, ErrorCode errorCode, String suggestion) {

    public static ErrorDetails of(ODataMcpException e) {
        return new ErrorDetails(false, e.getMessage(), e.getCode(), e.getSuggestion());
    }
}
