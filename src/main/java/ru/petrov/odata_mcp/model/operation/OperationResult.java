package ru.petrov.odata_mcp.model.operation;

import com.fasterxml.jackson.annotation.JsonInclude;
import ru.petrov.odata_mcp.exception.ErrorCode;
import ru.petrov.odata_mcp.exception.ODataMcpException;

/**
 * Ответ диспетчера. Ошибки не пробрасываются, а возвращаются здесь с кодом и подсказкой.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResult(
        boolean success,
        String operation,
        String message,
        Object result,
        String error,
        ErrorCode errorCode,
        String suggestion
) {
    public static OperationResult success(Operation operation, String message, Object result) {
        return new OperationResult(true, operation.value(), message, result, null, null, null);
    }

    public static OperationResult failure(String operation, ODataMcpException e) {
        return new OperationResult(false, operation, null, null, e.getMessage(), e.getCode(), e.getSuggestion());
    }
}
