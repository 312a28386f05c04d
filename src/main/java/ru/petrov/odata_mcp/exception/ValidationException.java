package ru.petrov.odata_mcp.exception;

/** Некорректные входные данные: операция, категория, лимит. */
public class ValidationException extends ODataMcpException {
    public ValidationException(String message) {
        super(ErrorCode.INVALID_ARGUMENT, message);
    }
}
