package ru.petrov.odata_mcp.exception;

/** Сервис или сущность не найдены в каталоге. */
public class NotFoundException extends ODataMcpException {
    public NotFoundException(String message, String suggestion) {
        super(ErrorCode.NOT_FOUND, message, suggestion);
    }
}
