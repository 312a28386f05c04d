package ru.petrov.odata_mcp.exception;

/** Не удалось определить адрес и учетные данные для destination. */
public class DestinationException extends ODataMcpException {
    public DestinationException(String message) {
        super(ErrorCode.DESTINATION_ERROR, message);
    }

    public DestinationException(String message, Throwable cause) {
        super(ErrorCode.DESTINATION_ERROR, message, null, cause);
    }
}
