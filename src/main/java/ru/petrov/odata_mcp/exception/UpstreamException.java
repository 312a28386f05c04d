package ru.petrov.odata_mcp.exception;

/** Ошибка удаленного OData-сервиса, текст передается как есть. */
public class UpstreamException extends ODataMcpException {
    public UpstreamException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_ERROR, message, null, cause);
    }
}
