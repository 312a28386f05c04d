package ru.petrov.odata_mcp.exception;

import java.util.Objects;

/**
 * Базовое исключение шлюза: стабильный {@link ErrorCode}, текст для человека
 * и необязательная подсказка, как исправить вызов.
 */
public class ODataMcpException extends RuntimeException {
    private final ErrorCode code;
    private final String suggestion;

    public ODataMcpException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public ODataMcpException(ErrorCode code, String message, String suggestion) {
        this(code, message, suggestion, null);
    }

    public ODataMcpException(ErrorCode code, String message, String suggestion, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.suggestion = suggestion;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getSuggestion() {
        return suggestion;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{code=" + code
                + ", message=" + getMessage()
                + (suggestion == null ? "" : ", suggestion=" + suggestion)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
