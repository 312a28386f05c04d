package ru.petrov.odata_mcp.exception;

/** Операция запрещена метаданными сущности (creatable/updatable/deletable). */
public class CapabilityException extends ODataMcpException {
    public CapabilityException(String message) {
        super(ErrorCode.OPERATION_NOT_ALLOWED, message,
                "Check the entity capabilities with 'discover' before calling write operations.");
    }
}
