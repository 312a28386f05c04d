package ru.petrov.odata_mcp.exception;

import java.util.List;

/** В параметрах не передано ключевое свойство сущности. */
public class MissingKeyPropertyException extends ODataMcpException {
    private final List<String> requiredKeys;

    public MissingKeyPropertyException(String missingKey, List<String> requiredKeys) {
        super(ErrorCode.MISSING_KEY_PROPERTY,
                "Missing required key property: " + missingKey + ". Required keys: " + String.join(", ", requiredKeys),
                "Pass every key property inside 'parameters'.");
        this.requiredKeys = List.copyOf(requiredKeys);
    }

    public List<String> getRequiredKeys() {
        return requiredKeys;
    }
}
