package ru.petrov.odata_mcp.model.operation;

import com.fasterxml.jackson.annotation.JsonValue;
import ru.petrov.odata_mcp.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * CRUD-операции, которые умеет выполнять диспетчер.
 */
public enum Operation {
    READ("read"),
    READ_SINGLE("read-single"),
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    Operation(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isWrite() {
        return this == CREATE || this == UPDATE || this == DELETE;
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(Operation::value).collect(Collectors.joining(", "));
    }

    public static Operation fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Operation is required. Valid operations are: " + allowedValues());
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Operation operation : values()) {
            if (operation.value.equals(normalized)) {
                return operation;
            }
        }
        throw new ValidationException("Invalid operation: " + raw + ". Valid operations are: " + allowedValues());
    }
}
