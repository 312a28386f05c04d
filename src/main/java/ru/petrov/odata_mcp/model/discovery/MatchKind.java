package ru.petrov.odata_mcp.model.discovery;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MatchKind {
    SERVICE,
    ENTITY,
    PROPERTY;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
