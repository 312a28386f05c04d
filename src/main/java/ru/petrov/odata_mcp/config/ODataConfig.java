package ru.petrov.odata_mcp.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Имена destination для поиска (технический пользователь) и для выполнения операций.
 * Если отдельное имя не задано, используется общее destinationName.
 */
@Validated
@ConfigurationProperties(prefix = "app.odata")
public record ODataConfig(
        @NotBlank(message = "Имя destination обязательно")
        @DefaultValue("ERP_SYSTEM")
        String destinationName,

        String discoveryDestinationName,

        String executionDestinationName,

        @Positive
        @DefaultValue("50")
        int maxInMemorySizeMb
) {
    public String discoveryDestination() {
        return isBlank(discoveryDestinationName) ? destinationName : discoveryDestinationName;
    }

    public String executionDestination() {
        return isBlank(executionDestinationName) ? destinationName : executionDestinationName;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
