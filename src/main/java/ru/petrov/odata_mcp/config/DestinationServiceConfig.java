package ru.petrov.odata_mcp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Подключение к управляемому сервису destination.
 * Пустой uri отключает этот путь, остаются только destination из окружения.
 *
 * @param clientToken технический токен доступа к сервису destination (выпускается вне приложения)
 */
@ConfigurationProperties(prefix = "app.destination-service")
public record DestinationServiceConfig(
        String uri,
        String clientToken
) {
    public boolean isEnabled() {
        return uri != null && !uri.isBlank();
    }
}
