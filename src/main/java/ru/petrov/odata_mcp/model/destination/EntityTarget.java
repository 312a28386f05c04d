package ru.petrov.odata_mcp.model.destination;

/**
 * Куда отправлять запрос: destination, путь сервиса и набор сущностей.
 * {@code serviceUrl} может быть абсолютным адресом или путем относительно destination.
 *
 * @param keyType тип OData единственного ключа сущности; null для составного ключа
 */
public record EntityTarget(Destination destination, String serviceUrl, String entitySet, String keyType) {

    public String serviceRoot() {
        if (serviceUrl != null && (serviceUrl.startsWith("http://") || serviceUrl.startsWith("https://"))) {
            return trimSlash(serviceUrl);
        }
        String base = trimSlash(destination.url());
        if (serviceUrl == null || serviceUrl.isBlank()) {
            return base;
        }
        return base + (serviceUrl.startsWith("/") ? "" : "/") + trimSlash(serviceUrl);
    }

    private static String trimSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
