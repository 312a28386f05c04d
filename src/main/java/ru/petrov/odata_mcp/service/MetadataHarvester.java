package ru.petrov.odata_mcp.service;

import ru.petrov.odata_mcp.model.catalog.ServiceCatalog;

/**
 * Источник каталога сервисов. Вызывается один раз при старте приложения.
 */
public interface MetadataHarvester {

    ServiceCatalog loadCatalog();
}
