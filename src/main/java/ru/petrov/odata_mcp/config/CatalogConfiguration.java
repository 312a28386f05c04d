package ru.petrov.odata_mcp.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.petrov.odata_mcp.model.catalog.ServiceCatalog;
import ru.petrov.odata_mcp.service.MetadataHarvester;

@Configuration
public class CatalogConfiguration {

    @Bean
    public ServiceCatalog serviceCatalog(MetadataHarvester metadataHarvester) {
        return metadataHarvester.loadCatalog();
    }
}
