package ru.petrov.odata_mcp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import ru.petrov.odata_mcp.config.CatalogConfig;
import ru.petrov.odata_mcp.config.DestinationServiceConfig;
import ru.petrov.odata_mcp.config.DiscoveryConfig;
import ru.petrov.odata_mcp.config.ODataConfig;

@SpringBootApplication
@EnableConfigurationProperties({ODataConfig.class, CatalogConfig.class, DiscoveryConfig.class, DestinationServiceConfig.class})
public class OdataMcpApplication {

	public static void main(String[] args) {
		SpringApplication.run(OdataMcpApplication.class, args);
	}

}
