package ru.petrov.odata_mcp.config;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.petrov.odata_mcp.tools.ODataTools;

/**
 * Регистрирует методы {@link ODataTools} как инструменты MCP-сервера.
 */
@Configuration
public class McpToolsConfiguration {

    @Bean
    public ToolCallbackProvider odataToolCallbacks(ODataTools oDataTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(oDataTools)
                .build();
    }
}
