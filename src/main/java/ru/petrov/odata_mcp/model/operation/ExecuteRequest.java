package ru.petrov.odata_mcp.model.operation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Запрос на выполнение CRUD-операции. Параметры запроса OData передаются плоскими полями,
 * старый вложенный объект queryOptions поддерживается для совместимости.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteRequest {
    private String serviceId;
    private String entityName;
    private String operation;
    private Map<String, Object> parameters;
    private String filterString;
    private String selectString;
    private String expandString;
    private String orderbyString;
    private Integer topNumber;
    private Integer skipNumber;
    private Map<String, Object> queryOptions;
    private Boolean useUserToken;

    @JsonIgnore
    public boolean isUserTokenRequested() {
        return !Boolean.FALSE.equals(useUserToken);
    }
}
