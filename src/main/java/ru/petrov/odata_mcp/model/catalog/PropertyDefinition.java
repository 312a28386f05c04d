package ru.petrov.odata_mcp.model.catalog;

/**
 * Описание свойства сущности из метаданных OData.
 * @param name      Техническое имя свойства (напр. EmailAddress)
 * @param type      Тип данных OData (напр. Edm.String)
 * @param nullable  Допускает ли свойство пустое значение
 * @param maxLength Максимальная длина, если задана в метаданных, иначе null
 */
public record PropertyDefinition(
        String name,
        String type,
        boolean nullable,
        Integer maxLength
) {}
