package ru.petrov.odata_mcp.client;

import ru.petrov.odata_mcp.model.destination.Destination;

import java.util.Optional;

/**
 * Поиск destination в управляемом сервисе destination.
 */
public interface DestinationLookup {

    /**
     * @param name      Имя destination.
     * @param userToken Токен пользователя или null для технической учетной записи.
     * @return Пустой результат, если destination с таким именем нет.
     */
    Optional<Destination> find(String name, String userToken);
}
