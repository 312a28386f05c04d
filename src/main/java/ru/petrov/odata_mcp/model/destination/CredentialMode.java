package ru.petrov.odata_mcp.model.destination;

/**
 * TECHNICAL: сервисная учетная запись. END_USER: токен аутентифицированного пользователя.
 */
public enum CredentialMode {
    TECHNICAL,
    END_USER
}
