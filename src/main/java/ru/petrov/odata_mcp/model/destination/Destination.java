package ru.petrov.odata_mcp.model.destination;

/**
 * Именованная точка подключения: адрес и учетные данные.
 * Если задан authToken, используется Bearer, иначе Basic по username/password.
 */
public record Destination(
        String name,
        String url,
        String username,
        String password,
        String authToken,
        CredentialMode credentialMode
) {
    public static Destination basic(String name, String url, String username, String password) {
        return new Destination(name, url, username, password, null, CredentialMode.TECHNICAL);
    }

    public boolean hasBearerToken() {
        return authToken != null && !authToken.isBlank();
    }

    @Override
    public String toString() {
        return "Destination{name=" + name + ", url=" + url + ", mode=" + credentialMode + '}';
    }
}
