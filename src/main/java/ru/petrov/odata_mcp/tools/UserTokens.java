package ru.petrov.odata_mcp.tools;

import org.springframework.http.HttpHeaders;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Извлечение токена пользователя из заголовка Authorization: Bearer.
 */
public final class UserTokens {
    private static final String BEARER_PREFIX = "Bearer ";

    private UserTokens() {
    }

    public static String fromAuthorizationHeader(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    /**
     * Токен из HTTP-запроса, в котором выполняется вызов инструмента, если такой запрос есть.
     */
    public static String fromCurrentRequest() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes)) {
            return null;
        }
        return fromAuthorizationHeader(((ServletRequestAttributes) attributes).getRequest().getHeader(HttpHeaders.AUTHORIZATION));
    }
}
