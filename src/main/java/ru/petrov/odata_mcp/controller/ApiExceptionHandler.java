package ru.petrov.odata_mcp.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import ru.petrov.odata_mcp.exception.ErrorDetails;
import ru.petrov.odata_mcp.exception.ODataMcpException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ODataMcpException.class)
    public ResponseEntity<ErrorDetails> handle(ODataMcpException e) {
        log.warn("Ошибка запроса: {}", e.toString());
        return ResponseEntity.status(e.getCode().httpStatus()).body(ErrorDetails.of(e));
    }
}
