package ru.petrov.odata_mcp.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Инструкция для AI-ассистента: какие инструменты есть и в каком порядке их вызывать.
 */
@Service
public class InstructionsService {
    private final String instructions;

    public InstructionsService(@Value("${app.instructions-location:classpath:instructions.md}") Resource resource) {
        try (InputStream is = resource.getInputStream()) {
            this.instructions = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать инструкцию " + resource.getDescription(), e);
        }
    }

    public String instructions() {
        return instructions;
    }
}
