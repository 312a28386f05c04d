package ru.petrov.odata_mcp.model.catalog;

import com.fasterxml.jackson.annotation.JsonValue;
import ru.petrov.odata_mcp.exception.ValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Тематические категории сервисов и ключевые слова, по которым они назначаются.
 * ALL не имеет ключевых слов: ее получает сервис, не попавший ни в одну категорию.
 */
public enum CategoryTag {
    BUSINESS_PARTNER("business-partner", List.of("business_partner", "bp_", "customer", "supplier", "business partner")),
    SALES("sales", List.of("sales", "order", "quotation", "opportunity")),
    FINANCE("finance", List.of("finance", "accounting", "payment", "invoice", "gl_", "ar_", "ap_")),
    PROCUREMENT("procurement", List.of("purchase", "procurement", "vendor", "po_")),
    HR("hr", List.of("employee", "hr_", "personnel", "payroll", "human")),
    LOGISTICS("logistics", List.of("logistics", "warehouse", "inventory", "material", "wm_", "mm_")),
    ALL("all", List.of());

    private final String value;
    private final List<String> keywords;

    CategoryTag(String value, List<String> keywords) {
        this.value = value;
        this.keywords = keywords;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public List<String> keywords() {
        return keywords;
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(CategoryTag::value).collect(Collectors.joining(", "));
    }

    /**
     * Пустое значение означает ALL. Неизвестное значение вызывает ошибку валидации.
     */
    public static CategoryTag fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALL;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (CategoryTag tag : values()) {
            if (tag.value.equals(normalized)) {
                return tag;
            }
        }
        throw new ValidationException("Invalid category: " + raw + ". Valid categories are: " + allowedValues());
    }
}
