package com.orchestrator.service.impl;

import com.orchestrator.exception.InputValidationException;
import com.orchestrator.model.step.InputField;
import com.orchestrator.model.step.InputSchema;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts raw user-input values (typically strings typed at a prompt or sent by a client)
 * into the type their field declares, applying defaults and the required check.
 * <p>
 * Dates are validated as ISO-8601 ({@code yyyy-MM-dd}) and kept as strings so that they survive
 * a round trip through session storage unchanged.
 */
@Component
@Slf4j
public class InputValueConverter {

    /**
     * Normalises a full set of values against a schema. Keys that the schema does not declare are
     * kept as they are.
     */
    public Map<String, Object> normalize(InputSchema schema, Map<String, Object> rawValues) {
        Map<String, Object> raw = rawValues == null ? Map.of() : rawValues;
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (InputField field : schema.fields()) {
            Object value = convert(field, raw.get(field.id()));
            if (value != null) {
                normalized.put(field.id(), value);
            }
        }
        raw.forEach(normalized::putIfAbsent);
        return normalized;
    }

    /**
     * @return The converted value, the field's default when the raw value is blank, or
     *         {@code null} for a blank optional field without default.
     * @throws InputValidationException if a required value is missing or cannot be converted.
     */
    public Object convert(InputField field, Object raw) {
        if (isBlank(raw)) {
            if (field.defaultValue() != null) {
                return field.defaultValue();
            }
            if (field.required()) {
                throw new InputValidationException("Field \"" + describe(field) + "\" is required");
            }
            return null;
        }
        String type = field.type() == null ? "text" : field.type();
        return switch (type) {
            case "number" -> toNumber(field, raw);
            case "boolean" -> toBoolean(field, raw);
            case "date" -> toDate(field, raw);
            case "single_select" -> toOption(field, raw);
            case "multi_select" -> toOptions(field, raw);
            default -> raw instanceof String ? ((String) raw).trim() : raw;
        };
    }

    private Object toNumber(InputField field, Object raw) {
        if (raw instanceof Number) {
            return raw;
        }
        String text = raw.toString().trim();
        try {
            BigDecimal number = new BigDecimal(text);
            if (number.scale() <= 0 || number.stripTrailingZeros().scale() <= 0) {
                return number.longValueExact();
            }
            return number.doubleValue();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InputValidationException("Field \"" + describe(field) + "\" expects a number but got \"" + text + "\"");
        }
    }

    private Boolean toBoolean(InputField field, Object raw) {
        if (raw instanceof Boolean bool) {
            return bool;
        }
        String text = raw.toString().trim().toLowerCase();
        return switch (text) {
            case "true", "yes", "y", "1" -> Boolean.TRUE;
            case "false", "no", "n", "0" -> Boolean.FALSE;
            default -> throw new InputValidationException(
                    "Field \"" + describe(field) + "\" expects true or false but got \"" + raw + "\"");
        };
    }

    private String toDate(InputField field, Object raw) {
        String text = raw.toString().trim();
        try {
            return LocalDate.parse(text).toString();
        } catch (DateTimeParseException e) {
            throw new InputValidationException(
                    "Field \"" + describe(field) + "\" expects a date (yyyy-MM-dd) but got \"" + text + "\"");
        }
    }

    private Object toOption(InputField field, Object raw) {
        String value = raw.toString().trim();
        List<String> options = optionValues(field);
        if (!options.isEmpty() && !options.contains(value)) {
            throw new InputValidationException(
                    "Field \"" + describe(field) + "\" must be one of " + options + " but got \"" + value + "\"");
        }
        return value;
    }

    private List<String> toOptions(InputField field, Object raw) {
        List<String> values;
        if (raw instanceof Collection<?> collection) {
            values = collection.stream().map(String::valueOf).map(String::trim).toList();
        } else {
            values = Arrays.stream(raw.toString().split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        }
        List<String> options = optionValues(field);
        for (String value : values) {
            if (!options.isEmpty() && !options.contains(value)) {
                throw new InputValidationException(
                        "Field \"" + describe(field) + "\" must be chosen from " + options + " but got \"" + value + "\"");
            }
        }
        return values;
    }

    // Options may be plain strings or {value, label} objects.
    private List<String> optionValues(InputField field) {
        if (field.config() == null || !(field.config().get("options") instanceof Collection<?> options)) {
            return List.of();
        }
        return options.stream()
                .map(option -> option instanceof Map<?, ?> map ? map.get("value") : option)
                .filter(Objects::nonNull)
                .map(String::valueOf)
                .toList();
    }

    private static boolean isBlank(Object raw) {
        return raw == null || (raw instanceof String text && text.isBlank());
    }

    private static String describe(InputField field) {
        return field.label() != null ? field.label() : field.id();
    }
}
