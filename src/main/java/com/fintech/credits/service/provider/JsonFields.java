package com.fintech.credits.service.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Null-safe reads from provider JSON. Missing nodes, JSON nulls and blank strings all read as null.
 */
final class JsonFields {

    private JsonFields() {
    }

    static JsonNode path(JsonNode node, String... fields) {
        JsonNode current = node;
        for (String field : fields) {
            if (current == null || current.isMissingNode() || current.isNull()) {
                return null;
            }
            current = current.get(field);
        }
        if (current == null || current.isMissingNode() || current.isNull()) {
            return null;
        }
        return current;
    }

    static String text(JsonNode node, String... fields) {
        JsonNode value = path(node, fields);
        if (value == null || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * A field that is either an id string or an expanded object carrying {@code id}
     * (Stripe's {@code customer}, {@code subscription}, {@code product}, ...).
     */
    static String idOrExpanded(JsonNode node, String... fields) {
        JsonNode value = path(node, fields);
        if (value == null) {
            return null;
        }
        if (value.isObject()) {
            return text(value, "id");
        }
        return text(node, fields);
    }

    static JsonNode firstElement(JsonNode node, String... fields) {
        JsonNode array = path(node, fields);
        if (array == null || !array.isArray() || array.isEmpty()) {
            return null;
        }
        return array.get(0);
    }

    /**
     * Integer from a number or a numeric string; anything else reads as null.
     */
    static Integer integer(JsonNode node, String... fields) {
        JsonNode value = path(node, fields);
        if (value == null) {
            return null;
        }
        if (value.canConvertToInt()) {
            return value.asInt();
        }
        if (value.isTextual()) {
            try {
                return Integer.valueOf(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static LocalDateTime epochSeconds(JsonNode node, ZoneId zone, String... fields) {
        JsonNode value = path(node, fields);
        if (value == null || !value.canConvertToLong()) {
            return null;
        }
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(value.asLong()), zone);
    }

    static LocalDateTime isoDateTime(JsonNode node, ZoneId zone, String... fields) {
        String value = text(node, fields);
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).atZoneSameInstant(zone).toLocalDateTime();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
