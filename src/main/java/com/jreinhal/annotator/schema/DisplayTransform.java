package com.jreinhal.annotator.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * How a persisted field value is turned into the text an annotator edits ({@link #load})
 * and back ({@link #save}). The set is closed on purpose: task configuration picks one of
 * these by name and never supplies code.
 */
public enum DisplayTransform {
    IDENTITY,
    JOIN_WITH_COMMA,
    JOIN_WITH_NEWLINE,
    JSON;

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final Pattern COMMA = Pattern.compile(",");
    private static final Pattern NEWLINE = Pattern.compile("\\r?\\n");

    public Object load(Object value) {
        switch (this) {
            case JOIN_WITH_COMMA:
                return join(value, ", ");
            case JOIN_WITH_NEWLINE:
                return join(value, "\n");
            case JSON:
                if (value instanceof Map || value instanceof Collection) {
                    try {
                        return MAPPER.writeValueAsString(value);
                    } catch (JsonProcessingException e) {
                        throw new IllegalArgumentException("Field value is not JSON serializable", e);
                    }
                }
                return value == null ? "" : value;
            default:
                return value == null ? "" : value;
        }
    }

    public Object save(Object value) {
        switch (this) {
            case JOIN_WITH_COMMA:
                return split(value, COMMA);
            case JOIN_WITH_NEWLINE:
                return split(value, NEWLINE);
            case JSON:
                if (value instanceof String text) {
                    if (text.isBlank()) {
                        return new LinkedHashMap<String, Object>();
                    }
                    try {
                        return MAPPER.readValue(text, Object.class);
                    } catch (JsonProcessingException e) {
                        // kept verbatim so a half-typed document is not lost
                        return text;
                    }
                }
                return value == null ? new LinkedHashMap<String, Object>() : value;
            default:
                return value;
        }
    }

    public boolean joinsLists() {
        return this == JOIN_WITH_COMMA || this == JOIN_WITH_NEWLINE;
    }

    private static Object join(Object value, String delimiter) {
        if (value instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).collect(Collectors.joining(delimiter));
        }
        return value == null ? "" : value;
    }

    private static Object split(Object value, Pattern delimiter) {
        if (value instanceof String text) {
            List<String> items = new ArrayList<>();
            for (String part : delimiter.split(text)) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    items.add(trimmed);
                }
            }
            return items;
        }
        return value == null ? new ArrayList<String>() : value;
    }

    public static DisplayTransform fromString(String value) {
        if (value == null || value.isBlank()) {
            return IDENTITY;
        }
        String normalized = value.trim().toUpperCase().replace('-', '_');
        if ("ARRAY_TO_STRING".equals(normalized)) {
            return JOIN_WITH_COMMA;
        }
        return DisplayTransform.valueOf(normalized);
    }
}
