package com.board.core.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts in-memory records into graph-storable properties and back.
 *
 * <p>Encoding, per key:
 * <ol>
 *   <li>null values are dropped</li>
 *   <li>lists made only of strings, or only of integral numbers, or only of
 *       floating point numbers are stored as native lists</li>
 *   <li>any other map, list or object is stored as its JSON text</li>
 *   <li>strings, numbers and booleans are stored as they are</li>
 * </ol>
 *
 * <p>Decoding is a heuristic: a string wrapped in braces or in square brackets
 * is parsed as JSON and replaced by the result when parsing succeeds. A plain
 * string that happens to look like that comes back parsed ({@code "[1]"} turns
 * into a list, while {@code "[draft]"} stays a string). The encoding carries no
 * tag to tell the two apart.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PropertySanitizer {

    private final ObjectMapper objectMapper;

    // ==================== Encode ====================

    /**
     * Builds a store-safe property map. The result never contains null values.
     */
    public Map<String, Object> sanitize(Map<String, ?> record) {
        var sanitized = new LinkedHashMap<String, Object>();
        record.forEach((key, value) -> {
            if (value != null) {
                sanitized.put(key, sanitizeValue(value));
            }
        });
        return sanitized;
    }

    private Object sanitizeValue(Object value) {
        if (isScalar(value)) {
            return value;
        }
        if (value instanceof Collection<?> collection && isNativeList(collection)) {
            return value;
        }
        return toJson(value);
    }

    private boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private boolean isNativeList(Collection<?> values) {
        return values.stream().allMatch(String.class::isInstance)
                || values.stream().allMatch(this::isIntegral)
                || values.stream().allMatch(this::isFloating);
    }

    private boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte;
    }

    private boolean isFloating(Object value) {
        return value instanceof Double || value instanceof Float;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be encoded as JSON: " + value.getClass().getName(), e);
        }
    }

    // ==================== Decode ====================

    /**
     * Reverses {@link #sanitize(Map)} for properties read from the store.
     * Strings that fail to parse are kept as they are.
     */
    public Map<String, Object> restore(Map<String, ?> properties) {
        var restored = new LinkedHashMap<String, Object>();
        properties.forEach((key, value) -> restored.put(key, restoreValue(value)));
        return restored;
    }

    Object restoreValue(Object value) {
        if (!(value instanceof String text) || !looksLikeJson(text)) {
            return value;
        }
        try {
            return jsonReader().readValue(text);
        } catch (JsonProcessingException e) {
            log.trace("Keeping raw string, not valid JSON: {}", text);
            return text;
        }
    }

    /**
     * Rejects text with anything after the first JSON value, so {@code "[1] or [2]"} stays a string.
     */
    private ObjectReader jsonReader() {
        return objectMapper.readerFor(Object.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    private boolean looksLikeJson(String text) {
        return (text.startsWith("{") && text.endsWith("}"))
                || (text.startsWith("[") && text.endsWith("]"));
    }
}
