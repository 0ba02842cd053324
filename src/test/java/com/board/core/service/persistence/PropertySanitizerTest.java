package com.board.core.service.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PropertySanitizerTest {

    private final PropertySanitizer sanitizer = new PropertySanitizer(new ObjectMapper());

    @Test
    @DisplayName("Null values are omitted rather than stored")
    void dropsNulls() {
        var record = new HashMap<String, Object>();
        record.put("id", "item-1");
        record.put("description", null);

        assertThat(sanitizer.sanitize(record))
                .containsOnlyKeys("id");
    }

    @Test
    @DisplayName("Scalars and homogeneous lists are stored natively")
    void keepsStorableValues() {
        var record = Map.<String, Object>of(
                "instanceName", "Place Order",
                "x", 120,
                "ratio", 0.5,
                "locked", true,
                "tags", List.of("ordering", "core"),
                "sizes", List.of(1, 2, 3)
        );

        assertThat(sanitizer.sanitize(record)).isEqualTo(record);
    }

    @Test
    @DisplayName("Nested and mixed values are stored as JSON text")
    void encodesNestedValues() {
        var record = Map.<String, Object>of(
                "attributes", List.of(Map.of("name", "orderId")),
                "position", Map.of("x", 1),
                "mixed", List.of("a", 1)
        );

        var sanitized = sanitizer.sanitize(record);

        assertThat(sanitized.get("attributes")).isEqualTo("[{\"name\":\"orderId\"}]");
        assertThat(sanitized.get("position")).isEqualTo("{\"x\":1}");
        assertThat(sanitized.get("mixed")).isEqualTo("[\"a\",1]");
    }

    @Test
    @DisplayName("Bracket-delimited strings are parsed back into structures")
    void restoresJsonText() {
        var restored = sanitizer.restore(Map.of(
                "attributes", "[{\"name\":\"orderId\"}]",
                "position", "{\"x\":1}",
                "instanceName", "Place Order"
        ));

        assertThat(restored.get("attributes")).isEqualTo(List.of(Map.of("name", "orderId")));
        assertThat(restored.get("position")).isEqualTo(Map.of("x", 1));
        assertThat(restored.get("instanceName")).isEqualTo("Place Order");
    }

    @Test
    @DisplayName("Strings that fail to parse are kept as they are")
    void keepsInvalidJsonText() {
        assertThat(sanitizer.restoreValue("[draft]")).isEqualTo("[draft]");
        assertThat(sanitizer.restoreValue("{not json}")).isEqualTo("{not json}");
        assertThat(sanitizer.restoreValue("[1, 2")).isEqualTo("[1, 2");
        assertThat(sanitizer.restoreValue("[1] or [2]")).isEqualTo("[1] or [2]");
        assertThat(sanitizer.restoreValue("{\"a\":1} then {\"b\":2}")).isEqualTo("{\"a\":1} then {\"b\":2}");
    }

    @Test
    @DisplayName("A plain string shaped like JSON comes back decoded")
    void decodesJsonShapedPlainStrings() {
        var stored = sanitizer.sanitize(Map.of("label", "[1]"));

        assertThat(stored.get("label")).isEqualTo("[1]");
        assertThat(sanitizer.restore(stored).get("label")).isEqualTo(List.of(1));
    }
}
