package net.findmycard.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.lang.Nullable;

/**
 * Package-private static helpers for reading typed values out of Scryfall card JSON.
 */
final class ScryfallJsonSupport {

    private ScryfallJsonSupport() {
    }

    @Nullable
    static String text(JsonNode node, String field) {
        if (node == null || !node.has(field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (!value.isTextual()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    static double number(JsonNode node, String field) {
        if (node == null || !node.has(field) || !node.get(field).isNumber()) {
            return 0.0;
        }
        return node.get(field).asDouble();
    }

    /**
     * Scryfall quotes prices as strings; non-numeric quotes are treated as missing.
     */
    @Nullable
    static BigDecimal decimal(JsonNode node, String field) {
        String raw = text(node, field);
        if (raw == null) {
            if (node != null && node.has(field) && node.get(field).isNumber()) {
                return node.get(field).decimalValue();
            }
            return null;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    static List<String> textArray(JsonNode node, String field) {
        if (node == null || !node.has(field) || !node.get(field).isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node.get(field)) {
            if (element.isTextual() && !element.asText().isBlank()) {
                values.add(element.asText());
            }
        }
        return values;
    }

    static Map<String, String> textObject(JsonNode node, String field) {
        if (node == null || !node.has(field) || !node.get(field).isObject()) {
            return Map.of();
        }
        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.get(field).fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getValue().isTextual() && !entry.getValue().asText().isBlank()) {
                values.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return values;
    }
}
