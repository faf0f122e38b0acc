package io.tradehybrid.brokerlink.broker.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson setup and lenient field readers shared by the venue codecs.
 * Venues send numbers both as JSON numbers and as strings ("0.0010"); the readers accept both.
 */
public final class JsonSupport {

    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Numeric field, or {@code defaultValue} when missing, null or unparseable.
     */
    public static double number(JsonNode node, String field, double defaultValue) {
        Double value = optionalNumber(node, field);
        return value != null ? value : defaultValue;
    }

    /**
     * Numeric field, or null when missing, null or unparseable.
     */
    public static Double optionalNumber(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (value.isNumber()) return value.asDouble();
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty()) return null;
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Text field, or null when missing or null. Numbers are rendered as text.
     */
    public static String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) return null;
        return value.asText();
    }

    /**
     * Treat an object as a one-element array. Some venues collapse single-element arrays.
     */
    public static List<JsonNode> elements(JsonNode node) {
        List<JsonNode> out = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return out;
        }
        if (node.isArray()) {
            node.forEach(out::add);
        } else {
            out.add(node);
        }
        return out;
    }

    private JsonSupport() {}
}
