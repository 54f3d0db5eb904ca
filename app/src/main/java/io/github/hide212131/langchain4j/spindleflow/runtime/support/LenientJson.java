package io.github.hide212131.langchain4j.spindleflow.runtime.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts a JSON object from free-form model output: the whole text when it parses, otherwise the
 * span between the first {@code '{'} and the last {@code '}'}.
 */
public final class LenientJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LenientJson() {
    }

    public static Optional<JsonNode> extractObject(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<JsonNode> direct = tryParse(text.trim());
        if (direct.isPresent()) {
            return direct;
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return tryParse(text.substring(start, end + 1));
    }

    /** Text values of an array field; non-text items are rendered as JSON. Missing fields yield an empty list. */
    public static List<String> stringArray(JsonNode node, String field) {
        JsonNode array = node.get(field);
        List<String> values = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode item : array) {
            String value = item.isTextual() ? item.asText() : item.toString();
            if (!value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }

    private static Optional<JsonNode> tryParse(String candidate) {
        try {
            JsonNode node = MAPPER.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
