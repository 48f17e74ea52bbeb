package com.example.brd.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lenient accessors for loosely-structured JSON input.
 */
public final class JsonFields {

    private JsonFields() {}

    /**
     * Returns the trimmed string at {@code field}, or null when the field is missing,
     * not a string, or blank.
     */
    public static String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) return null;
        String text = value.textValue().strip();
        return text.isEmpty() ? null : text;
    }

    /**
     * Like {@link #text(JsonNode, String)} but also accepts numbers and booleans,
     * rendered as text (section numbers and page versions are often numeric).
     */
    public static String scalar(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) return null;
        String text = value.asText().strip();
        return text.isEmpty() ? null : text;
    }
}
