package com.example.brd.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A canonical requirement record. The underlying JSON is treated as read-only.
 *
 * @param node the requirement object as parsed from its document
 */
public record Requirement(JsonNode node) {

    public static final String DEFAULT_KIND = "Other";

    /** Sort key: the "id" value as text, empty when missing. */
    public String id() {
        JsonNode id = node.get("id");
        if (id == null || id.isNull()) return "";
        return id.isValueNode() ? id.asText() : id.toString();
    }

    /** The "kind" tag, or {@value #DEFAULT_KIND} when missing or blank. */
    public String kind() {
        String kind = JsonFields.text(node, "kind");
        return kind != null ? kind : DEFAULT_KIND;
    }

    /** Legacy {@code classification.primary} hint; informative only. */
    public String legacyPrimaryClassification() {
        return JsonFields.text(node.path("classification"), "primary");
    }

    public String title() {
        return JsonFields.text(node, "title");
    }

    public String statement() {
        return JsonFields.text(node, "statement");
    }

    /**
     * Distinct, trimmed {@code references[].relativePath} values in encounter order.
     */
    public List<String> referencePaths() {
        List<String> paths = new ArrayList<>();
        JsonNode references = node.get("references");
        if (references == null || !references.isArray()) return paths;
        for (JsonNode reference : references) {
            String path = JsonFields.text(reference, "relativePath");
            if (path != null && !paths.contains(path)) {
                paths.add(path);
            }
        }
        return paths;
    }
}
