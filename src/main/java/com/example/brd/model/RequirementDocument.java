package com.example.brd.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * One canonical requirements file: source document metadata, requirements and open questions.
 *
 * @param fileName name of the uploaded file, used when the document declares no relative path
 * @param root     parsed JSON object
 */
public record RequirementDocument(String fileName, JsonNode root) {

    public SourceDocumentInfo source() {
        return SourceDocumentInfo.from(root.path("sourceDocument"));
    }

    /**
     * Key used to cite this document: the declared {@code sourceDocument.relativePath},
     * or the file name.
     */
    public String originKey() {
        String relativePath = source().relativePath();
        return relativePath != null ? relativePath : fileName;
    }

    /** Title for the bibliography: declared title, else the relative path's file name, else the file name. */
    public String title() {
        SourceDocumentInfo source = source();
        if (source.title() != null) return source.title();
        if (source.relativePath() != null) {
            String path = source.relativePath();
            int slash = path.lastIndexOf('/');
            String name = slash >= 0 ? path.substring(slash + 1) : path;
            if (!name.isBlank()) return name;
        }
        return fileName;
    }

    /** Object entries of the "requirements" array; anything else is ignored. */
    public List<Requirement> requirements() {
        List<Requirement> requirements = new ArrayList<>();
        JsonNode items = root.get("requirements");
        if (items == null || !items.isArray()) return requirements;
        for (JsonNode item : items) {
            if (item.isObject()) {
                requirements.add(new Requirement(item));
            }
        }
        return requirements;
    }

    /** Non-blank, trimmed "openQuestions" strings. */
    public List<String> openQuestions() {
        List<String> questions = new ArrayList<>();
        JsonNode items = root.get("openQuestions");
        if (items == null || !items.isArray()) return questions;
        for (JsonNode item : items) {
            if (item.isTextual() && !item.textValue().isBlank()) {
                questions.add(item.textValue().strip());
            }
        }
        return questions;
    }
}
