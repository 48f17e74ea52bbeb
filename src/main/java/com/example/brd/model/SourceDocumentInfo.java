package com.example.brd.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Metadata of the source document a requirements file was derived from
 * ({@code sourceDocument} block). Every field may be null.
 */
public record SourceDocumentInfo(
        String title,
        String relativePath,
        String sourceType,
        String retrievedAt,
        String confluencePageId,
        String confluenceSpace,
        String confluenceVersion,
        String url
) {

    public static SourceDocumentInfo from(JsonNode sourceDocument) {
        JsonNode confluence = sourceDocument != null ? sourceDocument.path("confluence") : null;
        boolean hasConfluence = confluence != null && confluence.isObject();
        return new SourceDocumentInfo(
                JsonFields.text(sourceDocument, "title"),
                JsonFields.text(sourceDocument, "relativePath"),
                JsonFields.text(sourceDocument, "sourceType"),
                JsonFields.text(sourceDocument, "retrievedAt"),
                hasConfluence ? JsonFields.scalar(confluence, "pageId") : null,
                hasConfluence ? JsonFields.scalar(confluence, "space") : null,
                hasConfluence ? JsonFields.scalar(confluence, "version") : null,
                hasConfluence ? JsonFields.text(confluence, "url") : null
        );
    }

    /** Human-readable provenance lines ("Source type: ...", "Confluence URL: ..."). */
    public List<String> describe() {
        List<String> lines = new ArrayList<>();
        if (sourceType != null) lines.add("Source type: " + sourceType);
        if (relativePath != null) lines.add("Source: " + relativePath);
        if (confluencePageId != null) lines.add("Confluence pageId: " + confluencePageId);
        if (confluenceSpace != null) lines.add("Confluence space: " + confluenceSpace);
        if (confluenceVersion != null) lines.add("Confluence version: " + confluenceVersion);
        if (url != null) lines.add("Confluence URL: " + url);
        if (retrievedAt != null) lines.add("Retrieved at: " + retrievedAt);
        return lines;
    }
}
