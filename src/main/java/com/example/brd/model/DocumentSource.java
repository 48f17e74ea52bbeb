package com.example.brd.model;

import java.util.List;

/**
 * Provenance of one input document as shown in the report.
 *
 * @param metadata lines such as "Source type: confluence" or "Confluence pageId: 884211"
 */
public record DocumentSource(String originDocumentKey, String fileName, String documentTitle, List<String> metadata) {

    public static DocumentSource of(RequirementDocument document) {
        return new DocumentSource(document.originKey(), document.fileName(), document.title(),
                List.copyOf(document.source().describe()));
    }
}
