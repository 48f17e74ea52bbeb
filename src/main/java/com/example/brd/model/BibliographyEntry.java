package com.example.brd.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A numbered bibliography line.
 *
 * @param number       citation number, starting at 1
 * @param relativePath cited path
 * @param title        title of the input document with this path as origin key, may be null
 * @param url          source URL of that document, may be null
 */
public record BibliographyEntry(int number, String relativePath, String title, String url) {

    /** "[n] title — path — url", omitting missing parts. */
    public String line() {
        List<String> parts = new ArrayList<>();
        if (title != null && !title.isBlank()) parts.add(title.strip());
        parts.add(relativePath);
        if (url != null && !url.isBlank()) parts.add(url.strip());
        return "[" + number + "] " + String.join(" — ", parts);
    }
}
