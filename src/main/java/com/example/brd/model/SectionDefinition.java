package com.example.brd.model;

import java.util.List;

/**
 * One section of the BRD outline.
 *
 * @param id             unique, non-blank section identifier (e.g. BRD-03)
 * @param number         display number, may be null
 * @param title          display title, may be null
 * @param purpose        short description printed under the heading, may be null
 * @param match          rules OR-ed together; an empty list never matches
 * @param renderingHints renderer hints
 */
public record SectionDefinition(
        String id,
        String number,
        String title,
        String purpose,
        List<MatchExpression> match,
        RenderingHints renderingHints
) {
    public SectionDefinition {
        match = match != null ? List.copyOf(match) : List.of();
        if (renderingHints == null) renderingHints = RenderingHints.DEFAULT;
    }

    /** "number. title" when both are set, otherwise the title, otherwise the id. */
    public String heading() {
        boolean hasNumber = number != null && !number.isBlank();
        boolean hasTitle = title != null && !title.isBlank();
        if (hasNumber && hasTitle) return number + ". " + title;
        return hasTitle ? title : id;
    }
}
