package com.example.brd.model;

import java.util.Comparator;

/**
 * A requirement placed in the classification index, with the key of the document it came from.
 */
public record ClassifiedRequirement(Requirement requirement, String originDocumentKey) {

    public static final Comparator<ClassifiedRequirement> BY_REQUIREMENT_ID =
            Comparator.comparing(entry -> entry.requirement().id());
}
