package com.example.brd.model;

import java.util.List;

/**
 * Read-only summary of the loaded taxonomy, as returned by the API.
 */
public record TaxonomyView(
        boolean firstMatchWins,
        String unassignedSectionId,
        String fallbackSectionId,
        List<SectionSummary> sections
) {

    public record SectionSummary(
            String id,
            String heading,
            String purpose,
            int ruleCount,
            RenderingHints renderingHints
    ) {}

    public static TaxonomyView from(Taxonomy taxonomy) {
        List<SectionSummary> sections = taxonomy.sections().stream()
                .map(s -> new SectionSummary(s.id(), s.heading(), s.purpose(), s.match().size(), s.renderingHints()))
                .toList();
        return new TaxonomyView(
                taxonomy.policy().firstMatchWins(),
                taxonomy.policy().unassignedSectionId(),
                taxonomy.fallbackSectionId(),
                sections
        );
    }
}
