package com.example.brd.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered BRD sections plus the assignment policy. Immutable; built once at startup
 * and shared by every classification run.
 */
public final class Taxonomy {

    private final List<SectionDefinition> sections;
    private final AssignmentPolicy policy;
    private final Set<String> sectionIds;
    private final String fallbackSectionId;

    public Taxonomy(List<SectionDefinition> sections, AssignmentPolicy policy) {
        this.sections = sections != null ? List.copyOf(sections) : List.of();
        this.policy = policy != null ? policy : AssignmentPolicy.defaults();

        Set<String> ids = new LinkedHashSet<>();
        for (SectionDefinition section : this.sections) {
            if (section.id() == null || section.id().isBlank()) {
                throw new TaxonomyConfigurationException("Section without id in taxonomy");
            }
            if (!ids.add(section.id())) {
                throw new TaxonomyConfigurationException("Duplicate section id: " + section.id());
            }
        }
        if (ids.isEmpty()) {
            throw new TaxonomyConfigurationException("Taxonomy defines no valid section id");
        }
        this.sectionIds = Collections.unmodifiableSet(ids);

        // policy id when valid, else BRD-99 when defined, else the lexicographically smallest id
        if (ids.contains(this.policy.unassignedSectionId())) {
            this.fallbackSectionId = this.policy.unassignedSectionId();
        } else if (ids.contains(AssignmentPolicy.DEFAULT_UNASSIGNED_SECTION_ID)) {
            this.fallbackSectionId = AssignmentPolicy.DEFAULT_UNASSIGNED_SECTION_ID;
        } else {
            this.fallbackSectionId = ids.stream().sorted().findFirst().orElseThrow();
        }
    }

    public List<SectionDefinition> sections() {
        return sections;
    }

    public AssignmentPolicy policy() {
        return policy;
    }

    /** Valid section ids in taxonomy order. */
    public Set<String> sectionIds() {
        return sectionIds;
    }

    public boolean isValidSectionId(String id) {
        return id != null && sectionIds.contains(id);
    }

    /** Section that receives unmatched or mis-assigned requirements; always a valid id. */
    public String fallbackSectionId() {
        return fallbackSectionId;
    }
}
