package com.example.brd.model;

/**
 * How requirements are assigned to sections.
 *
 * @param firstMatchWins      stop at the first matching section (default true)
 * @param unassignedSectionId section used when no rule matches
 */
public record AssignmentPolicy(boolean firstMatchWins, String unassignedSectionId) {

    public static final String DEFAULT_UNASSIGNED_SECTION_ID = "BRD-99";

    public AssignmentPolicy {
        if (unassignedSectionId == null || unassignedSectionId.isBlank()) {
            unassignedSectionId = DEFAULT_UNASSIGNED_SECTION_ID;
        }
    }

    public static AssignmentPolicy defaults() {
        return new AssignmentPolicy(true, DEFAULT_UNASSIGNED_SECTION_ID);
    }
}
