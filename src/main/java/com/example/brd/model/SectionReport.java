package com.example.brd.model;

import java.util.List;
import java.util.Map;

/**
 * One BRD section of the classification report.
 */
public record SectionReport(
        String id,
        String heading,
        String purpose,
        RenderingHints renderingHints,
        Map<String, Integer> kindCounts,
        List<RequirementItem> requirements
) {}
