package com.example.brd.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the BRD classifier.
 */
@ConfigurationProperties(prefix = "brd")
public record BrdProperties(
        Taxonomy taxonomy,
        Report report
) {

    public BrdProperties {
        if (taxonomy == null) taxonomy = new Taxonomy(null);
        if (report == null) report = new Report(null, false);
    }

    /**
     * Where the BRD section outline is loaded from.
     *
     * @param location Spring resource location (e.g. classpath:brd_sections.json, file:/etc/brd/sections.json)
     */
    public record Taxonomy(String location) {
        public Taxonomy {
            if (location == null || location.isBlank()) location = "classpath:brd_sections.json";
        }
    }

    /**
     * Options for the classification report.
     *
     * @param title                report title
     * @param includeOpenQuestions whether document-level open questions are copied into the report
     */
    public record Report(String title, boolean includeOpenQuestions) {
        public Report {
            if (title == null || title.isBlank()) title = "Canonical Requirements";
        }
    }
}
