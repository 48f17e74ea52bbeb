package com.example.brd.service;

import com.example.brd.model.JsonFields;
import com.example.brd.model.Requirement;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text summaries of a requirement for the report: the statement line, the user story
 * and the BDD scenario.
 */
@Service
public class RequirementSummaryFormatter {

    static final String EMPTY = "—";

    /**
     * The statement followed by the " [ID]" tag and citation markers. Without a statement, a
     * sentence built from the user story is used; without either, an empty string.
     */
    public String summary(Requirement requirement, String citationMarkers) {
        String text = requirement.statement();
        if (text == null) {
            text = storySentence(requirement.node().get("story"));
        }
        if (text == null) {
            return "";
        }

        StringBuilder line = new StringBuilder(text);
        String id = JsonFields.text(requirement.node(), "id");
        if (id != null) {
            line.append(" [").append(id).append(']');
        }
        if (citationMarkers != null && !citationMarkers.isEmpty()) {
            line.append(' ').append(citationMarkers);
        }
        return line.toString();
    }

    /** "As a: ...", "I want: ...", "So that: ..." lines, or "—". */
    public String story(Requirement requirement) {
        JsonNode story = requirement.node().get("story");
        if (story == null || !story.isObject()) return EMPTY;

        List<String> lines = new ArrayList<>();
        addLine(lines, "As a: ", JsonFields.text(story, "asA"));
        addLine(lines, "I want: ", JsonFields.text(story, "iWant"));
        addLine(lines, "So that: ", JsonFields.text(story, "soThat"));
        return lines.isEmpty() ? EMPTY : String.join("\n", lines);
    }

    /** Feature, scenario and "keyword text" steps, or "—". */
    public String bdd(Requirement requirement) {
        JsonNode bdd = requirement.node().get("bdd");
        if (bdd == null || !bdd.isObject()) return EMPTY;

        List<String> lines = new ArrayList<>();
        addLine(lines, "Feature: ", JsonFields.text(bdd, "feature"));
        addLine(lines, "Scenario: ", JsonFields.text(bdd, "scenario"));

        JsonNode steps = bdd.get("steps");
        if (steps != null && steps.isArray()) {
            List<String> stepLines = new ArrayList<>();
            for (JsonNode step : steps) {
                String keyword = JsonFields.text(step, "keyword");
                String text = JsonFields.text(step, "text");
                if (keyword != null && text != null) {
                    stepLines.add(keyword + " " + text);
                }
            }
            if (!stepLines.isEmpty()) {
                lines.add("Steps:");
                lines.addAll(stepLines);
            }
        }
        return lines.isEmpty() ? EMPTY : String.join("\n", lines);
    }

    private String storySentence(JsonNode story) {
        if (story == null || !story.isObject()) return null;
        String asA = JsonFields.text(story, "asA");
        String iWant = JsonFields.text(story, "iWant");
        String soThat = JsonFields.text(story, "soThat");

        List<String> parts = new ArrayList<>();
        if (asA != null && iWant != null) {
            parts.add("As %s, I want %s.".formatted(asA, iWant));
        }
        if (soThat != null) {
            parts.add("So that %s.".formatted(soThat));
        }
        return parts.isEmpty() ? null : String.join(" ", parts);
    }

    private static void addLine(List<String> lines, String label, String value) {
        if (value != null) lines.add(label + value);
    }
}
