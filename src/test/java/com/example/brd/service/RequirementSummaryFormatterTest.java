package com.example.brd.service;

import static com.example.brd.TestJson.requirement;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.brd.model.Requirement;
import org.junit.jupiter.api.Test;

class RequirementSummaryFormatterTest {

    private final RequirementSummaryFormatter formatter = new RequirementSummaryFormatter();

    @Test
    void statementWithIdTagAndMarkers() {
        Requirement requirement = requirement("{\"id\": \"REQ-4\", \"statement\": \"  Invoices are numbered.  \"}");

        assertThat(formatter.summary(requirement, "[1][2]")).isEqualTo("Invoices are numbered. [REQ-4] [1][2]");
        assertThat(formatter.summary(requirement, "")).isEqualTo("Invoices are numbered. [REQ-4]");
    }

    @Test
    void storySentenceWhenStatementMissing() {
        Requirement requirement = requirement("""
                { "id": "US-1",
                  "story": { "asA": "clerk", "iWant": "to search orders", "soThat": "I answer calls faster" } }
                """);

        assertThat(formatter.summary(requirement, "[3]"))
                .isEqualTo("As clerk, I want to search orders. So that I answer calls faster. [US-1] [3]");
    }

    @Test
    void nothingToSummarize() {
        assertThat(formatter.summary(requirement("{\"id\": \"X\", \"story\": {\"asA\": \"clerk\"}}"), "[1]")).isEmpty();
        assertThat(formatter.summary(requirement("{}"), null)).isEmpty();
    }

    @Test
    void storyBlock() {
        Requirement requirement = requirement("{\"story\": {\"asA\": \"clerk\", \"soThat\": \"speed\"}}");

        assertThat(formatter.story(requirement)).isEqualTo("As a: clerk\nSo that: speed");
        assertThat(formatter.story(requirement("{\"story\": \"text\"}"))).isEqualTo("—");
    }

    @Test
    void bddBlockWithSteps() {
        Requirement requirement = requirement("""
                { "bdd": { "feature": "Login", "scenario": "Wrong password",
                           "steps": [ { "keyword": "Given", "text": "a locked account" },
                                      { "keyword": "When" },
                                      "junk",
                                      { "keyword": "Then", "text": "an error is shown" } ] } }
                """);

        assertThat(formatter.bdd(requirement)).isEqualTo(
                "Feature: Login\nScenario: Wrong password\nSteps:\nGiven a locked account\nThen an error is shown");
        assertThat(formatter.bdd(requirement("{}"))).isEqualTo("—");
    }
}
