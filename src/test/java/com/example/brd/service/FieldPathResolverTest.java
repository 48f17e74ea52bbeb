package com.example.brd.service;

import static com.example.brd.TestJson.node;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

class FieldPathResolverTest {

    private final FieldPathResolver resolver = new FieldPathResolver();

    private final JsonNode requirement = node("""
            {
              "id": "REQ-1",
              "owner": null,
              "approved": false,
              "classification": { "primary": "Functional" },
              "story": { "asA": "clerk", "iWant": "to search" },
              "tags": ["a", "b"]
            }
            """);

    @Test
    void stripsRequirementPrefix() {
        assertThat(resolver.resolve(requirement, "requirement.classification.primary").textValue())
                .isEqualTo("Functional");
        assertThat(resolver.resolve(requirement, "requirement.story.asA").textValue()).isEqualTo("clerk");
    }

    @Test
    void acceptsPathsWithoutPrefix() {
        assertThat(resolver.resolve(requirement, "id").textValue()).isEqualTo("REQ-1");
    }

    @Test
    void bareRequirementReturnsWholeRecord() {
        assertThat(resolver.resolve(requirement, "requirement")).isSameAs(requirement);
    }

    @Test
    void missingKeyIsAbsent() {
        assertThat(resolver.resolve(requirement, "requirement.missing").isMissingNode()).isTrue();
        assertThat(resolver.resolve(requirement, "requirement.story.soThat").isMissingNode()).isTrue();
    }

    @Test
    void traversalThroughNonObjectIsAbsent() {
        assertThat(resolver.resolve(requirement, "requirement.id.length").isMissingNode()).isTrue();
        assertThat(resolver.resolve(requirement, "requirement.tags.0").isMissingNode()).isTrue();
        assertThat(resolver.resolve(requirement, "requirement.owner.name").isMissingNode()).isTrue();
    }

    @Test
    void explicitNullAndFalseAreNotAbsent() {
        JsonNode owner = resolver.resolve(requirement, "requirement.owner");
        assertThat(owner.isMissingNode()).isFalse();
        assertThat(owner.isNull()).isTrue();

        JsonNode approved = resolver.resolve(requirement, "requirement.approved");
        assertThat(approved.isMissingNode()).isFalse();
        assertThat(approved.booleanValue()).isFalse();
    }

    @Test
    void emptyOrNullPathIsAbsent() {
        assertThat(resolver.resolve(requirement, "").isMissingNode()).isTrue();
        assertThat(resolver.resolve(requirement, "   ").isMissingNode()).isTrue();
        assertThat(resolver.resolve(requirement, null).isMissingNode()).isTrue();
        assertThat(resolver.resolve(requirement, "requirement.").isMissingNode()).isTrue();
    }
}
