package com.example.brd.service;

import static com.example.brd.TestJson.document;
import static com.example.brd.TestJson.requirement;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.example.brd.model.Bibliography;
import com.example.brd.model.BibliographyEntry;
import com.example.brd.model.ClassificationIndex;
import com.example.brd.model.ClassifiedRequirement;
import com.example.brd.model.Requirement;
import com.example.brd.model.RequirementDocument;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BibliographyBuilderTest {

    private final BibliographyBuilder builder = new BibliographyBuilder();

    private static ClassificationIndex index(ClassifiedRequirement... entries) {
        ClassificationIndex.Builder index = ClassificationIndex.builder(List.of("S"));
        for (ClassifiedRequirement entry : entries) {
            index.add("S", entry.requirement().kind(), entry);
        }
        return index.build();
    }

    @Test
    void numbersFollowSortedPathsNotEncounterOrder() {
        ClassificationIndex index = index(
                new ClassifiedRequirement(requirement("{\"id\": \"1\"}"), "docB.json"),
                new ClassifiedRequirement(requirement("{\"id\": \"2\"}"), "docA.json"));

        Bibliography bibliography = builder.build(index);

        assertThat(bibliography.asMap()).containsExactly(Map.entry("docA.json", 1), Map.entry("docB.json", 2));
    }

    @Test
    void collectsReferencePathsAndOriginKeysOnce() {
        Requirement withRefs = requirement("""
                { "id": "R1", "references": [
                    { "relativePath": " specs/zeta.md " },
                    { "relativePath": "specs/alpha.md" },
                    { "relativePath": "specs/alpha.md" },
                    { "relativePath": "" },
                    { "quote": "no path" },
                    "bogus"
                ] }
                """);
        ClassificationIndex index = index(
                new ClassifiedRequirement(withRefs, "docs/main.json"),
                new ClassifiedRequirement(requirement("{\"id\": \"R2\"}"), "docs/main.json"),
                new ClassifiedRequirement(requirement("{\"id\": \"R3\"}"), "  "));

        Bibliography bibliography = builder.build(index);

        assertThat(bibliography.entries())
                .extracting(BibliographyEntry::number, BibliographyEntry::relativePath)
                .containsExactly(
                        tuple(1, "docs/main.json"),
                        tuple(2, "specs/alpha.md"),
                        tuple(3, "specs/zeta.md"));
    }

    @Test
    void citationsAreAscendingAndDistinct() {
        Requirement requirement = requirement("""
                { "id": "R1", "references": [ { "relativePath": "c.md" }, { "relativePath": "a.md" } ] }
                """);
        ClassifiedRequirement entry = new ClassifiedRequirement(requirement, "a.md");
        ClassificationIndex index = index(
                entry,
                new ClassifiedRequirement(requirement("{\"id\": \"R2\"}"), "b.md"));

        Bibliography bibliography = builder.build(index);

        assertThat(bibliography.citationsFor(entry)).containsExactly(1, 3);
        assertThat(bibliography.markersFor(entry)).isEqualTo("[1][3]");
    }

    @Test
    void requirementWithoutSourcesHasNoMarkers() {
        Bibliography bibliography = builder.build(index());

        ClassifiedRequirement entry = new ClassifiedRequirement(requirement("{}"), "");
        assertThat(bibliography.entries()).isEmpty();
        assertThat(bibliography.citationsFor(entry)).isEmpty();
        assertThat(bibliography.markersFor(entry)).isEmpty();
    }

    @Test
    void formatMarkersSortsAndDeduplicates() {
        assertThat(Bibliography.formatMarkers(List.of(3, 1, 3))).isEqualTo("[1][3]");
        assertThat(Bibliography.formatMarkers(List.of())).isEmpty();
    }

    @Test
    void entriesCarryDocumentTitleAndUrl() {
        RequirementDocument billing = document("billing.json", """
                { "sourceDocument": { "title": "Billing Spec", "relativePath": "confluence/billing.md",
                                      "confluence": { "pageId": 123, "url": "https://wiki.example.com/x/123" } },
                  "requirements": [ { "id": "B-1", "references": [ { "relativePath": "figma/flows.md" } ] } ] }
                """);
        RequirementDocument portal = document("portal.json", """
                { "sourceDocument": { "relativePath": "confluence/portal/overview.md" },
                  "requirements": [ { "id": "P-1" } ] }
                """);
        ClassificationIndex.Builder index = ClassificationIndex.builder(List.of("S"));
        for (RequirementDocument document : List.of(billing, portal)) {
            document.requirements().forEach(r ->
                    index.add("S", r.kind(), new ClassifiedRequirement(r, document.originKey())));
        }

        Bibliography bibliography = builder.build(index.build(), List.of(billing, portal));

        assertThat(bibliography.entries()).containsExactly(
                new BibliographyEntry(1, "confluence/billing.md", "Billing Spec", "https://wiki.example.com/x/123"),
                new BibliographyEntry(2, "confluence/portal/overview.md", "overview.md", null),
                new BibliographyEntry(3, "figma/flows.md", null, null));
        assertThat(bibliography.entries().get(0).line())
                .isEqualTo("[1] Billing Spec — confluence/billing.md — https://wiki.example.com/x/123");
        assertThat(bibliography.entries().get(2).line()).isEqualTo("[3] figma/flows.md");
    }

    @Test
    void sharedOriginKeyTakesTitleFromSmallestFileName() {
        String source = "{\"sourceDocument\": {\"relativePath\": \"confluence/FIN/billing.md\", \"title\": \"%s\"}}";
        RequirementDocument later = document("b.requirements.json", source.formatted("Billing v2"));
        RequirementDocument earlier = document("a.requirements.json", source.formatted("Billing v1"));
        ClassificationIndex index = index(
                new ClassifiedRequirement(requirement("{\"id\": \"1\"}"), "confluence/FIN/billing.md"));

        Bibliography forward = builder.build(index, List.of(later, earlier));
        Bibliography reversed = builder.build(index, List.of(earlier, later));

        assertThat(forward.entries()).extracting(BibliographyEntry::title).containsExactly("Billing v1");
        assertThat(reversed).isEqualTo(forward);
    }

    @Test
    void numberingIsIndependentOfDocumentOrder() {
        ClassifiedRequirement first = new ClassifiedRequirement(
                requirement("{\"id\": \"1\", \"references\": [{\"relativePath\": \"z.md\"}]}"), "m.json");
        ClassifiedRequirement second = new ClassifiedRequirement(
                requirement("{\"id\": \"2\", \"references\": [{\"relativePath\": \"a.md\"}]}"), "b.json");

        Bibliography forward = builder.build(index(first, second));
        Bibliography backward = builder.build(index(second, first));

        assertThat(forward).isEqualTo(backward);
        assertThat(forward.asMap()).containsExactly(
                Map.entry("a.md", 1), Map.entry("b.json", 2), Map.entry("m.json", 3), Map.entry("z.md", 4));
    }
}
