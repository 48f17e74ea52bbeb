package com.example.brd.service;

import com.example.brd.config.BrdProperties;
import com.example.brd.model.Bibliography;
import com.example.brd.model.ClassificationIndex;
import com.example.brd.model.ClassificationReport;
import com.example.brd.model.ClassifiedRequirement;
import com.example.brd.model.DocumentOpenQuestions;
import com.example.brd.model.DocumentSource;
import com.example.brd.model.RequirementDocument;
import com.example.brd.model.RequirementItem;
import com.example.brd.model.SectionDefinition;
import com.example.brd.model.SectionReport;
import com.example.brd.model.Taxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the renderer-facing {@link ClassificationReport} from a finished index and bibliography.
 * <p>
 * Sections follow taxonomy order; requirements inside a section are sorted by id across all kinds.
 */
@Service
public class ClassificationReportAssembler {

    private static final Logger log = LoggerFactory.getLogger(ClassificationReportAssembler.class);

    private final RequirementSummaryFormatter summaryFormatter;
    private final BrdProperties properties;

    public ClassificationReportAssembler(RequirementSummaryFormatter summaryFormatter,
                                         BrdProperties properties) {
        this.summaryFormatter = summaryFormatter;
        this.properties = properties;
    }

    public ClassificationReport assemble(Taxonomy taxonomy,
                                         ClassificationIndex index,
                                         Bibliography bibliography,
                                         List<RequirementDocument> documents) {
        List<SectionReport> sections = taxonomy.sections().stream()
                .map(section -> sectionReport(section, index, bibliography))
                .toList();

        List<DocumentSource> sources = documents.stream()
                .map(DocumentSource::of)
                .sorted(Comparator.comparing(DocumentSource::originDocumentKey)
                        .thenComparing(DocumentSource::fileName, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();

        List<DocumentOpenQuestions> openQuestions = properties.report().includeOpenQuestions()
                ? openQuestions(documents)
                : List.of();

        long emptySections = sections.stream().filter(s -> s.requirements().isEmpty()).count();
        log.info("Report assembled: {} sections ({} empty), {} bibliography entries, {} documents with open questions",
                sections.size(), emptySections, bibliography.entries().size(), openQuestions.size());

        return ClassificationReport.from(properties.report().title(), sections,
                bibliography.entries(), sources, openQuestions);
    }

    private SectionReport sectionReport(SectionDefinition section,
                                        ClassificationIndex index,
                                        Bibliography bibliography) {
        Map<String, Integer> kindCounts = new LinkedHashMap<>();
        index.kindsOf(section.id()).forEach((kind, entries) -> kindCounts.put(kind, entries.size()));

        List<RequirementItem> items = index.entriesSortedById(section.id()).stream()
                .map(entry -> item(entry, bibliography))
                .toList();

        return new SectionReport(section.id(), section.heading(), section.purpose(),
                section.renderingHints(), kindCounts, items);
    }

    private RequirementItem item(ClassifiedRequirement entry, Bibliography bibliography) {
        var requirement = entry.requirement();
        List<Integer> citations = bibliography.citationsFor(entry);
        return new RequirementItem(
                requirement.id(),
                requirement.kind(),
                requirement.title(),
                summaryFormatter.summary(requirement, Bibliography.formatMarkers(citations)),
                summaryFormatter.story(requirement),
                summaryFormatter.bdd(requirement),
                entry.originDocumentKey(),
                citations,
                requirement.legacyPrimaryClassification()
        );
    }

    private List<DocumentOpenQuestions> openQuestions(List<RequirementDocument> documents) {
        return documents.stream()
                .map(d -> new DocumentOpenQuestions(d.originKey(), d.title(), d.openQuestions()))
                .filter(q -> !q.questions().isEmpty())
                .sorted(Comparator.comparing(DocumentOpenQuestions::originDocumentKey))
                .toList();
    }
}
