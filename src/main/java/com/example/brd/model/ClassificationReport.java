package com.example.brd.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Renderer-facing view of one classification run: sections in taxonomy order,
 * the numbered bibliography, source documents and (optionally) open questions.
 */
public record ClassificationReport(
        String title,
        LocalDateTime generatedAt,
        int totalRequirements,
        List<SectionReport> sections,
        List<BibliographyEntry> bibliography,
        List<DocumentSource> sources,
        List<DocumentOpenQuestions> openQuestions
) {

    /**
     * Factory method that stamps the generation time and counts requirements.
     */
    public static ClassificationReport from(String title,
                                            List<SectionReport> sections,
                                            List<BibliographyEntry> bibliography,
                                            List<DocumentSource> sources,
                                            List<DocumentOpenQuestions> openQuestions) {
        int total = sections.stream().mapToInt(s -> s.requirements().size()).sum();
        return new ClassificationReport(
                title,
                LocalDateTime.now(),
                total,
                List.copyOf(sections),
                List.copyOf(bibliography),
                sources != null ? List.copyOf(sources) : List.of(),
                openQuestions != null ? List.copyOf(openQuestions) : List.of()
        );
    }
}
