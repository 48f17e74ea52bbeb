package com.example.brd.orchestrator;

import com.example.brd.model.Bibliography;
import com.example.brd.model.ClassificationIndex;
import com.example.brd.model.ClassificationReport;
import com.example.brd.model.ClassificationResult;
import com.example.brd.model.RequirementDocument;
import com.example.brd.model.Taxonomy;
import com.example.brd.service.BibliographyBuilder;
import com.example.brd.service.ClassificationIndexBuilder;
import com.example.brd.service.ClassificationReportAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Classification pipeline.
 * Pipeline:
 * 1. Section assignment of every requirement (classification index)
 * 2. Bibliography numbering over the finished index
 * 3. Report assembly
 * <p>
 * Runs synchronously on the calling thread; each run builds its own index and bibliography.
 */
@Service
public class ClassificationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ClassificationOrchestrator.class);

    private final Taxonomy taxonomy;
    private final ClassificationIndexBuilder indexBuilder;
    private final BibliographyBuilder bibliographyBuilder;
    private final ClassificationReportAssembler reportAssembler;

    public ClassificationOrchestrator(Taxonomy taxonomy,
                                      ClassificationIndexBuilder indexBuilder,
                                      BibliographyBuilder bibliographyBuilder,
                                      ClassificationReportAssembler reportAssembler) {
        this.taxonomy = taxonomy;
        this.indexBuilder = indexBuilder;
        this.bibliographyBuilder = bibliographyBuilder;
        this.reportAssembler = reportAssembler;
    }

    public ClassificationResult classify(List<RequirementDocument> documents) {
        log.info("Starting classification of {} documents against {} sections",
                documents.size(), taxonomy.sections().size());

        // ── Step 1: Section assignment ──
        log.info("[1/3] Assigning sections...");
        ClassificationIndex index = indexBuilder.build(documents, taxonomy);
        log.info("[1/3] {} requirements classified", index.totalRequirements());

        // ── Step 2: Bibliography ──
        log.info("[2/3] Numbering citations...");
        Bibliography bibliography = bibliographyBuilder.build(index, documents);
        log.info("[2/3] {} sources numbered", bibliography.entries().size());

        // ── Step 3: Report ──
        log.info("[3/3] Assembling report...");
        ClassificationReport report = reportAssembler.assemble(taxonomy, index, bibliography, documents);
        log.info("[3/3] Report '{}' ready", report.title());

        return new ClassificationResult(index, bibliography, report);
    }

    public Taxonomy taxonomy() {
        return taxonomy;
    }
}
