package com.example.brd.controller;

import com.example.brd.model.ClassificationResult;
import com.example.brd.model.InvalidRequirementDocumentException;
import com.example.brd.model.RequirementDocument;
import com.example.brd.model.TaxonomyView;
import com.example.brd.orchestrator.ClassificationOrchestrator;
import com.example.brd.service.RequirementDocumentReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * REST controller for requirements classification.
 */
@RestController
@RequestMapping("/api")
public class ClassificationController {

    private static final Logger log = LoggerFactory.getLogger(ClassificationController.class);

    private final ClassificationOrchestrator orchestrator;
    private final RequirementDocumentReader documentReader;

    public ClassificationController(ClassificationOrchestrator orchestrator,
                                    RequirementDocumentReader documentReader) {
        this.orchestrator = orchestrator;
        this.documentReader = documentReader;
    }

    /**
     * Classifies canonical requirements documents into BRD sections and returns the report as JSON.
     *
     * <p>Endpoint: POST /api/classify
     * <p>Content-Type: multipart/form-data
     * <p>Parameter: files (one or more *.json requirements documents)
     */
    @PostMapping(value = "/classify", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> classify(@RequestParam("files") List<MultipartFile> files) {
        // ── Input validation ──
        if (files == null || files.stream().allMatch(MultipartFile::isEmpty)) {
            return badRequest("No files uploaded. Please upload one or more requirements JSON files.");
        }
        for (MultipartFile file : files) {
            String filename = file.getOriginalFilename();
            if (filename == null || !filename.toLowerCase().endsWith(".json")) {
                return badRequest("Invalid format for '%s'. Only JSON files accepted.".formatted(filename));
            }
        }

        log.info("Received classification request for {} files", files.size());

        try {
            List<RequirementDocument> documents = readDocuments(files);
            ClassificationResult result = orchestrator.classify(documents);
            return ResponseEntity.ok(result.report());

        } catch (InvalidRequirementDocumentException e) {
            log.warn("Rejected upload: {}", e.getMessage());
            return badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Error during classification", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during classification",
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    /**
     * Returns the loaded BRD sections and assignment policy.
     *
     * <p>Endpoint: GET /api/taxonomy
     */
    @GetMapping("/taxonomy")
    public ResponseEntity<TaxonomyView> taxonomy() {
        return ResponseEntity.ok(TaxonomyView.from(orchestrator.taxonomy()));
    }

    /**
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "BRD-Classifier",
                "sections", orchestrator.taxonomy().sections().size()
        ));
    }

    private List<RequirementDocument> readDocuments(List<MultipartFile> files) throws IOException {
        List<RequirementDocument> documents = new ArrayList<>();
        for (MultipartFile file : files) {
            if (file.isEmpty()) continue;
            try (InputStream in = file.getInputStream()) {
                documents.add(documentReader.read(file.getOriginalFilename(), in));
            }
        }
        return documents;
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
