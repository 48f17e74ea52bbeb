package com.example.brd.service;

import com.example.brd.model.InvalidRequirementDocumentException;
import com.example.brd.model.RequirementDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;

/**
 * Parses a canonical requirements JSON file into a {@link RequirementDocument}.
 */
@Service
public class RequirementDocumentReader {

    private static final Logger log = LoggerFactory.getLogger(RequirementDocumentReader.class);

    private final ObjectMapper objectMapper;

    public RequirementDocumentReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param fileName name used as origin key when the document declares no relative path
     * @param content  JSON content
     * @throws InvalidRequirementDocumentException if the content is not a JSON object
     */
    public RequirementDocument read(String fileName, InputStream content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new InvalidRequirementDocumentException(
                    "File '%s' is not valid JSON: %s".formatted(fileName, e.getOriginalMessage()), e);
        } catch (IOException e) {
            throw new RuntimeException("Unable to read '%s': %s".formatted(fileName, e.getMessage()), e);
        }
        return toDocument(fileName, root);
    }

    public RequirementDocument read(String fileName, String json) {
        try {
            return toDocument(fileName, objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidRequirementDocumentException(
                    "File '%s' is not valid JSON: %s".formatted(fileName, e.getOriginalMessage()), e);
        }
    }

    private RequirementDocument toDocument(String fileName, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidRequirementDocumentException(
                    "File '%s' must contain a JSON object".formatted(fileName));
        }
        RequirementDocument document = new RequirementDocument(fileName, root);
        log.debug("Read '{}' (origin key {}, {} requirements)",
                fileName, document.originKey(), document.requirements().size());
        return document;
    }
}
