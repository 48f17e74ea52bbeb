package com.example.brd.service;

import com.example.brd.model.AssignmentPolicy;
import com.example.brd.model.JsonFields;
import com.example.brd.model.MatchExpression;
import com.example.brd.model.RenderingHints;
import com.example.brd.model.SectionDefinition;
import com.example.brd.model.Taxonomy;
import com.example.brd.model.TaxonomyConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the BRD sections JSON into an immutable {@link Taxonomy}.
 * <p>
 * Expected shape:
 * <pre>
 * {
 *   "assignmentPolicy": { "firstMatchWins": true, "unassignedSectionId": "BRD-99" },
 *   "sections": [
 *     { "id": "BRD-01", "number": "1", "title": "...", "purpose": "...",
 *       "match": [ { "field": "requirement.kind", "op": "eq", "value": "Business" } ],
 *       "renderingHints": { "includeReferences": true, "includeQuotes": false } }
 *   ]
 * }
 * </pre>
 * Individual bad sections are skipped with a warning; only a structurally unusable
 * file raises {@link TaxonomyConfigurationException}.
 */
@Service
public class TaxonomyLoader {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyLoader.class);

    private final ObjectMapper objectMapper;
    private final MatchExpressionParser expressionParser;

    public TaxonomyLoader(ObjectMapper objectMapper, MatchExpressionParser expressionParser) {
        this.objectMapper = objectMapper;
        this.expressionParser = expressionParser;
    }

    public Taxonomy load(Resource resource) {
        String source = resource.getDescription();
        try (InputStream in = resource.getInputStream()) {
            return load(objectMapper.readTree(in), source);
        } catch (JsonProcessingException e) {
            throw new TaxonomyConfigurationException("Invalid JSON in taxonomy " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new TaxonomyConfigurationException("Unable to read taxonomy " + source + ": " + e.getMessage(), e);
        }
    }

    public Taxonomy load(String json) {
        try {
            return load(objectMapper.readTree(json), "inline taxonomy");
        } catch (JsonProcessingException e) {
            throw new TaxonomyConfigurationException("Invalid JSON in taxonomy: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @param root   parsed sections JSON
     * @param source description of where it came from, for messages
     */
    public Taxonomy load(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new TaxonomyConfigurationException("Invalid taxonomy (expected object): " + source);
        }
        JsonNode sectionsNode = root.get("sections");
        if (sectionsNode == null || !sectionsNode.isArray() || sectionsNode.isEmpty()) {
            throw new TaxonomyConfigurationException("Invalid taxonomy (missing sections[]): " + source);
        }

        List<SectionDefinition> sections = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < sectionsNode.size(); i++) {
            JsonNode node = sectionsNode.get(i);
            if (!node.isObject()) {
                log.warn("Taxonomy {}: sections[{}] is not an object, skipped", source, i);
                continue;
            }
            String id = JsonFields.text(node, "id");
            if (id == null) {
                log.warn("Taxonomy {}: sections[{}] has no id, skipped", source, i);
                continue;
            }
            if (!seen.add(id)) {
                log.warn("Taxonomy {}: duplicate section id {} at sections[{}], skipped", source, id, i);
                continue;
            }
            sections.add(parseSection(node, id));
        }

        AssignmentPolicy policy = parsePolicy(root.path("assignmentPolicy"));
        Taxonomy taxonomy = new Taxonomy(sections, policy);

        if (!taxonomy.fallbackSectionId().equals(policy.unassignedSectionId())) {
            log.warn("Taxonomy {}: unassignedSectionId {} is not a section id, using {}",
                    source, policy.unassignedSectionId(), taxonomy.fallbackSectionId());
        }
        log.info("Loaded taxonomy from {}: {} sections, firstMatchWins={}, fallback {}",
                source, sections.size(), policy.firstMatchWins(), taxonomy.fallbackSectionId());
        return taxonomy;
    }

    private SectionDefinition parseSection(JsonNode node, String id) {
        List<MatchExpression> rules = new ArrayList<>();
        JsonNode match = node.get("match");
        if (match != null && match.isArray()) {
            for (int i = 0; i < match.size(); i++) {
                rules.add(expressionParser.parse(match.get(i), id + ".match[" + i + "]"));
            }
        } else if (match != null) {
            log.warn("Section {}: 'match' is not an array, section will never match", id);
        }

        return new SectionDefinition(
                id,
                JsonFields.scalar(node, "number"),
                JsonFields.text(node, "title"),
                JsonFields.text(node, "purpose"),
                rules,
                parseHints(node.get("renderingHints"))
        );
    }

    private RenderingHints parseHints(JsonNode hints) {
        if (hints == null || !hints.isObject()) {
            return RenderingHints.DEFAULT;
        }
        return new RenderingHints(
                !isExplicitFalse(hints.get("includeReferences")),
                !isExplicitFalse(hints.get("includeQuotes")));
    }

    private AssignmentPolicy parsePolicy(JsonNode policy) {
        if (!policy.isObject()) {
            return AssignmentPolicy.defaults();
        }
        JsonNode firstMatchWins = policy.get("firstMatchWins");
        return new AssignmentPolicy(
                firstMatchWins == null || !firstMatchWins.isBoolean() || firstMatchWins.booleanValue(),
                JsonFields.text(policy, "unassignedSectionId"));
    }

    private static boolean isExplicitFalse(JsonNode value) {
        return value != null && value.isBoolean() && !value.booleanValue();
    }
}
