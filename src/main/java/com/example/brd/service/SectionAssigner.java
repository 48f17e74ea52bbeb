package com.example.brd.service;

import com.example.brd.model.Requirement;
import com.example.brd.model.SectionDefinition;
import com.example.brd.model.Taxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the BRD section of a requirement.
 * <p>
 * Sections are tried in taxonomy order. With {@code firstMatchWins} the first match is returned
 * immediately; otherwise every section is evaluated and the first of the matched ids is still
 * the one returned. Unmatched requirements go to the policy's unassigned section, and any id
 * outside the taxonomy is coerced to {@link Taxonomy#fallbackSectionId()}.
 */
@Service
public class SectionAssigner {

    private static final Logger log = LoggerFactory.getLogger(SectionAssigner.class);

    private final ExpressionEvaluator expressionEvaluator;

    public SectionAssigner(ExpressionEvaluator expressionEvaluator) {
        this.expressionEvaluator = expressionEvaluator;
    }

    /**
     * @return a section id that is always valid for {@code taxonomy}
     */
    public String assign(Requirement requirement, Taxonomy taxonomy) {
        List<String> matched = matchingSectionIds(requirement, taxonomy);
        String sectionId = matched.isEmpty() ? taxonomy.policy().unassignedSectionId() : matched.get(0);

        if (matched.size() > 1) {
            log.debug("Requirement {} matched {} sections {}, keeping {}",
                    requirement.id(), matched.size(), matched, sectionId);
        }
        return coerce(sectionId, taxonomy);
    }

    /**
     * Matching section ids in taxonomy order. Holds at most one id when
     * {@code firstMatchWins} is set.
     */
    public List<String> matchingSectionIds(Requirement requirement, Taxonomy taxonomy) {
        boolean firstMatchWins = taxonomy.policy().firstMatchWins();
        List<String> matched = new ArrayList<>();
        for (SectionDefinition section : taxonomy.sections()) {
            if (section.match().isEmpty()) continue;
            if (expressionEvaluator.matchesAny(section.match(), requirement.node())) {
                matched.add(section.id());
                if (firstMatchWins) break;
            }
        }
        return matched;
    }

    String coerce(String sectionId, Taxonomy taxonomy) {
        if (taxonomy.isValidSectionId(sectionId)) {
            return sectionId;
        }
        log.warn("Section id {} is not defined in the taxonomy, using {}", sectionId, taxonomy.fallbackSectionId());
        return taxonomy.fallbackSectionId();
    }
}
