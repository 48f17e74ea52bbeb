package com.example.brd.model;

import java.util.List;

/**
 * A requirement as presented in a report section.
 *
 * @param id                    requirement id ("" when missing)
 * @param kind                  kind tag
 * @param title                 requirement title, may be null
 * @param summary               statement (or story sentence) with id tag and citation markers
 * @param story                 user story block, "—" when empty
 * @param bdd                   BDD block, "—" when empty
 * @param originDocumentKey     key of the document the requirement came from
 * @param citations             ascending citation numbers
 * @param legacyClassification  legacy classification.primary hint, may be null
 */
public record RequirementItem(
        String id,
        String kind,
        String title,
        String summary,
        String story,
        String bdd,
        String originDocumentKey,
        List<Integer> citations,
        String legacyClassification
) {}
