package com.example.brd.service;

import com.example.brd.model.ClassificationIndex;
import com.example.brd.model.ClassifiedRequirement;
import com.example.brd.model.Requirement;
import com.example.brd.model.RequirementDocument;
import com.example.brd.model.Taxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Classifies every requirement of every document into section → kind buckets.
 * Buckets keep encounter order; every taxonomy section is present, possibly empty.
 */
@Service
public class ClassificationIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(ClassificationIndexBuilder.class);

    private final SectionAssigner sectionAssigner;

    public ClassificationIndexBuilder(SectionAssigner sectionAssigner) {
        this.sectionAssigner = sectionAssigner;
    }

    public ClassificationIndex build(List<RequirementDocument> documents, Taxonomy taxonomy) {
        ClassificationIndex.Builder builder = ClassificationIndex.builder(taxonomy.sectionIds());
        int fallbackCount = 0;

        for (RequirementDocument document : documents) {
            String originKey = document.originKey();
            for (Requirement requirement : document.requirements()) {
                String sectionId = sectionAssigner.assign(requirement, taxonomy);
                if (sectionId.equals(taxonomy.fallbackSectionId())) fallbackCount++;
                builder.add(sectionId, requirement.kind(), new ClassifiedRequirement(requirement, originKey));
            }
        }

        ClassificationIndex index = builder.build();
        log.info("Classified {} requirements from {} documents ({} in fallback section {})",
                index.totalRequirements(), documents.size(), fallbackCount, taxonomy.fallbackSectionId());
        return index;
    }
}
