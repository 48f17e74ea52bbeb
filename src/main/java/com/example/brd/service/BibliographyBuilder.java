package com.example.brd.service;

import com.example.brd.model.Bibliography;
import com.example.brd.model.BibliographyEntry;
import com.example.brd.model.ClassificationIndex;
import com.example.brd.model.ClassifiedRequirement;
import com.example.brd.model.RequirementDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Numbers every distinct source path cited by the classified requirements.
 * <p>
 * Two phases: collect the complete path set from the finished index, then number the
 * sorted set 1..N. Numbers depend only on the set of paths, never on document order.
 */
@Service
public class BibliographyBuilder {

    private static final Logger log = LoggerFactory.getLogger(BibliographyBuilder.class);

    private static final Comparator<RequirementDocument> BY_FILE_NAME =
            Comparator.comparing(RequirementDocument::fileName, Comparator.nullsLast(Comparator.naturalOrder()));

    public Bibliography build(ClassificationIndex index) {
        return build(index, List.of());
    }

    /**
     * @param index     finished classification index
     * @param documents input documents; used only for entry titles and URLs
     */
    public Bibliography build(ClassificationIndex index, List<RequirementDocument> documents) {
        SortedSet<String> paths = collectPaths(index);

        // documents sharing an origin key: the smallest file name supplies title and URL
        Map<String, RequirementDocument> documentsByKey = new HashMap<>();
        for (RequirementDocument document : documents) {
            documentsByKey.merge(document.originKey(), document,
                    (kept, other) -> BY_FILE_NAME.compare(other, kept) < 0 ? other : kept);
        }

        List<BibliographyEntry> entries = new ArrayList<>(paths.size());
        int number = 1;
        for (String path : paths) {
            RequirementDocument document = documentsByKey.get(path);
            entries.add(new BibliographyEntry(
                    number++,
                    path,
                    document != null ? document.title() : null,
                    document != null ? document.source().url() : null));
        }

        log.info("Bibliography built: {} distinct sources", entries.size());
        return new Bibliography(entries);
    }

    private SortedSet<String> collectPaths(ClassificationIndex index) {
        SortedSet<String> paths = new TreeSet<>();
        index.entries().forEach(entry -> addPaths(entry, paths));
        return paths;
    }

    private void addPaths(ClassifiedRequirement entry, SortedSet<String> paths) {
        paths.addAll(entry.requirement().referencePaths());
        String origin = entry.originDocumentKey();
        if (origin != null && !origin.isBlank()) {
            paths.add(origin.strip());
        }
    }
}
