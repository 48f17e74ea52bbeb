package com.example.brd.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Requirements grouped by section id, then by kind tag.
 * <p>
 * Buckets keep encounter order; {@link #entriesSortedById(String)} gives the presentation
 * order. Instances are immutable; use {@link #builder(Collection)} to assemble one.
 */
public final class ClassificationIndex {

    private final Map<String, Map<String, List<ClassifiedRequirement>>> sections;

    private ClassificationIndex(Map<String, Map<String, List<ClassifiedRequirement>>> sections) {
        this.sections = sections;
    }

    public static Builder builder(Collection<String> sectionIds) {
        return new Builder(sectionIds);
    }

    /** Section ids in taxonomy order (plus any added later, in insertion order). */
    public List<String> sectionIds() {
        return List.copyOf(sections.keySet());
    }

    /** Kind tag → entries for one section; empty for an unknown id. */
    public Map<String, List<ClassifiedRequirement>> kindsOf(String sectionId) {
        return sections.getOrDefault(sectionId, Map.of());
    }

    /** All entries of a section across kinds, stably sorted by requirement id. */
    public List<ClassifiedRequirement> entriesSortedById(String sectionId) {
        List<ClassifiedRequirement> entries = new ArrayList<>();
        kindsOf(sectionId).values().forEach(entries::addAll);
        entries.sort(ClassifiedRequirement.BY_REQUIREMENT_ID);
        return entries;
    }

    public Stream<ClassifiedRequirement> entries() {
        return sections.values().stream()
                .flatMap(kinds -> kinds.values().stream())
                .flatMap(List::stream);
    }

    public int totalRequirements() {
        return (int) entries().count();
    }

    public Map<String, Map<String, List<ClassifiedRequirement>>> asMap() {
        return sections;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ClassificationIndex other && sections.equals(other.sections);
    }

    @Override
    public int hashCode() {
        return sections.hashCode();
    }

    /**
     * Single-pass builder. Not thread-safe; the built index is.
     */
    public static final class Builder {

        private final Map<String, Map<String, List<ClassifiedRequirement>>> sections = new LinkedHashMap<>();

        private Builder(Collection<String> sectionIds) {
            sectionIds.forEach(id -> sections.put(id, new LinkedHashMap<>()));
        }

        public Builder add(String sectionId, String kind, ClassifiedRequirement entry) {
            sections.computeIfAbsent(sectionId, id -> new LinkedHashMap<>())
                    .computeIfAbsent(kind, k -> new ArrayList<>())
                    .add(entry);
            return this;
        }

        public ClassificationIndex build() {
            Map<String, Map<String, List<ClassifiedRequirement>>> frozen = new LinkedHashMap<>();
            sections.forEach((sectionId, kinds) -> {
                Map<String, List<ClassifiedRequirement>> frozenKinds = new LinkedHashMap<>();
                kinds.forEach((kind, entries) -> frozenKinds.put(kind, List.copyOf(entries)));
                frozen.put(sectionId, Collections.unmodifiableMap(frozenKinds));
            });
            return new ClassificationIndex(Collections.unmodifiableMap(frozen));
        }
    }
}
