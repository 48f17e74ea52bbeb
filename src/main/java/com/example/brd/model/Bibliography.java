package com.example.brd.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Citation numbers for every distinct source path, plus the inline marker format.
 * Immutable.
 */
public final class Bibliography {

    private final List<BibliographyEntry> entries;
    private final Map<String, Integer> numbersByPath;

    public Bibliography(List<BibliographyEntry> entries) {
        this.entries = List.copyOf(entries);
        Map<String, Integer> numbers = new LinkedHashMap<>();
        this.entries.forEach(entry -> numbers.put(entry.relativePath(), entry.number()));
        this.numbersByPath = Collections.unmodifiableMap(numbers);
    }

    public List<BibliographyEntry> entries() {
        return entries;
    }

    /** Path → citation number, in ascending number order. */
    public Map<String, Integer> asMap() {
        return numbersByPath;
    }

    /** Citation number of a path, or null when the path was never cited. */
    public Integer numberOf(String relativePath) {
        return relativePath != null ? numbersByPath.get(relativePath.strip()) : null;
    }

    /**
     * Ascending, de-duplicated citation numbers for a requirement's references and its origin document.
     */
    public List<Integer> citationsFor(Requirement requirement, String originDocumentKey) {
        TreeSet<Integer> numbers = new TreeSet<>();
        for (String path : requirement.referencePaths()) {
            Integer number = numberOf(path);
            if (number != null) numbers.add(number);
        }
        if (originDocumentKey != null && !originDocumentKey.isBlank()) {
            Integer number = numberOf(originDocumentKey);
            if (number != null) numbers.add(number);
        }
        return List.copyOf(numbers);
    }

    public List<Integer> citationsFor(ClassifiedRequirement entry) {
        return citationsFor(entry.requirement(), entry.originDocumentKey());
    }

    /** Inline markers such as "[1][3]"; empty when nothing is cited. */
    public String markersFor(ClassifiedRequirement entry) {
        return formatMarkers(citationsFor(entry));
    }

    public static String formatMarkers(Collection<Integer> numbers) {
        return new TreeSet<>(numbers).stream()
                .map(n -> "[" + n + "]")
                .collect(Collectors.joining());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Bibliography other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }
}
