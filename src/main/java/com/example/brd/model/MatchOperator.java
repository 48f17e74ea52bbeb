package com.example.brd.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operators available to leaf match expressions.
 */
public enum MatchOperator {
    EXISTS("exists"),
    EQ("eq"),
    IN("in"),
    CONTAINS("contains"),
    CONTAINS_TEXT("containsText");

    private final String tag;

    MatchOperator(String tag) {
        this.tag = tag;
    }

    /**
     * Looks up an operator by its configuration tag. Tags are case-sensitive.
     *
     * @return the operator, or empty for an unknown tag
     */
    public static Optional<MatchOperator> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(op -> op.tag.equals(tag))
                .findFirst();
    }
}
