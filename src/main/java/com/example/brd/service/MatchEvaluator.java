package com.example.brd.service;

import com.example.brd.model.MatchOperator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.Locale;

/**
 * Evaluates one leaf comparison between a resolved requirement value and the rule's expected value.
 * <p>
 * Operators:
 * <ul>
 *   <li>{@code exists}: value is present; a boolean expected value is compared against presence</li>
 *   <li>{@code eq}: structural equality, numbers compared by value</li>
 *   <li>{@code in}: expected is an array containing the value</li>
 *   <li>{@code contains}: array value contains expected, or string value contains expected substring</li>
 *   <li>{@code containsText}: case-insensitive substring test on a string or on any string in an array</li>
 * </ul>
 * Unknown operators never match.
 */
@Service
public class MatchEvaluator {

    /** 1 and 1.0 are equal; everything else falls back to JsonNode equality. */
    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.equals(b)) return 0;
        if (a.isNumber() && b.isNumber()) {
            return compareNumbers(a, b);
        }
        return 1;
    };

    // Infinite or NaN doubles have no BigDecimal form
    private static int compareNumbers(JsonNode a, JsonNode b) {
        if (!isFinite(a) || !isFinite(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        try {
            return a.decimalValue().compareTo(b.decimalValue());
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private static boolean isFinite(JsonNode number) {
        return !(number.isDouble() || number.isFloat()) || Double.isFinite(number.doubleValue());
    }

    /**
     * Evaluates an operator given by its configuration tag.
     *
     * @return false for an unknown tag
     */
    public boolean evaluate(JsonNode value, String operatorTag, JsonNode expected) {
        return MatchOperator.fromTag(operatorTag)
                .map(op -> evaluate(value, op, expected))
                .orElse(false);
    }

    public boolean evaluate(JsonNode value, MatchOperator operator, JsonNode expected) {
        JsonNode actual = value != null ? value : MissingNode.getInstance();
        JsonNode wanted = expected != null ? expected : MissingNode.getInstance();

        return switch (operator) {
            case EXISTS -> exists(actual, wanted);
            case EQ -> !actual.isMissingNode() && same(actual, wanted);
            case IN -> in(actual, wanted);
            case CONTAINS -> contains(actual, wanted);
            case CONTAINS_TEXT -> containsText(actual, wanted);
        };
    }

    private boolean exists(JsonNode value, JsonNode expected) {
        boolean present = !value.isMissingNode();
        return expected.isBoolean() ? present == expected.booleanValue() : present;
    }

    private boolean in(JsonNode value, JsonNode expected) {
        if (value.isMissingNode() || !expected.isArray()) return false;
        for (JsonNode candidate : expected) {
            if (same(value, candidate)) return true;
        }
        return false;
    }

    private boolean contains(JsonNode value, JsonNode expected) {
        if (expected.isMissingNode()) return false;
        if (value.isArray()) {
            for (JsonNode member : value) {
                if (same(member, expected)) return true;
            }
            return false;
        }
        if (value.isTextual() && expected.isTextual()) {
            return value.textValue().contains(expected.textValue());
        }
        return false;
    }

    private boolean containsText(JsonNode value, JsonNode expected) {
        if (!expected.isTextual()) return false;
        String needle = expected.textValue().toLowerCase(Locale.ROOT);

        if (value.isTextual()) {
            return value.textValue().toLowerCase(Locale.ROOT).contains(needle);
        }
        if (value.isArray()) {
            for (JsonNode member : value) {
                if (member.isTextual() && member.textValue().toLowerCase(Locale.ROOT).contains(needle)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean same(JsonNode a, JsonNode b) {
        return a.equals(NUMERIC_AWARE, b);
    }
}
