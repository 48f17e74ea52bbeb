package com.example.brd.service;

import com.example.brd.model.MatchExpression;
import com.example.brd.model.MatchExpression.Combinator;
import com.example.brd.model.MatchExpression.Junction;
import com.example.brd.model.MatchExpression.Leaf;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Evaluates a match expression tree against a requirement.
 * <p>
 * {@code any} and {@code all} over an empty list are both false: an empty rule
 * must not match every requirement. Malformed nodes are false.
 */
@Service
public class ExpressionEvaluator {

    private final FieldPathResolver pathResolver;
    private final MatchEvaluator matchEvaluator;

    public ExpressionEvaluator(FieldPathResolver pathResolver, MatchEvaluator matchEvaluator) {
        this.pathResolver = pathResolver;
        this.matchEvaluator = matchEvaluator;
    }

    public boolean evaluate(MatchExpression expression, JsonNode requirement) {
        if (expression instanceof Combinator combinator) {
            List<MatchExpression> children = combinator.children();
            if (children.isEmpty()) return false;
            return combinator.junction() == Junction.ANY
                    ? children.stream().anyMatch(child -> evaluate(child, requirement))
                    : children.stream().allMatch(child -> evaluate(child, requirement));
        }
        if (expression instanceof Leaf leaf) {
            JsonNode value = pathResolver.resolve(requirement, leaf.field());
            return matchEvaluator.evaluate(value, leaf.operator(), leaf.expected());
        }
        return false;
    }

    /** True when any of the rules matches (a section's match list). */
    public boolean matchesAny(List<MatchExpression> rules, JsonNode requirement) {
        return rules.stream().anyMatch(rule -> evaluate(rule, requirement));
    }
}
