package com.example.brd.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.List;

/**
 * A section match rule, parsed once from the sections JSON.
 * <p>
 * A node is either a {@link Combinator} ({@code any} / {@code all} over child expressions),
 * a {@link Leaf} comparison ({@code field}, {@code op}, {@code value}), or a {@link Malformed}
 * node kept in place of configuration that could not be understood. Malformed nodes never match.
 */
public sealed interface MatchExpression
        permits MatchExpression.Combinator, MatchExpression.Leaf, MatchExpression.Malformed {

    enum Junction {
        /** OR across children. */
        ANY,
        /** AND across children. */
        ALL
    }

    /**
     * @param junction how child results are combined
     * @param children child expressions; an empty list never matches
     */
    record Combinator(Junction junction, List<MatchExpression> children) implements MatchExpression {
        public Combinator {
            children = children != null ? List.copyOf(children) : List.of();
        }
    }

    /**
     * @param field    dotted path into the requirement (e.g. requirement.story.asA)
     * @param operator comparison to apply
     * @param expected value from the rule; {@link MissingNode} when the rule has no "value"
     */
    record Leaf(String field, MatchOperator operator, JsonNode expected) implements MatchExpression {
        public Leaf {
            if (expected == null) expected = MissingNode.getInstance();
        }
    }

    /**
     * @param reason why the node was rejected at load time
     */
    record Malformed(String reason) implements MatchExpression {}
}
