package com.example.brd.service;

import com.example.brd.model.MatchExpression;
import com.example.brd.model.MatchExpression.Combinator;
import com.example.brd.model.MatchExpression.Junction;
import com.example.brd.model.MatchExpression.Leaf;
import com.example.brd.model.MatchExpression.Malformed;
import com.example.brd.model.MatchOperator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the loosely-typed match rules of the sections JSON into a {@link MatchExpression} tree.
 * <p>
 * Nothing here throws: a node that cannot be understood becomes {@link Malformed} and is
 * logged once, at load time.
 */
@Service
public class MatchExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(MatchExpressionParser.class);

    public MatchExpression parse(JsonNode node) {
        return parse(node, "match");
    }

    /**
     * @param node     raw rule node
     * @param location where the node sits in the configuration, for log messages
     */
    public MatchExpression parse(JsonNode node, String location) {
        if (node == null || !node.isObject()) {
            return malformed(location, "expression is not an object");
        }

        // "any" wins when a node carries both combinators
        if (node.has("any")) {
            return combinator(Junction.ANY, node.get("any"), location + ".any");
        }
        if (node.has("all")) {
            return combinator(Junction.ALL, node.get("all"), location + ".all");
        }

        JsonNode field = node.get("field");
        JsonNode op = node.get("op");
        if (field == null || !field.isTextual()) {
            return malformed(location, "missing or non-string 'field'");
        }
        if (op == null || !op.isTextual()) {
            return malformed(location, "missing or non-string 'op'");
        }

        Optional<MatchOperator> operator = MatchOperator.fromTag(op.textValue());
        if (operator.isEmpty()) {
            return malformed(location, "unknown operator '" + op.textValue() + "'");
        }

        JsonNode expected = node.has("value") ? node.get("value").deepCopy() : MissingNode.getInstance();
        return new Leaf(field.textValue(), operator.get(), expected);
    }

    private MatchExpression combinator(Junction junction, JsonNode body, String location) {
        if (body == null || !body.isArray()) {
            return malformed(location, "combinator body is not an array");
        }
        List<MatchExpression> children = new ArrayList<>();
        for (int i = 0; i < body.size(); i++) {
            children.add(parse(body.get(i), location + "[" + i + "]"));
        }
        if (children.isEmpty()) {
            log.debug("Empty '{}' at {} will never match", junction.name().toLowerCase(), location);
        }
        return new Combinator(junction, children);
    }

    private MatchExpression malformed(String location, String reason) {
        log.warn("Malformed match expression at {}: {} (treated as no match)", location, reason);
        return new Malformed(reason);
    }
}
