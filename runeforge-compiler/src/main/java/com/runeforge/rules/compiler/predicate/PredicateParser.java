package com.runeforge.rules.compiler.predicate;

import com.fasterxml.jackson.databind.JsonNode;
import com.runeforge.rules.api.predicate.Predicate;
import com.runeforge.rules.api.predicate.PredicateStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads predicates from their JSON form.
 *
 * <p>A predicate is an array of statements. A statement is a string atom or an object with
 * {@code not}, {@code and} or {@code or}; when several keys are present {@code not} wins over
 * {@code and}, which wins over {@code or}. A key whose value is null counts as absent. An object
 * with none of them is an always-true empty conjunction.
 */
public final class PredicateParser {
    private static final Logger logger = Logger.getLogger(PredicateParser.class.getName());

    private PredicateParser() {
    }

    /**
     * @param node array of statements, a single statement, or null/missing
     */
    public static Predicate parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Predicate.always();
        }
        if (node.isArray()) {
            return new Predicate(statements(node));
        }
        return new Predicate(List.of(statement(node)));
    }

    static PredicateStatement statement(JsonNode node) {
        if (node.isObject()) {
            if (node.hasNonNull("not")) {
                return PredicateStatement.not(statement(node.get("not")));
            }
            if (node.hasNonNull("and")) {
                return new PredicateStatement.And(statements(node.get("and")));
            }
            if (node.hasNonNull("or")) {
                return new PredicateStatement.Or(statements(node.get("or")));
            }
            return new PredicateStatement.And(List.of());
        }
        if (node.isArray()) {
            return new PredicateStatement.And(statements(node));
        }
        if (!node.isValueNode() || node.isNull()) {
            logger.warning("Unsupported predicate statement: " + node);
            return new PredicateStatement.And(List.of());
        }
        return PredicateStatement.atom(node.asText());
    }

    private static List<PredicateStatement> statements(JsonNode node) {
        if (!node.isArray()) {
            return List.of(statement(node));
        }
        List<PredicateStatement> result = new ArrayList<>(node.size());
        for (JsonNode child : node) {
            result.add(statement(child));
        }
        return result;
    }
}
