/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.predicate;

import java.util.List;
import java.util.Objects;

/**
 * A single statement of the predicate language.
 *
 * <p>Atoms are plain strings: either a roll option checked for membership or one of the
 * structured {@code self:} forms. Composites nest further statements with AND/OR/NOT logic.
 */
public sealed interface PredicateStatement
        permits PredicateStatement.Atom, PredicateStatement.And,
        PredicateStatement.Or, PredicateStatement.Not {

    static Atom atom(String text) {
        return new Atom(text);
    }

    static And and(PredicateStatement... statements) {
        return new And(List.of(statements));
    }

    static Or or(PredicateStatement... statements) {
        return new Or(List.of(statements));
    }

    static Not not(PredicateStatement statement) {
        return new Not(statement);
    }

    /**
     * String statement, e.g. {@code "flanking"} or {@code "self:level:gte:5"}.
     */
    record Atom(String text) implements PredicateStatement {
        public Atom {
            Objects.requireNonNull(text, "Atom text cannot be null");
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * All nested statements must hold. An empty list holds vacuously.
     */
    record And(List<PredicateStatement> statements) implements PredicateStatement {
        public And {
            statements = List.copyOf(statements);
        }
    }

    /**
     * At least one nested statement must hold.
     */
    record Or(List<PredicateStatement> statements) implements PredicateStatement {
        public Or {
            statements = List.copyOf(statements);
        }
    }

    record Not(PredicateStatement statement) implements PredicateStatement {
        public Not {
            Objects.requireNonNull(statement, "Negated statement cannot be null");
        }
    }
}
