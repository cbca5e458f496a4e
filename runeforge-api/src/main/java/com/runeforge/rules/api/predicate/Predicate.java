/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.predicate;

import java.util.Arrays;
import java.util.List;

/**
 * Activation condition carried by rule elements and their results.
 *
 * <p>The statement list is combined with implicit AND. A predicate is never baked in when a
 * result is created; it travels with the result so the same aggregate can be re-filtered
 * whenever the roll-option snapshot changes.
 */
public record Predicate(List<PredicateStatement> statements) {

    private static final Predicate ALWAYS = new Predicate(List.of());

    public Predicate {
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    /**
     * The empty predicate. Always true.
     */
    public static Predicate always() {
        return ALWAYS;
    }

    /**
     * Convenience factory for predicates made only of atoms.
     */
    public static Predicate of(String... atoms) {
        if (atoms.length == 0) {
            return ALWAYS;
        }
        return new Predicate(Arrays.stream(atoms)
                .<PredicateStatement>map(PredicateStatement.Atom::new)
                .toList());
    }

    public static Predicate of(PredicateStatement... statements) {
        return statements.length == 0 ? ALWAYS : new Predicate(List.of(statements));
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public String toString() {
        return statements.toString();
    }
}
