/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api;

import com.runeforge.rules.api.predicate.Predicate;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.predicate.PredicateStatement;

/**
 * Contract for evaluating activation predicates.
 *
 * <p>Evaluation is side-effect free. A missing or empty predicate is true; statements in a
 * predicate are combined with AND. Statements referencing data the context does not carry
 * (a level comparison without a level) are false rather than errors.
 */
public interface IPredicateEvaluator {

    boolean evaluate(Predicate predicate, PredicateContext context);

    boolean evaluate(PredicateStatement statement, PredicateContext context);
}
