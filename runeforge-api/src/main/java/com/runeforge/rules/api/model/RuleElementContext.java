/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.model;

import com.runeforge.rules.api.ChoiceStore;

import java.util.Objects;

/**
 * Per-pass input to the processors. Created fresh for every processing pass and never kept.
 *
 * @param source     display name of the item carrying the rule elements, e.g. {@code "Fleet"}
 * @param level      character level
 * @param actor      optional actor attributes
 * @param selections recorded choices and toggles
 */
public record RuleElementContext(String source, int level, ActorSnapshot actor, ChoiceStore selections) {

    public RuleElementContext {
        Objects.requireNonNull(source, "source cannot be null");
        selections = selections == null ? ChoiceStore.empty() : selections;
    }

    public static RuleElementContext of(String source, int level) {
        return new RuleElementContext(source, level, null, ChoiceStore.empty());
    }

    public RuleElementContext withSelections(ChoiceStore store) {
        return new RuleElementContext(source, level, actor, store);
    }

    public RuleElementContext withSource(String newSource) {
        return new RuleElementContext(newSource, level, actor, selections);
    }
}
