/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.runeforge.rules.api.model.ModifierType;
import com.runeforge.rules.api.predicate.Predicate;

/**
 * A named, typed numeric adjustment to a statistic. Positive values are bonuses, negative
 * values penalties.
 *
 * @param selector     statistic this applies to, e.g. {@code speed} or {@code ac}
 * @param alwaysActive true when the modifier carries no predicate
 * @param description  optional explanation, e.g. of an adjustment
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Modifier(
        String label,
        String source,
        int value,
        ModifierType type,
        String selector,
        Predicate predicate,
        boolean enabled,
        boolean alwaysActive,
        String description
) implements ToggleableResult<Modifier> {

    public Modifier {
        type = type == null ? ModifierType.UNTYPED : type;
        predicate = predicate == null ? Predicate.always() : predicate;
    }

    public static Modifier of(String label, String source, int value, ModifierType type, String selector) {
        return new Modifier(label, source, value, type, selector, Predicate.always(), true, true, null);
    }

    public boolean isBonus() {
        return value > 0;
    }

    public boolean isPenalty() {
        return value < 0;
    }

    @Override
    public Modifier withEnabled(boolean newEnabled) {
        return new Modifier(label, source, value, type, selector, predicate, newEnabled, alwaysActive, description);
    }

    public Modifier withValue(int newValue) {
        return new Modifier(label, source, newValue, type, selector, predicate, enabled, alwaysActive, description);
    }

    public Modifier withSource(String newSource) {
        return new Modifier(label, newSource, value, type, selector, predicate, enabled, alwaysActive, description);
    }
}
