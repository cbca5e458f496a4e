/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.runeforge.rules.api.model.ModificationPhase;
import com.runeforge.rules.api.model.PropertyMode;
import com.runeforge.rules.api.predicate.Predicate;

/**
 * A change to a dotted property path such as {@code system.skills.athletics.rank}.
 *
 * @param priority ordering within a phase, lower first
 */
public record PropertyModification(
        String source,
        String path,
        PropertyMode mode,
        double value,
        ModificationPhase phase,
        int priority,
        Predicate predicate,
        boolean enabled
) implements ToggleableResult<PropertyModification> {

    public PropertyModification {
        predicate = predicate == null ? Predicate.always() : predicate;
    }

    @Override
    public PropertyModification withEnabled(boolean newEnabled) {
        return new PropertyModification(source, path, mode, value, phase, priority, predicate, newEnabled);
    }
}
