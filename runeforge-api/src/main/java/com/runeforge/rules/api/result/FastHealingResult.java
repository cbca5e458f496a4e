/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.runeforge.rules.api.model.FastHealingType;
import com.runeforge.rules.api.predicate.Predicate;

import java.util.List;

/**
 * Healing per turn.
 *
 * @param deactivatedBy damage types that switch the healing off for a turn
 * @param active        false once deactivated
 */
public record FastHealingResult(
        int value,
        FastHealingType type,
        String source,
        List<String> deactivatedBy,
        boolean active,
        Predicate predicate
) implements ProcessedResult {

    public FastHealingResult {
        deactivatedBy = deactivatedBy == null ? List.of() : List.copyOf(deactivatedBy);
        predicate = predicate == null ? Predicate.always() : predicate;
    }

    public FastHealingResult withActive(boolean newActive) {
        return new FastHealingResult(value, type, source, deactivatedBy, newActive, predicate);
    }
}
