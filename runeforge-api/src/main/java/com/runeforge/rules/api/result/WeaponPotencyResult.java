/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.runeforge.rules.api.predicate.Predicate;

/**
 * A potency rune: one item bonus to attack rolls and the matching one to damage.
 *
 * @param value potency, 1 to 3
 */
public record WeaponPotencyResult(
        int value,
        Modifier attackModifier,
        Modifier damageModifier,
        String source,
        Predicate predicate
) implements ProcessedResult {

    public WeaponPotencyResult {
        predicate = predicate == null ? Predicate.always() : predicate;
    }
}
