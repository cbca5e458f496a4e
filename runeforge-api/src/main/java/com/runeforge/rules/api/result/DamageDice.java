/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.runeforge.rules.api.predicate.Predicate;

/**
 * Extra damage dice, e.g. {@code 1d6 fire}.
 *
 * @param dieSize  die notation such as {@code d6}
 * @param category optional damage category such as {@code persistent} or {@code splash}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DamageDice(
        String source,
        String selector,
        int diceNumber,
        String dieSize,
        String damageType,
        String category,
        Predicate predicate,
        boolean enabled
) implements ToggleableResult<DamageDice> {

    public DamageDice {
        predicate = predicate == null ? Predicate.always() : predicate;
    }

    @Override
    public DamageDice withEnabled(boolean newEnabled) {
        return new DamageDice(source, selector, diceNumber, dieSize, damageType, category, predicate, newEnabled);
    }
}
