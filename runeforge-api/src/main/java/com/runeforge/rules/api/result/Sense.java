/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.runeforge.rules.api.model.SenseAcuity;
import com.runeforge.rules.api.predicate.Predicate;

/**
 * @param range range in feet, {@code null} when unlimited
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Sense(
        String type,
        Integer range,
        SenseAcuity acuity,
        String source,
        String label,
        Predicate predicate,
        boolean enabled
) implements ToggleableResult<Sense> {

    public Sense {
        predicate = predicate == null ? Predicate.always() : predicate;
    }

    @Override
    public Sense withEnabled(boolean newEnabled) {
        return new Sense(type, range, acuity, source, label, predicate, newEnabled);
    }
}
