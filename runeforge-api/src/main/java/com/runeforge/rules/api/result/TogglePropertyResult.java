/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.runeforge.rules.api.predicate.Predicate;

/**
 * @param property   toggled property path, e.g. {@code flags.pf2e.stance.mountain-stance}
 * @param rollOption explicit roll option emitted while enabled
 * @param predicate  availability of the toggle
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TogglePropertyResult(
        String property,
        String label,
        boolean enabled,
        String rollOption,
        String description,
        String source,
        Predicate predicate
) implements ToggleableResult<TogglePropertyResult> {

    public TogglePropertyResult {
        predicate = predicate == null ? Predicate.always() : predicate;
    }

    @Override
    public TogglePropertyResult withEnabled(boolean newEnabled) {
        return new TogglePropertyResult(property, label, newEnabled, rollOption, description, source, predicate);
    }
}
