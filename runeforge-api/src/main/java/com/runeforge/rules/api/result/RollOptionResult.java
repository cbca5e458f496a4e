/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.runeforge.rules.api.predicate.Predicate;

/**
 * @param option roll option added while enabled, e.g. {@code stance:mountain-stance}
 * @param domain roll domain, {@code all} by default
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RollOptionResult(
        String option,
        String domain,
        boolean toggleable,
        boolean enabled,
        String label,
        String source,
        Predicate predicate
) implements ToggleableResult<RollOptionResult> {

    public RollOptionResult {
        predicate = predicate == null ? Predicate.always() : predicate;
    }

    @Override
    public RollOptionResult withEnabled(boolean newEnabled) {
        return new RollOptionResult(option, domain, toggleable, newEnabled, label, source, predicate);
    }
}
