/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.runeforge.rules.api.model.ImmunityType;
import com.runeforge.rules.api.predicate.Predicate;

import java.util.List;

public record ImmunityResult(ImmunityType type, List<String> values, String source, Predicate predicate)
        implements ProcessedResult {

    public ImmunityResult {
        values = values == null ? List.of() : List.copyOf(values);
        predicate = predicate == null ? Predicate.always() : predicate;
    }
}
