/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.runeforge.rules.api.predicate.Predicate;

import java.util.List;

public record WeaknessResult(List<String> types, int value, String source, Predicate predicate)
        implements ProcessedResult {

    public WeaknessResult {
        types = types == null ? List.of() : List.copyOf(types);
        predicate = predicate == null ? Predicate.always() : predicate;
    }
}
