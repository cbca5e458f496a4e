/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.runeforge.rules.api.predicate.Predicate;

import java.util.List;

/**
 * @param types      damage types covered; may contain {@code all} or {@code physical}
 * @param exceptions damage sources that bypass this entry
 */
public record ResistanceResult(
        List<String> types,
        int value,
        String source,
        List<String> exceptions,
        Predicate predicate
) implements ProcessedResult {

    public ResistanceResult {
        types = types == null ? List.of() : List.copyOf(types);
        exceptions = exceptions == null ? List.of() : List.copyOf(exceptions);
        predicate = predicate == null ? Predicate.always() : predicate;
    }
}
