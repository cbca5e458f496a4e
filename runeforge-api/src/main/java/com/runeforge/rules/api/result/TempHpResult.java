/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.runeforge.rules.api.predicate.Predicate;

import java.util.List;

/**
 * @param events when the temporary hit points are granted, e.g. {@code turn-start}
 */
public record TempHpResult(int value, String source, List<String> events, Predicate predicate)
        implements ProcessedResult {

    public TempHpResult {
        events = events == null ? List.of() : List.copyOf(events);
        predicate = predicate == null ? Predicate.always() : predicate;
    }
}
