/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.runeforge.rules.api.predicate.Predicate;

/**
 * @param extraDice additional weapon damage dice, 1 to 3
 */
public record StrikingResult(int extraDice, String selector, String source, Predicate predicate)
        implements ProcessedResult {

    public StrikingResult {
        predicate = predicate == null ? Predicate.always() : predicate;
    }
}
