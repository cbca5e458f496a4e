/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.runeforge.rules.api.predicate.Predicate;

/**
 * A movement speed in feet.
 *
 * @param type land, fly, swim, climb, burrow...
 */
public record Speed(String type, int value, String source, Predicate predicate) implements ProcessedResult {

    public Speed {
        predicate = predicate == null ? Predicate.always() : predicate;
    }
}
