/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.model;

import java.util.Map;

/**
 * Actor attributes that formulas may reference.
 *
 * @param level     actor level, used by {@code @actor.level}
 * @param abilities ability modifiers keyed by ability slug (str, dex, ...)
 */
public record ActorSnapshot(int level, Map<String, Integer> abilities) {

    public ActorSnapshot {
        abilities = abilities == null ? Map.of() : Map.copyOf(abilities);
    }

    public static ActorSnapshot ofLevel(int level) {
        return new ActorSnapshot(level, Map.of());
    }
}
