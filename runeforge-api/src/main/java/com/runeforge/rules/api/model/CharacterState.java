/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.model;

import com.runeforge.rules.api.predicate.PredicateContext;

import java.util.Map;
import java.util.Set;

/**
 * Character state supplied by the caller for one effects calculation.
 *
 * @param level       character level
 * @param rollOptions roll options already active before any rule element is applied
 * @param traits      active traits
 * @param effects     names of active effects
 * @param abilities   ability modifiers for formulas
 */
public record CharacterState(
        int level,
        Set<String> rollOptions,
        Set<String> traits,
        Set<String> effects,
        Map<String, Integer> abilities
) {

    public CharacterState {
        rollOptions = rollOptions == null ? Set.of() : Set.copyOf(rollOptions);
        traits = traits == null ? Set.of() : Set.copyOf(traits);
        effects = effects == null ? Set.of() : Set.copyOf(effects);
        abilities = abilities == null ? Map.of() : Map.copyOf(abilities);
    }

    public static CharacterState ofLevel(int level) {
        return new CharacterState(level, Set.of(), Set.of(), Set.of(), Map.of());
    }

    public ActorSnapshot actor() {
        return new ActorSnapshot(level, abilities);
    }

    public PredicateContext toPredicateContext() {
        return new PredicateContext(rollOptions, level, traits, effects);
    }
}
