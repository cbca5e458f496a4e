/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.element;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Wire discriminants of the rule element instruction set.
 *
 * <p>{@link #UNRECOGNIZED} stands for any key the engine does not implement; elements of that
 * kind are carried through parsing and skipped by the registry.
 */
public enum RuleElementKind {
    FLAT_MODIFIER("FlatModifier"),
    ADJUST_MODIFIER("AdjustModifier"),
    DAMAGE_DICE("DamageDice"),
    BASE_SPEED("BaseSpeed"),
    SENSE("Sense"),
    GRANT_ITEM("GrantItem"),
    CHOICE_SET("ChoiceSet"),
    ACTIVE_EFFECT_LIKE("ActiveEffectLike"),
    ROLL_OPTION("RollOption"),
    TOGGLE_PROPERTY("ToggleProperty"),
    WEAPON_POTENCY("WeaponPotency"),
    STRIKING("Striking"),
    TEMP_HP("TempHP"),
    FAST_HEALING("FastHealing"),
    RESISTANCE("Resistance"),
    WEAKNESS("Weakness"),
    IMMUNITY("Immunity"),
    CREATURE_SIZE("CreatureSize"),
    ACTOR_TRAITS("ActorTraits"),
    UNRECOGNIZED(null);

    private static final Set<RuleElementKind> SUPPORTED = EnumSet.complementOf(EnumSet.of(UNRECOGNIZED));

    private final String key;

    RuleElementKind(String key) {
        this.key = key;
    }

    /**
     * The wire key, or {@code null} for {@link #UNRECOGNIZED}.
     */
    public String key() {
        return key;
    }

    public boolean isSupported() {
        return this != UNRECOGNIZED;
    }

    /**
     * Case-sensitive lookup; keys are authored exactly as in the upstream content schema.
     *
     * @return the kind for the key, or {@link #UNRECOGNIZED}
     */
    public static RuleElementKind fromKey(String key) {
        if (key == null) {
            return UNRECOGNIZED;
        }
        return Arrays.stream(values())
                .filter(kind -> key.equals(kind.key))
                .findFirst()
                .orElse(UNRECOGNIZED);
    }

    public static Set<RuleElementKind> supported() {
        return SUPPORTED;
    }
}
