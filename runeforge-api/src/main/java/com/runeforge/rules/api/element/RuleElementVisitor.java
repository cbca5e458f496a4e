/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.element;

/**
 * Exhaustive dispatch over {@link RuleElement} kinds. Adding a kind adds a method here, so every
 * visitor has to decide what to do with it.
 */
public interface RuleElementVisitor<R> {

    R visitFlatModifier(RuleElement.FlatModifier element);

    R visitAdjustModifier(RuleElement.AdjustModifier element);

    R visitDamageDice(RuleElement.DamageDice element);

    R visitBaseSpeed(RuleElement.BaseSpeed element);

    R visitSense(RuleElement.Sense element);

    R visitGrantItem(RuleElement.GrantItem element);

    R visitChoiceSet(RuleElement.ChoiceSet element);

    R visitActiveEffectLike(RuleElement.ActiveEffectLike element);

    R visitRollOption(RuleElement.RollOption element);

    R visitToggleProperty(RuleElement.ToggleProperty element);

    R visitWeaponPotency(RuleElement.WeaponPotency element);

    R visitStriking(RuleElement.Striking element);

    R visitTempHp(RuleElement.TempHp element);

    R visitFastHealing(RuleElement.FastHealing element);

    R visitResistance(RuleElement.Resistance element);

    R visitWeakness(RuleElement.Weakness element);

    R visitImmunity(RuleElement.Immunity element);

    R visitCreatureSize(RuleElement.CreatureSize element);

    R visitActorTraits(RuleElement.ActorTraits element);

    R visitUnrecognized(RuleElement.Unrecognized element);
}
