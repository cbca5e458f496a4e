/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.element;

import com.runeforge.rules.api.model.AdjustMode;
import com.runeforge.rules.api.model.FastHealingType;
import com.runeforge.rules.api.model.ImmunityType;
import com.runeforge.rules.api.model.ModificationPhase;
import com.runeforge.rules.api.model.ModifierType;
import com.runeforge.rules.api.model.PropertyMode;
import com.runeforge.rules.api.model.SenseAcuity;
import com.runeforge.rules.api.model.SizeCategory;
import com.runeforge.rules.api.predicate.Predicate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A declarative instruction carried by a feat, spell, item or condition.
 *
 * <p>The instruction set is closed: every supported kind is a record below, and anything else
 * read from content is an {@link Unrecognized} element. Rule elements are authored once and
 * never mutated; optional fields are {@code null} when absent so processors can apply their
 * defaults.
 */
public sealed interface RuleElement permits
        RuleElement.FlatModifier, RuleElement.AdjustModifier, RuleElement.DamageDice,
        RuleElement.BaseSpeed, RuleElement.Sense, RuleElement.GrantItem, RuleElement.ChoiceSet,
        RuleElement.ActiveEffectLike, RuleElement.RollOption, RuleElement.ToggleProperty,
        RuleElement.WeaponPotency, RuleElement.Striking, RuleElement.TempHp,
        RuleElement.FastHealing, RuleElement.Resistance, RuleElement.Weakness,
        RuleElement.Immunity, RuleElement.CreatureSize, RuleElement.ActorTraits,
        RuleElement.Unrecognized {

    RuleElementKind kind();

    /**
     * Activation condition. Never null; empty when the element is unconditional.
     */
    Predicate predicate();

    <R> R accept(RuleElementVisitor<R> visitor);

    /**
     * Wire key of this element. Same as {@code kind().key()} except for unrecognized elements,
     * which report the raw key they were read with.
     */
    default String key() {
        return kind().key();
    }

    private static Predicate orAlways(Predicate predicate) {
        return predicate == null ? Predicate.always() : predicate;
    }

    private static List<String> listOrEmpty(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    private static List<String> listOrNull(List<String> values) {
        return values == null ? null : List.copyOf(values);
    }

    private static Map<String, Object> mapOrNull(Map<String, Object> values) {
        return values == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    record FlatModifier(String selector, ValueOperand value, ModifierType type, String label,
                        Boolean enabled, Predicate predicate) implements RuleElement {
        public FlatModifier {
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.FLAT_MODIFIER;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitFlatModifier(this);
        }
    }

    /**
     * Rewrites modifiers produced earlier in the same pass.
     *
     * @param slug optional case-insensitive filter matched against label or source
     */
    record AdjustModifier(String selector, String slug, AdjustMode mode, Double value,
                          Predicate predicate) implements RuleElement {
        public AdjustModifier {
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.ADJUST_MODIFIER;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitAdjustModifier(this);
        }
    }

    record DamageDice(String selector, Integer diceNumber, String dieSize, String damageType,
                      String category, DiceOverride override, Predicate predicate) implements RuleElement {
        public DamageDice {
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.DAMAGE_DICE;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitDamageDice(this);
        }
    }

    /**
     * Replacement for the base dice. Fields that are set win over the element's own.
     */
    record DiceOverride(Integer diceNumber, String dieSize) {
    }

    record BaseSpeed(String selector, ValueOperand value, String label,
                     Predicate predicate) implements RuleElement {
        public BaseSpeed {
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.BASE_SPEED;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitBaseSpeed(this);
        }
    }

    record Sense(String selector, Integer range, SenseAcuity acuity, String label,
                 Predicate predicate) implements RuleElement {
        public Sense {
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.SENSE;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitSense(this);
        }
    }

    /**
     * @param uuid  compendium reference of the granted item
     * @param item  inline item data, used when no uuid is given
     * @param level character level from which the grant applies
     */
    record GrantItem(String uuid, Map<String, Object> item, Boolean allowDuplicate, Integer level,
                     Predicate predicate) implements RuleElement {
        public GrantItem {
            item = mapOrNull(item);
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.GRANT_ITEM;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitGrantItem(this);
        }
    }

    record ChoiceSet(String flag, String prompt, Boolean adjustName, List<Choice> choices,
                     Integer selection, Predicate predicate) implements RuleElement {
        public ChoiceSet {
            choices = choices == null ? List.of() : List.copyOf(choices);
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.CHOICE_SET;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitChoiceSet(this);
        }
    }

    /**
     * Generic property mutation. The path may contain {@code {item|flag}} placeholders that
     * are filled from recorded choices.
     */
    record ActiveEffectLike(String path, PropertyMode mode, ValueOperand value, ModificationPhase phase,
                            Integer priority, Predicate predicate) implements RuleElement {
        public ActiveEffectLike {
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.ACTIVE_EFFECT_LIKE;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitActiveEffectLike(this);
        }
    }

    record RollOption(String option, String domain, Boolean toggleable, Boolean value, String label,
                      Boolean alwaysActive, Predicate predicate) implements RuleElement {
        public RollOption {
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.ROLL_OPTION;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitRollOption(this);
        }
    }

    record ToggleProperty(String property, String label, Boolean value, String rollOption,
                          String description, Predicate predicate) implements RuleElement {
        public ToggleProperty {
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.TOGGLE_PROPERTY;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitToggleProperty(this);
        }
    }

    record WeaponPotency(ValueOperand value, String selector, Predicate predicate) implements RuleElement {
        public WeaponPotency {
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.WEAPON_POTENCY;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitWeaponPotency(this);
        }
    }

    record Striking(ValueOperand value, String selector, Predicate predicate) implements RuleElement {
        public Striking {
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.STRIKING;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitStriking(this);
        }
    }

    record TempHp(ValueOperand value, List<String> events, String label,
                  Predicate predicate) implements RuleElement {
        public TempHp {
            events = listOrNull(events);
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.TEMP_HP;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitTempHp(this);
        }
    }

    record FastHealing(ValueOperand value, FastHealingType type, List<String> deactivatedBy, String label,
                       Predicate predicate) implements RuleElement {
        public FastHealing {
            deactivatedBy = listOrEmpty(deactivatedBy);
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.FAST_HEALING;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitFastHealing(this);
        }
    }

    /**
     * @param types      damage types, {@code "all"} or {@code "physical"}
     * @param exceptions damage sources that bypass this resistance
     */
    record Resistance(List<String> types, ValueOperand value, List<String> exceptions, String label,
                      Predicate predicate) implements RuleElement {
        public Resistance {
            types = listOrEmpty(types);
            exceptions = listOrEmpty(exceptions);
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.RESISTANCE;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitResistance(this);
        }
    }

    record Weakness(List<String> types, ValueOperand value, String label,
                    Predicate predicate) implements RuleElement {
        public Weakness {
            types = listOrEmpty(types);
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.WEAKNESS;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitWeakness(this);
        }
    }

    record Immunity(ImmunityType type, List<String> values, String label,
                    Predicate predicate) implements RuleElement {
        public Immunity {
            values = listOrEmpty(values);
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.IMMUNITY;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitImmunity(this);
        }
    }

    /**
     * @param value    absolute target size, wins over {@code resizeBy}
     * @param resizeBy relative steps along the size ordering
     */
    record CreatureSize(SizeCategory value, Integer resizeBy, SizeCategory maximumSize,
                        SizeCategory minimumSize, Predicate predicate) implements RuleElement {
        public CreatureSize {
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.CREATURE_SIZE;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitCreatureSize(this);
        }
    }

    record ActorTraits(List<String> add, List<String> remove, Predicate predicate) implements RuleElement {
        public ActorTraits {
            add = listOrEmpty(add);
            remove = listOrEmpty(remove);
            predicate = orAlways(predicate);
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.ACTOR_TRAITS;
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitActorTraits(this);
        }
    }

    /**
     * An element whose key this engine does not implement. The raw payload is kept so the
     * element can be reported or passed on untouched.
     */
    record Unrecognized(String rawKey, Map<String, Object> payload) implements RuleElement {
        public Unrecognized {
            payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        }

        @Override
        public RuleElementKind kind() {
            return RuleElementKind.UNRECOGNIZED;
        }

        @Override
        public String key() {
            return rawKey;
        }

        @Override
        public Predicate predicate() {
            return Predicate.always();
        }

        @Override
        public <R> R accept(RuleElementVisitor<R> visitor) {
            return visitor.visitUnrecognized(this);
        }

        @Override
        public String toString() {
            return "Unrecognized[" + Objects.toString(rawKey, "<no key>") + "]";
        }
    }
}
