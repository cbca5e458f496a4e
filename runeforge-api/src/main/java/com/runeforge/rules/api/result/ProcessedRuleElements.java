/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Aggregate of a processing pass: one ordered list per result category.
 *
 * <p>Instances are immutable and disposable. They are rebuilt whenever the active effect set
 * changes; {@link #merge} combines the aggregates of independent passes by concatenating each
 * category in argument order, and {@link #empty()} is its identity.
 */
public record ProcessedRuleElements(
        @JsonProperty("modifiers") List<Modifier> modifiers,
        @JsonProperty("damage_dice") List<DamageDice> damageDice,
        @JsonProperty("speeds") List<Speed> speeds,
        @JsonProperty("senses") List<Sense> senses,
        @JsonProperty("granted_items") List<GrantedItem> grantedItems,
        @JsonProperty("choice_sets") List<ChoiceSetPrompt> choiceSets,
        @JsonProperty("property_modifications") List<PropertyModification> propertyModifications,
        @JsonProperty("roll_options") List<RollOptionResult> rollOptions,
        @JsonProperty("toggle_properties") List<TogglePropertyResult> toggleProperties,
        @JsonProperty("weapon_potencies") List<WeaponPotencyResult> weaponPotencies,
        @JsonProperty("striking_bonuses") List<StrikingResult> strikingBonuses,
        @JsonProperty("temp_hp") List<TempHpResult> tempHp,
        @JsonProperty("fast_healing") List<FastHealingResult> fastHealing,
        @JsonProperty("resistances") List<ResistanceResult> resistances,
        @JsonProperty("weaknesses") List<WeaknessResult> weaknesses,
        @JsonProperty("immunities") List<ImmunityResult> immunities,
        @JsonProperty("size_modifiers") List<CreatureSizeResult> sizeModifiers,
        @JsonProperty("trait_modifications") List<ActorTraitsResult> traitModifications
) {

    private static final ProcessedRuleElements EMPTY = new Builder().build();

    public ProcessedRuleElements {
        modifiers = List.copyOf(modifiers);
        damageDice = List.copyOf(damageDice);
        speeds = List.copyOf(speeds);
        senses = List.copyOf(senses);
        grantedItems = List.copyOf(grantedItems);
        choiceSets = List.copyOf(choiceSets);
        propertyModifications = List.copyOf(propertyModifications);
        rollOptions = List.copyOf(rollOptions);
        toggleProperties = List.copyOf(toggleProperties);
        weaponPotencies = List.copyOf(weaponPotencies);
        strikingBonuses = List.copyOf(strikingBonuses);
        tempHp = List.copyOf(tempHp);
        fastHealing = List.copyOf(fastHealing);
        resistances = List.copyOf(resistances);
        weaknesses = List.copyOf(weaknesses);
        immunities = List.copyOf(immunities);
        sizeModifiers = List.copyOf(sizeModifiers);
        traitModifications = List.copyOf(traitModifications);
    }

    public static ProcessedRuleElements empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Concatenates every category across the inputs, preserving argument order.
     */
    public static ProcessedRuleElements merge(ProcessedRuleElements... results) {
        return merge(List.of(results));
    }

    public static ProcessedRuleElements merge(List<ProcessedRuleElements> results) {
        if (results.isEmpty()) {
            return EMPTY;
        }
        if (results.size() == 1) {
            return results.get(0);
        }
        Builder builder = new Builder();
        for (ProcessedRuleElements result : results) {
            builder.addAll(result);
        }
        return builder.build();
    }

    /**
     * Number of results across every category.
     */
    @JsonIgnore
    public int size() {
        return modifiers.size() + damageDice.size() + speeds.size() + senses.size()
                + grantedItems.size() + choiceSets.size() + propertyModifications.size()
                + rollOptions.size() + toggleProperties.size() + weaponPotencies.size()
                + strikingBonuses.size() + tempHp.size() + fastHealing.size() + resistances.size()
                + weaknesses.size() + immunities.size() + sizeModifiers.size() + traitModifications.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Mutable accumulator used while a pass is running.
     */
    public static final class Builder {
        private final List<Modifier> modifiers = new ArrayList<>();
        private final List<DamageDice> damageDice = new ArrayList<>();
        private final List<Speed> speeds = new ArrayList<>();
        private final List<Sense> senses = new ArrayList<>();
        private final List<GrantedItem> grantedItems = new ArrayList<>();
        private final List<ChoiceSetPrompt> choiceSets = new ArrayList<>();
        private final List<PropertyModification> propertyModifications = new ArrayList<>();
        private final List<RollOptionResult> rollOptions = new ArrayList<>();
        private final List<TogglePropertyResult> toggleProperties = new ArrayList<>();
        private final List<WeaponPotencyResult> weaponPotencies = new ArrayList<>();
        private final List<StrikingResult> strikingBonuses = new ArrayList<>();
        private final List<TempHpResult> tempHp = new ArrayList<>();
        private final List<FastHealingResult> fastHealing = new ArrayList<>();
        private final List<ResistanceResult> resistances = new ArrayList<>();
        private final List<WeaknessResult> weaknesses = new ArrayList<>();
        private final List<ImmunityResult> immunities = new ArrayList<>();
        private final List<CreatureSizeResult> sizeModifiers = new ArrayList<>();
        private final List<ActorTraitsResult> traitModifications = new ArrayList<>();

        private Builder() {
        }

        public Builder modifier(Modifier value) {
            modifiers.add(value);
            return this;
        }

        /**
         * Read-only view of the modifiers accumulated so far.
         */
        public List<Modifier> modifiers() {
            return Collections.unmodifiableList(modifiers);
        }

        /**
         * Replaces every accumulated modifier with the mapped value, in place.
         */
        public Builder replaceModifiers(Function<Modifier, Modifier> mapper) {
            modifiers.replaceAll(mapper::apply);
            return this;
        }

        public Builder damageDice(DamageDice value) {
            damageDice.add(value);
            return this;
        }

        public Builder speed(Speed value) {
            speeds.add(value);
            return this;
        }

        public Builder sense(Sense value) {
            senses.add(value);
            return this;
        }

        public Builder grantedItem(GrantedItem value) {
            grantedItems.add(value);
            return this;
        }

        public Builder choiceSet(ChoiceSetPrompt value) {
            choiceSets.add(value);
            return this;
        }

        public Builder propertyModification(PropertyModification value) {
            propertyModifications.add(value);
            return this;
        }

        public Builder rollOption(RollOptionResult value) {
            rollOptions.add(value);
            return this;
        }

        public Builder toggleProperty(TogglePropertyResult value) {
            toggleProperties.add(value);
            return this;
        }

        /**
         * Adds the potency and both of its modifiers.
         */
        public Builder weaponPotency(WeaponPotencyResult value) {
            weaponPotencies.add(value);
            modifiers.add(value.attackModifier());
            modifiers.add(value.damageModifier());
            return this;
        }

        public Builder striking(StrikingResult value) {
            strikingBonuses.add(value);
            return this;
        }

        public Builder tempHp(TempHpResult value) {
            tempHp.add(value);
            return this;
        }

        public Builder fastHealing(FastHealingResult value) {
            fastHealing.add(value);
            return this;
        }

        public Builder resistance(ResistanceResult value) {
            resistances.add(value);
            return this;
        }

        public Builder weakness(WeaknessResult value) {
            weaknesses.add(value);
            return this;
        }

        public Builder immunity(ImmunityResult value) {
            immunities.add(value);
            return this;
        }

        public Builder sizeModifier(CreatureSizeResult value) {
            sizeModifiers.add(value);
            return this;
        }

        public Builder traitModification(ActorTraitsResult value) {
            traitModifications.add(value);
            return this;
        }

        /**
         * Appends every category of {@code other}. Potency modifiers are already part of its
         * modifier list and are not added twice.
         */
        public Builder addAll(ProcessedRuleElements other) {
            modifiers.addAll(other.modifiers());
            damageDice.addAll(other.damageDice());
            speeds.addAll(other.speeds());
            senses.addAll(other.senses());
            grantedItems.addAll(other.grantedItems());
            choiceSets.addAll(other.choiceSets());
            propertyModifications.addAll(other.propertyModifications());
            rollOptions.addAll(other.rollOptions());
            toggleProperties.addAll(other.toggleProperties());
            weaponPotencies.addAll(other.weaponPotencies());
            strikingBonuses.addAll(other.strikingBonuses());
            tempHp.addAll(other.tempHp());
            fastHealing.addAll(other.fastHealing());
            resistances.addAll(other.resistances());
            weaknesses.addAll(other.weaknesses());
            immunities.addAll(other.immunities());
            sizeModifiers.addAll(other.sizeModifiers());
            traitModifications.addAll(other.traitModifications());
            return this;
        }

        public ProcessedRuleElements build() {
            return new ProcessedRuleElements(modifiers, damageDice, speeds, senses, grantedItems,
                    choiceSets, propertyModifications, rollOptions, toggleProperties, weaponPotencies,
                    strikingBonuses, tempHp, fastHealing, resistances, weaknesses, immunities,
                    sizeModifiers, traitModifications);
        }
    }
}
