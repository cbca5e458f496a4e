/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.predicate;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Snapshot of character state that predicates are evaluated against.
 *
 * <p>Immutable: toggling a stance produces a new context via {@link #withOption(String)} and
 * the caller re-filters the existing aggregate with it.
 *
 * @param options active roll options
 * @param level   character level, or {@code null} when unknown
 * @param traits  active traits
 * @param effects names of active effects
 */
public record PredicateContext(
        Set<String> options,
        Integer level,
        Set<String> traits,
        Set<String> effects
) {

    public PredicateContext {
        options = options == null ? Set.of() : Set.copyOf(options);
        traits = traits == null ? Set.of() : Set.copyOf(traits);
        effects = effects == null ? Set.of() : Set.copyOf(effects);
    }

    public static PredicateContext empty() {
        return new PredicateContext(Set.of(), null, Set.of(), Set.of());
    }

    public static PredicateContext ofOptions(Collection<String> options) {
        return new PredicateContext(new HashSet<>(options), null, Set.of(), Set.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasOption(String option) {
        return options.contains(option);
    }

    public PredicateContext withOption(String option) {
        Set<String> updated = new HashSet<>(options);
        updated.add(option);
        return new PredicateContext(updated, level, traits, effects);
    }

    public PredicateContext withOptions(Collection<String> added) {
        if (added.isEmpty()) {
            return this;
        }
        Set<String> updated = new HashSet<>(options);
        updated.addAll(added);
        return new PredicateContext(updated, level, traits, effects);
    }

    public PredicateContext withoutOption(String option) {
        Set<String> updated = new HashSet<>(options);
        updated.remove(option);
        return new PredicateContext(updated, level, traits, effects);
    }

    public PredicateContext withLevel(Integer newLevel) {
        return new PredicateContext(options, newLevel, traits, effects);
    }

    public static final class Builder {
        private final Set<String> options = new HashSet<>();
        private final Set<String> traits = new HashSet<>();
        private final Set<String> effects = new HashSet<>();
        private Integer level;

        private Builder() {
        }

        public Builder option(String option) {
            options.add(option);
            return this;
        }

        public Builder options(Collection<String> values) {
            options.addAll(values);
            return this;
        }

        public Builder level(Integer value) {
            this.level = value;
            return this;
        }

        public Builder trait(String trait) {
            traits.add(trait);
            return this;
        }

        public Builder traits(Collection<String> values) {
            traits.addAll(values);
            return this;
        }

        public Builder effect(String effect) {
            effects.add(effect);
            return this;
        }

        public Builder effects(Collection<String> values) {
            effects.addAll(values);
            return this;
        }

        public PredicateContext build() {
            return new PredicateContext(options, level, traits, effects);
        }
    }
}
