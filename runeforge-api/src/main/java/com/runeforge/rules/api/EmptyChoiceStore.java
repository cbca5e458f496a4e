/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api;

import com.runeforge.rules.api.model.ChoiceSnapshot;

import java.util.List;
import java.util.Optional;

final class EmptyChoiceStore implements ChoiceStore {

    static final EmptyChoiceStore INSTANCE = new EmptyChoiceStore();

    private EmptyChoiceStore() {
    }

    @Override
    public List<String> selection(String flag) {
        return List.of();
    }

    @Override
    public void select(String flag, List<String> values) {
        throw new UnsupportedOperationException("Empty choice store is read-only");
    }

    @Override
    public void clear(String flag) {
        // nothing recorded
    }

    @Override
    public Optional<Boolean> toggle(String key) {
        return Optional.empty();
    }

    @Override
    public void setToggle(String key, boolean enabled) {
        throw new UnsupportedOperationException("Empty choice store is read-only");
    }

    @Override
    public ChoiceSnapshot snapshot() {
        return ChoiceSnapshot.empty();
    }
}
