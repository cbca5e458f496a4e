/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api;

import com.runeforge.rules.api.model.ChoiceSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * User-resolved selections and toggle states.
 *
 * <p>The store is owned by the caller and passed explicitly into every processing pass. The
 * engine only reads and writes through this contract and never assumes exclusive access: a UI
 * may read the store while the single user-driven writer updates it.
 *
 * <p>Selection keys are choice-set flags; toggle keys are toggle property paths or roll
 * options.
 */
public interface ChoiceStore {

    /**
     * @return the recorded values for the flag, or an empty list when unresolved
     */
    List<String> selection(String flag);

    /**
     * Records the values for a flag, replacing any previous selection.
     */
    void select(String flag, List<String> values);

    void clear(String flag);

    /**
     * @return the stored toggle state, empty when the user never touched the toggle
     */
    Optional<Boolean> toggle(String key);

    void setToggle(String key, boolean enabled);

    ChoiceSnapshot snapshot();

    default boolean isResolved(String flag) {
        return !selection(flag).isEmpty();
    }

    /**
     * A read-only store with nothing recorded.
     */
    static ChoiceStore empty() {
        return EmptyChoiceStore.INSTANCE;
    }
}
