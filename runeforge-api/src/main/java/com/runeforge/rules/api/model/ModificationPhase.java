/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derivation phase in which a property modification is applied. Declaration order is
 * application order.
 */
public enum ModificationPhase {
    APPLY_AES("applyAEs"),
    BEFORE_DERIVED("beforeDerived"),
    AFTER_DERIVED("afterDerived"),
    BEFORE_ROLL("beforeRoll");

    private final String wireName;

    ModificationPhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static ModificationPhase fromWire(String text) {
        if (text == null) return null;
        for (ModificationPhase phase : values()) {
            if (phase.wireName.equals(text)) {
                return phase;
            }
        }
        return null;
    }
}
