/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bonus type used by stacking rules.
 *
 * <p>Status, circumstance and item bonuses do not stack with bonuses of the same type;
 * untyped bonuses always stack; all penalties stack.
 */
public enum ModifierType {
    STATUS("status"),
    CIRCUMSTANCE("circumstance"),
    ITEM("item"),
    UNTYPED("untyped");

    private final String wireName;

    ModifierType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @return the matching type, or {@code null} if the text is unknown
     */
    public static ModifierType fromWire(String text) {
        if (text == null) return null;
        for (ModifierType type : values()) {
            if (type.wireName.equalsIgnoreCase(text)) {
                return type;
            }
        }
        return null;
    }
}
