/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ImmunityType {
    DAMAGE("damage"),
    CONDITION("condition"),
    EFFECT("effect"),
    CRITICAL_HITS("critical-hits"),
    PRECISION_DAMAGE("precision-damage");

    private final String wireName;

    ImmunityType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static ImmunityType fromWire(String text) {
        if (text == null) return null;
        for (ImmunityType type : values()) {
            if (type.wireName.equals(text)) {
                return type;
            }
        }
        return null;
    }
}
