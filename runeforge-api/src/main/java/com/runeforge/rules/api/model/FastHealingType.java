/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FastHealingType {
    FAST_HEALING("fast-healing"),
    REGENERATION("regeneration");

    private final String wireName;

    FastHealingType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static FastHealingType fromWire(String text) {
        if (text == null) return null;
        for (FastHealingType type : values()) {
            if (type.wireName.equals(text)) {
                return type;
            }
        }
        return null;
    }
}
