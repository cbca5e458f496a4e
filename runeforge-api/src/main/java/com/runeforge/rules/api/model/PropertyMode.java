/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operation applied by an ActiveEffectLike property modification.
 */
public enum PropertyMode {
    ADD,
    SUBTRACT,
    MULTIPLY,
    OVERRIDE,
    UPGRADE,
    DOWNGRADE;

    public double apply(double current, double value) {
        return switch (this) {
            case ADD -> current + value;
            case SUBTRACT -> current - value;
            case MULTIPLY -> current * value;
            case OVERRIDE -> value;
            case UPGRADE -> Math.max(current, value);
            case DOWNGRADE -> Math.min(current, value);
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static PropertyMode fromWire(String text) {
        if (text == null) return null;
        try {
            return PropertyMode.valueOf(text.toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
