/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Creature size categories, declared smallest to largest. The ordinal is the step index used
 * for relative resizing.
 */
public enum SizeCategory {
    TINY,
    SMALL,
    MEDIUM,
    LARGE,
    HUGE,
    GARGANTUAN;

    public boolean isLargerThan(SizeCategory other) {
        return ordinal() > other.ordinal();
    }

    public boolean isSmallerThan(SizeCategory other) {
        return ordinal() < other.ordinal();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static SizeCategory fromWire(String text) {
        if (text == null) return null;
        try {
            return SizeCategory.valueOf(text.toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
