/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.model;

/**
 * How an AdjustModifier element rewrites the value of a matched modifier.
 */
public enum AdjustMode {
    ADD,
    MULTIPLY,
    OVERRIDE,
    /** Keep the higher of the two values. */
    UPGRADE,
    /** Keep the lower of the two values. */
    DOWNGRADE;

    /**
     * Adjusts a modifier value. Modifier values are whole numbers, so a fractional result
     * such as {@code 5 * 0.5} is floored.
     */
    public int apply(int current, double value) {
        double adjusted = switch (this) {
            case ADD -> current + value;
            case MULTIPLY -> current * value;
            case OVERRIDE -> value;
            case UPGRADE -> Math.max(current, value);
            case DOWNGRADE -> Math.min(current, value);
        };
        return (int) Math.floor(adjusted);
    }

    public static AdjustMode fromWire(String text) {
        if (text == null) return null;
        try {
            return AdjustMode.valueOf(text.toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
