/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SenseAcuity {
    PRECISE(3),
    IMPRECISE(2),
    VAGUE(1);

    private final int rank;

    SenseAcuity(int rank) {
        this.rank = rank;
    }

    /**
     * Higher is better.
     */
    public int rank() {
        return rank;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static SenseAcuity fromWire(String text) {
        if (text == null) return null;
        try {
            return SenseAcuity.valueOf(text.toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
