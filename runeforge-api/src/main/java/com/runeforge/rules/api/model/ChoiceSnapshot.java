/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of a choice store.
 */
public record ChoiceSnapshot(
        @JsonProperty("selections") Map<String, List<String>> selections,
        @JsonProperty("toggles") Map<String, Boolean> toggles
) {

    public ChoiceSnapshot {
        selections = selections == null ? Map.of() : Map.copyOf(selections);
        toggles = toggles == null ? Map.of() : Map.copyOf(toggles);
    }

    public static ChoiceSnapshot empty() {
        return new ChoiceSnapshot(Map.of(), Map.of());
    }
}
