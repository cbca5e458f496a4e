/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.model;

import com.runeforge.rules.api.element.RuleElement;

import java.util.List;
import java.util.Objects;

/**
 * A feat, item, condition or spell together with its ordered rule elements.
 */
public record RuleSource(String name, List<RuleElement> elements) {

    public RuleSource {
        Objects.requireNonNull(name, "name cannot be null");
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public static RuleSource of(String name, RuleElement... elements) {
        return new RuleSource(name, List.of(elements));
    }
}
