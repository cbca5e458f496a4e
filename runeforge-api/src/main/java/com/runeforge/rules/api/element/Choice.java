/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.element;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.runeforge.rules.api.predicate.Predicate;

/**
 * One option of a choice set.
 *
 * @param label     display label
 * @param value     value stored when the option is selected
 * @param predicate availability condition
 * @param img       optional icon path
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Choice(String label, String value, Predicate predicate, String img) {

    public Choice {
        predicate = predicate == null ? Predicate.always() : predicate;
    }

    public static Choice of(String label, String value) {
        return new Choice(label, value, Predicate.always(), null);
    }
}
