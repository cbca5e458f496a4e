/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.runeforge.rules.api.model.SizeCategory;
import com.runeforge.rules.api.predicate.Predicate;

/**
 * @param size     absolute size, {@code null} for a relative change
 * @param resizeBy steps along the size ordering
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreatureSizeResult(
        SizeCategory size,
        int resizeBy,
        SizeCategory maximumSize,
        SizeCategory minimumSize,
        String source,
        Predicate predicate
) implements ProcessedResult {

    public CreatureSizeResult {
        predicate = predicate == null ? Predicate.always() : predicate;
    }
}
