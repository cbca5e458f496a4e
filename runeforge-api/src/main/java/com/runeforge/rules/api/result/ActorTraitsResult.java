/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.runeforge.rules.api.predicate.Predicate;

import java.util.List;

public record ActorTraitsResult(List<String> add, List<String> remove, String source, Predicate predicate)
        implements ProcessedResult {

    public ActorTraitsResult {
        add = add == null ? List.of() : List.copyOf(add);
        remove = remove == null ? List.of() : List.copyOf(remove);
        predicate = predicate == null ? Predicate.always() : predicate;
    }
}
