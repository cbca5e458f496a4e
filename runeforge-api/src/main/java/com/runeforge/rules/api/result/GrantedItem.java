/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.runeforge.rules.api.predicate.Predicate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An item granted by a feat or feature. Exactly one of {@code uuid} and {@code itemData} is
 * normally set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GrantedItem(
        String source,
        String uuid,
        Map<String, Object> itemData,
        boolean allowDuplicate,
        Integer level,
        Predicate predicate,
        boolean enabled
) implements ToggleableResult<GrantedItem> {

    public GrantedItem {
        itemData = itemData == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(itemData));
        predicate = predicate == null ? Predicate.always() : predicate;
    }

    /**
     * Identity used for duplicate detection: the uuid, else the inline item's name.
     */
    public String identity() {
        if (uuid != null) {
            return uuid;
        }
        Object name = itemData == null ? null : itemData.get("name");
        return name == null ? null : name.toString();
    }

    @Override
    public GrantedItem withEnabled(boolean newEnabled) {
        return new GrantedItem(source, uuid, itemData, allowDuplicate, level, predicate, newEnabled);
    }
}
