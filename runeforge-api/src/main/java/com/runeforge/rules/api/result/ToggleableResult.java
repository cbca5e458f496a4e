/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

/**
 * A result the user can switch on and off. Results are immutable, so toggling yields a copy.
 */
public interface ToggleableResult<T extends ToggleableResult<T>> extends ProcessedResult {

    boolean enabled();

    T withEnabled(boolean enabled);
}
