/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.runeforge.rules.api.predicate.Predicate;

/**
 * Common shape of every processed result: where it came from and when it applies.
 */
public interface ProcessedResult {

    String source();

    Predicate predicate();
}
