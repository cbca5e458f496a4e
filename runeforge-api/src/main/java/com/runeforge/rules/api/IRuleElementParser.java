/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Contract for reading rule elements from their JSON wire shape.
 *
 * <p>Unknown keys never fail parsing: they become {@link RuleElement.Unrecognized} elements.
 * Input that is not JSON, or not of the expected top-level shape, is rejected.
 */
public interface IRuleElementParser {

    /**
     * Parses a JSON array of rule elements.
     */
    List<RuleElement> parseElements(String json);

    /**
     * Parses a JSON array of sources, each {@code {"name": ..., "rules": [...]}}.
     */
    List<RuleSource> parseSources(String json);

    /**
     * Reads and parses a source file.
     *
     * @throws IOException if the file cannot be read
     */
    List<RuleSource> parseSources(Path path) throws IOException;
}
