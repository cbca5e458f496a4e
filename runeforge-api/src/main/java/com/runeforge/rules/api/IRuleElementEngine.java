/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.ProcessedRuleElements;

import java.util.List;
import java.util.Set;

/**
 * Contract for turning rule elements into typed results.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IRuleElementEngine engine = new RuleElementRegistry(tracer);
 * ProcessedRuleElements fleet = engine.processSource("Fleet", fleetRules, 5);
 * ProcessedRuleElements rage = engine.processSource("Rage", rageRules, 5);
 * ProcessedRuleElements all = engine.merge(fleet, rage);
 * }</pre>
 *
 * <p>A malformed or unknown element never aborts a pass: it is logged and contributes nothing.
 */
public interface IRuleElementEngine {

    /**
     * Processes elements in order, accumulating one aggregate.
     */
    ProcessedRuleElements process(List<RuleElement> elements, RuleElementContext context);

    /**
     * Processes the elements of one source with a fresh context.
     */
    default ProcessedRuleElements processSource(String sourceName, List<RuleElement> elements, int level) {
        return process(elements, RuleElementContext.of(sourceName, level));
    }

    /**
     * Category-wise concatenation, preserving order.
     */
    default ProcessedRuleElements merge(ProcessedRuleElements... results) {
        return ProcessedRuleElements.merge(results);
    }

    boolean isSupported(String key);

    /**
     * Wire keys of every supported kind.
     */
    Set<String> supportedKinds();
}
