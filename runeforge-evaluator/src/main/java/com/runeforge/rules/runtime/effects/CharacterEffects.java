package com.runeforge.rules.runtime.effects;

import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.result.ProcessedRuleElements;

/**
 * Result of one effects calculation.
 *
 * @param all      every result of every source, active or not
 * @param active   the results that apply under {@code snapshot}
 * @param snapshot predicate context the active results were filtered with
 */
public record CharacterEffects(ProcessedRuleElements all, ProcessedRuleElements active, PredicateContext snapshot) {
}
