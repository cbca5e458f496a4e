package com.runeforge.rules.runtime.effects;

import com.runeforge.rules.api.ChoiceStore;
import com.runeforge.rules.api.IPredicateEvaluator;
import com.runeforge.rules.api.IRuleElementEngine;
import com.runeforge.rules.api.model.CharacterState;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.model.RuleSource;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.result.ProcessedRuleElements;
import com.runeforge.rules.runtime.choice.Toggles;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Turns a character's active sources into the effects that currently apply.
 *
 * <ol>
 *   <li>Each source is processed with its own context.</li>
 *   <li>The per-source aggregates are merged in source order.</li>
 *   <li>The predicate snapshot is the character's roll options plus those of enabled toggles
 *       available to the character, then those of RollOption results active under that
 *       context.</li>
 *   <li>The merged aggregate is filtered with the snapshot.</li>
 * </ol>
 *
 * Results are rebuilt from scratch on every call; toggling a stance means calling again.
 */
public final class CharacterEffectsCalculator {
    private static final Logger logger = Logger.getLogger(CharacterEffectsCalculator.class.getName());

    private final IRuleElementEngine engine;
    private final IPredicateEvaluator evaluator;
    private final ActiveEffectFilter filter;

    public CharacterEffectsCalculator(IRuleElementEngine engine, IPredicateEvaluator evaluator) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator cannot be null");
        this.filter = new ActiveEffectFilter(evaluator);
    }

    public CharacterEffects calculate(List<RuleSource> sources, CharacterState state, ChoiceStore store) {
        List<ProcessedRuleElements> perSource = new ArrayList<>(sources.size());
        for (RuleSource source : sources) {
            RuleElementContext context = new RuleElementContext(source.name(), state.level(), state.actor(), store);
            perSource.add(engine.process(source.elements(), context));
        }
        ProcessedRuleElements all = engine.merge(perSource.toArray(new ProcessedRuleElements[0]));

        PredicateContext stateContext = state.toPredicateContext();
        PredicateContext snapshot = stateContext
                .withOptions(Toggles.enabledRollOptions(all.toggleProperties(), stateContext, evaluator));
        snapshot = snapshot.withOptions(Toggles.activeRollOptions(all.rollOptions(), snapshot, evaluator));

        ProcessedRuleElements active = filter.filter(all, snapshot);
        logger.fine(() -> String.format("Calculated effects for %d sources: %d results, %d active",
                sources.size(), all.size(), active.size()));
        return new CharacterEffects(all, active, snapshot);
    }
}
