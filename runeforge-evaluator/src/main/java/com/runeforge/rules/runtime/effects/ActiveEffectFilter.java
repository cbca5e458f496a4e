package com.runeforge.rules.runtime.effects;

import com.runeforge.rules.api.IPredicateEvaluator;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.result.ProcessedResult;
import com.runeforge.rules.api.result.ProcessedRuleElements;
import com.runeforge.rules.runtime.aggregate.Activation;

import java.util.List;

/**
 * Narrows an aggregate to the results that apply under a predicate context.
 *
 * <p>Choice sets are kept as they are: a pending choice is shown whether or not anything it
 * unlocks is active. Toggle properties are filtered by availability only, since a disabled
 * toggle must stay visible so the user can switch it on.
 */
public final class ActiveEffectFilter {
    private final IPredicateEvaluator evaluator;

    public ActiveEffectFilter(IPredicateEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public ProcessedRuleElements filter(ProcessedRuleElements aggregate, PredicateContext context) {
        return new ProcessedRuleElements(
                active(aggregate.modifiers(), context),
                active(aggregate.damageDice(), context),
                active(aggregate.speeds(), context),
                active(aggregate.senses(), context),
                active(aggregate.grantedItems(), context),
                aggregate.choiceSets(),
                active(aggregate.propertyModifications(), context),
                active(aggregate.rollOptions(), context),
                aggregate.toggleProperties().stream()
                        .filter(toggle -> evaluator.evaluate(toggle.predicate(), context))
                        .toList(),
                active(aggregate.weaponPotencies(), context),
                active(aggregate.strikingBonuses(), context),
                active(aggregate.tempHp(), context),
                active(aggregate.fastHealing(), context),
                active(aggregate.resistances(), context),
                active(aggregate.weaknesses(), context),
                active(aggregate.immunities(), context),
                active(aggregate.sizeModifiers(), context),
                active(aggregate.traitModifications(), context));
    }

    private <T extends ProcessedResult> List<T> active(List<T> results, PredicateContext context) {
        return Activation.active(results, context, evaluator);
    }
}
