package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.IPredicateEvaluator;
import com.runeforge.rules.api.model.ModifierType;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.result.Modifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single calculated value such as AC, a skill or a saving throw: a base value plus the
 * stacked total of the modifiers that apply in the given predicate context.
 *
 * <p>Not thread-safe; build one per calculation.
 */
public final class Statistic {
    private final String name;
    private final List<Modifier> modifiers = new ArrayList<>();
    private int baseValue;

    public Statistic(String name, int baseValue) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.baseValue = baseValue;
    }

    /**
     * Collects every modifier whose selector matches the statistic name.
     */
    public static Statistic forSelector(String selector, int baseValue, List<Modifier> modifiers) {
        Statistic statistic = new Statistic(selector, baseValue);
        for (Modifier modifier : modifiers) {
            if (selector.equals(modifier.selector())) {
                statistic.addModifier(modifier);
            }
        }
        return statistic;
    }

    public String name() {
        return name;
    }

    public int baseValue() {
        return baseValue;
    }

    public void setBaseValue(int baseValue) {
        this.baseValue = baseValue;
    }

    public void addModifier(Modifier modifier) {
        modifiers.add(Objects.requireNonNull(modifier, "modifier cannot be null"));
    }

    public void removeModifiersBySource(String source) {
        modifiers.removeIf(modifier -> Objects.equals(source, modifier.source()));
    }

    public void clearModifiers() {
        modifiers.clear();
    }

    public List<Modifier> modifiers() {
        return Collections.unmodifiableList(modifiers);
    }

    /**
     * Enabled modifiers whose predicate holds.
     */
    public List<Modifier> applicable(PredicateContext context, IPredicateEvaluator evaluator) {
        return Activation.active(modifiers, context, evaluator);
    }

    public int totalModifier(PredicateContext context, IPredicateEvaluator evaluator) {
        return ModifierStacking.total(applicable(context, evaluator));
    }

    public int value(PredicateContext context, IPredicateEvaluator evaluator) {
        return baseValue + totalModifier(context, evaluator);
    }

    public Breakdown breakdown(PredicateContext context, IPredicateEvaluator evaluator) {
        List<Modifier> applicable = applicable(context, evaluator);
        Map<ModifierType, Modifier> highest = ModifierStacking.highestByType(applicable);

        List<BonusBreakdown> bonuses = new ArrayList<>();
        List<Modifier> penalties = new ArrayList<>();
        for (Modifier modifier : applicable) {
            if (modifier.isPenalty()) {
                penalties.add(modifier);
            } else if (modifier.isBonus()) {
                bonuses.add(bonusBreakdown(modifier, highest));
            }
        }
        int total = ModifierStacking.total(applicable);
        return new Breakdown(name, baseValue, total, baseValue + total, applicable, bonuses, penalties);
    }

    private static BonusBreakdown bonusBreakdown(Modifier modifier, Map<ModifierType, Modifier> highest) {
        if (modifier.type() == ModifierType.UNTYPED) {
            return new BonusBreakdown(modifier, true, "Untyped bonuses stack");
        }
        if (highest.get(modifier.type()) == modifier) {
            return new BonusBreakdown(modifier, true, "Highest bonus of this type");
        }
        return new BonusBreakdown(modifier, false, "Suppressed by higher " + modifier.type().wireName() + " bonus");
    }

    /**
     * How a statistic's value came about.
     */
    public record Breakdown(
            String name,
            int baseValue,
            int totalModifier,
            int finalValue,
            List<Modifier> applicable,
            List<BonusBreakdown> bonuses,
            List<Modifier> penalties
    ) {
        public Breakdown {
            applicable = List.copyOf(applicable);
            bonuses = List.copyOf(bonuses);
            penalties = List.copyOf(penalties);
        }
    }

    public record BonusBreakdown(Modifier modifier, boolean applied, String reason) {
    }
}
