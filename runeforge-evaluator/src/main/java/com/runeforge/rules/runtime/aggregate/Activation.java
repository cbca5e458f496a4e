package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.IPredicateEvaluator;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.result.ProcessedResult;
import com.runeforge.rules.api.result.ToggleableResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a processed result applies under a predicate context.
 */
public final class Activation {

    private Activation() {
    }

    /**
     * True when the result is enabled (for toggleable results) and its predicate holds.
     */
    public static boolean isActive(ProcessedResult result, PredicateContext context, IPredicateEvaluator evaluator) {
        if (result instanceof ToggleableResult<?> toggleable && !toggleable.enabled()) {
            return false;
        }
        return evaluator.evaluate(result.predicate(), context);
    }

    public static <T extends ProcessedResult> List<T> active(List<T> results, PredicateContext context,
                                                             IPredicateEvaluator evaluator) {
        List<T> active = new ArrayList<>(results.size());
        for (T result : results) {
            if (isActive(result, context, evaluator)) {
                active.add(result);
            }
        }
        return active;
    }
}
