package com.runeforge.rules.runtime.choice;

import com.runeforge.rules.api.IPredicateEvaluator;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.result.RollOptionResult;
import com.runeforge.rules.api.result.TogglePropertyResult;
import com.runeforge.rules.runtime.aggregate.Activation;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Roll options contributed by toggles and RollOption elements.
 */
public final class Toggles {

    private Toggles() {
    }

    /**
     * Whether the toggle may be shown to the user.
     */
    public static boolean isAvailable(TogglePropertyResult toggle, PredicateContext context,
                                      IPredicateEvaluator evaluator) {
        return evaluator.evaluate(toggle.predicate(), context);
    }

    /**
     * The roll option an enabled toggle emits: its explicit roll option, or one derived from a
     * property of the form {@code flags.<namespace>.<category>.<name...>} as
     * {@code category:name}. Disabled toggles emit nothing.
     */
    public static Optional<String> rollOption(TogglePropertyResult toggle) {
        if (!toggle.enabled()) {
            return Optional.empty();
        }
        if (toggle.rollOption() != null && !toggle.rollOption().isBlank()) {
            return Optional.of(toggle.rollOption());
        }
        String[] parts = toggle.property().split("\\.");
        if (parts.length >= 4 && parts[0].equals("flags")) {
            String name = String.join(":", Arrays.copyOfRange(parts, 3, parts.length));
            return Optional.of(parts[2] + ":" + name);
        }
        return Optional.empty();
    }

    /**
     * Options of enabled toggles that are available in the context. An unavailable toggle
     * contributes nothing, whatever its stored state.
     */
    public static Set<String> enabledRollOptions(List<TogglePropertyResult> toggles, PredicateContext context,
                                                 IPredicateEvaluator evaluator) {
        Set<String> options = new LinkedHashSet<>();
        for (TogglePropertyResult toggle : toggles) {
            if (isAvailable(toggle, context, evaluator)) {
                rollOption(toggle).ifPresent(options::add);
            }
        }
        return options;
    }

    /**
     * Options of enabled RollOption results whose predicate holds in the context.
     */
    public static Set<String> activeRollOptions(List<RollOptionResult> rollOptions, PredicateContext context,
                                                IPredicateEvaluator evaluator) {
        Set<String> options = new LinkedHashSet<>();
        for (RollOptionResult rollOption : Activation.active(rollOptions, context, evaluator)) {
            options.add(rollOption.option());
        }
        return options;
    }
}
