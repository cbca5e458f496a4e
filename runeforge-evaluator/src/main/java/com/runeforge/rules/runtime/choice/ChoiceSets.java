package com.runeforge.rules.runtime.choice;

import com.runeforge.rules.api.IPredicateEvaluator;
import com.runeforge.rules.api.element.Choice;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.result.ChoiceSetPrompt;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Operations on choice-set prompts: which options are offered, whether a selection is valid
 * and recording it.
 */
public final class ChoiceSets {

    private ChoiceSets() {
    }

    /**
     * Options whose predicate holds in the context, in declaration order.
     */
    public static List<Choice> availableChoices(ChoiceSetPrompt prompt, PredicateContext context,
                                                IPredicateEvaluator evaluator) {
        List<Choice> available = new ArrayList<>();
        for (Choice choice : prompt.choices()) {
            if (evaluator.evaluate(choice.predicate(), context)) {
                available.add(choice);
            }
        }
        return available;
    }

    /**
     * A selection is valid when it has exactly the required number of values, each one the
     * value of a declared option.
     */
    public static boolean validateSelection(ChoiceSetPrompt prompt, List<String> values) {
        if (values == null || values.size() != prompt.selectionCount()) {
            return false;
        }
        Set<String> valid = new HashSet<>();
        for (Choice choice : prompt.choices()) {
            valid.add(choice.value());
        }
        return valid.containsAll(values);
    }

    /**
     * @throws IllegalArgumentException when the selection does not validate
     */
    public static ChoiceSetPrompt applySelection(ChoiceSetPrompt prompt, List<String> values) {
        if (!validateSelection(prompt, values)) {
            throw new IllegalArgumentException(String.format(
                    "Invalid selection %s for %s: expected %d of %s",
                    values, prompt.flag(), prompt.selectionCount(), choiceValues(prompt)));
        }
        return prompt.withSelection(values);
    }

    public static boolean isComplete(ChoiceSetPrompt prompt) {
        return prompt.isComplete();
    }

    public static List<ChoiceSetPrompt> incomplete(List<ChoiceSetPrompt> prompts) {
        List<ChoiceSetPrompt> pending = new ArrayList<>();
        for (ChoiceSetPrompt prompt : prompts) {
            if (!prompt.isComplete()) {
                pending.add(prompt);
            }
        }
        return pending;
    }

    /**
     * Label of the option carrying {@code value}, empty when no option does.
     */
    public static Optional<String> selectionLabel(ChoiceSetPrompt prompt, String value) {
        return prompt.choices().stream()
                .filter(choice -> choice.value().equals(value))
                .map(Choice::label)
                .findFirst();
    }

    private static List<String> choiceValues(ChoiceSetPrompt prompt) {
        return prompt.choices().stream().map(Choice::value).toList();
    }
}
