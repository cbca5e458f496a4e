/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.result;

import com.runeforge.rules.api.element.Choice;
import com.runeforge.rules.api.predicate.Predicate;

import java.util.List;

/**
 * A pending or answered user choice.
 *
 * @param flag           stable key the selection is stored under
 * @param selectionCount number of values the user must pick
 * @param selection      values recorded so far, empty when unresolved
 */
public record ChoiceSetPrompt(
        String source,
        String flag,
        String prompt,
        List<Choice> choices,
        int selectionCount,
        boolean adjustName,
        List<String> selection,
        Predicate predicate
) implements ProcessedResult {

    public ChoiceSetPrompt {
        choices = choices == null ? List.of() : List.copyOf(choices);
        selection = selection == null ? List.of() : List.copyOf(selection);
        predicate = predicate == null ? Predicate.always() : predicate;
    }

    public ChoiceSetPrompt withSelection(List<String> values) {
        return new ChoiceSetPrompt(source, flag, prompt, choices, selectionCount, adjustName, values, predicate);
    }

    public boolean isComplete() {
        return selection.size() == selectionCount;
    }
}
