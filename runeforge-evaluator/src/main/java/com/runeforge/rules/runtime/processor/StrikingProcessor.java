package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.StrikingResult;
import com.runeforge.rules.runtime.value.ValueResolver;

import java.util.OptionalInt;

/**
 * Striking: one to three extra weapon damage dice.
 */
public class StrikingProcessor implements ElementProcessor<RuleElement.Striking, StrikingResult> {
    static final String DEFAULT_SELECTOR = "strike-damage";

    @Override
    public StrikingResult process(RuleElement.Striking element, RuleElementContext context) {
        OptionalInt value = ValueResolver.resolve(element.value(), context);
        if (value.isEmpty()) {
            return null;
        }
        return new StrikingResult(
                WeaponPotencyProcessor.clamp(value.getAsInt()),
                Labels.isBlank(element.selector()) ? DEFAULT_SELECTOR : element.selector(),
                context.source(),
                element.predicate());
    }
}
