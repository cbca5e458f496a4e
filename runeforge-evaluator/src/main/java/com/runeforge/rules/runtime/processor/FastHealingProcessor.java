package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.FastHealingType;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.FastHealingResult;
import com.runeforge.rules.runtime.value.ValueResolver;

import java.util.OptionalInt;

public class FastHealingProcessor implements ElementProcessor<RuleElement.FastHealing, FastHealingResult> {

    @Override
    public FastHealingResult process(RuleElement.FastHealing element, RuleElementContext context) {
        OptionalInt value = ValueResolver.resolve(element.value(), context);
        if (value.isEmpty()) {
            return null;
        }
        return new FastHealingResult(
                value.getAsInt(),
                element.type() == null ? FastHealingType.FAST_HEALING : element.type(),
                element.label() != null ? element.label() : context.source(),
                element.deactivatedBy(),
                true,
                element.predicate());
    }
}
