package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.WeaknessResult;
import com.runeforge.rules.runtime.value.ValueResolver;

import java.util.OptionalInt;
import java.util.logging.Logger;

public class WeaknessProcessor implements ElementProcessor<RuleElement.Weakness, WeaknessResult> {
    private static final Logger logger = Logger.getLogger(WeaknessProcessor.class.getName());

    @Override
    public WeaknessResult process(RuleElement.Weakness element, RuleElementContext context) {
        if (element.types().isEmpty()) {
            logger.warning(context.source() + ": Weakness without damage types");
            return null;
        }
        OptionalInt value = ValueResolver.resolve(element.value(), context);
        if (value.isEmpty()) {
            return null;
        }
        return new WeaknessResult(
                element.types(),
                value.getAsInt(),
                element.label() != null ? element.label() : context.source(),
                element.predicate());
    }
}
