package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.ResistanceResult;
import com.runeforge.rules.runtime.value.ValueResolver;

import java.util.OptionalInt;
import java.util.logging.Logger;

public class ResistanceProcessor implements ElementProcessor<RuleElement.Resistance, ResistanceResult> {
    private static final Logger logger = Logger.getLogger(ResistanceProcessor.class.getName());

    @Override
    public ResistanceResult process(RuleElement.Resistance element, RuleElementContext context) {
        if (element.types().isEmpty()) {
            logger.warning(context.source() + ": Resistance without damage types");
            return null;
        }
        OptionalInt value = ValueResolver.resolve(element.value(), context);
        if (value.isEmpty()) {
            return null;
        }
        return new ResistanceResult(
                element.types(),
                value.getAsInt(),
                element.label() != null ? element.label() : context.source(),
                element.exceptions(),
                element.predicate());
    }
}
