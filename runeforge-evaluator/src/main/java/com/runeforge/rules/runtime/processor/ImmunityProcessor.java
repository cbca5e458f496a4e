package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.ImmunityType;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.ImmunityResult;

import java.util.logging.Logger;

/**
 * Immunity. Critical-hit and precision immunities need no values; the other types list the
 * damage types, conditions or effects covered.
 */
public class ImmunityProcessor implements ElementProcessor<RuleElement.Immunity, ImmunityResult> {
    private static final Logger logger = Logger.getLogger(ImmunityProcessor.class.getName());

    @Override
    public ImmunityResult process(RuleElement.Immunity element, RuleElementContext context) {
        ImmunityType type = element.type();
        if (type == null) {
            logger.warning(context.source() + ": Immunity without a known type");
            return null;
        }
        return new ImmunityResult(
                type,
                element.values(),
                element.label() != null ? element.label() : context.source(),
                element.predicate());
    }
}
