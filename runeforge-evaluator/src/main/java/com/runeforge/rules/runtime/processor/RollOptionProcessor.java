package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.RollOptionResult;

import java.util.logging.Logger;

/**
 * RollOption: sets a named flag for predicates. A toggleable option starts from its authored
 * default and follows the stored toggle once the user has flipped it.
 */
public class RollOptionProcessor implements ElementProcessor<RuleElement.RollOption, RollOptionResult> {
    private static final Logger logger = Logger.getLogger(RollOptionProcessor.class.getName());

    static final String DEFAULT_DOMAIN = "all";

    @Override
    public RollOptionResult process(RuleElement.RollOption element, RuleElementContext context) {
        if (Labels.isBlank(element.option())) {
            logger.warning(context.source() + ": RollOption without option");
            return null;
        }
        boolean toggleable = element.toggleable() != null && element.toggleable();
        boolean enabled;
        if (element.value() != null) {
            enabled = element.value();
        } else {
            enabled = element.alwaysActive() == null || element.alwaysActive();
        }
        if (toggleable) {
            enabled = context.selections().toggle(element.option()).orElse(enabled);
        }
        return new RollOptionResult(
                element.option(),
                element.domain() == null ? DEFAULT_DOMAIN : element.domain(),
                toggleable,
                enabled,
                element.label(),
                context.source(),
                element.predicate());
    }
}
