package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.TogglePropertyResult;

import java.util.logging.Logger;

public class TogglePropertyProcessor implements ElementProcessor<RuleElement.ToggleProperty, TogglePropertyResult> {
    private static final Logger logger = Logger.getLogger(TogglePropertyProcessor.class.getName());

    @Override
    public TogglePropertyResult process(RuleElement.ToggleProperty element, RuleElementContext context) {
        if (Labels.isBlank(element.property())) {
            logger.warning(context.source() + ": ToggleProperty without property");
            return null;
        }
        boolean authored = element.value() != null && element.value();
        return new TogglePropertyResult(
                element.property(),
                element.label() != null ? element.label() : element.property(),
                context.selections().toggle(element.property()).orElse(authored),
                element.rollOption(),
                element.description(),
                context.source(),
                element.predicate());
    }
}
