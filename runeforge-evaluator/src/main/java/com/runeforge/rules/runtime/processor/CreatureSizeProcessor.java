package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.CreatureSizeResult;

public class CreatureSizeProcessor implements ElementProcessor<RuleElement.CreatureSize, CreatureSizeResult> {

    @Override
    public CreatureSizeResult process(RuleElement.CreatureSize element, RuleElementContext context) {
        return new CreatureSizeResult(
                element.value(),
                element.resizeBy() == null ? 0 : element.resizeBy(),
                element.maximumSize(),
                element.minimumSize(),
                context.source(),
                element.predicate());
    }
}
