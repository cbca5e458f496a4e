package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.ActorTraitsResult;

public class ActorTraitsProcessor implements ElementProcessor<RuleElement.ActorTraits, ActorTraitsResult> {

    @Override
    public ActorTraitsResult process(RuleElement.ActorTraits element, RuleElementContext context) {
        return new ActorTraitsResult(element.add(), element.remove(), context.source(), element.predicate());
    }
}
