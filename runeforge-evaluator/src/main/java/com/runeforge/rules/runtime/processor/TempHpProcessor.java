package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.TempHpResult;
import com.runeforge.rules.runtime.value.ValueResolver;

import java.util.List;
import java.util.OptionalInt;

public class TempHpProcessor implements ElementProcessor<RuleElement.TempHp, TempHpResult> {
    static final List<String> DEFAULT_EVENTS = List.of("effect-start");

    @Override
    public TempHpResult process(RuleElement.TempHp element, RuleElementContext context) {
        OptionalInt value = ValueResolver.resolve(element.value(), context);
        if (value.isEmpty()) {
            return null;
        }
        return new TempHpResult(
                value.getAsInt(),
                element.label() != null ? element.label() : context.source(),
                element.events() == null ? DEFAULT_EVENTS : element.events(),
                element.predicate());
    }
}
