package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.Speed;
import com.runeforge.rules.runtime.value.ValueResolver;

import java.util.OptionalInt;

public class BaseSpeedProcessor implements ElementProcessor<RuleElement.BaseSpeed, Speed> {
    static final String LAND = "land";

    @Override
    public Speed process(RuleElement.BaseSpeed element, RuleElementContext context) {
        OptionalInt value = ValueResolver.resolve(element.value(), context);
        if (value.isEmpty()) {
            return null;
        }
        String type = Labels.isBlank(element.selector()) ? LAND : element.selector();
        return new Speed(type, value.getAsInt(), context.source(), element.predicate());
    }
}
