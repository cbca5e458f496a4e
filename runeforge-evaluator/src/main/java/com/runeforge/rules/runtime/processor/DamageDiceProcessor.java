package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.DamageDice;

/**
 * DamageDice: extra dice on a damage roll. An override block replaces the element's own dice.
 */
public class DamageDiceProcessor implements ElementProcessor<RuleElement.DamageDice, DamageDice> {
    static final String DEFAULT_DIE_SIZE = "d6";
    static final String UNTYPED = "untyped";

    @Override
    public DamageDice process(RuleElement.DamageDice element, RuleElementContext context) {
        Integer diceNumber = element.diceNumber();
        String dieSize = element.dieSize();
        if (element.override() != null) {
            diceNumber = element.override().diceNumber();
            dieSize = element.override().dieSize();
        }
        return new DamageDice(
                context.source(),
                element.selector(),
                diceNumber == null ? 1 : diceNumber,
                dieSize == null ? DEFAULT_DIE_SIZE : dieSize,
                element.damageType() == null ? UNTYPED : element.damageType(),
                element.category(),
                element.predicate(),
                true);
    }
}
