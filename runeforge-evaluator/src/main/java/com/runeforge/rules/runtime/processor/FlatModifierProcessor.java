package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.ModifierType;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.Modifier;
import com.runeforge.rules.runtime.value.ValueResolver;

import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * FlatModifier: a typed bonus or penalty to one statistic, e.g. Fleet's +5 untyped speed.
 */
public class FlatModifierProcessor implements ElementProcessor<RuleElement.FlatModifier, Modifier> {
    private static final Logger logger = Logger.getLogger(FlatModifierProcessor.class.getName());

    @Override
    public Modifier process(RuleElement.FlatModifier element, RuleElementContext context) {
        if (Labels.isBlank(element.selector())) {
            logger.warning(context.source() + ": FlatModifier without selector");
            return null;
        }
        OptionalInt value = ValueResolver.resolve(element.value(), context);
        if (value.isEmpty()) {
            return null;
        }
        int resolved = value.getAsInt();
        String label = element.label() != null
                ? element.label()
                : Labels.signed(resolved) + " " + Labels.titleCase(element.selector());
        return new Modifier(
                label,
                context.source(),
                resolved,
                element.type() == null ? ModifierType.UNTYPED : element.type(),
                element.selector(),
                element.predicate(),
                element.enabled() == null || element.enabled(),
                element.predicate().isEmpty(),
                null);
    }
}
