package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.ModificationPhase;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.PropertyModification;
import com.runeforge.rules.runtime.choice.PlaceholderResolver;
import com.runeforge.rules.runtime.value.ValueResolver;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.logging.Logger;

/**
 * ActiveEffectLike: a direct change to a character property path. Placeholders in the path
 * are filled from the choice store; a path that still references an unanswered choice is
 * not emitted.
 */
public class ActiveEffectLikeProcessor implements ElementProcessor<RuleElement.ActiveEffectLike, PropertyModification> {
    private static final Logger logger = Logger.getLogger(ActiveEffectLikeProcessor.class.getName());

    static final int DEFAULT_PRIORITY = 100;

    @Override
    public PropertyModification process(RuleElement.ActiveEffectLike element, RuleElementContext context) {
        if (Labels.isBlank(element.path()) || element.mode() == null) {
            logger.warning(context.source() + ": ActiveEffectLike needs a path and a mode");
            return null;
        }
        OptionalDouble value = ValueResolver.resolveNumber(element.value(), context);
        if (value.isEmpty()) {
            return null;
        }
        Optional<String> path = PlaceholderResolver.resolve(element.path(), context.selections());
        if (path.isEmpty()) {
            logger.warning(context.source() + ": unresolved choice in path '" + element.path() + "'");
            return null;
        }
        return new PropertyModification(
                context.source(),
                path.get(),
                element.mode(),
                value.getAsDouble(),
                element.phase() == null ? ModificationPhase.APPLY_AES : element.phase(),
                element.priority() == null ? DEFAULT_PRIORITY : element.priority(),
                element.predicate(),
                true);
    }
}
