package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.AdjustMode;
import com.runeforge.rules.api.result.Modifier;

import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * AdjustModifier rewrites modifiers produced earlier in the same pass instead of producing a
 * result of its own.
 *
 * <p>A modifier matches when its selector equals the element's selector and, if a slug is
 * given, the slug occurs case-insensitively in its label or source. Each match is replaced by
 * a copy with the adjusted value and {@value #ADJUSTED_SUFFIX} appended to its source.
 * Non-matching modifiers pass through unchanged.
 */
public class AdjustModifierProcessor {
    static final String ADJUSTED_SUFFIX = " (adjusted)";

    public UnaryOperator<Modifier> adjustment(RuleElement.AdjustModifier element) {
        AdjustMode mode = element.mode() == null ? AdjustMode.ADD : element.mode();
        double value = element.value() == null ? 0 : element.value();
        return modifier -> matches(element, modifier)
                ? modifier.withValue(mode.apply(modifier.value(), value)).withSource(modifier.source() + ADJUSTED_SUFFIX)
                : modifier;
    }

    static boolean matches(RuleElement.AdjustModifier element, Modifier modifier) {
        if (element.selector() == null || !element.selector().equals(modifier.selector())) {
            return false;
        }
        if (Labels.isBlank(element.slug())) {
            return true;
        }
        String slug = element.slug().toLowerCase(Locale.ROOT);
        return contains(modifier.label(), slug) || contains(modifier.source(), slug);
    }

    private static boolean contains(String text, String slug) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(slug);
    }
}
