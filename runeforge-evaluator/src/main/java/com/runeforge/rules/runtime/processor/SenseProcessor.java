package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.model.SenseAcuity;
import com.runeforge.rules.api.result.Sense;

import java.util.logging.Logger;

/**
 * Sense: a special sense such as darkvision. Acuity defaults by sense type.
 */
public class SenseProcessor implements ElementProcessor<RuleElement.Sense, Sense> {
    private static final Logger logger = Logger.getLogger(SenseProcessor.class.getName());

    @Override
    public Sense process(RuleElement.Sense element, RuleElementContext context) {
        if (Labels.isBlank(element.selector())) {
            logger.warning(context.source() + ": Sense without selector");
            return null;
        }
        String type = element.selector();
        SenseAcuity acuity = element.acuity() != null ? element.acuity() : defaultAcuity(type);
        String label = element.label() != null ? element.label() : label(type, element.range(), acuity);
        return new Sense(type, element.range(), acuity, context.source(), label, element.predicate(), true);
    }

    static SenseAcuity defaultAcuity(String type) {
        return switch (type) {
            case "darkvision", "low-light-vision", "see-invisibility" -> SenseAcuity.PRECISE;
            case "thoughtsense", "lifesense" -> SenseAcuity.VAGUE;
            default -> SenseAcuity.IMPRECISE;
        };
    }

    /**
     * {@code "Darkvision"}, {@code "Tremorsense 30 feet (imprecise)"}. Precise acuity is implied.
     */
    static String label(String type, Integer range, SenseAcuity acuity) {
        StringBuilder label = new StringBuilder(Labels.titleCase(type));
        if (range != null) {
            label.append(' ').append(range).append(" feet");
        }
        if (acuity != SenseAcuity.PRECISE) {
            label.append(" (").append(acuity.wireName()).append(')');
        }
        return label.toString();
    }
}
