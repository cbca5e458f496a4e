package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.ChoiceSetPrompt;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * ChoiceSet: a prompt the user answers once. The current answer, if any, is read back from
 * the choice store of the pass.
 */
public class ChoiceSetProcessor implements ElementProcessor<RuleElement.ChoiceSet, ChoiceSetPrompt> {
    private static final Logger logger = Logger.getLogger(ChoiceSetProcessor.class.getName());

    static final String DEFAULT_PROMPT = "Make a selection";

    @Override
    public ChoiceSetPrompt process(RuleElement.ChoiceSet element, RuleElementContext context) {
        if (element.choices().isEmpty()) {
            logger.warning(context.source() + ": ChoiceSet has no choices");
            return null;
        }
        String flag = Labels.isBlank(element.flag()) ? derivedFlag(context.source()) : element.flag();
        return new ChoiceSetPrompt(
                context.source(),
                flag,
                Labels.isBlank(element.prompt()) ? DEFAULT_PROMPT : element.prompt(),
                element.choices(),
                element.selection() == null ? 1 : element.selection(),
                element.adjustName() != null && element.adjustName(),
                context.selections().selection(flag),
                element.predicate());
    }

    /**
     * {@code "Weapon Expertise"} to {@code "choice-weapon-expertise"}.
     */
    static String derivedFlag(String source) {
        return "choice-" + source.toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
    }
}
