package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.GrantedItem;

import java.util.logging.Logger;

/**
 * GrantItem: grants another item by uuid or inline data, optionally from a minimum level on.
 */
public class GrantItemProcessor implements ElementProcessor<RuleElement.GrantItem, GrantedItem> {
    private static final Logger logger = Logger.getLogger(GrantItemProcessor.class.getName());

    @Override
    public GrantedItem process(RuleElement.GrantItem element, RuleElementContext context) {
        if (Labels.isBlank(element.uuid()) && element.item() == null) {
            logger.warning(context.source() + ": GrantItem without uuid or item data");
            return null;
        }
        if (element.level() != null && context.level() < element.level()) {
            logger.fine(() -> context.source() + ": GrantItem requires level " + element.level());
            return null;
        }
        return new GrantedItem(
                context.source(),
                element.uuid(),
                element.item(),
                element.allowDuplicate() != null && element.allowDuplicate(),
                element.level(),
                element.predicate(),
                true);
    }
}
