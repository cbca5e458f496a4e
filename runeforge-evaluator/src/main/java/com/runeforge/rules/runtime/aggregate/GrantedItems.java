package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.IPredicateEvaluator;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.result.GrantedItem;

import java.util.List;

public final class GrantedItems {

    private GrantedItems() {
    }

    public static List<GrantedItem> active(List<GrantedItem> items, PredicateContext context,
                                           IPredicateEvaluator evaluator) {
        return Activation.active(items, context, evaluator);
    }

    /**
     * True when an item with the identity was already granted by a grant that forbids duplicates.
     */
    public static boolean isAlreadyGranted(List<GrantedItem> items, String uuid) {
        if (uuid == null) {
            return false;
        }
        return items.stream().anyMatch(item -> uuid.equals(item.identity()) && !item.allowDuplicate());
    }
}
