package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.IPredicateEvaluator;
import com.runeforge.rules.api.model.PropertyMode;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.result.PropertyModification;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Applies ActiveEffectLike property modifications onto a nested property tree such as
 * {@code {"system": {"skills": {"athletics": {"rank": 1}}}}}.
 */
public final class PropertyModifications {
    private static final Logger logger = Logger.getLogger(PropertyModifications.class.getName());

    private static final Comparator<PropertyModification> APPLICATION_ORDER =
            Comparator.comparing(PropertyModification::phase)
                    .thenComparingInt(PropertyModification::priority);

    private PropertyModifications() {
    }

    /**
     * Stable sort by phase, then by priority within a phase (lower first).
     */
    public static List<PropertyModification> sort(List<PropertyModification> modifications) {
        List<PropertyModification> sorted = new ArrayList<>(modifications);
        sorted.sort(APPLICATION_ORDER);
        return sorted;
    }

    public static List<PropertyModification> active(List<PropertyModification> modifications,
                                                    PredicateContext context, IPredicateEvaluator evaluator) {
        return Activation.active(modifications, context, evaluator);
    }

    /**
     * Applies the enabled modifications in application order, mutating {@code properties}.
     * Missing intermediate objects are created and a missing leaf counts as 0. A modification
     * whose path crosses a non-object value, or whose leaf is not numeric, is skipped unless it
     * overrides.
     *
     * @return the number of modifications applied
     */
    public static int apply(Map<String, Object> properties, List<PropertyModification> modifications) {
        int applied = 0;
        for (PropertyModification modification : sort(modifications)) {
            if (modification.enabled() && applyOne(properties, modification)) {
                applied++;
            }
        }
        return applied;
    }

    @SuppressWarnings("unchecked")
    private static boolean applyOne(Map<String, Object> properties, PropertyModification modification) {
        String[] segments = modification.path().split("\\.");
        Map<String, Object> node = properties;
        for (int i = 0; i < segments.length - 1; i++) {
            Object child = node.get(segments[i]);
            if (child == null) {
                child = new LinkedHashMap<String, Object>();
                node.put(segments[i], child);
            }
            if (!(child instanceof Map)) {
                logger.warning(String.format("Skipping %s from %s: '%s' is not an object",
                        modification.path(), modification.source(), segments[i]));
                return false;
            }
            node = (Map<String, Object>) child;
        }

        String leaf = segments[segments.length - 1];
        Object current = node.get(leaf);
        double base;
        if (current == null) {
            base = 0;
        } else if (current instanceof Number number) {
            base = number.doubleValue();
        } else if (modification.mode() == PropertyMode.OVERRIDE) {
            base = 0;
        } else {
            logger.warning(String.format("Skipping %s from %s: current value '%s' is not numeric",
                    modification.path(), modification.source(), current));
            return false;
        }
        node.put(leaf, toNumber(modification.mode().apply(base, modification.value())));
        return true;
    }

    private static Number toNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) <= Integer.MAX_VALUE) {
            return (int) value;
        }
        return value;
    }
}
