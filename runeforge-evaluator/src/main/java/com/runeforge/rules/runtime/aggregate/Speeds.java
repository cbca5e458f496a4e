package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.IPredicateEvaluator;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.result.Speed;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Movement speeds. Speeds of the same type do not add up: the fastest source wins.
 */
public final class Speeds {
    static final String LAND = "land";

    private Speeds() {
    }

    /**
     * Fastest active speed of any type, 0 when none applies.
     */
    public static int effectiveSpeed(List<Speed> speeds, PredicateContext context, IPredicateEvaluator evaluator) {
        int max = 0;
        boolean any = false;
        for (Speed speed : Activation.active(speeds, context, evaluator)) {
            max = any ? Math.max(max, speed.value()) : speed.value();
            any = true;
        }
        return any ? max : 0;
    }

    /**
     * Fastest speed per type, in first-seen type order.
     */
    public static Object2IntMap<String> speedsByType(List<Speed> speeds) {
        Object2IntLinkedOpenHashMap<String> byType = new Object2IntLinkedOpenHashMap<>();
        for (Speed speed : speeds) {
            if (byType.containsKey(speed.type())) {
                byType.put(speed.type(), Math.max(byType.getInt(speed.type()), speed.value()));
            } else {
                byType.put(speed.type(), speed.value());
            }
        }
        return byType;
    }

    /**
     * {@code "25 feet, fly 30 feet"}: land speed first and unnamed.
     */
    public static String formatSpeeds(Object2IntMap<String> speeds) {
        List<String> parts = new ArrayList<>();
        for (Object2IntMap.Entry<String> entry : speeds.object2IntEntrySet()) {
            if (LAND.equals(entry.getKey())) {
                parts.add(0, entry.getIntValue() + " feet");
            } else {
                parts.add(entry.getKey() + " " + entry.getIntValue() + " feet");
            }
        }
        return String.join(", ", parts);
    }
}
