package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.model.ModifierType;
import com.runeforge.rules.api.result.Modifier;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bonus-type stacking.
 *
 * <ul>
 *   <li>Typed bonuses (status, circumstance, item) do not stack with the same type: only the
 *       highest counts. On a tie the first one seen is applied.</li>
 *   <li>Untyped bonuses always stack.</li>
 *   <li>All penalties stack regardless of type.</li>
 * </ul>
 *
 * Zero-valued modifiers are neither bonuses nor penalties and never contribute.
 */
public final class ModifierStacking {

    private ModifierStacking() {
    }

    public static int total(List<Modifier> modifiers) {
        int total = 0;
        for (Modifier modifier : appliedModifiers(modifiers)) {
            total += modifier.value();
        }
        return total;
    }

    /**
     * @return applied bonuses in input order, then every penalty
     */
    public static List<Modifier> appliedModifiers(List<Modifier> modifiers) {
        Map<ModifierType, Modifier> highestByType = highestByType(modifiers);
        List<Modifier> applied = new ArrayList<>();
        List<Modifier> penalties = new ArrayList<>();
        for (Modifier modifier : modifiers) {
            if (modifier.isPenalty()) {
                penalties.add(modifier);
            } else if (modifier.isBonus()
                    && (modifier.type() == ModifierType.UNTYPED || highestByType.get(modifier.type()) == modifier)) {
                applied.add(modifier);
            }
        }
        applied.addAll(penalties);
        return applied;
    }

    /**
     * Whether adding {@code candidate} to {@code existing} would change the total.
     */
    public static boolean wouldStack(Modifier candidate, List<Modifier> existing) {
        if (candidate.isPenalty() || candidate.type() == ModifierType.UNTYPED) {
            return true;
        }
        int currentHighest = Integer.MIN_VALUE;
        boolean sameTypeSeen = false;
        for (Modifier modifier : existing) {
            if (modifier.isBonus() && modifier.type() == candidate.type()) {
                sameTypeSeen = true;
                currentHighest = Math.max(currentHighest, modifier.value());
            }
        }
        return !sameTypeSeen || candidate.value() > currentHighest;
    }

    /**
     * Human-readable reason why {@code modifier} does or does not count among {@code all}.
     */
    public static String explanation(Modifier modifier, List<Modifier> all) {
        if (modifier.isPenalty()) {
            return "All penalties stack";
        }
        if (modifier.type() == ModifierType.UNTYPED) {
            return "Untyped bonuses stack";
        }
        String type = modifier.type().wireName();
        List<Modifier> sameType = new ArrayList<>();
        for (Modifier other : all) {
            if (other != modifier && other.isBonus() && other.type() == modifier.type()) {
                sameType.add(other);
            }
        }
        if (sameType.isEmpty()) {
            return "Only " + type + " bonus";
        }
        for (Modifier other : sameType) {
            if (other.value() > modifier.value()) {
                return "Suppressed by higher " + type + " bonus from " + other.source();
            }
        }
        return "Highest " + type + " bonus";
    }

    static Map<ModifierType, Modifier> highestByType(List<Modifier> modifiers) {
        Map<ModifierType, Modifier> highest = new EnumMap<>(ModifierType.class);
        for (Modifier modifier : modifiers) {
            if (!modifier.isBonus() || modifier.type() == ModifierType.UNTYPED) {
                continue;
            }
            Modifier current = highest.get(modifier.type());
            if (current == null || modifier.value() > current.value()) {
                highest.put(modifier.type(), modifier);
            }
        }
        return highest;
    }
}
