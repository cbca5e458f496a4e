package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.result.ResistanceResult;

import java.util.List;
import java.util.Set;

/**
 * Damage resistances. Resistances never stack: the highest matching entry applies.
 */
public final class Resistances {
    static final String ALL = "all";
    static final String PHYSICAL = "physical";
    static final Set<String> PHYSICAL_TYPES = Set.of("bludgeoning", "piercing", "slashing");

    private Resistances() {
    }

    /**
     * @param damageSource named source of the damage, e.g. {@code adamantine}; may be null
     * @return the highest resistance that covers the damage type and is not bypassed by the
     * source, 0 when none does
     */
    public static int effectiveResistance(List<ResistanceResult> resistances, String damageType, String damageSource) {
        int max = 0;
        for (ResistanceResult resistance : resistances) {
            if (!covers(resistance.types(), damageType, true)) {
                continue;
            }
            if (damageSource != null && resistance.exceptions().contains(damageSource)) {
                continue;
            }
            max = Math.max(max, resistance.value());
        }
        return max;
    }

    public static int applyResistance(int damage, int resistance) {
        return Math.max(0, damage - resistance);
    }

    static boolean covers(List<String> types, String damageType, boolean allowAll) {
        return types.contains(damageType)
                || (allowAll && types.contains(ALL))
                || (types.contains(PHYSICAL) && PHYSICAL_TYPES.contains(damageType));
    }
}
