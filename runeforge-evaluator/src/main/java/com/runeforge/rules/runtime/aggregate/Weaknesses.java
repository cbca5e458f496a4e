package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.result.WeaknessResult;

import java.util.List;

/**
 * Damage weaknesses. Like resistances, only the highest matching entry applies.
 */
public final class Weaknesses {

    private Weaknesses() {
    }

    public static int effectiveWeakness(List<WeaknessResult> weaknesses, String damageType) {
        int max = 0;
        for (WeaknessResult weakness : weaknesses) {
            if (Resistances.covers(weakness.types(), damageType, false)) {
                max = Math.max(max, weakness.value());
            }
        }
        return max;
    }

    /**
     * Weakness only adds to damage that was actually dealt.
     */
    public static int applyWeakness(int damage, int weakness) {
        return damage > 0 ? damage + weakness : 0;
    }
}
