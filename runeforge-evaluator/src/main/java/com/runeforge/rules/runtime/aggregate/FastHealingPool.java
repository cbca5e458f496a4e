package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.result.FastHealingResult;

import java.util.Collection;
import java.util.List;

/**
 * Fast healing and regeneration. Unlike most defensive effects, sources add up.
 */
public final class FastHealingPool {

    private FastHealingPool() {
    }

    /**
     * Sum of active sources that none of the recent damage types switched off.
     */
    public static int total(List<FastHealingResult> sources, Collection<String> recentDamageTypes) {
        int total = 0;
        for (FastHealingResult source : sources) {
            boolean deactivated = source.deactivatedBy().stream().anyMatch(recentDamageTypes::contains);
            if (source.active() && !deactivated) {
                total += source.value();
            }
        }
        return total;
    }

    /**
     * @return an inactive copy when the damage type switches this source off, otherwise the
     * source itself
     */
    public static FastHealingResult deactivate(FastHealingResult source, String damageType) {
        return source.deactivatedBy().contains(damageType) ? source.withActive(false) : source;
    }

    public static FastHealingResult reactivate(FastHealingResult source) {
        return source.active() ? source : source.withActive(true);
    }
}
