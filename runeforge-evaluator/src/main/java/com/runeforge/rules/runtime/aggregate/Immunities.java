package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.model.ImmunityType;
import com.runeforge.rules.api.result.ImmunityResult;

import java.util.List;

public final class Immunities {

    private Immunities() {
    }

    public static boolean isImmuneToDamage(List<ImmunityResult> immunities, String damageType) {
        return covers(immunities, ImmunityType.DAMAGE, damageType);
    }

    public static boolean isImmuneToCondition(List<ImmunityResult> immunities, String condition) {
        return covers(immunities, ImmunityType.CONDITION, condition);
    }

    public static boolean isImmuneToEffect(List<ImmunityResult> immunities, String effect) {
        return covers(immunities, ImmunityType.EFFECT, effect);
    }

    public static boolean isImmuneToCriticalHits(List<ImmunityResult> immunities) {
        return immunities.stream().anyMatch(immunity -> immunity.type() == ImmunityType.CRITICAL_HITS);
    }

    public static boolean isImmuneToPrecisionDamage(List<ImmunityResult> immunities) {
        return immunities.stream().anyMatch(immunity -> immunity.type() == ImmunityType.PRECISION_DAMAGE);
    }

    /**
     * @return 0 when immune to the damage type, otherwise the damage unchanged
     */
    public static int applyImmunities(int damage, String damageType, List<ImmunityResult> immunities) {
        return isImmuneToDamage(immunities, damageType) ? 0 : damage;
    }

    private static boolean covers(List<ImmunityResult> immunities, ImmunityType type, String value) {
        return immunities.stream().anyMatch(immunity -> immunity.type() == type && immunity.values().contains(value));
    }
}
