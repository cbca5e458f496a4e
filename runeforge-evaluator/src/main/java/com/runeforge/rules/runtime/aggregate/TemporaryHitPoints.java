package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.result.TempHpResult;

import java.util.List;
import java.util.Optional;

/**
 * Temporary hit points never stack; the single highest grant is kept.
 */
public final class TemporaryHitPoints {

    private TemporaryHitPoints() {
    }

    /**
     * @return the highest grant, the earliest one on ties, or empty when there is none
     */
    public static Optional<TempHpResult> highest(List<TempHpResult> sources) {
        TempHpResult highest = null;
        for (TempHpResult source : sources) {
            if (highest == null || source.value() > highest.value()) {
                highest = source;
            }
        }
        return Optional.ofNullable(highest);
    }
}
