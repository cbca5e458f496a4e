package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.result.StrikingResult;

import java.util.List;

/**
 * Striking runes add weapon damage dice. Only the best rune counts.
 */
public final class StrikingDice {

    private StrikingDice() {
    }

    public static int totalDice(int baseDice, List<StrikingResult> bonuses) {
        int best = 0;
        for (StrikingResult bonus : bonuses) {
            best = Math.max(best, bonus.extraDice());
        }
        return baseDice + best;
    }

    public static String label(int extraDice) {
        return switch (extraDice) {
            case 1 -> "Striking";
            case 2 -> "Greater Striking";
            case 3 -> "Major Striking";
            default -> "+" + extraDice + " Damage Dice";
        };
    }
}
