package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.model.SizeCategory;
import com.runeforge.rules.api.result.CreatureSizeResult;

import java.util.List;

/**
 * Creature size after every CreatureSize change, with the space and reach it implies.
 */
public final class CreatureSizes {
    private static final SizeCategory[] ORDER = SizeCategory.values();

    private CreatureSizes() {
    }

    /**
     * Moves {@code delta} steps along the size scale, saturating at tiny and gargantuan.
     */
    public static SizeCategory resizeCreature(SizeCategory size, int delta) {
        long index = (long) size.ordinal() + delta;
        return ORDER[(int) Math.max(0, Math.min(ORDER.length - 1, index))];
    }

    /**
     * Applies each change in order. An absolute size replaces the current size and ends that
     * change; otherwise the relative step is applied, then the maximum and minimum clamps.
     */
    public static SizeCategory finalSize(SizeCategory baseSize, List<CreatureSizeResult> changes) {
        SizeCategory current = baseSize;
        for (CreatureSizeResult change : changes) {
            if (change.size() != null) {
                current = change.size();
                continue;
            }
            if (change.resizeBy() != 0) {
                current = resizeCreature(current, change.resizeBy());
            }
            if (change.maximumSize() != null && current.isLargerThan(change.maximumSize())) {
                current = change.maximumSize();
            }
            if (change.minimumSize() != null && current.isSmallerThan(change.minimumSize())) {
                current = change.minimumSize();
            }
        }
        return current;
    }

    /**
     * Space occupied, in feet.
     */
    public static double space(SizeCategory size) {
        return switch (size) {
            case TINY -> 2.5;
            case SMALL, MEDIUM -> 5;
            case LARGE -> 10;
            case HUGE -> 15;
            case GARGANTUAN -> 20;
        };
    }

    /**
     * Natural reach, in feet.
     */
    public static int reach(SizeCategory size) {
        return switch (size) {
            case TINY, SMALL, MEDIUM -> 5;
            case LARGE -> 10;
            case HUGE -> 15;
            case GARGANTUAN -> 20;
        };
    }
}
