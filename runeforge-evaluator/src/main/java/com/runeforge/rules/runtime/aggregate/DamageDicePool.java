package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.result.DamageDice;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Pools damage dice of the same die size and damage type, e.g. 1d6 fire and 2d6 fire into
 * 3d6 fire. Pools keep first-seen order.
 */
public final class DamageDicePool {
    static final String UNTYPED = "untyped";

    private DamageDicePool() {
    }

    /**
     * @param sources names of the items that contributed, in order
     */
    public record Pool(int diceNumber, String dieSize, String damageType, List<String> sources) {

        public Pool {
            sources = List.copyOf(sources);
        }

        /**
         * {@code "3d6 fire"}, or just {@code "2d4"} for untyped damage.
         */
        @Override
        public String toString() {
            return diceNumber + dieSize + (UNTYPED.equals(damageType) ? "" : " " + damageType);
        }
    }

    /**
     * Disabled entries are skipped.
     */
    public static List<Pool> pool(List<DamageDice> dice) {
        Object2ObjectLinkedOpenHashMap<String, Accumulator> pools = new Object2ObjectLinkedOpenHashMap<>();
        for (DamageDice entry : dice) {
            if (!entry.enabled()) {
                continue;
            }
            Accumulator accumulator = pools.computeIfAbsent(entry.dieSize() + "-" + entry.damageType(),
                    key -> new Accumulator(entry.dieSize(), entry.damageType()));
            accumulator.diceNumber += entry.diceNumber();
            accumulator.sources.add(entry.source());
        }
        List<Pool> result = new ArrayList<>(pools.size());
        for (Accumulator accumulator : pools.values()) {
            result.add(new Pool(accumulator.diceNumber, accumulator.dieSize, accumulator.damageType, accumulator.sources));
        }
        return result;
    }

    /**
     * {@code "3d6 fire + 1d4 cold"}.
     */
    public static String format(List<Pool> pools) {
        return pools.stream().map(Pool::toString).collect(Collectors.joining(" + "));
    }

    private static final class Accumulator {
        private final String dieSize;
        private final String damageType;
        private final List<String> sources = new ArrayList<>();
        private int diceNumber;

        Accumulator(String dieSize, String damageType) {
            this.dieSize = dieSize;
            this.damageType = damageType;
        }
    }
}
