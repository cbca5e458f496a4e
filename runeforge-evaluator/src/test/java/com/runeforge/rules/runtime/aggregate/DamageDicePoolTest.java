package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.result.DamageDice;
import com.runeforge.rules.api.result.StrikingResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DamageDicePoolTest {

    private static DamageDice dice(String source, int number, String size, String type) {
        return new DamageDice(source, "strike-damage", number, size, type, null, null, true);
    }

    @Test
    @DisplayName("1d6 fire and 2d6 fire pool into 3d6 fire")
    void poolsSameDieAndType() {
        List<DamageDicePool.Pool> pools = DamageDicePool.pool(List.of(
                dice("Flaming Rune", 1, "d6", "fire"),
                dice("Fire Breath", 2, "d6", "fire")));

        assertThat(pools).singleElement().satisfies(pool -> {
            assertThat(pool.diceNumber()).isEqualTo(3);
            assertThat(pool.sources()).containsExactly("Flaming Rune", "Fire Breath");
        });
        assertThat(DamageDicePool.format(pools)).isEqualTo("3d6 fire");
    }

    @Test
    @DisplayName("Pools keep first-seen order, skip disabled dice and omit untyped")
    void orderingAndFormatting() {
        List<DamageDicePool.Pool> pools = DamageDicePool.pool(List.of(
                dice("Frost Rune", 1, "d6", "cold"),
                dice("Sneak Attack", 2, "d4", "untyped"),
                dice("Frost Rune", 1, "d6", "cold"),
                dice("Shock Rune", 1, "d6", "electricity").withEnabled(false)));

        assertThat(DamageDicePool.format(pools)).isEqualTo("2d6 cold + 2d4");
    }

    @Test
    @DisplayName("Only the best striking rune adds dice")
    void strikingDice() {
        List<StrikingResult> runes = List.of(
                new StrikingResult(1, "strike-damage", "Striking", null),
                new StrikingResult(2, "strike-damage", "Greater Striking", null));

        assertThat(StrikingDice.totalDice(1, runes)).isEqualTo(3);
        assertThat(StrikingDice.totalDice(1, List.of())).isEqualTo(1);
    }

    @ParameterizedTest(name = "{0} extra dice is {1}")
    @CsvSource({"1, Striking", "2, Greater Striking", "3, Major Striking", "4, +4 Damage Dice"})
    void strikingLabel(int extraDice, String label) {
        assertThat(StrikingDice.label(extraDice)).isEqualTo(label);
    }
}
