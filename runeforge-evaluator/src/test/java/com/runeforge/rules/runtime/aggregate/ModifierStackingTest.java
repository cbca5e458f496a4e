package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.model.ModifierType;
import com.runeforge.rules.api.result.Modifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModifierStackingTest {

    private final Modifier heroism = Modifier.of("Heroism", "Heroism", 1, ModifierType.STATUS, "attack");
    private final Modifier bless = Modifier.of("Bless", "Bless", 1, ModifierType.STATUS, "attack");
    private final Modifier inspire = Modifier.of("Inspire Courage", "Bard", 2, ModifierType.STATUS, "attack");
    private final Modifier flank = Modifier.of("Flanking", "Ally", 2, ModifierType.CIRCUMSTANCE, "attack");
    private final Modifier untypedA = Modifier.of("A", "A", 1, ModifierType.UNTYPED, "attack");
    private final Modifier untypedB = Modifier.of("B", "B", 1, ModifierType.UNTYPED, "attack");
    private final Modifier frightened = Modifier.of("Frightened", "Fear", -1, ModifierType.STATUS, "attack");
    private final Modifier sickened = Modifier.of("Sickened", "Nausea", -2, ModifierType.STATUS, "attack");

    @Test
    @DisplayName("Same-type bonuses keep the highest, untyped bonuses and penalties all stack")
    void total() {
        List<Modifier> modifiers = List.of(heroism, inspire, flank, untypedA, untypedB, frightened, sickened);

        assertThat(ModifierStacking.total(modifiers)).isEqualTo(2 + 2 + 1 + 1 - 1 - 2);
    }

    @Test
    @DisplayName("Applied modifiers list bonuses in order, then penalties")
    void applied() {
        List<Modifier> modifiers = List.of(frightened, heroism, inspire, untypedA);

        assertThat(ModifierStacking.appliedModifiers(modifiers)).containsExactly(inspire, untypedA, frightened);
    }

    @Test
    @DisplayName("Tied bonuses of a type apply once")
    void ties() {
        assertThat(ModifierStacking.total(List.of(heroism, bless))).isEqualTo(1);
        assertThat(ModifierStacking.appliedModifiers(List.of(heroism, bless))).containsExactly(heroism);
    }

    @Test
    @DisplayName("A new bonus stacks only when it beats the current best of its type")
    void wouldStack() {
        assertThat(ModifierStacking.wouldStack(inspire, List.of(heroism))).isTrue();
        assertThat(ModifierStacking.wouldStack(bless, List.of(heroism))).isFalse();
        assertThat(ModifierStacking.wouldStack(flank, List.of(heroism))).isTrue();
        assertThat(ModifierStacking.wouldStack(frightened, List.of(sickened))).isTrue();
    }

    @Test
    @DisplayName("Explanations name the reason a modifier counts or not")
    void explanation() {
        List<Modifier> all = List.of(heroism, inspire, flank, untypedA, frightened);

        assertThat(ModifierStacking.explanation(frightened, all)).isEqualTo("All penalties stack");
        assertThat(ModifierStacking.explanation(untypedA, all)).isEqualTo("Untyped bonuses stack");
        assertThat(ModifierStacking.explanation(flank, all)).isEqualTo("Only circumstance bonus");
        assertThat(ModifierStacking.explanation(inspire, all)).isEqualTo("Highest status bonus");
        assertThat(ModifierStacking.explanation(heroism, all))
                .isEqualTo("Suppressed by higher status bonus from Bard");
    }
}
