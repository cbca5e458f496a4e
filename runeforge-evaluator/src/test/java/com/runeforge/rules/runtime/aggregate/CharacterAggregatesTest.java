package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.model.FastHealingType;
import com.runeforge.rules.api.model.SenseAcuity;
import com.runeforge.rules.api.predicate.Predicate;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.result.ActorTraitsResult;
import com.runeforge.rules.api.result.FastHealingResult;
import com.runeforge.rules.api.result.GrantedItem;
import com.runeforge.rules.api.result.Sense;
import com.runeforge.rules.api.result.Speed;
import com.runeforge.rules.api.result.TempHpResult;
import com.runeforge.rules.infra.config.EngineSettings;
import com.runeforge.rules.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.runeforge.rules.runtime.predicate.PredicateEvaluator;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CharacterAggregatesTest {

    private final PredicateEvaluator evaluator =
            new PredicateEvaluator(EngineSettings.defaults(), new InMemoryMetricsRegistry());

    @Nested
    @DisplayName("speeds")
    class SpeedRules {

        private final List<Speed> speeds = List.of(
                new Speed("land", 25, "Dwarf", null),
                new Speed("fly", 30, "Wings", Predicate.of("wings-out")),
                new Speed("land", 30, "Boots", null));

        @Test
        @DisplayName("Effective speed is the fastest active speed")
        void effective() {
            assertThat(Speeds.effectiveSpeed(speeds, PredicateContext.empty(), evaluator)).isEqualTo(30);
            assertThat(Speeds.effectiveSpeed(List.of(), PredicateContext.empty(), evaluator)).isZero();
        }

        @Test
        @DisplayName("Speeds are reported per type with land first")
        void byType() {
            Object2IntMap<String> byType = Speeds.speedsByType(List.of(
                    new Speed("fly", 60, "Wings", null), new Speed("land", 25, "Dwarf", null),
                    new Speed("land", 30, "Boots", null)));

            assertThat(byType.getInt("land")).isEqualTo(30);
            assertThat(Speeds.formatSpeeds(byType)).isEqualTo("30 feet, fly 60 feet");
        }
    }

    @Test
    @DisplayName("Senses consolidate to the longest range, then the best acuity")
    void senses() {
        Sense scentShort = new Sense("scent", 15, SenseAcuity.IMPRECISE, "Ancestry", "Scent", null, true);
        Sense scentLong = new Sense("scent", 30, SenseAcuity.VAGUE, "Feat", "Scent", null, true);
        Sense darkvision = new Sense("darkvision", null, SenseAcuity.PRECISE, "Dwarf", "Darkvision", null, true);
        Sense darkvisionBetter = new Sense("darkvision", null, SenseAcuity.PRECISE, "Item", "Darkvision", null, true);

        List<Sense> consolidated = Senses.consolidate(List.of(scentShort, darkvision, scentLong, darkvisionBetter));

        assertThat(consolidated).containsExactly(scentLong, darkvision);
        assertThat(Senses.hasSense(consolidated, "darkvision")).isTrue();
        assertThat(Senses.range(consolidated, "scent")).hasValue(30);
        assertThat(Senses.range(consolidated, "darkvision")).isEmpty();
        assertThat(Senses.hasSense(List.of(darkvision.withEnabled(false)), "darkvision")).isFalse();
    }

    @Test
    @DisplayName("Traits apply removals before additions and come out sorted")
    void traits() {
        List<String> traits = Traits.finalTraits(Set.of("Human", "Humanoid"), List.of(
                new ActorTraitsResult(List.of("Undead"), List.of("Human"), "Lich", null),
                new ActorTraitsResult(List.of("evil"), List.of(), "Curse", null)));

        assertThat(traits).containsExactly("evil", "humanoid", "undead");
        assertThat(Traits.hasTrait(traits, "UNDEAD")).isTrue();
        assertThat(Traits.hasAllTraits(traits, List.of("evil", "undead"))).isTrue();
        assertThat(Traits.hasAnyTrait(traits, List.of("good", "fey"))).isFalse();
        assertThat(Traits.traitCategory("Evil")).hasValue("alignment");
        assertThat(Traits.traitCategory("undead")).hasValue("creature-type");
        assertThat(Traits.traitCategory("elf")).isEmpty();
    }

    @Test
    @DisplayName("Temporary hit points keep the highest grant")
    void tempHp() {
        TempHpResult first = new TempHpResult(5, "Heroism", List.of("effect-start"), null);
        TempHpResult tie = new TempHpResult(5, "False Life", List.of("effect-start"), null);
        TempHpResult lower = new TempHpResult(3, "Toughness", List.of("effect-start"), null);

        assertThat(TemporaryHitPoints.highest(List.of(lower, first, tie))).containsSame(first);
        assertThat(TemporaryHitPoints.highest(List.of())).isEmpty();
    }

    @Test
    @DisplayName("Fast healing sums sources not switched off by recent damage")
    void fastHealing() {
        FastHealingResult regeneration = new FastHealingResult(10, FastHealingType.REGENERATION, "Troll",
                List.of("fire", "acid"), true, null);
        FastHealingResult ring = new FastHealingResult(2, FastHealingType.FAST_HEALING, "Ring", List.of(), true, null);

        assertThat(FastHealingPool.total(List.of(regeneration, ring), Set.of())).isEqualTo(12);
        assertThat(FastHealingPool.total(List.of(regeneration, ring), Set.of("fire"))).isEqualTo(2);

        FastHealingResult burned = FastHealingPool.deactivate(regeneration, "acid");
        assertThat(burned.active()).isFalse();
        assertThat(FastHealingPool.deactivate(ring, "acid")).isSameAs(ring);
        assertThat(FastHealingPool.reactivate(burned).active()).isTrue();
    }

    @Test
    @DisplayName("Duplicate grants are detected by identity")
    void grantedItems() {
        GrantedItem shieldBlock = new GrantedItem("Fighter", "shield-block", null, false, null, null, true);
        GrantedItem repeatable = new GrantedItem("Fighter", "torch", null, true, null, null, true);

        assertThat(GrantedItems.isAlreadyGranted(List.of(shieldBlock, repeatable), "shield-block")).isTrue();
        assertThat(GrantedItems.isAlreadyGranted(List.of(shieldBlock, repeatable), "torch")).isFalse();
        assertThat(GrantedItems.active(List.of(shieldBlock, repeatable.withEnabled(false)),
                PredicateContext.empty(), evaluator)).containsExactly(shieldBlock);
    }
}
