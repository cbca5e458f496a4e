package com.runeforge.rules.runtime.choice;

import com.runeforge.rules.api.element.Choice;
import com.runeforge.rules.api.predicate.Predicate;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.result.ChoiceSetPrompt;
import com.runeforge.rules.api.result.RollOptionResult;
import com.runeforge.rules.api.result.TogglePropertyResult;
import com.runeforge.rules.infra.config.EngineSettings;
import com.runeforge.rules.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.runeforge.rules.runtime.predicate.PredicateEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChoiceSetsTest {

    private final PredicateEvaluator evaluator =
            new PredicateEvaluator(EngineSettings.defaults(), new InMemoryMetricsRegistry());

    private final ChoiceSetPrompt prompt = new ChoiceSetPrompt("Weapon Expertise", "weapon", "Pick two weapons",
            List.of(Choice.of("Sword", "sword"), Choice.of("Axe", "axe"),
                    new Choice("Greataxe", "greataxe", Predicate.of("self:level:gte:5"), null)),
            2, false, List.of(), null);

    @Nested
    @DisplayName("choice sets")
    class Choices {

        @Test
        @DisplayName("Options are offered only when their predicate holds")
        void available() {
            PredicateContext lowLevel = PredicateContext.builder().level(3).build();

            assertThat(ChoiceSets.availableChoices(prompt, lowLevel, evaluator))
                    .extracting(Choice::value).containsExactly("sword", "axe");
        }

        @Test
        @DisplayName("A selection needs exactly the required count of known values")
        void validate() {
            assertThat(ChoiceSets.validateSelection(prompt, List.of("sword", "axe"))).isTrue();
            assertThat(ChoiceSets.validateSelection(prompt, List.of("sword"))).isFalse();
            assertThat(ChoiceSets.validateSelection(prompt, List.of("sword", "bow"))).isFalse();
        }

        @Test
        @DisplayName("Applying a valid selection completes the prompt")
        void apply() {
            ChoiceSetPrompt answered = ChoiceSets.applySelection(prompt, List.of("axe", "sword"));

            assertThat(ChoiceSets.isComplete(answered)).isTrue();
            assertThat(ChoiceSets.incomplete(List.of(prompt, answered))).containsExactly(prompt);
            assertThat(ChoiceSets.selectionLabel(answered, "axe")).hasValue("Axe");
            assertThat(ChoiceSets.selectionLabel(answered, "bow")).isEmpty();
        }

        @Test
        @DisplayName("Applying an invalid selection is rejected")
        void applyInvalid() {
            assertThatThrownBy(() -> ChoiceSets.applySelection(prompt, List.of("bow")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Invalid selection [bow] for weapon");
        }
    }

    @Nested
    @DisplayName("toggles")
    class ToggleRules {

        private final TogglePropertyResult stance = new TogglePropertyResult("flags.pf2e.stance.mountain-stance",
                "Mountain Stance", true, null, null, "Mountain Stance", Predicate.of("unarmored"));

        @Test
        @DisplayName("Enabled toggles emit a roll option derived from their property")
        void derivedRollOption() {
            assertThat(Toggles.rollOption(stance)).hasValue("stance:mountain-stance");
            assertThat(Toggles.rollOption(stance.withEnabled(false))).isEmpty();
        }

        @Test
        @DisplayName("An explicit roll option wins over the derived one")
        void explicitRollOption() {
            TogglePropertyResult rage = new TogglePropertyResult("flags.system.rage", "Rage", true, "rage",
                    null, "Rage", null);

            PredicateContext unarmored = PredicateContext.ofOptions(Set.of("unarmored"));

            assertThat(Toggles.enabledRollOptions(List.of(stance, rage), unarmored, evaluator))
                    .containsExactly("stance:mountain-stance", "rage");
        }

        @Test
        @DisplayName("An unavailable toggle emits no roll option even when switched on")
        void unavailableToggle() {
            assertThat(Toggles.enabledRollOptions(List.of(stance), PredicateContext.empty(), evaluator)).isEmpty();
        }

        @Test
        @DisplayName("Availability follows the toggle predicate")
        void availability() {
            assertThat(Toggles.isAvailable(stance, PredicateContext.ofOptions(Set.of("unarmored")), evaluator)).isTrue();
            assertThat(Toggles.isAvailable(stance, PredicateContext.empty(), evaluator)).isFalse();
        }

        @Test
        @DisplayName("Active roll options come from enabled results whose predicate holds")
        void activeRollOptions() {
            List<RollOptionResult> results = List.of(
                    new RollOptionResult("raging", "all", true, true, null, "Rage", null),
                    new RollOptionResult("hunted-prey", "all", false, true, null, "Hunt", Predicate.of("hunting")),
                    new RollOptionResult("fatigued", "all", false, false, null, "Fatigue", null));

            assertThat(Toggles.activeRollOptions(results, PredicateContext.empty(), evaluator))
                    .containsExactly("raging");
        }
    }
}
