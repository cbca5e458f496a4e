package com.runeforge.rules.runtime.effects;

import com.runeforge.rules.api.model.CharacterState;
import com.runeforge.rules.api.model.RuleSource;
import com.runeforge.rules.api.result.Modifier;
import com.runeforge.rules.compiler.RuleElementParser;
import com.runeforge.rules.infra.config.EngineSettings;
import com.runeforge.rules.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.runeforge.rules.runtime.RuleElementRegistry;
import com.runeforge.rules.runtime.choice.InMemoryChoiceStore;
import com.runeforge.rules.runtime.predicate.PredicateEvaluator;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CharacterEffectsCalculatorTest {

    private static final String SOURCES = """
            [
              {"name": "Mountain Stance", "rules": [
                {"key": "ToggleProperty", "property": "flags.pf2e.stance.mountain-stance", "label": "Mountain Stance"},
                {"key": "FlatModifier", "selector": "ac", "value": 4, "type": "item",
                 "predicate": ["stance:mountain-stance"]}
              ]},
              {"name": "Rage", "rules": [
                {"key": "RollOption", "option": "raging", "toggleable": true, "value": false},
                {"key": "FlatModifier", "selector": "ac", "value": -1, "predicate": ["raging"]},
                {"key": "Resistance", "type": ["fire"], "value": 5, "predicate": ["raging"]}
              ]},
              {"name": "Weapon Expertise", "rules": [
                {"key": "ChoiceSet", "flag": "weapon", "choices": [
                  {"label": "Sword", "value": "sword"}, {"label": "Axe", "value": "axe"}]}
              ]},
              {"name": "Veteran", "rules": [
                {"key": "FlatModifier", "selector": "hp", "value": 10, "predicate": ["self:level:gte:5"]}
              ]}
            ]
            """;

    private List<RuleSource> sources;
    private CharacterEffectsCalculator calculator;
    private InMemoryChoiceStore store;

    @BeforeEach
    void setUp() {
        sources = new RuleElementParser().parseSources(SOURCES);
        PredicateEvaluator evaluator = new PredicateEvaluator(EngineSettings.defaults(), new InMemoryMetricsRegistry());
        RuleElementRegistry registry = new RuleElementRegistry(OpenTelemetry.noop().getTracer("test"),
                new InMemoryMetricsRegistry());
        calculator = new CharacterEffectsCalculator(registry, evaluator);
        store = new InMemoryChoiceStore();
    }

    @Test
    @DisplayName("Nothing toggled: conditional effects are collected but inactive")
    void nothingToggled() {
        CharacterEffects effects = calculator.calculate(sources, CharacterState.ofLevel(3), store);

        assertThat(effects.all().modifiers()).hasSize(3);
        assertThat(effects.active().modifiers()).isEmpty();
        assertThat(effects.active().resistances()).isEmpty();
        assertThat(effects.active().choiceSets()).singleElement()
                .satisfies(prompt -> assertThat(prompt.isComplete()).isFalse());
        assertThat(effects.snapshot().options()).isEmpty();
    }

    @Test
    @DisplayName("Stored toggles feed the predicate snapshot")
    void togglesActivateEffects() {
        // Given
        store.setToggle("flags.pf2e.stance.mountain-stance", true);
        store.setToggle("raging", true);
        store.select("weapon", List.of("axe"));

        // When
        CharacterEffects effects = calculator.calculate(sources, CharacterState.ofLevel(3), store);

        // Then
        assertThat(effects.snapshot().options()).contains("stance:mountain-stance", "raging");
        assertThat(effects.active().modifiers()).extracting(Modifier::value).containsExactly(4, -1);
        assertThat(effects.active().resistances()).singleElement()
                .satisfies(resistance -> assertThat(resistance.value()).isEqualTo(5));
        assertThat(effects.active().choiceSets().get(0).selection()).containsExactly("axe");
    }

    @Test
    @DisplayName("Character level and roll options gate effects")
    void characterState() {
        CharacterState state = new CharacterState(6, Set.of("raging"), Set.of(), Set.of(), Map.of());

        CharacterEffects effects = calculator.calculate(sources, state, store);

        assertThat(effects.active().modifiers()).extracting(Modifier::selector).containsExactly("ac", "hp");
    }

    @Test
    @DisplayName("A toggle the character cannot use adds no roll option, even when stored on")
    void unavailableToggleIgnored() {
        // Given
        List<RuleSource> dragonStance = new RuleElementParser().parseSources("""
                [
                  {"name": "Dragon Stance", "rules": [
                    {"key": "ToggleProperty", "property": "flags.pf2e.stance.dragon", "label": "Dragon Stance",
                     "predicate": ["self:level:gte:5"]},
                    {"key": "FlatModifier", "selector": "damage", "value": 2, "predicate": ["stance:dragon"]}
                  ]}
                ]
                """);
        store.setToggle("flags.pf2e.stance.dragon", true);

        // When
        CharacterEffects lowLevel = calculator.calculate(dragonStance, CharacterState.ofLevel(1), store);
        CharacterEffects highLevel = calculator.calculate(dragonStance, CharacterState.ofLevel(5), store);

        // Then
        assertThat(lowLevel.active().toggleProperties()).isEmpty();
        assertThat(lowLevel.snapshot().options()).doesNotContain("stance:dragon");
        assertThat(lowLevel.active().modifiers()).isEmpty();
        assertThat(highLevel.active().toggleProperties()).hasSize(1);
        assertThat(highLevel.active().modifiers()).extracting(Modifier::label).containsExactly("+2 Damage");
    }
}
