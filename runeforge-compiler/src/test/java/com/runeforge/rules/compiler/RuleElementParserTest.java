package com.runeforge.rules.compiler;

import com.runeforge.rules.api.element.Choice;
import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.element.RuleElementKind;
import com.runeforge.rules.api.element.ValueOperand;
import com.runeforge.rules.api.model.ImmunityType;
import com.runeforge.rules.api.model.ModifierType;
import com.runeforge.rules.api.model.RuleSource;
import com.runeforge.rules.api.model.SizeCategory;
import com.runeforge.rules.api.predicate.Predicate;
import com.runeforge.rules.api.predicate.PredicateStatement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleElementParserTest {

    private final RuleElementParser parser = new RuleElementParser();

    @Nested
    @DisplayName("element fields")
    class ElementFields {

        @Test
        @DisplayName("FlatModifier reads every field")
        void flatModifier() {
            List<RuleElement> elements = parser.parseElements("""
                    [{"key": "FlatModifier", "selector": "speed", "value": 5, "type": "untyped",
                      "label": "Fleet", "predicate": ["self:level:gte:1"]}]
                    """);

            assertThat(elements).singleElement().isEqualTo(new RuleElement.FlatModifier(
                    "speed", ValueOperand.of(5), ModifierType.UNTYPED, "Fleet", null,
                    Predicate.of("self:level:gte:1")));
        }

        @Test
        @DisplayName("string values are kept as formulas")
        void formulaValue() {
            RuleElement element = parser.parseElements("""
                    [{"key": "TempHP", "value": "@actor.level * 2"}]
                    """).get(0);

            assertThat(((RuleElement.TempHp) element).value()).isEqualTo(ValueOperand.of("@actor.level * 2"));
        }

        @Test
        @DisplayName("fractional numbers are kept as authored")
        void fractionalValues() {
            List<RuleElement> elements = parser.parseElements("""
                    [{"key": "ActiveEffectLike", "path": "system.speed", "mode": "multiply", "value": 0.5},
                     {"key": "AdjustModifier", "selector": "ac", "mode": "multiply", "value": 0.5}]
                    """);

            assertThat(((RuleElement.ActiveEffectLike) elements.get(0)).value()).isEqualTo(ValueOperand.of(0.5));
            assertThat(((RuleElement.AdjustModifier) elements.get(1)).value()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("damage types accept a string or an array")
        void typeStringOrArray() {
            List<RuleElement> elements = parser.parseElements("""
                    [{"key": "Resistance", "type": "fire", "value": 5},
                     {"key": "Weakness", "type": ["cold", "silver"], "value": 2}]
                    """);

            assertThat(((RuleElement.Resistance) elements.get(0)).types()).containsExactly("fire");
            assertThat(((RuleElement.Weakness) elements.get(1)).types()).containsExactly("cold", "silver");
        }

        @Test
        @DisplayName("immunity values accept a string or an array")
        void immunity() {
            RuleElement.Immunity immunity = (RuleElement.Immunity) parser.parseElements("""
                    [{"key": "Immunity", "type": "condition", "value": "paralyzed"}]
                    """).get(0);

            assertThat(immunity.type()).isEqualTo(ImmunityType.CONDITION);
            assertThat(immunity.values()).containsExactly("paralyzed");
        }

        @Test
        @DisplayName("choices keep their own predicates")
        void choiceSet() {
            RuleElement.ChoiceSet choiceSet = (RuleElement.ChoiceSet) parser.parseElements("""
                    [{"key": "ChoiceSet", "flag": "weaponGroup",
                      "choices": [{"label": "Axe", "value": "axe"},
                                  {"label": "Bow", "value": "bow", "predicate": ["trained:bow"]}]}]
                    """).get(0);

            assertThat(choiceSet.flag()).isEqualTo("weaponGroup");
            assertThat(choiceSet.choices()).extracting(Choice::value).containsExactly("axe", "bow");
            assertThat(choiceSet.choices().get(1).predicate().statements())
                    .containsExactly(PredicateStatement.atom("trained:bow"));
        }

        @Test
        @DisplayName("unknown enum text leaves the field unset")
        void unknownEnum() {
            RuleElement.CreatureSize size = (RuleElement.CreatureSize) parser.parseElements("""
                    [{"key": "CreatureSize", "value": "colossal", "maximumSize": "huge"}]
                    """).get(0);

            assertThat(size.value()).isNull();
            assertThat(size.maximumSize()).isEqualTo(SizeCategory.HUGE);
        }

        @Test
        @DisplayName("missing predicate is the empty predicate")
        void missingPredicate() {
            RuleElement element = parser.parseElements("[{\"key\": \"ActorTraits\", \"add\": [\"undead\"]}]").get(0);

            assertThat(element.predicate().isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("forward compatibility")
    class ForwardCompatibility {

        @Test
        @DisplayName("unknown keys become unrecognized elements carrying the payload")
        void unknownKey() {
            List<RuleElement> elements = parser.parseElements("""
                    [{"key": "Aura", "radius": 30}, {"key": "Sense", "selector": "darkvision"}]
                    """);

            assertThat(elements).hasSize(2);
            assertThat(elements.get(0).kind()).isEqualTo(RuleElementKind.UNRECOGNIZED);
            assertThat(elements.get(0).key()).isEqualTo("Aura");
            assertThat(((RuleElement.Unrecognized) elements.get(0)).payload()).containsEntry("radius", 30);
            assertThat(elements.get(1).kind()).isEqualTo(RuleElementKind.SENSE);
        }

        @Test
        @DisplayName("elements without a key are unrecognized")
        void missingKey() {
            RuleElement element = parser.parseElements("[{\"selector\": \"speed\"}]").get(0);

            assertThat(element).isInstanceOf(RuleElement.Unrecognized.class);
            assertThat(element.key()).isNull();
        }
    }

    @Nested
    @DisplayName("top-level shape")
    class TopLevel {

        @Test
        @DisplayName("malformed JSON is rejected")
        void malformedJson() {
            assertThatThrownBy(() -> parser.parseElements("[{\"key\": "))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("Malformed rule JSON");
        }

        @Test
        @DisplayName("non-array element content is rejected")
        void nonArray() {
            assertThatThrownBy(() -> parser.parseElements("{\"key\": \"FlatModifier\"}"))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("Expected a JSON array");
        }

        @Test
        @DisplayName("sources need a name")
        void sourceWithoutName() {
            assertThatThrownBy(() -> parser.parseSources("[{\"rules\": []}]"))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("missing or empty name");
        }

        @Test
        @DisplayName("a single source object is accepted")
        void singleSource() {
            List<RuleSource> sources = parser.parseSources("""
                    {"name": "Fleet", "rules": [{"key": "FlatModifier", "selector": "speed", "value": 5}]}
                    """);

            assertThat(sources).singleElement()
                    .satisfies(source -> {
                        assertThat(source.name()).isEqualTo("Fleet");
                        assertThat(source.elements()).hasSize(1);
                    });
        }
    }
}
