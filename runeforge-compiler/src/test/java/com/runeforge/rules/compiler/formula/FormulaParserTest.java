package com.runeforge.rules.compiler.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;

class FormulaParserTest {

    @ParameterizedTest(name = "{0} at level {1} = {2}")
    @CsvSource(delimiter = '|', value = {
            "@actor.level        | 7  | 7",
            "@actor.level * 2    | 7  | 14",
            "@actor.level*5      | 3  | 15",
            "@actor.level / 2    | 7  | 3",
            "@actor.level/3      | 2  | 0",
            "10                  | 1  | 10",
            "-4                  | 1  | -4",
            "+3                  | 1  | 3",
            "2.9                 | 1  | 2.9",
            "-2.5                | 1  | -2.5",
            "0.5                 | 4  | 0.5"
    })
    @DisplayName("accepted forms evaluate against the level")
    void evaluatesAcceptedForms(String formula, int level, double expected) {
        assertThat(FormulaParser.parse(formula))
                .get()
                .extracting(expression -> expression.evaluate(level))
                .isEqualTo(OptionalDouble.of(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "@actor.level / 0",
            "@actor.level + 1",
            "@actor.level * -2",
            "@actor.abilities.str.mod",
            "5 feet",
            "",
            "ten"
    })
    @DisplayName("anything outside the grammar does not parse")
    void rejectsEverythingElse(String formula) {
        assertThat(FormulaParser.parse(formula)).isEmpty();
        assertThat(FormulaParser.isValid(formula)).isFalse();
    }

    @Test
    @DisplayName("null formula does not parse")
    void nullFormula() {
        assertThat(FormulaParser.parse(null)).isEmpty();
    }

    @Test
    @DisplayName("level multiplication does not wrap around")
    void largeProductIsExact() {
        FormulaExpression expression = FormulaParser.parse("@actor.level * 2000000000").orElseThrow();

        assertThat(expression.evaluate(20)).hasValue(40_000_000_000d);
    }
}
