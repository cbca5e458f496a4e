package com.runeforge.rules.compiler.analysis;

import com.runeforge.rules.api.element.Choice;
import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.element.ValueOperand;
import com.runeforge.rules.api.model.ModifierType;
import com.runeforge.rules.api.model.RuleSource;
import com.runeforge.rules.api.model.SizeCategory;
import com.runeforge.rules.compiler.RuleElementParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RuleElementAnalyzerTest {

    private final RuleElementAnalyzer analyzer = new RuleElementAnalyzer();

    @Test
    @DisplayName("Well-formed elements produce no findings")
    void cleanSource() {
        RuleSource fleet = RuleSource.of("Fleet",
                new RuleElement.FlatModifier("speed", ValueOperand.of(5), ModifierType.UNTYPED, null, null, null),
                new RuleElement.TempHp(ValueOperand.of("@actor.level * 2"), null, null, null));

        AnalysisReport report = analyzer.analyze(fleet);

        assertThat(report.elementCount()).isEqualTo(2);
        assertThat(report.findings()).isEmpty();
        assertThat(report.hasErrors()).isFalse();
    }

    @Test
    @DisplayName("Formulas outside the grammar are errors")
    void unresolvableFormula() {
        RuleSource source = RuleSource.of("Strength Bonus",
                new RuleElement.FlatModifier("damage", ValueOperand.of("@actor.abilities.str.mod"), null, null, null, null));

        AnalysisReport report = analyzer.analyze(source);

        assertThat(report.errors()).singleElement()
                .satisfies(finding -> {
                    assertThat(finding.source()).isEqualTo("Strength Bonus");
                    assertThat(finding.index()).isZero();
                    assertThat(finding.key()).isEqualTo("FlatModifier");
                    assertThat(finding.message()).contains("unresolvable formula");
                });
    }

    @Test
    @DisplayName("Missing required fields are errors")
    void missingFields() {
        RuleSource source = RuleSource.of("Broken",
                new RuleElement.FlatModifier(null, null, null, null, null, null),
                new RuleElement.ChoiceSet("flag", null, null, List.of(), null, null),
                new RuleElement.GrantItem(null, null, null, null, null));

        AnalysisReport report = analyzer.analyze(source);

        assertThat(report.errors()).extracting(AnalysisReport.Finding::message).containsExactly(
                "missing required field 'selector'",
                "missing required field 'value'",
                "choice set has no choices",
                "neither 'uuid' nor 'item' is set");
    }

    @Test
    @DisplayName("Clamped values and odd sizes are warnings")
    void warnings() {
        RuleSource source = RuleSource.of("Odd",
                new RuleElement.WeaponPotency(ValueOperand.of(4), null, null),
                new RuleElement.CreatureSize(null, null, SizeCategory.SMALL, SizeCategory.LARGE, null),
                new RuleElement.ChoiceSet("f", null, null, List.of(Choice.of("A", "a")), 2, null));

        AnalysisReport report = analyzer.analyze(source);

        assertThat(report.hasErrors()).isFalse();
        assertThat(report.warnings()).extracting(AnalysisReport.Finding::message).containsExactly(
                "value 4 will be clamped to 1..3",
                "neither an absolute size nor a resize step",
                "minimumSize large is larger than maximumSize small",
                "requires 2 selections but offers 1 choices");
    }

    @Test
    @DisplayName("Unknown kinds are reported as skipped")
    void unknownKinds() {
        List<RuleSource> sources = new RuleElementParser().parseSources("""
                [{"name": "Aura of Courage", "rules": [{"key": "Aura", "radius": 15}]}]
                """);

        AnalysisReport report = analyzer.analyze(sources);

        assertThat(report.warnings()).singleElement()
                .satisfies(finding -> assertThat(finding.toString())
                        .isEqualTo("WARNING Aura of Courage[0] Aura: unsupported rule element kind, it will be skipped"));
    }

    @Test
    @DisplayName("Unrecognized elements built directly keep their key")
    void unrecognizedDirect() {
        AnalysisReport report = analyzer.analyze(RuleSource.of("X",
                new RuleElement.Unrecognized("Aura", Map.of())));

        assertThat(report.warnings()).hasSize(1);
    }
}
