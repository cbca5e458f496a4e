package com.runeforge.rules.compiler.analysis;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.element.RuleElementVisitor;
import com.runeforge.rules.api.element.ValueOperand;
import com.runeforge.rules.api.model.RuleSource;
import com.runeforge.rules.compiler.analysis.AnalysisReport.Finding;
import com.runeforge.rules.compiler.analysis.AnalysisReport.Severity;
import com.runeforge.rules.compiler.formula.FormulaParser;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Lints parsed rule sources without processing them.
 *
 * <p>The engine degrades bad elements silently at runtime. This analyzer reports them up front
 * so content problems can be fixed where they are authored:
 * <ul>
 *   <li>unsupported kinds, which the registry skips;</li>
 *   <li>missing required fields and formulas outside the supported grammar, which make the
 *       element inert;</li>
 *   <li>empty choice sets and grants without a target;</li>
 *   <li>literal values the processors will clamp.</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * List&lt;RuleSource&gt; sources = loader.load(contentDir);
 * AnalysisReport report = new RuleElementAnalyzer().analyze(sources);
 * report.errors().forEach(System.out::println);
 * </pre>
 */
public class RuleElementAnalyzer {
    private static final Logger logger = Logger.getLogger(RuleElementAnalyzer.class.getName());

    public AnalysisReport analyze(List<RuleSource> sources) {
        List<Finding> findings = new ArrayList<>();
        int elementCount = 0;
        for (RuleSource source : sources) {
            List<RuleElement> elements = source.elements();
            for (int i = 0; i < elements.size(); i++) {
                RuleElement element = elements.get(i);
                Checker checker = new Checker(source.name(), i, element.key(), findings);
                element.accept(checker);
                elementCount++;
            }
        }
        AnalysisReport report = new AnalysisReport(elementCount, findings);
        logger.fine(() -> String.format("Analyzed %d elements: %d errors, %d warnings",
                report.elementCount(), report.errors().size(), report.warnings().size()));
        return report;
    }

    public AnalysisReport analyze(RuleSource source) {
        return analyze(List.of(source));
    }

    private static final class Checker implements RuleElementVisitor<Void> {
        private final String source;
        private final int index;
        private final String key;
        private final List<Finding> findings;

        Checker(String source, int index, String key, List<Finding> findings) {
            this.source = source;
            this.index = index;
            this.key = key;
            this.findings = findings;
        }

        private void error(String message) {
            findings.add(new Finding(source, index, key, Severity.ERROR, message));
        }

        private void warning(String message) {
            findings.add(new Finding(source, index, key, Severity.WARNING, message));
        }

        private void required(Object value, String field) {
            if (value == null || (value instanceof String text && text.isBlank())) {
                error("missing required field '" + field + "'");
            }
        }

        private void value(ValueOperand operand) {
            if (operand == null) {
                error("missing required field 'value'");
            } else if (operand instanceof ValueOperand.Formula formula && !FormulaParser.isValid(formula.expression())) {
                error("unresolvable formula '" + formula.expression() + "'");
            }
        }

        private void clampedRange(ValueOperand operand) {
            if (operand instanceof ValueOperand.Literal literal && (literal.value() < 1 || literal.value() > 3)) {
                warning("value " + literal + " will be clamped to 1..3");
            }
        }

        @Override
        public Void visitFlatModifier(RuleElement.FlatModifier element) {
            required(element.selector(), "selector");
            value(element.value());
            return null;
        }

        @Override
        public Void visitAdjustModifier(RuleElement.AdjustModifier element) {
            required(element.selector(), "selector");
            return null;
        }

        @Override
        public Void visitDamageDice(RuleElement.DamageDice element) {
            if (element.diceNumber() != null && element.diceNumber() <= 0) {
                warning("non-positive diceNumber " + element.diceNumber());
            }
            return null;
        }

        @Override
        public Void visitBaseSpeed(RuleElement.BaseSpeed element) {
            value(element.value());
            return null;
        }

        @Override
        public Void visitSense(RuleElement.Sense element) {
            required(element.selector(), "selector");
            return null;
        }

        @Override
        public Void visitGrantItem(RuleElement.GrantItem element) {
            if (element.uuid() == null && element.item() == null) {
                error("neither 'uuid' nor 'item' is set");
            }
            return null;
        }

        @Override
        public Void visitChoiceSet(RuleElement.ChoiceSet element) {
            if (element.choices().isEmpty()) {
                error("choice set has no choices");
            } else if (element.selection() != null && element.selection() > element.choices().size()) {
                warning("requires " + element.selection() + " selections but offers "
                        + element.choices().size() + " choices");
            }
            return null;
        }

        @Override
        public Void visitActiveEffectLike(RuleElement.ActiveEffectLike element) {
            required(element.path(), "path");
            required(element.mode(), "mode");
            value(element.value());
            return null;
        }

        @Override
        public Void visitRollOption(RuleElement.RollOption element) {
            required(element.option(), "option");
            return null;
        }

        @Override
        public Void visitToggleProperty(RuleElement.ToggleProperty element) {
            required(element.property(), "property");
            return null;
        }

        @Override
        public Void visitWeaponPotency(RuleElement.WeaponPotency element) {
            value(element.value());
            clampedRange(element.value());
            return null;
        }

        @Override
        public Void visitStriking(RuleElement.Striking element) {
            value(element.value());
            clampedRange(element.value());
            return null;
        }

        @Override
        public Void visitTempHp(RuleElement.TempHp element) {
            value(element.value());
            return null;
        }

        @Override
        public Void visitFastHealing(RuleElement.FastHealing element) {
            value(element.value());
            return null;
        }

        @Override
        public Void visitResistance(RuleElement.Resistance element) {
            if (element.types().isEmpty()) {
                error("no damage types");
            }
            value(element.value());
            return null;
        }

        @Override
        public Void visitWeakness(RuleElement.Weakness element) {
            if (element.types().isEmpty()) {
                error("no damage types");
            }
            value(element.value());
            return null;
        }

        @Override
        public Void visitImmunity(RuleElement.Immunity element) {
            required(element.type(), "type");
            if (element.values().isEmpty()) {
                error("no immunity values");
            }
            return null;
        }

        @Override
        public Void visitCreatureSize(RuleElement.CreatureSize element) {
            if (element.value() == null && (element.resizeBy() == null || element.resizeBy() == 0)) {
                warning("neither an absolute size nor a resize step");
            }
            if (element.minimumSize() != null && element.maximumSize() != null
                    && element.minimumSize().isLargerThan(element.maximumSize())) {
                warning("minimumSize " + element.minimumSize().wireName()
                        + " is larger than maximumSize " + element.maximumSize().wireName());
            }
            return null;
        }

        @Override
        public Void visitActorTraits(RuleElement.ActorTraits element) {
            if (element.add().isEmpty() && element.remove().isEmpty()) {
                warning("neither traits to add nor traits to remove");
            }
            return null;
        }

        @Override
        public Void visitUnrecognized(RuleElement.Unrecognized element) {
            warning("unsupported rule element kind, it will be skipped");
            return null;
        }
    }
}
