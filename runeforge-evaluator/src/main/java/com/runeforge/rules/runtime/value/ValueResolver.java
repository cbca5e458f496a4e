package com.runeforge.rules.runtime.value;

import com.runeforge.rules.api.element.ValueOperand;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.compiler.formula.FormulaExpression;
import com.runeforge.rules.compiler.formula.FormulaParser;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Resolves element operands against the character level of a pass.
 *
 * <p>Literals resolve to themselves. Formulas follow the grammar of {@link FormulaParser};
 * anything outside it resolves to empty and is logged, which makes the owning element inert.
 *
 * <p>{@link #resolveNumber} keeps fractions and is used for property modifications.
 * {@link #resolve} serves whole-number results such as modifiers, speeds and resistances.
 */
public final class ValueResolver {
    private static final Logger logger = Logger.getLogger(ValueResolver.class.getName());

    private ValueResolver() {
    }

    public static OptionalDouble resolveNumber(ValueOperand operand, RuleElementContext context) {
        if (operand == null) {
            logger.warning(context.source() + ": rule element has no value");
            return OptionalDouble.empty();
        }
        if (operand instanceof ValueOperand.Literal literal) {
            return OptionalDouble.of(literal.value());
        }
        String expression = ((ValueOperand.Formula) operand).expression();
        Optional<FormulaExpression> formula = FormulaParser.parse(expression);
        OptionalDouble value = formula.isPresent() ? formula.get().evaluate(context.level()) : OptionalDouble.empty();
        if (value.isEmpty()) {
            logger.warning(context.source() + ": unable to resolve value '" + expression + "'");
        }
        return value;
    }

    /**
     * Resolves to a whole number, flooring fractions. Empty when unresolved or outside the int range.
     */
    public static OptionalInt resolve(ValueOperand operand, RuleElementContext context) {
        OptionalDouble value = resolveNumber(operand, context);
        if (value.isEmpty()) {
            return OptionalInt.empty();
        }
        double floored = Math.floor(value.getAsDouble());
        if (floored > Integer.MAX_VALUE || floored < Integer.MIN_VALUE) {
            logger.warning(context.source() + ": value " + operand + " is out of range");
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) floored);
    }
}
