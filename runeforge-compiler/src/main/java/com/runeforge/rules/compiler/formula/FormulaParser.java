package com.runeforge.rules.compiler.formula;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the value formula grammar used by rule elements.
 *
 * <pre>
 *   @actor.level
 *   @actor.level * N        N unsigned integer
 *   @actor.level / N        N unsigned integer, floor division, N = 0 rejected
 *   [+-]digits[.digits]     plain number, kept as written
 * </pre>
 *
 * Anything else does not parse. The grammar is deliberately closed: authored content relies on
 * exactly these forms.
 */
public final class FormulaParser {

    private static final String LEVEL_REFERENCE = "@actor.level";
    private static final Pattern LEVEL_MULTIPLY = Pattern.compile("^@actor\\.level\\s*\\*\\s*(\\d+)$");
    private static final Pattern LEVEL_DIVIDE = Pattern.compile("^@actor\\.level\\s*/\\s*(\\d+)$");
    private static final Pattern NUMBER = Pattern.compile("^[+-]?\\d+(\\.\\d+)?$");

    private FormulaParser() {
    }

    public static Optional<FormulaExpression> parse(String formula) {
        if (formula == null) {
            return Optional.empty();
        }
        String text = formula.trim();
        if (text.equals(LEVEL_REFERENCE)) {
            return Optional.of(new FormulaExpression.LevelReference(FormulaExpression.Operation.IDENTITY, 1));
        }
        Matcher multiply = LEVEL_MULTIPLY.matcher(text);
        if (multiply.matches()) {
            return operand(multiply.group(1))
                    .map(n -> new FormulaExpression.LevelReference(FormulaExpression.Operation.MULTIPLY, n));
        }
        Matcher divide = LEVEL_DIVIDE.matcher(text);
        if (divide.matches()) {
            return operand(divide.group(1))
                    .filter(n -> n != 0)
                    .map(n -> new FormulaExpression.LevelReference(FormulaExpression.Operation.DIVIDE, n));
        }
        if (NUMBER.matcher(text).matches()) {
            return number(text).map(FormulaExpression.Constant::new);
        }
        return Optional.empty();
    }

    public static boolean isValid(String formula) {
        return parse(formula).isPresent();
    }

    private static Optional<Integer> operand(String digits) {
        try {
            return Optional.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Double> number(String text) {
        double value = new BigDecimal(text).doubleValue();
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }
}
