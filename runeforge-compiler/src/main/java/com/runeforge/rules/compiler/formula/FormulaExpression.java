package com.runeforge.rules.compiler.formula;

import java.util.OptionalDouble;

/**
 * A compiled value formula.
 */
public sealed interface FormulaExpression permits FormulaExpression.Constant, FormulaExpression.LevelReference {

    /**
     * @param level character level
     * @return the value; level references always yield whole numbers
     */
    OptionalDouble evaluate(int level);

    record Constant(double value) implements FormulaExpression {
        @Override
        public OptionalDouble evaluate(int level) {
            return OptionalDouble.of(value);
        }
    }

    /**
     * {@code @actor.level}, optionally multiplied or floor-divided by a positive integer.
     */
    record LevelReference(Operation operation, int operand) implements FormulaExpression {

        public LevelReference {
            if (operation == Operation.DIVIDE && operand == 0) {
                throw new IllegalArgumentException("Division by zero");
            }
        }

        @Override
        public OptionalDouble evaluate(int level) {
            return switch (operation) {
                case MULTIPLY -> OptionalDouble.of((double) level * operand);
                case DIVIDE -> OptionalDouble.of(Math.floorDiv(level, operand));
                case IDENTITY -> OptionalDouble.of(level);
            };
        }
    }

    enum Operation {
        IDENTITY,
        MULTIPLY,
        DIVIDE
    }
}
