/*
 * Copyright (c) 2025 Runeforge
 * Licensed under the Apache License, Version 2.0
 */
package com.runeforge.rules.api.element;

import java.util.Objects;

/**
 * Numeric operand of a rule element: a literal number or a formula string such as
 * {@code "@actor.level * 5"} that is resolved against the processing context.
 */
public sealed interface ValueOperand permits ValueOperand.Literal, ValueOperand.Formula {

    static ValueOperand of(double value) {
        return new Literal(value);
    }

    static ValueOperand of(String formula) {
        return new Formula(formula);
    }

    /**
     * A number as authored. Fractions are kept; integral result categories floor them.
     */
    record Literal(double value) implements ValueOperand {
        @Override
        public String toString() {
            return value == Math.rint(value) && !Double.isInfinite(value)
                    ? Long.toString((long) value)
                    : Double.toString(value);
        }
    }

    record Formula(String expression) implements ValueOperand {
        public Formula {
            Objects.requireNonNull(expression, "Formula expression cannot be null");
        }

        @Override
        public String toString() {
            return expression;
        }
    }
}
