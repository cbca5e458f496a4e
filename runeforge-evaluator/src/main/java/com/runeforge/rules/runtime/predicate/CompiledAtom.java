package com.runeforge.rules.runtime.predicate;

import com.runeforge.rules.api.predicate.PredicateContext;

/**
 * Structured reading of an atom string, checked after plain roll-option membership.
 */
sealed interface CompiledAtom {

    boolean matches(PredicateContext context);

    /**
     * Plain roll option with no structured meaning.
     */
    enum OptionOnly implements CompiledAtom {
        INSTANCE;

        @Override
        public boolean matches(PredicateContext context) {
            return false;
        }
    }

    record Effect(String name) implements CompiledAtom {
        @Override
        public boolean matches(PredicateContext context) {
            return context.effects().contains(name);
        }
    }

    record Trait(String name) implements CompiledAtom {
        @Override
        public boolean matches(PredicateContext context) {
            return context.traits().contains(name);
        }
    }

    /**
     * Level comparison. False when the context carries no level.
     */
    record LevelComparison(Comparison comparison, int operand) implements CompiledAtom {
        @Override
        public boolean matches(PredicateContext context) {
            Integer level = context.level();
            return level != null && comparison.test(level, operand);
        }
    }

    enum Comparison {
        EXACT, GTE, LTE, GT, LT;

        boolean test(int level, int operand) {
            return switch (this) {
                case EXACT -> level == operand;
                case GTE -> level >= operand;
                case LTE -> level <= operand;
                case GT -> level > operand;
                case LT -> level < operand;
            };
        }

        static Comparison fromToken(String token) {
            return switch (token) {
                case "exact" -> EXACT;
                case "gte" -> GTE;
                case "lte" -> LTE;
                case "gt" -> GT;
                case "lt" -> LT;
                default -> null;
            };
        }
    }
}
