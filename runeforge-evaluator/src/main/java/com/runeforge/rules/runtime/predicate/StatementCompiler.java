package com.runeforge.rules.runtime.predicate;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.runeforge.rules.infra.metrics.Counter;

import java.util.logging.Logger;

/**
 * Compiles atom strings into {@link CompiledAtom}s and caches them.
 *
 * <p>The set of distinct atoms is bounded by the content dataset, so every atom is parsed once
 * and served from a size-bounded Caffeine cache afterwards. Thread-safe.
 */
final class StatementCompiler {
    private static final Logger logger = Logger.getLogger(StatementCompiler.class.getName());

    private final Cache<String, CompiledAtom> cache;
    private final Counter compiled;

    StatementCompiler(long maximumSize, Counter compiled) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
        this.compiled = compiled;
    }

    CompiledAtom compile(String atom) {
        return cache.get(atom, this::parse);
    }

    CacheStats stats() {
        return cache.stats();
    }

    long estimatedSize() {
        return cache.estimatedSize();
    }

    private CompiledAtom parse(String atom) {
        compiled.increment();
        CompiledAtom result = parseAtom(atom);
        logger.finest(() -> "Compiled predicate atom '" + atom + "' to " + result);
        return result;
    }

    /**
     * Recognizes {@code self:effect:<name>}, {@code self:trait:<name>},
     * {@code self:level:<cmp>:<n>} and the legacy exact form {@code self:level:<n>}. Segments after
     * the level operand are ignored.
     */
    static CompiledAtom parseAtom(String atom) {
        String[] parts = atom.split(":", -1);
        if (parts.length < 3 || !"self".equals(parts[0]) || parts[2].isEmpty()) {
            return CompiledAtom.OptionOnly.INSTANCE;
        }
        switch (parts[1]) {
            case "effect":
                return new CompiledAtom.Effect(parts[2]);
            case "trait":
                return new CompiledAtom.Trait(parts[2]);
            case "level":
                return level(parts);
            default:
                return CompiledAtom.OptionOnly.INSTANCE;
        }
    }

    private static CompiledAtom level(String[] parts) {
        CompiledAtom.Comparison comparison = CompiledAtom.Comparison.fromToken(parts[2]);
        if (comparison != null && parts.length >= 4 && !parts[3].isEmpty()) {
            Integer operand = integer(parts[3]);
            return operand == null ? CompiledAtom.OptionOnly.INSTANCE : new CompiledAtom.LevelComparison(comparison, operand);
        }
        if (parts.length == 3) {
            Integer operand = integer(parts[2]);
            if (operand != null) {
                return new CompiledAtom.LevelComparison(CompiledAtom.Comparison.EXACT, operand);
            }
        }
        return CompiledAtom.OptionOnly.INSTANCE;
    }

    private static Integer integer(String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            logger.fine("Level operand is not an integer: " + text);
            return null;
        }
    }
}
