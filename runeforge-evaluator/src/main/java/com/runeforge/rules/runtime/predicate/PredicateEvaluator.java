package com.runeforge.rules.runtime.predicate;

import com.runeforge.rules.api.IPredicateEvaluator;
import com.runeforge.rules.api.predicate.Predicate;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.predicate.PredicateStatement;
import com.runeforge.rules.infra.config.EngineSettings;
import com.runeforge.rules.infra.metrics.MetricsRegistry;

import java.util.List;

/**
 * Evaluates predicates against a {@link PredicateContext}.
 *
 * <h2>Atoms</h2>
 * <p>An atom is true when it is one of the active roll options. Otherwise it is read as a
 * structured statement:
 * <ul>
 * <li>{@code self:effect:<name>} - the effect is active</li>
 * <li>{@code self:trait:<name>} - the trait is present</li>
 * <li>{@code self:level:<cmp>:<n>} with {@code exact}, {@code gte}, {@code lte}, {@code gt}
 * or {@code lt}, and the legacy {@code self:level:<n>}</li>
 * </ul>
 * Anything else is false, and so is a level statement when the context carries no level.
 *
 * <h2>Composites</h2>
 * <p>{@code not}, {@code and} and {@code or} nest recursively. An empty conjunction is true,
 * an empty disjunction false.
 *
 * <h2>Thread Safety</h2>
 * <p>Evaluation is pure. Compiled atoms are shared through a concurrent cache.
 */
public class PredicateEvaluator implements IPredicateEvaluator {

    private final StatementCompiler compiler;

    public PredicateEvaluator() {
        this(EngineSettings.fromEnvironment(), MetricsRegistry.getInstance());
    }

    public PredicateEvaluator(EngineSettings settings, MetricsRegistry metrics) {
        this.compiler = new StatementCompiler(settings.predicateCacheSize(),
                metrics.counter("predicate_atoms_compiled"));
    }

    @Override
    public boolean evaluate(Predicate predicate, PredicateContext context) {
        if (predicate == null || predicate.isEmpty()) {
            return true;
        }
        return allMatch(predicate.statements(), context);
    }

    @Override
    public boolean evaluate(PredicateStatement statement, PredicateContext context) {
        if (statement instanceof PredicateStatement.Atom atom) {
            return context.hasOption(atom.text()) || compiler.compile(atom.text()).matches(context);
        }
        if (statement instanceof PredicateStatement.Not not) {
            return !evaluate(not.statement(), context);
        }
        if (statement instanceof PredicateStatement.And and) {
            return allMatch(and.statements(), context);
        }
        PredicateStatement.Or or = (PredicateStatement.Or) statement;
        for (PredicateStatement child : or.statements()) {
            if (evaluate(child, context)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Number of distinct atoms currently held by the compiled-statement cache.
     */
    public long cachedAtoms() {
        return compiler.estimatedSize();
    }

    private boolean allMatch(List<PredicateStatement> statements, PredicateContext context) {
        for (PredicateStatement statement : statements) {
            if (!evaluate(statement, context)) {
                return false;
            }
        }
        return true;
    }
}
