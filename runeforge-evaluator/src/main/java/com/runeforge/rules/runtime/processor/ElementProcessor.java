package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;

/**
 * Converts one kind of rule element into its typed result.
 *
 * <p>Implementations are stateless and side-effect free: the result depends only on the
 * element and the context. A {@code null} result means the element contributes nothing,
 * e.g. because its value could not be resolved; the reason is logged.
 *
 * @param <E> element kind
 * @param <R> result type
 */
@FunctionalInterface
public interface ElementProcessor<E extends RuleElement, R> {

    R process(E element, RuleElementContext context);
}
