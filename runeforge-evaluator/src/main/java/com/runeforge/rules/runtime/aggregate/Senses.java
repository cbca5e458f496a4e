package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.IPredicateEvaluator;
import com.runeforge.rules.api.predicate.PredicateContext;
import com.runeforge.rules.api.result.Sense;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

public final class Senses {

    private Senses() {
    }

    public static List<Sense> active(List<Sense> senses, PredicateContext context, IPredicateEvaluator evaluator) {
        return Activation.active(senses, context, evaluator);
    }

    /**
     * Keeps one sense per type: the longest range wins, then the better acuity.
     */
    public static List<Sense> consolidate(List<Sense> senses) {
        Map<String, Sense> best = new LinkedHashMap<>();
        for (Sense sense : senses) {
            best.merge(sense.type(), sense, Senses::better);
        }
        return new ArrayList<>(best.values());
    }

    public static boolean hasSense(List<Sense> senses, String type) {
        return senses.stream().anyMatch(sense -> sense.enabled() && sense.type().equals(type));
    }

    /**
     * Range of the first enabled sense of the type, empty when unlimited or absent.
     */
    public static OptionalInt range(List<Sense> senses, String type) {
        for (Sense sense : senses) {
            if (sense.enabled() && sense.type().equals(type)) {
                return sense.range() == null ? OptionalInt.empty() : OptionalInt.of(sense.range());
            }
        }
        return OptionalInt.empty();
    }

    private static Sense better(Sense current, Sense candidate) {
        int currentRange = current.range() == null ? -1 : current.range();
        int candidateRange = candidate.range() == null ? -1 : candidate.range();
        if (candidateRange != currentRange) {
            return candidateRange > currentRange ? candidate : current;
        }
        return candidate.acuity().rank() > current.acuity().rank() ? candidate : current;
    }
}
