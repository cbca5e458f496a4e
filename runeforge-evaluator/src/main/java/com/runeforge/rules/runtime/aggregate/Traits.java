package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.result.ActorTraitsResult;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Character traits after every ActorTraits change. Traits are compared case-insensitively
 * and reported lowercased.
 */
public final class Traits {
    private static final Set<String> ALIGNMENT = Set.of("lawful", "chaotic", "good", "evil", "neutral");
    private static final Set<String> SIZE = Set.of("tiny", "small", "medium", "large", "huge", "gargantuan");
    private static final Set<String> CREATURE_TYPE = Set.of(
            "aberration", "animal", "astral", "beast", "celestial", "construct", "dragon", "elemental",
            "ethereal", "fey", "fiend", "fungus", "humanoid", "monitor", "ooze", "plant", "spirit", "undead");

    private Traits() {
    }

    /**
     * Applies each change in order, removals before additions within a change.
     *
     * @return the final traits, sorted
     */
    public static List<String> finalTraits(Collection<String> baseTraits, List<ActorTraitsResult> changes) {
        TreeSet<String> traits = new TreeSet<>();
        for (String trait : baseTraits) {
            traits.add(normalize(trait));
        }
        for (ActorTraitsResult change : changes) {
            for (String trait : change.remove()) {
                traits.remove(normalize(trait));
            }
            for (String trait : change.add()) {
                traits.add(normalize(trait));
            }
        }
        return List.copyOf(traits);
    }

    public static boolean hasTrait(Collection<String> traits, String trait) {
        return traits.stream().anyMatch(candidate -> candidate.equalsIgnoreCase(trait));
    }

    public static boolean hasAnyTrait(Collection<String> traits, Collection<String> wanted) {
        return wanted.stream().anyMatch(trait -> hasTrait(traits, trait));
    }

    public static boolean hasAllTraits(Collection<String> traits, Collection<String> wanted) {
        return wanted.stream().allMatch(trait -> hasTrait(traits, trait));
    }

    /**
     * @return {@code alignment}, {@code size} or {@code creature-type}, empty for other traits
     */
    public static Optional<String> traitCategory(String trait) {
        String normalized = normalize(trait);
        if (ALIGNMENT.contains(normalized)) {
            return Optional.of("alignment");
        }
        if (SIZE.contains(normalized)) {
            return Optional.of("size");
        }
        if (CREATURE_TYPE.contains(normalized)) {
            return Optional.of("creature-type");
        }
        return Optional.empty();
    }

    private static String normalize(String trait) {
        return trait.toLowerCase(Locale.ROOT);
    }
}
