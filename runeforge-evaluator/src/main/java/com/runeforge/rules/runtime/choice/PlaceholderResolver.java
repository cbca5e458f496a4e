package com.runeforge.rules.runtime.choice;

import com.runeforge.rules.api.ChoiceStore;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {item|...}} placeholders in property paths with recorded choices.
 *
 * <p>The reference inside a placeholder names a choice-set flag, either bare
 * ({@code {item|weaponGroup}}) or as the flag path of the owning item
 * ({@code {item|flags.system.rulesSelections.weaponGroup}}). A multi-valued selection
 * contributes its first value.
 */
public final class PlaceholderResolver {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{item\\|([^}]+)}");
    private static final Pattern SELECTION_PATH = Pattern.compile("^flags\\.[^.]+\\.rulesSelections\\.(.+)$");

    private PlaceholderResolver() {
    }

    public static boolean hasPlaceholders(String path) {
        return PLACEHOLDER.matcher(path).find();
    }

    /**
     * @return the path with every placeholder substituted, or empty when any referenced flag
     * is unresolved
     */
    public static Optional<String> resolve(String path, ChoiceStore store) {
        Matcher matcher = PLACEHOLDER.matcher(path);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            List<String> selection = store.selection(flag(matcher.group(1)));
            if (selection.isEmpty()) {
                return Optional.empty();
            }
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(selection.get(0)));
        }
        matcher.appendTail(resolved);
        return Optional.of(resolved.toString());
    }

    static String flag(String reference) {
        Matcher matcher = SELECTION_PATH.matcher(reference.trim());
        return matcher.matches() ? matcher.group(1) : reference.trim();
    }
}
