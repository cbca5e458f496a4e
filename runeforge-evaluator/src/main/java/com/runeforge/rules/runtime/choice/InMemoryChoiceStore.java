package com.runeforge.rules.runtime.choice;

import com.runeforge.rules.api.ChoiceStore;
import com.runeforge.rules.api.model.ChoiceSnapshot;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Choice store kept in memory. Safe for a UI reading while a single writer records choices.
 */
public final class InMemoryChoiceStore implements ChoiceStore {
    private static final Logger logger = Logger.getLogger(InMemoryChoiceStore.class.getName());

    private final ConcurrentHashMap<String, List<String>> selections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Boolean> toggles = new ConcurrentHashMap<>();

    public InMemoryChoiceStore() {
    }

    /**
     * Restores a store from a snapshot taken earlier.
     */
    public static InMemoryChoiceStore from(ChoiceSnapshot snapshot) {
        InMemoryChoiceStore store = new InMemoryChoiceStore();
        snapshot.selections().forEach(store::select);
        snapshot.toggles().forEach(store::setToggle);
        return store;
    }

    @Override
    public List<String> selection(String flag) {
        return selections.getOrDefault(flag, List.of());
    }

    @Override
    public void select(String flag, List<String> values) {
        Objects.requireNonNull(flag, "flag cannot be null");
        if (values == null || values.isEmpty()) {
            clear(flag);
            return;
        }
        selections.put(flag, List.copyOf(values));
        logger.fine(() -> "Recorded selection " + flag + " = " + values);
    }

    @Override
    public void clear(String flag) {
        selections.remove(flag);
    }

    @Override
    public Optional<Boolean> toggle(String key) {
        return Optional.ofNullable(toggles.get(key));
    }

    @Override
    public void setToggle(String key, boolean enabled) {
        toggles.put(Objects.requireNonNull(key, "key cannot be null"), enabled);
        logger.fine(() -> "Toggle " + key + " set to " + enabled);
    }

    @Override
    public ChoiceSnapshot snapshot() {
        Map<String, List<String>> selectionCopy = new HashMap<>(selections);
        Map<String, Boolean> toggleCopy = new HashMap<>(toggles);
        return new ChoiceSnapshot(selectionCopy, toggleCopy);
    }
}
